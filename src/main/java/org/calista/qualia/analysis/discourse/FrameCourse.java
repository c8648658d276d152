package org.calista.qualia.analysis.discourse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frame distribution across respondent turns, for plotting.
 *
 * @param frames every frame seen in the interview, sorted
 * @param rows   one row per turn with a count for each of {@code frames}
 */
public record FrameCourse(List<String> frames, List<Row> rows) {

    public FrameCourse {
        frames = List.copyOf(frames);
        rows = List.copyOf(rows);
    }

    public record Row(int turnId, Map<String, Integer> counts) {
        public Row {
            counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
        }
    }
}
