package org.calista.qualia.analysis.affect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Affect view of one respondent turn.
 *
 * @param markerDensity affect markers per 100 words
 * @param dimensions    count per active dimension
 */
public record AffectTurnSummary(
        int turnId,
        int wordCount,
        int markerCount,
        double markerDensity,
        Map<String, Integer> dimensions,
        List<String> activeDimensions,
        int activeDimensionCount
) {
    public AffectTurnSummary {
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        activeDimensions = List.copyOf(activeDimensions);
    }
}
