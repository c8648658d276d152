package org.calista.qualia.analysis.discourse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Discourse view of one respondent turn.
 *
 * @param frames         raw frame counts (audit values, never changed by conflict rules)
 * @param adjustedFrames frame counts after conflict downweighting
 * @param topoi          topos counts keyed by {@code TOPOS_<NAME>}
 * @param dominantFrame  argmax of adjusted counts, {@code "-"} if no frame occurred
 */
public record DiscourseTurnSummary(
        int turnId,
        Map<String, Integer> frames,
        Map<String, Double> adjustedFrames,
        Map<String, Integer> topoi,
        String dominantFrame,
        int activeFrameCount,
        double frameDensity
) {
    public DiscourseTurnSummary {
        frames = Collections.unmodifiableMap(new LinkedHashMap<>(frames));
        adjustedFrames = Collections.unmodifiableMap(new LinkedHashMap<>(adjustedFrames));
        topoi = Collections.unmodifiableMap(new LinkedHashMap<>(topoi));
    }

    public int frameTotal() {
        int n = 0;
        for (int v : frames.values()) n += v;
        return n;
    }

    public int topoiTotal() {
        int n = 0;
        for (int v : topoi.values()) n += v;
        return n;
    }
}
