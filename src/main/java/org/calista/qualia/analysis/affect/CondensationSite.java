package org.calista.qualia.analysis.affect;

import java.util.List;

/**
 * Turn where affect condenses, with the reason behind each score component.
 */
public record CondensationSite(
        int turnId,
        int score,
        List<String> reasons,
        double markerDensity,
        int markerCount,
        List<String> dimensions,
        String preview
) {
    public CondensationSite {
        reasons = List.copyOf(reasons);
        dimensions = List.copyOf(dimensions);
    }
}
