package org.calista.qualia.justice;

import java.util.List;

/**
 * A tension axis aggregated over every justice site of the interview.
 */
public record AxisTotal(
        String claimFrame,
        String structureFrame,
        String label,
        int count,
        double totalIntensity,
        List<Integer> turns,
        List<String> contextTags
) {
    public AxisTotal {
        turns = List.copyOf(turns);
        contextTags = List.copyOf(contextTags);
    }
}
