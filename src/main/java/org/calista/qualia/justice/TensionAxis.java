package org.calista.qualia.justice;

import java.util.List;

/**
 * One claim-frame × structure-frame pair on a turn.
 */
public record TensionAxis(
        String claimFrame,
        String structureFrame,
        String label,
        double intensity,
        List<String> contextTags
) {
    public TensionAxis {
        contextTags = List.copyOf(contextTags);
    }

    public String key() {
        return claimFrame + "|" + structureFrame;
    }
}
