package org.calista.qualia.analysis.narrative;

import java.util.List;

/**
 * Turn proposed as a biographical turning point, with the rules that contributed to its score.
 */
public record TurningPointCandidate(
        int turnId,
        int score,
        List<String> reasons,
        List<String> shortSequence,
        List<String> processStructures,
        String preview
) {
    public TurningPointCandidate {
        reasons = List.copyOf(reasons);
        shortSequence = List.copyOf(shortSequence);
        processStructures = List.copyOf(processStructures);
    }
}
