package org.calista.qualia.analysis.narrative;

import java.util.List;

/**
 * Narrative view of one respondent turn.
 *
 * @param sequence          text type per sentence, {@code UNDETERMINED} where nothing matched
 * @param shortSequence     sequence with consecutive repeats collapsed
 * @param transitions       adjacent determined sentences whose types differ
 * @param processStructures distinct process-structure categories found, sorted
 */
public record NarrativeTurnSummary(
        int turnId,
        int sentenceCount,
        List<String> sequence,
        List<String> shortSequence,
        int transitions,
        List<String> processStructures,
        int annotationCount
) {
    public NarrativeTurnSummary {
        sequence = List.copyOf(sequence);
        shortSequence = List.copyOf(shortSequence);
        processStructures = List.copyOf(processStructures);
    }
}
