package org.calista.qualia.integrate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All four passes' summaries of one respondent turn, merged, plus the flags raised on them.
 */
public record TurnProfile(
        int turnId,
        int wordCount,
        String preview,
        List<String> textTypeSequence,
        List<String> processStructures,
        int transitions,
        String dominantAgency,
        double agencyDensity,
        Map<String, Integer> pronouns,
        String dominantFrame,
        int activeFrameCount,
        Map<String, Integer> frames,
        double affectDensity,
        List<String> affectDimensions,
        List<Flag> flags,
        int totalAnnotations
) {
    public TurnProfile {
        textTypeSequence = List.copyOf(textTypeSequence);
        processStructures = List.copyOf(processStructures);
        pronouns = Collections.unmodifiableMap(new LinkedHashMap<>(pronouns));
        frames = Collections.unmodifiableMap(new LinkedHashMap<>(frames));
        affectDimensions = List.copyOf(affectDimensions);
        flags = List.copyOf(flags);
    }

    public boolean has(Flag f) {
        return flags.contains(f);
    }

    public int flagCount() {
        return flags.size();
    }
}
