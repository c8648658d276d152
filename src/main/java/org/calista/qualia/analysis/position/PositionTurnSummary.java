package org.calista.qualia.analysis.position;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Positioning view of one respondent turn. Count maps hold only categories that occurred.
 *
 * @param dominantAgency agency category with the highest count, {@code "-"} if none
 * @param agencyDensity  agency annotations per 100 words
 */
public record PositionTurnSummary(
        int turnId,
        int wordCount,
        Map<String, Integer> pronouns,
        Map<String, Integer> agency,
        Map<String, Integer> syntactic,
        String dominantAgency,
        double agencyDensity
) {
    public PositionTurnSummary {
        pronouns = Collections.unmodifiableMap(new LinkedHashMap<>(pronouns));
        agency = Collections.unmodifiableMap(new LinkedHashMap<>(agency));
        syntactic = Collections.unmodifiableMap(new LinkedHashMap<>(syntactic));
    }

    public int agencyTotal() {
        int n = 0;
        for (int v : agency.values()) n += v;
        return n;
    }

    public int annotationCount() {
        int n = agencyTotal();
        for (int v : pronouns.values()) n += v;
        for (int v : syntactic.values()) n += v;
        return n;
    }
}
