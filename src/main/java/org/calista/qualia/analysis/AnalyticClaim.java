package org.calista.qualia.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Interpretive statement with its evidence and a question for the researcher.
 * Claims are suggestions, never verified facts.
 */
public record AnalyticClaim(
        String module,
        ClaimType type,
        String description,
        String evidence,
        List<Integer> turns,
        List<String> frames,
        double strength,
        String checkQuestion
) {
    public AnalyticClaim {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
        evidence = evidence == null ? "" : evidence;
        turns = turns == null ? List.of() : List.copyOf(turns);
        frames = frames == null ? List.of() : List.copyOf(frames);
        checkQuestion = checkQuestion == null ? "" : checkQuestion;
    }
}
