package org.calista.qualia.integrate;

import java.util.List;
import java.util.Objects;

/**
 * Interview-wide hypothesis. Worded as an indication to check, never as a finding.
 *
 * @param toVerify where in the transcript to look
 */
public record Hypothesis(
        Type type,
        String statement,
        String evidence,
        String checkQuestion,
        String toVerify,
        List<Integer> keyTurns
) {
    public enum Type { AGENCY_ARC_DOWNWARD, AGENCY_ARC_UPWARD, CENTRAL_FRAME, RISING_AFFECT }

    public Hypothesis {
        Objects.requireNonNull(type, "type");
        keyTurns = keyTurns == null ? List.of() : List.copyOf(keyTurns);
    }
}
