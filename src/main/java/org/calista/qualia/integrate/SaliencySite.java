package org.calista.qualia.integrate;

import java.util.List;

/**
 * Turn ranked as a cross-module condensation point.
 */
public record SaliencySite(TurnProfile profile, int score, List<String> reasons) {
    public SaliencySite {
        reasons = List.copyOf(reasons);
    }

    public int turnId() {
        return profile.turnId();
    }
}
