package org.calista.qualia.justice;

import java.util.List;
import java.util.Optional;

/**
 * Interview-level justice aggregate.
 *
 * @param dominantTension axis with the highest summed intensity, null when there are no sites
 */
public record JusticeProfile(
        double justiceScore,
        double justiceDensity,
        int justiceSiteCount,
        int totalTurns,
        List<Integer> peakTurns,
        double strongThreshold,
        List<AxisTotal> axes,
        AxisTotal dominantTension,
        Trajectory trajectory
) {
    public JusticeProfile {
        peakTurns = List.copyOf(peakTurns);
        axes = List.copyOf(axes);
    }

    public static JusticeProfile empty(int totalTurns) {
        return new JusticeProfile(0.0, 0.0, 0, totalTurns, List.of(), 0.0, List.of(), null, Trajectory.INSUFFICIENT_DATA);
    }

    public Optional<AxisTotal> dominant() {
        return Optional.ofNullable(dominantTension);
    }

    public Optional<AxisTotal> axis(String claimFrame, String structureFrame) {
        for (AxisTotal a : axes) {
            if (a.claimFrame().equals(claimFrame) && a.structureFrame().equals(structureFrame)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
