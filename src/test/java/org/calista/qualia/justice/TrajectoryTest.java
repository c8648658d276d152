package org.calista.qualia.justice;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TrajectoryTest {

    @Test
    @DisplayName("should need at least three sites")
    void shouldNeedThreeSites() {
        assertThat(Trajectory.classify(List.of())).isEqualTo(Trajectory.INSUFFICIENT_DATA);
        assertThat(Trajectory.classify(List.of(1.0, 9.0))).isEqualTo(Trajectory.INSUFFICIENT_DATA);
        assertThat(Trajectory.classify(null)).isEqualTo(Trajectory.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("should call a last third above 1.3 times the first third rising")
    void shouldDetectRising() {
        assertThat(Trajectory.classify(List.of(1.0, 1.0, 1.31))).isEqualTo(Trajectory.RISING);
        assertThat(Trajectory.classify(List.of(1.0, 1.0, 1.29))).isEqualTo(Trajectory.STABLE);
    }

    @Test
    @DisplayName("should call a first third above 1.3 times the last third falling")
    void shouldDetectFalling() {
        assertThat(Trajectory.classify(List.of(2.0, 5.0, 1.0))).isEqualTo(Trajectory.FALLING);
    }

    @Test
    @DisplayName("should average whole thirds on longer series")
    void shouldAverageThirds() {
        List<Double> values = List.of(1.0, 3.0, 9.0, 9.0, 2.0, 2.0);

        assertThat(Trajectory.classify(values)).isEqualTo(Trajectory.STABLE);
    }
}
