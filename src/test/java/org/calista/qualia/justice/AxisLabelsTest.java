package org.calista.qualia.justice;

import org.calista.qualia.framebook.Framebook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AxisLabelsTest {

    @Test
    @DisplayName("should label known axes and fall back to the frame pair")
    void shouldLabelAxes() {
        AxisLabels labels = AxisLabels.defaults();

        assertThat(labels.label(FrameRoles.LEGITIMACY_JUSTICE, FrameRoles.ECONOMIZATION)).isEqualTo("Fairness vs. market logic");
        assertThat(labels.label("CARE", "RENT")).isEqualTo("CARE × RENT");
    }

    @Test
    @DisplayName("should let framebook labels override the built-in ones")
    void shouldApplyOverrides() {
        Framebook fb = new Framebook();
        fb.axisLabels.put(AxisLabels.key(FrameRoles.LEGITIMACY_JUSTICE, FrameRoles.ECONOMIZATION), "Fair pay");
        fb.axisLabels.put(AxisLabels.key("CARE", "RENT"), "Care vs. rent");

        AxisLabels labels = AxisLabels.from(fb);

        assertThat(labels.label(FrameRoles.LEGITIMACY_JUSTICE, FrameRoles.ECONOMIZATION)).isEqualTo("Fair pay");
        assertThat(labels.label("CARE", "RENT")).isEqualTo("Care vs. rent");
        assertThat(labels.label(FrameRoles.SOLIDARITY_COMMUNITY, FrameRoles.INSTITUTIONAL_LOGIC)).isEqualTo("Community vs. system");
    }
}
