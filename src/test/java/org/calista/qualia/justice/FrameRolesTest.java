package org.calista.qualia.justice;

import org.calista.qualia.Fixtures;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.FrameClassification;
import org.calista.qualia.framebook.Framebook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FrameRolesTest {

    @Test
    @DisplayName("should fall back to the built-in roles without a classification")
    void shouldUseDefaults() {
        FrameRoles roles = FrameRoles.from(new Framebook(), new Diagnostics());

        assertThat(roles.fromFramebook()).isFalse();
        assertThat(roles.isClaim(FrameRoles.LEGITIMACY_JUSTICE)).isTrue();
        assertThat(roles.isStructure(FrameRoles.ECONOMIZATION)).isTrue();
        assertThat(roles.isAmplifying(FrameRoles.VULNERABILITY)).isTrue();
        assertThat(roles.isDampening(FrameRoles.NORMALIZATION)).isTrue();
        assertThat(roles.isContextTag("HOUSING")).isTrue();
    }

    @Test
    @DisplayName("should read roles from the framebook classification")
    void shouldReadClassification() {
        FrameRoles roles = FrameRoles.from(Fixtures.framebook(), new Diagnostics());

        assertThat(roles.fromFramebook()).isTrue();
        assertThat(roles.claim()).containsExactlyInAnyOrder("LEGITIMACY_JUSTICE", "AUTONOMY_SELF_DETERMINATION");
        assertThat(roles.isContextTag("SYSTEM_FAILURE")).isFalse();
        assertThat(roles.isContextTag("HOUSING")).isTrue();
    }

    @Test
    @DisplayName("should keep the first role of a frame listed twice and warn")
    void shouldResolveOverlap() {
        Framebook fb = new Framebook();
        fb.frameClassification = new FrameClassification();
        fb.frameClassification.claim = List.of("A");
        fb.frameClassification.structure = List.of("A", "B");
        fb.frameClassification.context.dampening = List.of("B");
        Diagnostics diagnostics = new Diagnostics();

        FrameRoles roles = FrameRoles.from(fb, diagnostics);

        assertThat(roles.isClaim("A")).isTrue();
        assertThat(roles.isStructure("A")).isFalse();
        assertThat(roles.isStructure("B")).isTrue();
        assertThat(roles.isDampening("B")).isFalse();
        assertThat(diagnostics.withCode("justice.role-overlap")).hasSize(2);
    }
}
