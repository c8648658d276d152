package org.calista.qualia.analysis.discourse;

import org.calista.qualia.Fixtures;
import org.calista.qualia.analysis.AnalyticClaim;
import org.calista.qualia.analysis.ClaimType;
import org.calista.qualia.analysis.Summaries;
import org.calista.qualia.annotate.PatternAnnotator;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.CategoryDef;
import org.calista.qualia.framebook.FrameConflict;
import org.calista.qualia.framebook.Framebook;
import org.calista.qualia.language.LanguageGate;
import org.calista.qualia.model.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiscoursePassTest {

    private Diagnostics diagnostics;
    private DiscoursePass pass;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        pass = passFor(Fixtures.framebook());
    }

    private DiscoursePass passFor(Framebook fb) {
        return new DiscoursePass(new PatternAnnotator(diagnostics), new LanguageGate("en", fb, diagnostics));
    }

    private static Framebook framebook(Map<String, Integer> priorities, FrameConflict... conflicts) {
        Framebook fb = new Framebook();
        for (String f : priorities.keySet()) fb.frames.put(f, CategoryDef.of("en", f.toLowerCase(Locale.ROOT)));
        fb.framePriorities.putAll(priorities);
        fb.frameConflicts.addAll(List.of(conflicts));
        fb.validate(new Diagnostics());
        return fb;
    }

    @Nested
    @DisplayName("dominant frame")
    class Dominant {

        @Test
        @DisplayName("should break count ties by priority")
        void shouldBreakTiesByPriority() {
            DiscoursePass p = passFor(framebook(Map.of("X", 20, "Y", 10)));

            assertThat(p.dominantFrame(Map.of("X", 5, "Y", 5))).isEqualTo("X");
            assertThat(passFor(framebook(Map.of("X", 10, "Y", 20))).dominantFrame(Map.of("X", 5, "Y", 5)))
                    .isEqualTo("Y");
        }

        @Test
        @DisplayName("should break full ties by name")
        void shouldBreakTiesByName() {
            DiscoursePass p = passFor(framebook(Map.of("B", 10, "A", 10)));

            Map<String, Integer> counts = new LinkedHashMap<>();
            counts.put("B", 2);
            counts.put("A", 2);

            assertThat(p.dominantFrame(counts)).isEqualTo("A");
        }

        @Test
        @DisplayName("should prefer the higher count over priority")
        void shouldPreferCount() {
            DiscoursePass p = passFor(framebook(Map.of("X", 20, "Y", 10)));

            assertThat(p.dominantFrame(Map.of("X", 1, "Y", 2))).isEqualTo("Y");
            assertThat(p.dominantFrame(Map.<String, Integer>of())).isEqualTo(Summaries.NONE);
        }
    }

    @Nested
    @DisplayName("conflicts")
    class Conflicts {

        @Test
        @DisplayName("should never raise an adjusted count above its raw count")
        void shouldNotExceedRaw() {
            DiscoursePass p = passFor(framebook(Map.of("A", 10, "B", 10, "C", 10),
                    new FrameConflict("A", "B", 0.5),
                    new FrameConflict("B", "C", 1.0),
                    new FrameConflict("C", "A", 0.0)));
            Map<String, Integer> raw = Map.of("A", 3, "B", 4, "C", 1);

            Map<String, Double> adjusted = p.applyConflicts(raw);

            raw.forEach((f, n) -> assertThat(adjusted.get(f)).isLessThanOrEqualTo(n.doubleValue()));
            assertThat(adjusted).containsEntry("B", 2.0).containsEntry("C", 1.0).containsEntry("A", 0.0);
        }

        @Test
        @DisplayName("should leave counts alone when the trigger is absent")
        void shouldIgnoreAbsentTrigger() {
            DiscoursePass p = passFor(framebook(Map.of("A", 10, "B", 10), new FrameConflict("A", "B", 0.5)));

            assertThat(p.applyConflicts(Map.of("B", 4))).containsEntry("B", 4.0);
        }
    }

    @Nested
    @DisplayName("turns")
    class Turns {

        @Test
        @DisplayName("should keep raw counts and pick the dominant frame from adjusted counts")
        void shouldSummarizeTurn() {
            Document d = Fixtures.respondentDocument("d1", "The system failed us. The system is about money.");

            pass.analyze(d);
            DiscourseTurnSummary s = pass.summarize(d).get(0);

            assertThat(s.frames()).containsEntry("INSTITUTIONAL_LOGIC", 2)
                    .containsEntry("SYSTEM_FAILURE", 1)
                    .containsEntry("ECONOMIZATION", 1);
            assertThat(s.adjustedFrames()).containsEntry("INSTITUTIONAL_LOGIC", 1.0);
            assertThat(s.dominantFrame()).isEqualTo("SYSTEM_FAILURE");
            assertThat(s.activeFrameCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should record topoi apart from frames")
        void shouldSeparateTopoi() {
            Document d = Fixtures.respondentDocument("d2", "I had no choice, the money was gone.");

            pass.analyze(d);
            DiscourseTurnSummary s = pass.summarize(d).get(0);

            assertThat(s.topoi()).containsEntry(DiscoursePass.TOPOS_PREFIX + "NECESSITY", 1);
            assertThat(s.frames()).containsOnlyKeys("ECONOMIZATION");
        }
    }

    @Nested
    @DisplayName("claims")
    class Claims {

        private Document analyzed(String... texts) {
            Document d = Fixtures.respondentDocument("c", texts);
            pass.analyze(d);
            return d;
        }

        @Test
        @DisplayName("should report declared tensions with the turns they share")
        void shouldReportTension() {
            Document d = analyzed("It is my calling but the money is bad.", "Nothing here.", "A calling, and costs.");

            List<AnalyticClaim> claims = pass.claims(d);

            assertThat(claims).filteredOn(c -> c.type() == ClaimType.TENSION).singleElement().satisfies(c -> {
                assertThat(c.turns()).containsExactly(1, 3);
                assertThat(c.description()).contains("Calling vs. money");
            });
        }

        @Test
        @DisplayName("should report co-occurring frames in at least two turns")
        void shouldReportCoOccurrence() {
            Document d = analyzed("It is my calling but the money is bad.", "A calling, and costs.");

            assertThat(pass.claims(d)).filteredOn(c -> c.type() == ClaimType.CO_OCCURRENCE).singleElement()
                    .satisfies(c -> assertThat(c.frames()).containsExactly("ECONOMIZATION", "VOCATION"));
        }

        @Test
        @DisplayName("should report a dominant frame above the share threshold")
        void shouldReportDominance() {
            Document d = analyzed("Money, money, money.", "It was about justice.", "Quiet.");

            assertThat(pass.claims(d)).filteredOn(c -> c.type() == ClaimType.DOMINANCE).singleElement()
                    .satisfies(c -> assertThat(c.frames()).containsExactly("ECONOMIZATION"));
        }

        @Test
        @DisplayName("should sort claims by strength")
        void shouldSortByStrength() {
            Document d = analyzed("It is my calling but the money is bad.", "A calling, and costs.", "Money again.");

            List<AnalyticClaim> claims = pass.claims(d);

            for (int i = 1; i < claims.size(); i++) {
                assertThat(claims.get(i - 1).strength()).isGreaterThanOrEqualTo(claims.get(i).strength());
            }
        }
    }

    @Test
    @DisplayName("frame course should list every frame for every turn")
    void shouldBuildFrameCourse() {
        Document d = Fixtures.respondentDocument("fc", "About money.", "About justice.");
        pass.analyze(d);

        FrameCourse course = pass.frameCourse(d);

        assertThat(course.frames()).containsExactly("ECONOMIZATION", "LEGITIMACY_JUSTICE");
        assertThat(course.rows()).hasSize(2);
        assertThat(course.rows().get(0).counts()).containsEntry("LEGITIMACY_JUSTICE", 0).containsEntry("ECONOMIZATION", 1);
    }
}
