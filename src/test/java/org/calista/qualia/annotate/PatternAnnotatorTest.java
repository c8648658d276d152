package org.calista.qualia.annotate;

import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Confidence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternAnnotatorTest {

    private Diagnostics diagnostics;
    private PatternAnnotator annotator;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        annotator = new PatternAnnotator(diagnostics);
    }

    @Nested
    @DisplayName("annotate")
    class Annotate {

        @Test
        @DisplayName("should match case-insensitively and keep original casing")
        void shouldMatchCaseInsensitively() {
            String text = "Money talks. MONEY rules.";

            List<Annotation> out = annotator.annotate("C_discourse", text, "ECONOMIZATION",
                    List.of("\\bmoney\\b"), 3, "frame_economization");

            assertThat(out).hasSize(2);
            assertThat(out.get(0).matchedText).isEqualTo("Money");
            assertThat(out.get(0).start).isZero();
            assertThat(out.get(0).end).isEqualTo(5);
            assertThat(out.get(1).matchedText).isEqualTo("MONEY");
            assertThat(out.get(1).start).isEqualTo(13);
            assertThat(out.get(1).sentence).isEqualTo("MONEY rules.");
            assertThat(out).allSatisfy(a -> {
                assertThat(a.ruleId).isEqualTo("frame_economization_00");
                assertThat(a.turnId).isEqualTo(3);
                assertThat(a.confidence).isEqualTo(Confidence.PATTERN);
                assertThat(text.substring(a.start, a.end)).isEqualTo(a.matchedText);
            });
        }

        @Test
        @DisplayName("should treat umlauts as word characters")
        void shouldMatchWholeGermanWords() {
            String text = "Die Behördenwillkür hat mich zermürbt. Überlastung überall.";

            List<Annotation> out = annotator.annotate("C_discourse", text, "BUREAUCRATIC_ORDER",
                    List.of("\\bbehörde\\w*", "\\büberlast\\w*", "\\bmich zermürb\\w*\\b"), 1, "frame_bureaucratic_order");

            assertThat(out).extracting(a -> a.matchedText)
                    .containsExactly("Behördenwillkür", "Überlastung", "mich zermürbt");
            assertThat(out.get(0).start).isEqualTo(4);
            assertThat(out.get(0).end).isEqualTo(19);
            assertThat(out).allSatisfy(a -> assertThat(text.substring(a.start, a.end)).isEqualTo(a.matchedText));
        }

        @Test
        @DisplayName("should number rules by pattern index")
        void shouldNumberRulesByPatternIndex() {
            List<Annotation> out = annotator.annotate("D_affect", "somehow my stomach", "AFFECT",
                    List.of("\\bsomehow\\b", "\\bstomach\\b"), 1, "affect_x");

            assertThat(out).extracting(a -> a.ruleId).containsExactly("affect_x_00", "affect_x_01");
        }

        @Test
        @DisplayName("should derive a rule prefix from module and category when none is given")
        void shouldDeriveRulePrefix() {
            List<Annotation> out = annotator.annotate("D_affect", "anyway", "DISTANCING",
                    List.of("anyway"), 1, null);

            assertThat(out).singleElement().satisfies(a -> assertThat(a.ruleId).isEqualTo("D_affect_distancing_00"));
        }

        @Test
        @DisplayName("should skip an invalid pattern and report it once")
        void shouldSkipInvalidPattern() {
            List<String> patterns = List.of("money(", "\\bmoney\\b");

            List<Annotation> first = annotator.annotate("C_discourse", "money", "ECONOMIZATION", patterns, 1, "p");
            List<Annotation> second = annotator.annotate("C_discourse", "money", "ECONOMIZATION", patterns, 2, "p");

            assertThat(first).singleElement().satisfies(a -> assertThat(a.ruleId).isEqualTo("p_01"));
            assertThat(second).hasSize(1);
            assertThat(diagnostics.withCode("pattern.invalid")).hasSize(1);
        }

        @Test
        @DisplayName("should return nothing for empty text or patterns")
        void shouldReturnNothingForEmptyInput() {
            assertThat(annotator.annotate("M", "", "C", List.of("x"), 1, "p")).isEmpty();
            assertThat(annotator.annotate("M", "x", "C", List.of(), 1, "p")).isEmpty();
        }
    }

    @Nested
    @DisplayName("annotateRegion")
    class AnnotateRegion {

        @Test
        @DisplayName("should only match inside the region and keep turn offsets")
        void shouldMatchInsideRegion() {
            String text = "then a. then b.";

            List<Annotation> out = annotator.annotateRegion("A_narrative", text, 8, 15, "then b.",
                    "TT_NARRATION", List.of("\\bthen\\b"), 1, "tt_narration");

            assertThat(out).singleElement().satisfies(a -> {
                assertThat(a.start).isEqualTo(8);
                assertThat(a.sentence).isEqualTo("then b.");
            });
        }

        @Test
        @DisplayName("should reject a region outside the text")
        void shouldRejectBadRegion() {
            assertThatThrownBy(() -> annotator.annotateRegion("M", "abc", 2, 9, null, "C", List.of("a"), 1, "p"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("containingSentence should cut at the surrounding terminators")
    void shouldFindContainingSentence() {
        String text = "First one. Second one! Third?";

        assertThat(PatternAnnotator.containingSentence(text, 12)).isEqualTo("Second one!");
        assertThat(PatternAnnotator.containingSentence(text, 0)).isEqualTo("First one.");
        assertThat(PatternAnnotator.containingSentence(text, 24)).isEqualTo("Third?");
        assertThat(PatternAnnotator.containingSentence("", 3)).isEmpty();
    }
}
