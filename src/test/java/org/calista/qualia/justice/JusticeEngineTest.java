package org.calista.qualia.justice;

import org.calista.qualia.Fixtures;
import org.calista.qualia.analysis.AnalyticClaim;
import org.calista.qualia.analysis.ClaimType;
import org.calista.qualia.analysis.affect.AffectPass;
import org.calista.qualia.analysis.discourse.DiscoursePass;
import org.calista.qualia.analysis.position.PositionPass;
import org.calista.qualia.annotate.PatternAnnotator;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.Framebook;
import org.calista.qualia.language.LanguageCapabilities;
import org.calista.qualia.language.LanguageGate;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class JusticeEngineTest {

    private static final String QUIET = "It was a quiet spring.";
    private static final String MEETING = "We talked about money and justice at the long meeting in the town hall "
            + "yesterday evening with many neighbours from the street and their children too.";
    private static final String FORCED = "I was forced to pay money for justice and somehow my stomach hurts "
            + "when I think of it all now because nobody listens to people.";

    private Diagnostics diagnostics;
    private Framebook framebook;
    private PositionPass position;
    private DiscoursePass discourse;
    private AffectPass affect;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        framebook = Fixtures.framebook(diagnostics);
        PatternAnnotator annotator = new PatternAnnotator(diagnostics);
        LanguageGate gate = new LanguageGate("en", framebook, diagnostics);
        position = new PositionPass(annotator, gate, LanguageCapabilities.patternOnly("en"), diagnostics);
        discourse = new DiscoursePass(annotator, gate);
        affect = new AffectPass(annotator, gate);
    }

    private JusticeEngine engineFor(Document d) {
        position.analyze(d);
        discourse.analyze(d);
        affect.analyze(d);
        return new JusticeEngine(d, position, discourse, affect,
                FrameRoles.from(framebook, diagnostics), AxisLabels.from(framebook));
    }

    private Document sixTurns() {
        return Fixtures.respondentDocument("j6",
                QUIET,
                MEETING,
                "My sister lived nearby.",
                "We often walked by the river.",
                FORCED,
                "That is where the story ends.");
    }

    @Nested
    @DisplayName("turn profile")
    class TurnProfile {

        private JusticeEngine engine;
        private Turn turn;

        @BeforeEach
        void setUp() {
            Document d = Fixtures.respondentDocument("t", "Some text of a turn.");
            engine = engineFor(d);
            turn = d.turns.get(0);
        }

        @Test
        @DisplayName("should have zero base when either side is missing")
        void shouldHaveZeroBaseWithOneSide() {
            JusticeTurnProfile claimOnly = engine.profile(turn, Map.of("LEGITIMACY_JUSTICE", 3), null, null);
            JusticeTurnProfile structureOnly = engine.profile(turn, Map.of("ECONOMIZATION", 2, "HOUSING", 1), null, null);

            assertThat(claimOnly.base()).isZero();
            assertThat(claimOnly.justiceSite()).isFalse();
            assertThat(structureOnly.base()).isZero();
            assertThat(structureOnly.intensity()).isZero();
            assertThat(structureOnly.axes()).isEmpty();
        }

        @Test
        @DisplayName("should take the geometric mean of claim and structure totals")
        void shouldUseGeometricMean() {
            JusticeTurnProfile p = engine.profile(turn,
                    Map.of("LEGITIMACY_JUSTICE", 2, "AUTONOMY_SELF_DETERMINATION", 2, "ECONOMIZATION", 1), null, null);

            assertThat(p.base()).isCloseTo(2.0, within(1e-9));
            assertThat(p.justiceSite()).isTrue();
            assertThat(p.axes()).hasSize(2);
            assertThat(p.axes().get(0).intensity()).isCloseTo(Math.sqrt(2.0), within(1e-9));
        }

        @Test
        @DisplayName("should apply context multipliers and collect unclassified frames as tags")
        void shouldApplyContext() {
            JusticeTurnProfile p = engine.profile(turn, Map.of(
                    "LEGITIMACY_JUSTICE", 1, "ECONOMIZATION", 1,
                    "VULNERABILITY", 1, "NORMALIZATION", 1, "HOUSING", 2, "SYSTEM_FAILURE", 1), null, null);

            assertThat(p.contextMultiplier()).isCloseTo(1.1 * 0.9, within(1e-9));
            assertThat(p.contextTags()).containsExactly("HOUSING");
            assertThat(p.axes()).singleElement().satisfies(a -> assertThat(a.contextTags()).containsExactly("HOUSING"));
        }

        @Test
        @DisplayName("should map dominant agency to its multiplier")
        void shouldMapAgency() {
            assertThat(JusticeEngine.agencyMultiplier(PositionPass.PASSIVE_SUFFERING)).isEqualTo(1.2);
            assertThat(JusticeEngine.agencyMultiplier(PositionPass.MORAL_REFLECTION)).isEqualTo(1.1);
            assertThat(JusticeEngine.agencyMultiplier(PositionPass.ACTIVE_AGENCY)).isEqualTo(1.0);
            assertThat(JusticeEngine.agencyMultiplier("-")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("interview profile")
    class Interview {

        @Test
        @DisplayName("should rank the passive, affect-laden site above the neutral one")
        void shouldRankSites() {
            JusticeEngine engine = engineFor(sixTurns());

            JusticeProfile profile = engine.interviewProfile();
            List<JusticeTurnProfile> turns = engine.turnProfiles();
            JusticeTurnProfile t2 = turns.get(1);
            JusticeTurnProfile t5 = turns.get(4);

            assertThat(turns).filteredOn(JusticeTurnProfile::justiceSite)
                    .extracting(JusticeTurnProfile::turnId).containsExactly(2, 5);
            assertThat(t5.affectMultiplier()).isCloseTo(1.08, within(1e-9));
            assertThat(t5.agencyMultiplier()).isEqualTo(1.2);
            assertThat(t2.affectMultiplier()).isEqualTo(1.0);
            assertThat(t5.normalizedIntensity()).isGreaterThan(t2.normalizedIntensity());
            assertThat(t5.strong()).isTrue();
            assertThat(t2.strong()).isFalse();

            assertThat(profile.justiceSiteCount()).isEqualTo(2);
            assertThat(profile.totalTurns()).isEqualTo(6);
            assertThat(profile.justiceDensity()).isCloseTo(2.0 / 6.0, within(1e-9));
            assertThat(profile.peakTurns()).containsExactly(5, 2);
            assertThat(profile.trajectory()).isEqualTo(Trajectory.INSUFFICIENT_DATA);
            assertThat(profile.justiceScore())
                    .isCloseTo(t2.normalizedIntensity() + t5.normalizedIntensity(), within(1e-9));
        }

        @Test
        @DisplayName("should name the shared axis as the dominant tension")
        void shouldReportDominantAxis() {
            JusticeEngine engine = engineFor(sixTurns());

            AxisTotal dominant = engine.interviewProfile().dominant().orElseThrow();
            List<AnalyticClaim> claims = engine.claims();

            assertThat(dominant.claimFrame()).isEqualTo("LEGITIMACY_JUSTICE");
            assertThat(dominant.structureFrame()).isEqualTo("ECONOMIZATION");
            assertThat(dominant.turns()).containsExactly(2, 5);
            assertThat(claims).filteredOn(c -> c.type() == ClaimType.JUSTICE_DOMINANCE).singleElement()
                    .satisfies(c -> {
                        assertThat(c.description()).contains("Fairness vs. market logic");
                        assertThat(c.turns()).containsExactly(2, 5);
                        assertThat(c.module()).isEqualTo(JusticeEngine.MODULE);
                    });
            assertThat(claims).filteredOn(c -> c.type() == ClaimType.JUSTICE_PEAK)
                    .singleElement().satisfies(c -> assertThat(c.turns()).containsExactly(5));
            assertThat(claims).noneMatch(c -> c.type() == ClaimType.JUSTICE_DENSITY);
        }

        @Test
        @DisplayName("should recompute after annotations are added")
        void shouldInvalidateCache() {
            Document d = sixTurns();
            JusticeEngine engine = engineFor(d);
            JusticeProfile before = engine.interviewProfile();
            Turn first = d.turns.get(0);

            d.add(Annotation.researcher(DiscoursePass.MODULE, "LEGITIMACY_JUSTICE", first, 9, 14, "coded"));
            d.add(Annotation.researcher(DiscoursePass.MODULE, "ECONOMIZATION", first, 15, 21, "coded"));

            assertThat(engine.interviewProfile()).isNotSameAs(before);
            assertThat(engine.interviewProfile().justiceSiteCount()).isEqualTo(3);
            assertThat(engine.interviewProfile()).isSameAs(engine.interviewProfile());
        }

        @Test
        @DisplayName("should derive turn profiles and interview profile from the same revision")
        void shouldKeepViewsConsistent() {
            Document d = sixTurns();
            JusticeEngine engine = engineFor(d);
            engine.claims();
            Turn first = d.turns.get(0);

            d.add(Annotation.researcher(DiscoursePass.MODULE, "LEGITIMACY_JUSTICE", first, 9, 14, "coded"));
            d.add(Annotation.researcher(DiscoursePass.MODULE, "ECONOMIZATION", first, 15, 21, "coded"));
            List<JusticeTurnProfile> turns = engine.turnProfiles();
            JusticeProfile profile = engine.interviewProfile();

            assertThat(turns).filteredOn(JusticeTurnProfile::justiceSite).hasSize(profile.justiceSiteCount());
            assertThat(turns).allSatisfy(t -> assertThat(t.strong())
                    .isEqualTo(t.justiceSite() && t.normalizedIntensity() >= profile.strongThreshold()));
            assertThat(engine.claims()).filteredOn(c -> c.type() == ClaimType.JUSTICE_PEAK)
                    .flatExtracting(AnalyticClaim::turns)
                    .containsExactlyInAnyOrderElementsOf(turns.stream()
                            .filter(JusticeTurnProfile::strong).map(JusticeTurnProfile::turnId)
                            .collect(Collectors.toList()));
        }

        @Test
        @DisplayName("should stay consistent while annotations are added concurrently")
        void shouldTolerateConcurrentWriters() throws Exception {
            Document d = sixTurns();
            JusticeEngine engine = engineFor(d);
            Turn first = d.turns.get(0);
            ExecutorService readers = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> reads = new ArrayList<>();
                for (int r = 0; r < 4; r++) {
                    reads.add(readers.submit(() -> {
                        for (int i = 0; i < 50; i++) {
                            List<AnalyticClaim> claims = engine.claims();
                            assertThat(claims).isNotEmpty();
                        }
                    }));
                }
                for (int i = 0; i < 50; i++) {
                    d.add(Annotation.researcher(DiscoursePass.MODULE, i % 2 == 0 ? "LEGITIMACY_JUSTICE" : "ECONOMIZATION",
                            first, i % 2 == 0 ? 9 : 15, i % 2 == 0 ? 14 : 21, "coded"));
                }
                for (Future<?> f : reads) f.get(30, TimeUnit.SECONDS);
            } finally {
                readers.shutdownNow();
            }

            JusticeEngine fresh = new JusticeEngine(d, position, discourse, affect,
                    FrameRoles.from(framebook, diagnostics), AxisLabels.from(framebook));
            assertThat(engine.interviewProfile()).isEqualTo(fresh.interviewProfile());
            assertThat(engine.turnProfiles()).isEqualTo(fresh.turnProfiles());
        }

        @Test
        @DisplayName("should return an empty profile when no turn carries both sides")
        void shouldHandleNoSites() {
            JusticeEngine engine = engineFor(Fixtures.respondentDocument("none", QUIET, "Money only."));

            JusticeProfile profile = engine.interviewProfile();

            assertThat(profile.justiceScore()).isZero();
            assertThat(profile.dominant()).isEmpty();
            assertThat(profile.trajectory()).isEqualTo(Trajectory.INSUFFICIENT_DATA);
            assertThat(profile.totalTurns()).isEqualTo(2);
            assertThat(engine.claims()).isEmpty();
        }

        @Test
        @DisplayName("should report density and context claims when tensions pervade the interview")
        void shouldReportDensityAndContext() {
            JusticeEngine engine = engineFor(Fixtures.respondentDocument("ctx",
                    "The rent is unfair and the money is gone.",
                    "Justice costs money.",
                    "Quiet."));

            List<AnalyticClaim> claims = engine.claims();

            assertThat(claims).extracting(AnalyticClaim::type)
                    .contains(ClaimType.JUSTICE_DENSITY, ClaimType.JUSTICE_CONTEXT);
            assertThat(claims).filteredOn(c -> c.type() == ClaimType.JUSTICE_CONTEXT).singleElement()
                    .satisfies(c -> assertThat(c.frames()).containsExactly("HOUSING"));
            for (int i = 1; i < claims.size(); i++) {
                assertThat(claims.get(i - 1).strength()).isGreaterThanOrEqualTo(claims.get(i).strength());
            }
        }
    }
}
