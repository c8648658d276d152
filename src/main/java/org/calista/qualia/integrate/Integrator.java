package org.calista.qualia.integrate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.analysis.AnalyticClaim;
import org.calista.qualia.analysis.ClaimType;
import org.calista.qualia.analysis.Summaries;
import org.calista.qualia.analysis.affect.AffectPass;
import org.calista.qualia.analysis.affect.AffectTurnSummary;
import org.calista.qualia.analysis.affect.CondensationSite;
import org.calista.qualia.analysis.discourse.DiscoursePass;
import org.calista.qualia.analysis.discourse.DiscourseTurnSummary;
import org.calista.qualia.analysis.narrative.NarrativePass;
import org.calista.qualia.analysis.narrative.NarrativeTurnSummary;
import org.calista.qualia.analysis.narrative.TurningPointCandidate;
import org.calista.qualia.analysis.position.PositionPass;
import org.calista.qualia.analysis.position.PositionTurnSummary;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Integrator — сводит четыре прохода в профили реплик и ищет межмодульные паттерны.
 *
 * <p>Design goals:
 * <ul>
 *   <li>reads only the passes' summary views, never raw annotations</li>
 *   <li>every output is a proposal with a check question, not a finding</li>
 *   <li>rankings are stable: equal scores keep turn order</li>
 * </ul>
 * Run it only after all four passes have finished on the document.
 */
public final class Integrator {
    private static final Logger log = LogManager.getLogger(Integrator.class);

    public static final int DEFAULT_TOP_N = 5;

    static final double CENTRAL_FRAME_SHARE = 35.0;
    static final double RISING_AFFECT_RATIO = 1.5;

    private final Document document;
    private final NarrativePass narrative;
    private final PositionPass position;
    private final DiscoursePass discourse;
    private final AffectPass affect;
    private final int topN;

    public Integrator(Document document, NarrativePass narrative, PositionPass position,
                      DiscoursePass discourse, AffectPass affect) {
        this(document, narrative, position, discourse, affect, DEFAULT_TOP_N);
    }

    public Integrator(Document document, NarrativePass narrative, PositionPass position,
                      DiscoursePass discourse, AffectPass affect, int topN) {
        this.document = Objects.requireNonNull(document, "document");
        this.narrative = Objects.requireNonNull(narrative, "narrative");
        this.position = Objects.requireNonNull(position, "position");
        this.discourse = Objects.requireNonNull(discourse, "discourse");
        this.affect = Objects.requireNonNull(affect, "affect");
        this.topN = Math.max(1, topN);
    }

    public IntegratedReport report() {
        List<TurnProfile> profiles = turnProfiles();
        IntegratedReport r = new IntegratedReport(
                profiles,
                saliencySites(profiles, topN),
                triangulate(profiles),
                hypotheses(profiles),
                claims()
        );
        if (log.isInfoEnabled()) {
            log.info("Integrated {}: profiles={}, triangulations={}, hypotheses={}, claims={}",
                    document.id, profiles.size(), r.triangulations().size(), r.hypotheses().size(), r.claims().size());
        }
        return r;
    }

    // ---------------- turn profiles ----------------

    public List<TurnProfile> turnProfiles() {
        Map<Integer, NarrativeTurnSummary> a = byTurn(narrative.summarize(document), NarrativeTurnSummary::turnId);
        Map<Integer, PositionTurnSummary> b = byTurn(position.summarize(document), PositionTurnSummary::turnId);
        Map<Integer, DiscourseTurnSummary> c = byTurn(discourse.summarize(document), DiscourseTurnSummary::turnId);
        Map<Integer, AffectTurnSummary> d = byTurn(affect.summarize(document), AffectTurnSummary::turnId);

        List<TurnProfile> out = new ArrayList<>();
        for (Turn turn : document.respondentTurns()) {
            int tid = turn.turnId;
            NarrativeTurnSummary na = a.get(tid);
            PositionTurnSummary po = b.get(tid);
            DiscourseTurnSummary di = c.get(tid);
            AffectTurnSummary af = d.get(tid);

            List<String> processes = na == null ? List.of() : na.processStructures();
            int transitions = na == null ? 0 : na.transitions();
            String agency = po == null ? Summaries.NONE : po.dominantAgency();
            double affectDensity = af == null ? 0.0 : af.markerDensity();
            int activeFrames = di == null ? 0 : di.activeFrameCount();

            List<Flag> flags = new ArrayList<>();
            if (processes.contains(NarrativePass.TRAJECTORY)) flags.add(Flag.TRAJECTORY_CURVE);
            if (processes.contains(NarrativePass.TRANSFORMATION)) flags.add(Flag.TRANSFORMATION);
            if (affectDensity > 5.0) flags.add(Flag.HIGH_AFFECT);
            if (PositionPass.PASSIVE_SUFFERING.equals(agency)) flags.add(Flag.PASSIVE);
            if (activeFrames >= 3) flags.add(Flag.MULTI_FRAME);
            if (transitions >= 2) flags.add(Flag.TEXT_TYPE_SHIFT);

            int total = (na == null ? 0 : na.annotationCount())
                    + (po == null ? 0 : po.annotationCount())
                    + (di == null ? 0 : di.frameTotal() + di.topoiTotal())
                    + (af == null ? 0 : af.markerCount());

            out.add(new TurnProfile(
                    tid,
                    turn.wordCount(),
                    Summaries.preview(turn.text),
                    na == null ? List.of() : na.shortSequence(),
                    processes,
                    transitions,
                    agency,
                    po == null ? 0.0 : po.agencyDensity(),
                    po == null ? Map.of() : po.pronouns(),
                    di == null ? Summaries.NONE : di.dominantFrame(),
                    activeFrames,
                    di == null ? Map.of() : di.frames(),
                    affectDensity,
                    af == null ? List.of() : af.activeDimensions(),
                    flags,
                    total
            ));
        }
        return out;
    }

    private static <S> Map<Integer, S> byTurn(List<S> rows, ToIntFunction<S> id) {
        Map<Integer, S> m = new LinkedHashMap<>();
        for (S r : rows) m.put(id.applyAsInt(r), r);
        return m;
    }

    // ---------------- saliency ----------------

    public List<SaliencySite> saliencySites(List<TurnProfile> profiles, int topN) {
        List<SaliencySite> all = new ArrayList<>();
        for (TurnProfile p : profiles) {
            List<String> reasons = new ArrayList<>();
            int score = 3 * p.flagCount();
            if (!p.flags().isEmpty()) reasons.add("flags: " + p.flags() + " (+" + score + ")");

            if (p.affectDensity() > 5.0) {
                score += 3;
                reasons.add(String.format(Locale.ROOT, "high affect density %.1f%% (+3)", p.affectDensity()));
            } else if (p.affectDensity() > 2.0) {
                score += 1;
                reasons.add(String.format(Locale.ROOT, "elevated affect density %.1f%% (+1)", p.affectDensity()));
            }
            if (p.activeFrameCount() >= 3) {
                score += 2;
                reasons.add(p.activeFrameCount() + " frames active (+2)");
            }
            if (p.transitions() >= 2) {
                score += 2;
                reasons.add(p.transitions() + " text type transitions (+2)");
            }
            if (!p.processStructures().isEmpty()) {
                score += 2;
                reasons.add("process structure: " + String.join(", ", p.processStructures()) + " (+2)");
            }
            all.add(new SaliencySite(p, score, reasons));
        }
        all.sort(Comparator.comparingInt(SaliencySite::score).reversed());
        return all.size() <= topN ? all : List.copyOf(all.subList(0, Math.max(0, topN)));
    }

    // ---------------- triangulation ----------------

    public List<TriangulationMatch> triangulate(List<TurnProfile> profiles) {
        List<TriangulationMatch> out = new ArrayList<>();
        for (TurnProfile p : profiles) {
            List<TriangulationPattern> hits = new ArrayList<>();
            for (TriangulationPattern t : TriangulationPattern.values()) {
                if (t.matches(p)) hits.add(t);
            }
            if (!hits.isEmpty()) out.add(new TriangulationMatch(p.turnId(), hits, p.preview()));
        }
        out.sort(Comparator.comparingInt(TriangulationMatch::count).reversed());
        return out;
    }

    // ---------------- hypotheses ----------------

    public List<Hypothesis> hypotheses(List<TurnProfile> profiles) {
        List<Hypothesis> out = new ArrayList<>();
        if (profiles.isEmpty()) return out;

        agencyArc(profiles).ifPresent(out::add);
        centralFrame(profiles).ifPresent(out::add);
        risingAffect(profiles).ifPresent(out::add);
        return out;
    }

    private Optional<Hypothesis> agencyArc(List<TurnProfile> profiles) {
        List<Integer> active = new ArrayList<>();
        List<Integer> passive = new ArrayList<>();
        List<Integer> activeTurns = new ArrayList<>();
        List<Integer> passiveTurns = new ArrayList<>();
        for (int i = 0; i < profiles.size(); i++) {
            String a = profiles.get(i).dominantAgency();
            if (PositionPass.ACTIVE_AGENCY.equals(a)) {
                active.add(i);
                activeTurns.add(profiles.get(i).turnId());
            } else if (PositionPass.PASSIVE_SUFFERING.equals(a)) {
                passive.add(i);
                passiveTurns.add(profiles.get(i).turnId());
            }
        }
        if (active.isEmpty() || passive.isEmpty()) return Optional.empty();

        double meanActive = mean(active);
        double meanPassive = mean(passive);
        List<Integer> keys = new ArrayList<>(activeTurns);
        keys.addAll(passiveTurns);
        keys.sort(Integer::compare);

        String evidence = "Active-dominant turns " + activeTurns + ", passive-dominant turns " + passiveTurns;
        if (meanActive < meanPassive) {
            return Optional.of(new Hypothesis(
                    Hypothesis.Type.AGENCY_ARC_DOWNWARD,
                    "There are indications of a trajectory: active agency early on gives way to a mode of suffering.",
                    evidence,
                    "Is this a biographical trajectory of suffering?",
                    "Read the original passages of the marked turns.",
                    keys));
        }
        if (meanPassive < meanActive) {
            return Optional.of(new Hypothesis(
                    Hypothesis.Type.AGENCY_ARC_UPWARD,
                    "There are indications of a transformation: passive suffering early on gives way to active shaping.",
                    evidence,
                    "Is this a process of biographical transformation?",
                    "Where exactly does the perspective tip over? Is there a trigger?",
                    keys));
        }
        return Optional.empty();
    }

    private Optional<Hypothesis> centralFrame(List<TurnProfile> profiles) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (TurnProfile p : profiles) {
            for (Map.Entry<String, Integer> e : p.frames().entrySet()) totals.merge(e.getKey(), e.getValue(), Integer::sum);
        }
        if (totals.isEmpty()) return Optional.empty();

        int total = 0;
        for (int v : totals.values()) total += v;
        String dominant = discourse.dominantFrame(totals);
        double pct = total > 0 ? totals.get(dominant) * 100.0 / total : 0.0;
        if (pct <= CENTRAL_FRAME_SHARE) return Optional.empty();

        List<Integer> turns = new ArrayList<>();
        for (TurnProfile p : profiles) if (p.frames().containsKey(dominant)) turns.add(p.turnId());

        return Optional.of(new Hypothesis(
                Hypothesis.Type.CENTRAL_FRAME,
                String.format(Locale.ROOT, "Frame '%s' dominates the interview (%.0f%%). It may be the respondent's central interpretive frame.",
                        dominant, pct),
                "Frame distribution: " + totals,
                "Is '" + dominant + "' the respondent's own reading, or an effect of how the questions were put?",
                "Does the frame appear in answers to different questions?",
                turns));
    }

    private Optional<Hypothesis> risingAffect(List<TurnProfile> profiles) {
        int n = profiles.size();
        if (n < 3) return Optional.empty();

        int maxIdx = 0;
        for (int i = 1; i < n; i++) {
            if (profiles.get(i).affectDensity() > profiles.get(maxIdx).affectDensity()) maxIdx = i;
        }
        double firstHalf = 0;
        double secondHalf = 0;
        for (int i = 0; i < n; i++) {
            if (i < n / 2) firstHalf += profiles.get(i).affectDensity();
            else secondHalf += profiles.get(i).affectDensity();
        }
        if (!(secondHalf > firstHalf * RISING_AFFECT_RATIO)) return Optional.empty();

        int keyTurn = profiles.get(maxIdx).turnId();
        return Optional.of(new Hypothesis(
                Hypothesis.Type.RISING_AFFECT,
                "Affective intensity rises over the interview. The conversation may be moving towards an emotionally charged core issue.",
                String.format(Locale.ROOT, "First half: %.1f, second half: %.1f", firstHalf, secondHalf),
                "Do the questions steer there, or does the respondent open up step by step?",
                "Key passage: turn " + keyTurn,
                List.of(keyTurn)));
    }

    private static double mean(List<Integer> xs) {
        double s = 0;
        for (int x : xs) s += x;
        return s / xs.size();
    }

    // ---------------- claims ----------------

    /** Turning points, discourse claims and affect condensation, sorted by strength (stable). */
    public List<AnalyticClaim> claims() {
        List<AnalyticClaim> out = new ArrayList<>();

        for (TurningPointCandidate tp : narrative.turningPoints(document, topN)) {
            out.add(new AnalyticClaim(
                    NarrativePass.MODULE,
                    ClaimType.TURNING_POINT,
                    "Narrative turning point candidate in turn " + tp.turnId(),
                    String.join("; ", tp.reasons()),
                    List.of(tp.turnId()),
                    List.of(),
                    tp.score(),
                    "Does this turn really mark a turning point in the biographical narrative?"));
        }

        out.addAll(discourse.claims(document));

        for (CondensationSite s : affect.condensationSites(document, topN)) {
            out.add(new AnalyticClaim(
                    AffectPass.MODULE,
                    ClaimType.AFFECT_CONDENSATION,
                    "Affective condensation in turn " + s.turnId(),
                    String.join("; ", s.reasons()),
                    List.of(s.turnId()),
                    List.of(),
                    s.score(),
                    "Does the affective condensation coincide with a narrative turning point or a frame shift?"));
        }

        out.sort(Comparator.comparingDouble(AnalyticClaim::strength).reversed());
        return out;
    }
}
