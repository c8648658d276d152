package org.calista.qualia.justice;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.analysis.AnalyticClaim;
import org.calista.qualia.analysis.ClaimType;
import org.calista.qualia.analysis.Summaries;
import org.calista.qualia.analysis.affect.AffectPass;
import org.calista.qualia.analysis.affect.AffectTurnSummary;
import org.calista.qualia.analysis.discourse.DiscoursePass;
import org.calista.qualia.analysis.discourse.DiscourseTurnSummary;
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
import java.util.TreeSet;

/**
 * JusticeEngine — (не)справедливость как напряжение между фреймами притязания и фреймами структуры.
 *
 * <p>Design goals:
 * <ul>
 *   <li>no annotations of its own: reads position, discourse and affect summaries</li>
 *   <li>all arithmetic on unrounded values; rounding belongs to presentation</li>
 *   <li>results are cached per {@link Document#revision()} and recomputed once annotations grow</li>
 * </ul>
 */
public final class JusticeEngine {
    private static final Logger log = LogManager.getLogger(JusticeEngine.class);

    public static final String MODULE = "E_justice";

    static final double AFFECT_CAP = 1.25;
    static final double PASSIVE_MULT = 1.2;
    static final double MORAL_MULT = 1.1;
    static final double AMPLIFY = 1.10;
    static final double DAMPEN = 0.90;
    static final double STRONG_PERCENTILE = 0.75;
    static final int PEAKS = 3;
    static final double DENSITY_CLAIM = 0.5;

    private final Document document;
    private final PositionPass position;
    private final DiscoursePass discourse;
    private final AffectPass affect;
    private final FrameRoles roles;
    private final AxisLabels labels;

    // ---------------- cache ----------------

    /** Turn profiles and interview profile computed together at one revision. */
    private record Snapshot(int revision, List<JusticeTurnProfile> turns, JusticeProfile profile) {}

    private Snapshot cached;

    public JusticeEngine(Document document, PositionPass position, DiscoursePass discourse,
                         AffectPass affect, FrameRoles roles) {
        this(document, position, discourse, affect, roles, AxisLabels.defaults());
    }

    public JusticeEngine(Document document, PositionPass position, DiscoursePass discourse,
                         AffectPass affect, FrameRoles roles, AxisLabels labels) {
        this.document = Objects.requireNonNull(document, "document");
        this.position = Objects.requireNonNull(position, "position");
        this.discourse = Objects.requireNonNull(discourse, "discourse");
        this.affect = Objects.requireNonNull(affect, "affect");
        this.roles = Objects.requireNonNull(roles, "roles");
        this.labels = Objects.requireNonNull(labels, "labels");
    }

    public List<JusticeTurnProfile> turnProfiles() {
        return refresh().turns();
    }

    public JusticeProfile interviewProfile() {
        return refresh().profile();
    }

    private synchronized Snapshot refresh() {
        int rev = document.revision();
        Snapshot current = cached;
        if (current != null && rev == current.revision()) return current;

        List<JusticeTurnProfile> raw = computeTurns();
        JusticeProfile profile = aggregate(raw);

        List<JusticeTurnProfile> marked = new ArrayList<>(raw.size());
        for (JusticeTurnProfile p : raw) {
            boolean strong = p.justiceSite() && p.normalizedIntensity() >= profile.strongThreshold();
            marked.add(strong ? p.withStrong(true) : p);
        }

        Snapshot fresh = new Snapshot(rev, List.copyOf(marked), profile);
        cached = fresh;

        if (log.isDebugEnabled()) {
            log.debug("Justice {} @rev {}: sites={}/{}, score={}, trajectory={}", document.id, rev,
                    profile.justiceSiteCount(), profile.totalTurns(),
                    Summaries.round2(profile.justiceScore()), profile.trajectory());
        }
        return fresh;
    }

    // ---------------- per turn ----------------

    private List<JusticeTurnProfile> computeTurns() {
        Map<Integer, DiscourseTurnSummary> frames = new LinkedHashMap<>();
        for (DiscourseTurnSummary s : discourse.summarize(document)) frames.put(s.turnId(), s);
        Map<Integer, PositionTurnSummary> agency = new LinkedHashMap<>();
        for (PositionTurnSummary s : position.summarize(document)) agency.put(s.turnId(), s);
        Map<Integer, AffectTurnSummary> affects = new LinkedHashMap<>();
        for (AffectTurnSummary s : affect.summarize(document)) affects.put(s.turnId(), s);

        List<JusticeTurnProfile> out = new ArrayList<>();
        for (Turn turn : document.respondentTurns()) {
            DiscourseTurnSummary di = frames.get(turn.turnId);
            Map<String, Integer> present = di == null ? Map.of() : di.frames();
            out.add(profile(turn, present, agency.get(turn.turnId), affects.get(turn.turnId)));
        }
        return out;
    }

    JusticeTurnProfile profile(Turn turn, Map<String, Integer> present,
                               PositionTurnSummary po, AffectTurnSummary af) {
        Map<String, Integer> claim = new LinkedHashMap<>();
        Map<String, Integer> structure = new LinkedHashMap<>();
        List<String> contextFrames = new ArrayList<>();
        List<String> tags = new ArrayList<>();

        for (Map.Entry<String, Integer> e : present.entrySet()) {
            String f = e.getKey();
            int n = e.getValue();
            if (n <= 0) continue;
            if (roles.isClaim(f)) claim.put(f, n);
            else if (roles.isStructure(f)) structure.put(f, n);
            else if (roles.isAmplifying(f) || roles.isDampening(f)) contextFrames.add(f);
            else if (roles.isContextTag(f)) tags.add(f);
        }

        int claimTotal = sum(claim);
        int structureTotal = sum(structure);
        double base = Math.sqrt((double) claimTotal * structureTotal);
        String preview = Summaries.preview(turn.text);

        if (base == 0.0) {
            return new JusticeTurnProfile(turn.turnId, claim, structure, claimTotal, structureTotal, 0.0,
                    1.0, 1.0, Summaries.NONE, 1.0, List.of(), 0.0, 0.0, List.of(), tags, false, false, preview);
        }

        double affectDensity = af == null ? 0.0 : af.markerDensity();
        double affectMult = Math.min(1.0 + affectDensity / 100.0, AFFECT_CAP);

        String agencyLabel = po == null ? Summaries.NONE : po.dominantAgency();
        double agencyMult = agencyMultiplier(agencyLabel);

        double contextMult = 1.0;
        for (String f : contextFrames) {
            if (roles.isAmplifying(f)) contextMult *= AMPLIFY;
            else if (roles.isDampening(f)) contextMult *= DAMPEN;
        }

        double mult = affectMult * agencyMult * contextMult;
        double intensity = base * mult;
        double normalized = intensity / (Math.max(turn.text.length(), 1) / 1000.0);

        List<TensionAxis> axes = new ArrayList<>();
        for (Map.Entry<String, Integer> a : claim.entrySet()) {
            for (Map.Entry<String, Integer> s : structure.entrySet()) {
                double ax = Math.sqrt((double) a.getValue() * s.getValue()) * mult;
                axes.add(new TensionAxis(a.getKey(), s.getKey(), labels.label(a.getKey(), s.getKey()), ax, tags));
            }
        }
        axes.sort(Comparator.comparingDouble(TensionAxis::intensity).reversed());

        return new JusticeTurnProfile(turn.turnId, claim, structure, claimTotal, structureTotal, base,
                affectMult, agencyMult, agencyLabel, contextMult, contextFrames, intensity, normalized,
                axes, tags, true, false, preview);
    }

    static double agencyMultiplier(String dominantAgency) {
        if (PositionPass.PASSIVE_SUFFERING.equals(dominantAgency)) return PASSIVE_MULT;
        if (PositionPass.MORAL_REFLECTION.equals(dominantAgency)) return MORAL_MULT;
        return 1.0;
    }

    private static int sum(Map<String, Integer> m) {
        int n = 0;
        for (int v : m.values()) n += v;
        return n;
    }

    // ---------------- interview ----------------

    private JusticeProfile aggregate(List<JusticeTurnProfile> profiles) {
        List<JusticeTurnProfile> sites = new ArrayList<>();
        for (JusticeTurnProfile p : profiles) if (p.justiceSite()) sites.add(p);
        int total = profiles.size();
        if (sites.isEmpty()) return JusticeProfile.empty(total);

        double score = 0;
        List<Double> ordered = new ArrayList<>(sites.size());
        for (JusticeTurnProfile p : sites) {
            score += p.normalizedIntensity();
            ordered.add(p.normalizedIntensity());
        }
        double density = (double) sites.size() / total;

        List<JusticeTurnProfile> ranked = new ArrayList<>(sites);
        ranked.sort(Comparator.comparingDouble(JusticeTurnProfile::normalizedIntensity).reversed());
        List<Integer> peaks = new ArrayList<>();
        for (int i = 0; i < Math.min(PEAKS, ranked.size()); i++) peaks.add(ranked.get(i).turnId());

        List<Double> asc = new ArrayList<>(ordered);
        asc.sort(Double::compare);
        double threshold = asc.get(Math.min((int) (asc.size() * STRONG_PERCENTILE), asc.size() - 1));

        List<AxisTotal> axes = axisTotals(sites);
        return new JusticeProfile(score, density, sites.size(), total, peaks, threshold, axes,
                axes.isEmpty() ? null : axes.get(0), Trajectory.classify(ordered));
    }

    private static List<AxisTotal> axisTotals(List<JusticeTurnProfile> sites) {
        final class Acc {
            final TensionAxis first;
            int count;
            double total;
            final List<Integer> turns = new ArrayList<>();
            final TreeSet<String> tags = new TreeSet<>();

            Acc(TensionAxis first) {
                this.first = first;
            }
        }

        Map<String, Acc> acc = new LinkedHashMap<>();
        for (JusticeTurnProfile p : sites) {
            for (TensionAxis ax : p.axes()) {
                Acc a = acc.computeIfAbsent(ax.key(), k -> new Acc(ax));
                a.count++;
                a.total += ax.intensity();
                a.turns.add(p.turnId());
                a.tags.addAll(ax.contextTags());
            }
        }

        List<AxisTotal> out = new ArrayList<>();
        for (Acc a : acc.values()) {
            out.add(new AxisTotal(a.first.claimFrame(), a.first.structureFrame(), a.first.label(),
                    a.count, a.total, a.turns, new ArrayList<>(a.tags)));
        }
        // stable: equal totals keep first-seen order
        out.sort(Comparator.comparingDouble(AxisTotal::totalIntensity).reversed());
        return out;
    }

    // ---------------- claims ----------------

    /** Dominance, trajectory, peak, density and context claims, strongest first. */
    public List<AnalyticClaim> claims() {
        Snapshot snapshot = refresh();
        JusticeProfile profile = snapshot.profile();
        List<AnalyticClaim> out = new ArrayList<>();

        profile.dominant().ifPresent(dt -> {
            String tags = dt.contextTags().isEmpty() ? "" : " (contextualized by: " + String.join(", ", dt.contextTags()) + ")";
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.JUSTICE_DOMINANCE,
                    String.format(Locale.ROOT, "The central justice tension is %s (%d turns, intensity %.2f)%s.",
                            dt.label(), dt.count(), dt.totalIntensity(), tags),
                    "Axis " + dt.claimFrame() + " × " + dt.structureFrame() + " in turns " + dt.turns(),
                    dt.turns(),
                    List.of(dt.claimFrame(), dt.structureFrame()),
                    Summaries.round2(dt.totalIntensity()),
                    "Is " + dt.structureFrame() + " experienced mainly as a violation of " + dt.claimFrame()
                            + "? Or is there another reading of the tension?"));
        });

        if (profile.trajectory() == Trajectory.RISING || profile.trajectory() == Trajectory.FALLING) {
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.JUSTICE_TRAJECTORY,
                    "The justice tension is " + profile.trajectory().name().toLowerCase(Locale.ROOT) + " over the interview.",
                    String.format(Locale.ROOT, "%d justice sites, score %.2f", profile.justiceSiteCount(), profile.justiceScore()),
                    List.of(),
                    List.of(),
                    Summaries.round2(profile.justiceScore()),
                    "Does the change correlate with frame shifts or with changes of agency?"));
        }

        List<JusticeTurnProfile> strong = new ArrayList<>();
        for (JusticeTurnProfile p : snapshot.turns()) if (p.strong()) strong.add(p);
        strong.sort(Comparator.comparingDouble(JusticeTurnProfile::normalizedIntensity).reversed());
        for (JusticeTurnProfile p : strong.subList(0, Math.min(PEAKS, strong.size()))) {
            String axis = p.axes().isEmpty() ? "" : ", axis: " + p.axes().get(0).label();
            String ctx = p.contextTags().isEmpty() ? "" : ", context: " + String.join(", ", p.contextTags());
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.JUSTICE_PEAK,
                    String.format(Locale.ROOT, "Turn %d is an intense site of (in)justice (intensity %.2f/1000 chars, %s%s%s).",
                            p.turnId(), p.normalizedIntensity(), p.agencyLabel(), axis, ctx),
                    p.preview(),
                    List.of(p.turnId()),
                    p.axes().isEmpty() ? List.of() : List.of(p.axes().get(0).claimFrame(), p.axes().get(0).structureFrame()),
                    Summaries.round2(p.normalizedIntensity()),
                    "What exactly is experienced as unjust in turn " + p.turnId() + "? Which concrete situation?"));
        }

        if (profile.justiceDensity() >= DENSITY_CLAIM) {
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.JUSTICE_DENSITY,
                    String.format(Locale.ROOT, "%.0f%% of the turns carry justice tensions; (in)justice runs through the whole interview.",
                            profile.justiceDensity() * 100),
                    profile.justiceSiteCount() + "/" + profile.totalTurns() + " turns",
                    List.of(),
                    List.of(),
                    Summaries.round2(profile.justiceDensity()),
                    "Is (in)justice the common thread of the interview, or an effect of how it was conducted?"));
        }

        TreeSet<String> allTags = new TreeSet<>();
        for (AxisTotal a : profile.axes()) allTags.addAll(a.contextTags());
        if (!allTags.isEmpty()) {
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.JUSTICE_CONTEXT,
                    "The justice tensions are modulated by context-specific frames: " + String.join(", ", allTags) + ".",
                    allTags.size() + " context frame(s) on tension axes",
                    List.of(),
                    new ArrayList<>(allTags),
                    allTags.size(),
                    "Are these context frames triggers or amplifiers of the experience of (in)justice?"));
        }

        out.sort(Comparator.comparingDouble(AnalyticClaim::strength).reversed());
        return out;
    }

    public FrameRoles roles() {
        return roles;
    }
}
