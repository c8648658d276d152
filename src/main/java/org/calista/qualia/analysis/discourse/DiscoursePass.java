package org.calista.qualia.analysis.discourse;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.analysis.AnalysisPass;
import org.calista.qualia.analysis.AnalyticClaim;
import org.calista.qualia.analysis.ClaimType;
import org.calista.qualia.analysis.Summaries;
import org.calista.qualia.annotate.PatternAnnotator;
import org.calista.qualia.framebook.CategoryDef;
import org.calista.qualia.framebook.FrameConflict;
import org.calista.qualia.framebook.FrameTension;
import org.calista.qualia.framebook.Framebook;
import org.calista.qualia.language.LanguageGate;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Discourse framing: frames and topoi per turn, conflict-adjusted dominance, and claims
 * about co-occurrence, trajectory, tension and dominance.
 *
 * <p>Raw counts stay untouched for the audit trail; only the derived adjusted map is scaled.</p>
 */
public final class DiscoursePass implements AnalysisPass<DiscourseTurnSummary> {
    private static final Logger log = LogManager.getLogger(DiscoursePass.class);

    public static final String MODULE = "C_discourse";
    public static final String TOPOS_PREFIX = "TOPOS_";

    static final double DOMINANCE_SHARE = 40.0;

    private final PatternAnnotator annotator;
    private final LanguageGate gate;
    private final Framebook framebook;

    public DiscoursePass(PatternAnnotator annotator, LanguageGate gate) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.framebook = gate.framebook();
    }

    @Override
    public String moduleId() {
        return MODULE;
    }

    @Override
    public String name() {
        return "Discourse framing";
    }

    // ---------------- analyze ----------------

    @Override
    public int analyze(Document document) {
        int added = 0;
        for (Turn turn : document.respondentTurns()) {
            List<Annotation> batch = new ArrayList<>();
            for (Map.Entry<String, CategoryDef> e : framebook.frames.entrySet()) {
                String frame = e.getKey();
                batch.addAll(annotator.annotate(MODULE, turn.text, frame,
                        gate.patterns("frames", frame, e.getValue()),
                        turn.turnId, "frame_" + frame.toLowerCase(Locale.ROOT)));
            }
            for (Map.Entry<String, CategoryDef> e : framebook.topoi.entrySet()) {
                String topos = e.getKey();
                batch.addAll(annotator.annotate(MODULE, turn.text, TOPOS_PREFIX + topos,
                        gate.patterns("topoi", topos, e.getValue()),
                        turn.turnId, "topos_" + topos.toLowerCase(Locale.ROOT)));
            }
            document.addAll(batch);
            added += batch.size();
        }
        log.debug("{}: {} annotations on {}", MODULE, added, document.id);
        return added;
    }

    // ---------------- summarize ----------------

    @Override
    public List<DiscourseTurnSummary> summarize(Document document) {
        List<DiscourseTurnSummary> out = new ArrayList<>();
        for (Turn turn : document.respondentTurns()) {
            Map<String, Integer> frames = new LinkedHashMap<>();
            Map<String, Integer> topoi = new LinkedHashMap<>();
            for (Annotation a : document.annotations(MODULE, turn.turnId)) {
                if (a.category.startsWith(TOPOS_PREFIX)) topoi.merge(a.category, 1, Integer::sum);
                else frames.merge(a.category, 1, Integer::sum);
            }
            Map<String, Double> adjusted = applyConflicts(frames);

            int total = 0;
            for (int v : frames.values()) total += v;

            out.add(new DiscourseTurnSummary(
                    turn.turnId,
                    frames,
                    adjusted,
                    topoi,
                    dominantFrame(adjusted),
                    frames.size(),
                    Summaries.density(total, turn.wordCount())
            ));
        }
        return out;
    }

    /**
     * Scales targets of every conflict whose trigger has at least one raw match.
     * With factors in [0,1] no adjusted count exceeds its raw count.
     */
    public Map<String, Double> applyConflicts(Map<String, Integer> raw) {
        Map<String, Double> adjusted = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : raw.entrySet()) adjusted.put(e.getKey(), e.getValue().doubleValue());
        if (adjusted.isEmpty()) return adjusted;

        for (FrameConflict c : framebook.frameConflicts) {
            if (raw.getOrDefault(c.ifPresent, 0) >= 1 && adjusted.containsKey(c.downweight)) {
                adjusted.put(c.downweight, adjusted.get(c.downweight) * c.factor);
            }
        }
        return adjusted;
    }

    /**
     * Highest count wins; ties go to the higher priority, then to the lexicographically smaller name.
     */
    public <N extends Number> String dominantFrame(Map<String, N> counts) {
        String best = null;
        for (String f : counts.keySet()) {
            if (best == null || compareForDominance(f, best, counts) < 0) best = f;
        }
        return best == null ? Summaries.NONE : best;
    }

    private <N extends Number> int compareForDominance(String a, String b, Map<String, N> counts) {
        int c = Double.compare(counts.get(b).doubleValue(), counts.get(a).doubleValue());
        if (c != 0) return c;
        c = Integer.compare(framebook.priority(b), framebook.priority(a));
        if (c != 0) return c;
        return a.compareTo(b);
    }

    // ---------------- claims ----------------

    /** All discourse claims, sorted by strength descending (stable). */
    public List<AnalyticClaim> claims(Document document) {
        List<DiscourseTurnSummary> rows = summarize(document);

        List<AnalyticClaim> out = new ArrayList<>();
        out.addAll(coOccurrenceClaims(rows));
        out.addAll(trajectoryClaims(rows));
        out.addAll(tensionClaims(rows));
        out.addAll(dominanceClaims(rows));
        out.sort(Comparator.comparingDouble(AnalyticClaim::strength).reversed());
        return out;
    }

    List<AnalyticClaim> coOccurrenceClaims(List<DiscourseTurnSummary> rows) {
        Map<String, List<Integer>> pairTurns = new TreeMap<>();
        for (DiscourseTurnSummary r : rows) {
            List<String> fs = new ArrayList<>(new TreeSet<>(r.frames().keySet()));
            for (int i = 0; i < fs.size(); i++) {
                for (int j = i + 1; j < fs.size(); j++) {
                    pairTurns.computeIfAbsent(fs.get(i) + "|" + fs.get(j), k -> new ArrayList<>()).add(r.turnId());
                }
            }
        }

        List<AnalyticClaim> out = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> e : pairTurns.entrySet()) {
            List<Integer> turns = e.getValue();
            if (turns.size() < 2) continue;
            String[] pair = e.getKey().split("\\|", 2);
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.CO_OCCURRENCE,
                    "Frames " + pair[0] + " and " + pair[1] + " occur together in " + turns.size() + " turns",
                    "Turns: " + turns,
                    turns,
                    List.of(pair[0], pair[1]),
                    turns.size(),
                    "Are " + pair[0] + " and " + pair[1] + " systematically linked? Do they reinforce each other or pull apart?"
            ));
        }
        return out;
    }

    List<AnalyticClaim> trajectoryClaims(List<DiscourseTurnSummary> rows) {
        int n = rows.size();
        if (n < 3) return List.of();

        int third = n / 3;
        Map<String, Integer> first = frameTotals(rows.subList(0, third));
        Map<String, Integer> last = frameTotals(rows.subList(n - third, n));

        TreeSet<String> onlyFirst = new TreeSet<>(first.keySet());
        onlyFirst.removeAll(last.keySet());
        TreeSet<String> onlyLast = new TreeSet<>(last.keySet());
        onlyLast.removeAll(first.keySet());

        List<AnalyticClaim> out = new ArrayList<>();
        if (!onlyFirst.isEmpty() || !onlyLast.isEmpty()) {
            List<String> shifted = new ArrayList<>(onlyFirst);
            shifted.addAll(onlyLast);
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.TRAJECTORY_SHIFT,
                    "Frame shift over the course of the interview",
                    "First third: " + first + ". Last third: " + last + ".",
                    List.of(),
                    shifted,
                    shifted.size(),
                    "Does the frame shift coincide with a narrative turning point or a change in agency?"
            ));
        }

        TreeSet<String> all = new TreeSet<>(first.keySet());
        all.addAll(last.keySet());
        for (String f : all) {
            int a = first.getOrDefault(f, 0);
            int e = last.getOrDefault(f, 0);
            if (e > a + 1) {
                out.add(new AnalyticClaim(MODULE, ClaimType.TRAJECTORY_GROWING,
                        "Frame " + f + " grows over the interview (" + a + "→" + e + ")",
                        "First third: " + a + ", last third: " + e,
                        List.of(), List.of(f), e - a,
                        "Why does " + f + " gain weight? A reaction to the questions or an inner dynamic?"));
            } else if (a > e + 1) {
                out.add(new AnalyticClaim(MODULE, ClaimType.TRAJECTORY_SHRINKING,
                        "Frame " + f + " recedes over the interview (" + a + "→" + e + ")",
                        "First third: " + a + ", last third: " + e,
                        List.of(), List.of(f), a - e,
                        "Why does " + f + " lose presence? Is it replaced by another frame?"));
            }
        }
        return out;
    }

    List<AnalyticClaim> tensionClaims(List<DiscourseTurnSummary> rows) {
        List<AnalyticClaim> out = new ArrayList<>();
        for (FrameTension t : framebook.frameTensions) {
            List<Integer> turns = new ArrayList<>();
            for (DiscourseTurnSummary r : rows) {
                if (r.frames().containsKey(t.frameA) && r.frames().containsKey(t.frameB)) turns.add(r.turnId());
            }
            if (turns.isEmpty()) continue;

            String label = t.description.isBlank() ? t.frameA + " vs. " + t.frameB : t.description;
            out.add(new AnalyticClaim(
                    MODULE,
                    ClaimType.TENSION,
                    "Frame tension: " + label,
                    "Both frames co-occur in turns: " + turns,
                    turns,
                    List.of(t.frameA, t.frameB),
                    turns.size(),
                    "How does the respondent handle the tension between " + t.frameA + " and " + t.frameB
                            + "? Resolve it, endure it, avoid it?"
            ));
        }
        return out;
    }

    List<AnalyticClaim> dominanceClaims(List<DiscourseTurnSummary> rows) {
        Map<String, Integer> raw = frameTotals(rows);
        if (raw.isEmpty()) return List.of();

        Map<String, Double> adjusted = applyConflicts(raw);
        double adjustedTotal = 0;
        for (double v : adjusted.values()) adjustedTotal += v;
        if (adjustedTotal <= 0) return List.of();

        String dominant = dominantFrame(adjusted);
        double pct = adjusted.get(dominant) / adjustedTotal * 100.0;
        if (pct <= DOMINANCE_SHARE) return List.of();

        int rawTotal = 0;
        for (int v : raw.values()) rawTotal += v;
        String rawDominant = dominantFrame(raw);
        double rawPct = raw.get(rawDominant) * 100.0 / rawTotal;

        String note = "";
        if (!rawDominant.equals(dominant)) {
            note = String.format(Locale.ROOT,
                    " (adjusted dominant %s at %.0f%%; without conflict weighting %s would dominate at %.0f%%)",
                    dominant, pct, rawDominant, rawPct);
        }

        Map<String, String> adjustedView = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : adjusted.entrySet()) {
            adjustedView.put(e.getKey(), String.format(Locale.ROOT, "%.1f", e.getValue()));
        }

        return List.of(new AnalyticClaim(
                MODULE,
                ClaimType.DOMINANCE,
                String.format(Locale.ROOT, "Frame %s dominates the interview (%.0f%% of weighted frame markers)%s",
                        dominant, pct, note),
                "Raw: " + raw + " | Adjusted: " + adjustedView,
                List.of(),
                List.of(dominant),
                Math.round(pct),
                "Is " + dominant + " the respondent's central interpretive frame, or an artefact of the interview guide?"
        ));
    }

    private static Map<String, Integer> frameTotals(List<DiscourseTurnSummary> rows) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (DiscourseTurnSummary r : rows) {
            for (Map.Entry<String, Integer> e : r.frames().entrySet()) totals.merge(e.getKey(), e.getValue(), Integer::sum);
        }
        return totals;
    }

    // ---------------- course ----------------

    public FrameCourse frameCourse(Document document) {
        List<DiscourseTurnSummary> rows = summarize(document);
        TreeSet<String> all = new TreeSet<>();
        for (DiscourseTurnSummary r : rows) all.addAll(r.frames().keySet());

        List<FrameCourse.Row> out = new ArrayList<>();
        for (DiscourseTurnSummary r : rows) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (String f : all) counts.put(f, r.frames().getOrDefault(f, 0));
            out.add(new FrameCourse.Row(r.turnId(), counts));
        }
        return new FrameCourse(new ArrayList<>(all), out);
    }
}
