package org.calista.qualia.analysis.affect;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.analysis.AnalysisPass;
import org.calista.qualia.analysis.Summaries;
import org.calista.qualia.annotate.PatternAnnotator;
import org.calista.qualia.framebook.CategoryDef;
import org.calista.qualia.language.LanguageGate;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Affect markers per dimension and the condensation sites built on them.
 */
public final class AffectPass implements AnalysisPass<AffectTurnSummary> {
    private static final Logger log = LogManager.getLogger(AffectPass.class);

    public static final String MODULE = "D_affect";

    public static final String AMBIVALENCE = "AMBIVALENCE";
    public static final String BODILY_REFERENCE = "BODILY_REFERENCE";
    public static final String DISTANCING = "DISTANCING";

    public static final int DEFAULT_TOP_N = 5;

    private final PatternAnnotator annotator;
    private final LanguageGate gate;

    public AffectPass(PatternAnnotator annotator, LanguageGate gate) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.gate = Objects.requireNonNull(gate, "gate");
    }

    @Override
    public String moduleId() {
        return MODULE;
    }

    @Override
    public String name() {
        return "Affect";
    }

    @Override
    public int analyze(Document document) {
        int added = 0;
        for (Turn turn : document.respondentTurns()) {
            List<Annotation> batch = new ArrayList<>();
            for (Map.Entry<String, CategoryDef> e : gate.framebook().affectDimensions.entrySet()) {
                String dim = e.getKey();
                batch.addAll(annotator.annotate(MODULE, turn.text, dim,
                        gate.patterns("affectDimensions", dim, e.getValue()),
                        turn.turnId, "affect_" + dim.toLowerCase(Locale.ROOT)));
            }
            document.addAll(batch);
            added += batch.size();
        }
        log.debug("{}: {} annotations on {}", MODULE, added, document.id);
        return added;
    }

    @Override
    public List<AffectTurnSummary> summarize(Document document) {
        List<AffectTurnSummary> out = new ArrayList<>();
        for (Turn turn : document.respondentTurns()) {
            Map<String, Integer> dims = new LinkedHashMap<>();
            List<Annotation> anns = document.annotations(MODULE, turn.turnId);
            for (Annotation a : anns) dims.merge(a.category, 1, Integer::sum);

            out.add(new AffectTurnSummary(
                    turn.turnId,
                    turn.wordCount(),
                    anns.size(),
                    Summaries.density(anns.size(), turn.wordCount()),
                    dims,
                    new ArrayList<>(dims.keySet()),
                    dims.size()
            ));
        }
        return out;
    }

    public List<CondensationSite> condensationSites(Document document) {
        return condensationSites(document, DEFAULT_TOP_N);
    }

    /**
     * Turns with at least one marker, ranked by condensation score (descending, stable).
     */
    public List<CondensationSite> condensationSites(Document document, int topN) {
        List<CondensationSite> all = new ArrayList<>();
        for (AffectTurnSummary s : summarize(document)) {
            if (s.markerCount() == 0) continue;

            List<String> reasons = new ArrayList<>();
            int score = condensationScore(s, reasons);
            String preview = document.turn(s.turnId()).map(t -> Summaries.preview(t.text)).orElse("");
            all.add(new CondensationSite(s.turnId(), score, reasons, s.markerDensity(), s.markerCount(),
                    s.activeDimensions(), preview));
        }
        all.sort((a, b) -> Integer.compare(b.score(), a.score()));
        return all.size() <= topN ? all : List.copyOf(all.subList(0, Math.max(0, topN)));
    }

    static int condensationScore(AffectTurnSummary s, List<String> reasons) {
        int score = 0;
        double d = s.markerDensity();
        if (d > 5.0) {
            score += 3;
            reasons.add(String.format(Locale.ROOT, "high affect density %.1f%% (+3)", d));
        } else if (d > 2.0) {
            score += 1;
            reasons.add(String.format(Locale.ROOT, "elevated affect density %.1f%% (+1)", d));
        }

        int dims = s.activeDimensionCount();
        if (dims >= 3) {
            score += 3;
            reasons.add(dims + " affect dimensions active (+3)");
        } else if (dims >= 2) {
            score += 1;
            reasons.add(dims + " affect dimensions active (+1)");
        }

        if (s.dimensions().containsKey(AMBIVALENCE)) {
            score += 2;
            reasons.add("ambivalence (+2)");
        }
        if (s.dimensions().containsKey(BODILY_REFERENCE)) {
            score += 2;
            reasons.add("bodily reference (+2)");
        }
        if (s.dimensions().containsKey(DISTANCING)) {
            score += 1;
            reasons.add("distancing (+1)");
        }
        return score;
    }
}
