package org.calista.qualia.analysis.narrative;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.analysis.AnalysisPass;
import org.calista.qualia.analysis.Summaries;
import org.calista.qualia.annotate.PatternAnnotator;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.CategoryDef;
import org.calista.qualia.framebook.Framebook;
import org.calista.qualia.language.LanguageGate;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Narrative structure: text type per sentence (narration, description, argumentation, ...)
 * and process structures over whole turns.
 *
 * <p>Text-type annotations are emitted only for the winning type of a sentence, so the
 * per-sentence sequence can be read back from the annotations alone.</p>
 */
public final class NarrativePass implements AnalysisPass<NarrativeTurnSummary> {
    private static final Logger log = LogManager.getLogger(NarrativePass.class);

    public static final String MODULE = "A_narrative";
    public static final String UNDETERMINED = "UNDETERMINED";
    public static final String TEXT_TYPE_PREFIX = "TT_";

    /** Process structure that marks a biographical trajectory of suffering. */
    public static final String TRAJECTORY = "TRAJECTORY";
    /** Process structure that marks a creative transformation. */
    public static final String TRANSFORMATION = "TRANSFORMATION";

    public static final int DEFAULT_TOP_N = 5;

    private final PatternAnnotator annotator;
    private final LanguageGate gate;
    private final Diagnostics diagnostics;

    public NarrativePass(PatternAnnotator annotator, LanguageGate gate, Diagnostics diagnostics) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    @Override
    public String moduleId() {
        return MODULE;
    }

    @Override
    public String name() {
        return "Narrative structure";
    }

    // ---------------- analyze ----------------

    @Override
    public int analyze(Document document) {
        Framebook fb = gate.framebook();
        int added = 0;

        for (Turn turn : document.respondentTurns()) {
            List<Annotation> batch = new ArrayList<>();

            int[][] spans = sentenceSpans(turn);
            for (int i = 0; i < spans.length; i++) {
                int[] span = spans[i];
                if (span == null) {
                    diagnostics.warnOnce("unlocated:" + document.id + ":" + turn.turnId, "narrative.sentence-unlocated", name(),
                            "Sentence " + (i + 1) + " of turn " + turn.turnId + " in " + document.id + " not found in turn text");
                    continue;
                }
                batch.addAll(classifySentence(turn, span, turn.sentences.get(i), fb.textTypes));
            }

            for (Map.Entry<String, CategoryDef> e : fb.processStructures.entrySet()) {
                String name = e.getKey();
                batch.addAll(annotator.annotate(MODULE, turn.text, name,
                        gate.patterns("processStructures", name, e.getValue()),
                        turn.turnId, "ps_" + name.toLowerCase(Locale.ROOT)));
            }

            document.addAll(batch);
            added += batch.size();
        }

        log.debug("{}: {} annotations on {}", MODULE, added, document.id);
        return added;
    }

    /** Annotations of the winning text type, or none when no type matched. */
    private List<Annotation> classifySentence(Turn turn, int[] span, String sentence, Map<String, CategoryDef> textTypes) {
        List<Annotation> best = List.of();
        for (Map.Entry<String, CategoryDef> e : textTypes.entrySet()) {
            String type = e.getKey();
            List<Annotation> hits = annotator.annotateRegion(MODULE, turn.text, span[0], span[1], sentence,
                    TEXT_TYPE_PREFIX + type, gate.patterns("textTypes", type, e.getValue()),
                    turn.turnId, "tt_" + type.toLowerCase(Locale.ROOT));
            // strictly greater: ties keep the earlier type
            if (hits.size() > best.size()) best = hits;
        }
        return best;
    }

    /**
     * Locates each sentence of the turn in its text, left to right. Unlocatable sentences get null.
     */
    static int[][] sentenceSpans(Turn turn) {
        int[][] spans = new int[turn.sentences.size()][];
        int cursor = 0;
        for (int i = 0; i < spans.length; i++) {
            String s = turn.sentences.get(i);
            int at = s.isEmpty() ? -1 : turn.text.indexOf(s, cursor);
            if (at < 0) continue;
            spans[i] = new int[]{at, at + s.length()};
            cursor = at + s.length();
        }
        return spans;
    }

    // ---------------- summarize ----------------

    @Override
    public List<NarrativeTurnSummary> summarize(Document document) {
        List<NarrativeTurnSummary> out = new ArrayList<>();
        for (Turn turn : document.respondentTurns()) {
            out.add(summarizeTurn(turn, document.annotations(MODULE, turn.turnId)));
        }
        return out;
    }

    private static NarrativeTurnSummary summarizeTurn(Turn turn, List<Annotation> anns) {
        int[][] spans = sentenceSpans(turn);
        List<String> sequence = new ArrayList<>(spans.length);
        TreeSet<String> processes = new TreeSet<>();

        for (Annotation a : anns) {
            if (!a.category.startsWith(TEXT_TYPE_PREFIX)) processes.add(a.category);
        }

        for (int[] span : spans) {
            String type = UNDETERMINED;
            if (span != null) {
                for (Annotation a : anns) {
                    if (!a.category.startsWith(TEXT_TYPE_PREFIX)) continue;
                    if (a.start >= span[0] && a.end <= span[1]) {
                        type = a.category.substring(TEXT_TYPE_PREFIX.length());
                        break;
                    }
                }
            }
            sequence.add(type);
        }

        List<String> shortSeq = new ArrayList<>();
        for (String t : sequence) {
            if (shortSeq.isEmpty() || !shortSeq.get(shortSeq.size() - 1).equals(t)) shortSeq.add(t);
        }

        return new NarrativeTurnSummary(
                turn.turnId,
                turn.sentenceCount(),
                sequence,
                shortSeq,
                countTransitions(sequence),
                new ArrayList<>(processes),
                anns.size()
        );
    }

    /** Adjacent pairs that are both determined and differ. */
    static int countTransitions(List<String> sequence) {
        int n = 0;
        for (int i = 1; i < sequence.size(); i++) {
            String a = sequence.get(i - 1);
            String b = sequence.get(i);
            if (UNDETERMINED.equals(a) || UNDETERMINED.equals(b)) continue;
            if (!a.equals(b)) n++;
        }
        return n;
    }

    // ---------------- turning points ----------------

    public List<TurningPointCandidate> turningPoints(Document document) {
        return turningPoints(document, DEFAULT_TOP_N);
    }

    /**
     * Turns ranked by turning-point score, descending and stable on ties. Turns scoring 0 are dropped.
     */
    public List<TurningPointCandidate> turningPoints(Document document, int topN) {
        List<TurningPointCandidate> all = new ArrayList<>();
        for (NarrativeTurnSummary s : summarize(document)) {
            List<String> reasons = new ArrayList<>();
            int score = turningPointScore(s, reasons);
            if (score <= 0) continue;

            String preview = document.turn(s.turnId()).map(t -> Summaries.preview(t.text)).orElse("");
            all.add(new TurningPointCandidate(s.turnId(), score, reasons, s.shortSequence(), s.processStructures(), preview));
        }
        all.sort((a, b) -> Integer.compare(b.score(), a.score()));
        return all.size() <= topN ? all : List.copyOf(all.subList(0, Math.max(0, topN)));
    }

    static int turningPointScore(NarrativeTurnSummary s, List<String> reasons) {
        int score = 0;
        if (s.transitions() > 0) {
            score += 2 * s.transitions();
            reasons.add(s.transitions() + " text type transition(s) (+" + (2 * s.transitions()) + ")");
        }
        int distinct = s.processStructures().size();
        if (distinct > 1) {
            score += 3 * distinct;
            reasons.add(distinct + " process structures co-occur: " + String.join(", ", s.processStructures()) + " (+" + (3 * distinct) + ")");
        } else if (distinct == 1) {
            score += 1;
            reasons.add("process structure " + s.processStructures().get(0) + " (+1)");
        }
        if (s.processStructures().contains(TRAJECTORY)) {
            score += 2;
            reasons.add("trajectory of suffering present (+2)");
        }
        return score;
    }
}
