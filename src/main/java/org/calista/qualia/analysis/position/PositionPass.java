package org.calista.qualia.analysis.position;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.analysis.AnalysisPass;
import org.calista.qualia.analysis.Summaries;
import org.calista.qualia.annotate.PatternAnnotator;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.CategoryDef;
import org.calista.qualia.language.LanguageCapabilities;
import org.calista.qualia.language.LanguageGate;
import org.calista.qualia.language.ParsedSubject;
import org.calista.qualia.language.SyntacticAnalyzer;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Confidence;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Subject positioning: pronouns, agency markers and (when a parser is available)
 * grammatical subjects by person and voice.
 */
public final class PositionPass implements AnalysisPass<PositionTurnSummary> {
    private static final Logger log = LogManager.getLogger(PositionPass.class);

    public static final String MODULE = "B_position";

    public static final String ACTIVE_AGENCY = "ACTIVE_AGENCY";
    public static final String PASSIVE_SUFFERING = "PASSIVE_SUFFERING";
    public static final String MORAL_REFLECTION = "MORAL_REFLECTION";

    public static final String PRONOUN_PREFIX = "PRON_";
    public static final String SYNTACTIC_PREFIX = "SYNTACTIC_";

    // ---------------- subject classes ----------------

    private static final Set<String> SUBJECT_DEPS = Set.of("sb", "nsubj", "nsubj:pass", "nsubjpass");
    private static final Set<String> PASSIVE_SUBJECT_DEPS = Set.of("nsubj:pass", "nsubjpass");
    private static final Set<String> PASSIVE_AUX_DEPS = Set.of("aux:pass", "auxpass");

    private static final Set<String> SELF = Set.of("ich", "i", "je", "yo", "io", "eu", "ik");
    private static final Set<String> WE = Set.of("wir", "we", "nous", "nosotros", "noi");
    private static final Set<String> ONE = Set.of("man", "one", "on");
    private static final Set<String> MODALS = Set.of(
            "muss", "müssen", "musste", "mussten", "kann", "können", "konnte", "konnten",
            "soll", "sollte", "sollten", "darf", "dürfen",
            "must", "can", "could", "should", "have to", "has to");

    private final PatternAnnotator annotator;
    private final LanguageGate gate;
    private final LanguageCapabilities capabilities;
    private final Diagnostics diagnostics;

    public PositionPass(PatternAnnotator annotator, LanguageGate gate,
                        LanguageCapabilities capabilities, Diagnostics diagnostics) {
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    @Override
    public String moduleId() {
        return MODULE;
    }

    @Override
    public String name() {
        return "Subject positioning";
    }

    // ---------------- analyze ----------------

    @Override
    public int analyze(Document document) {
        Map<String, List<String>> pronouns = gate.pronouns();
        Map<String, CategoryDef> agency = gate.framebook().agency;

        int added = 0;
        for (Turn turn : document.respondentTurns()) {
            List<Annotation> batch = new ArrayList<>();

            for (Map.Entry<String, List<String>> e : pronouns.entrySet()) {
                String label = e.getKey();
                batch.addAll(annotator.annotate(MODULE, turn.text, PRONOUN_PREFIX + label, e.getValue(),
                        turn.turnId, "pron_" + label.toLowerCase(Locale.ROOT)));
            }

            for (Map.Entry<String, CategoryDef> e : agency.entrySet()) {
                String cat = e.getKey();
                batch.addAll(annotator.annotate(MODULE, turn.text, cat,
                        gate.patterns("agency", cat, e.getValue()),
                        turn.turnId, "agency_" + cat.toLowerCase(Locale.ROOT)));
            }

            if (capabilities.hasSyntax) {
                batch.addAll(syntacticSubjects(document, turn));
            }

            document.addAll(batch);
            added += batch.size();
        }

        if (!capabilities.hasSyntax) {
            diagnostics.warnOnce("position-nosyntax:" + capabilities.language, "position.no-syntax", name(),
                    "No syntactic analyzer for '" + capabilities.language + "'; subject/voice annotations skipped");
        }
        log.debug("{}: {} annotations on {}", MODULE, added, document.id);
        return added;
    }

    private List<Annotation> syntacticSubjects(Document document, Turn turn) {
        SyntacticAnalyzer analyzer = capabilities.syntax().orElse(null);
        if (analyzer == null) return List.of();

        List<ParsedSubject> subjects;
        try {
            subjects = analyzer.subjects(turn.text);
        } catch (RuntimeException e) {
            diagnostics.warn("position.syntax-failed", name(),
                    "Syntactic analysis failed on turn " + turn.turnId + " of " + document.id + ": " + e.getMessage());
            return List.of();
        }
        if (subjects == null) return List.of();

        List<Annotation> out = new ArrayList<>();
        for (ParsedSubject s : subjects) {
            String dep = s.dependency() == null ? "" : s.dependency().toLowerCase(Locale.ROOT);
            if (!SUBJECT_DEPS.contains(dep)) continue;
            if (s.start() < 0 || s.end() > turn.text.length() || s.start() > s.end()
                    || !turn.text.substring(s.start(), s.end()).equals(s.text())) {
                diagnostics.warnOnce("syntax-offsets:" + document.id, "position.syntax-offsets", name(),
                        "Subject token offsets do not match turn text in " + document.id + "; token skipped");
                continue;
            }

            String subject = subjectClass(s);
            String voice = voice(s);
            out.add(Annotation.builder()
                    .module(MODULE)
                    .category(SYNTACTIC_PREFIX + subject + "_" + voice)
                    .ruleId("syn_subj_" + subject.toLowerCase(Locale.ROOT) + "_" + voice.toLowerCase(Locale.ROOT))
                    .pattern("dep=" + s.dependency() + ", head=" + s.headText())
                    .matchedText(s.text())
                    .span(s.start(), s.end())
                    .sentence(s.sentence().isEmpty() ? PatternAnnotator.containingSentence(turn.text, s.start()) : s.sentence())
                    .turnId(turn.turnId)
                    .confidence(Confidence.SYNTACTIC)
                    .note("head: " + s.headText())
                    .build());
        }
        return out;
    }

    static String subjectClass(ParsedSubject s) {
        String lemma = s.lemma().toLowerCase(Locale.ROOT);
        if (SELF.contains(lemma)) return "SELF";
        if (WE.contains(lemma)) return "WE";
        if (ONE.contains(lemma)) return "ONE";
        return "OTHER";
    }

    static String voice(ParsedSubject s) {
        String dep = s.dependency() == null ? "" : s.dependency().toLowerCase(Locale.ROOT);
        boolean passive = PASSIVE_SUBJECT_DEPS.contains(dep);
        boolean modal = "AUX".equalsIgnoreCase(s.headPos());
        for (ParsedSubject.Edge child : s.headChildren()) {
            String cd = child.dependency() == null ? "" : child.dependency().toLowerCase(Locale.ROOT);
            if (PASSIVE_AUX_DEPS.contains(cd)) passive = true;
            if ("aux".equals(cd) && child.text() != null && MODALS.contains(child.text().toLowerCase(Locale.ROOT))) {
                modal = true;
            }
        }
        if (passive) return "PASSIVE";
        if (modal) return "MODAL";
        return "ACTIVE";
    }

    // ---------------- summarize ----------------

    @Override
    public List<PositionTurnSummary> summarize(Document document) {
        List<String> agencyOrder = new ArrayList<>(gate.framebook().agency.keySet());
        List<PositionTurnSummary> out = new ArrayList<>();

        for (Turn turn : document.respondentTurns()) {
            Map<String, Integer> pronouns = new LinkedHashMap<>();
            Map<String, Integer> agency = new LinkedHashMap<>();
            Map<String, Integer> syntactic = new LinkedHashMap<>();

            for (Annotation a : document.annotations(MODULE, turn.turnId)) {
                if (a.category.startsWith(PRONOUN_PREFIX)) {
                    pronouns.merge(a.category.substring(PRONOUN_PREFIX.length()), 1, Integer::sum);
                } else if (a.category.startsWith(SYNTACTIC_PREFIX)) {
                    syntactic.merge(a.category, 1, Integer::sum);
                } else if (agencyOrder.contains(a.category)) {
                    agency.merge(a.category, 1, Integer::sum);
                }
            }

            int agencyTotal = 0;
            for (int v : agency.values()) agencyTotal += v;

            out.add(new PositionTurnSummary(
                    turn.turnId,
                    turn.wordCount(),
                    pronouns,
                    agency,
                    syntactic,
                    Summaries.dominant(agency, agencyOrder),
                    Summaries.density(agencyTotal, turn.wordCount())
            ));
        }
        return out;
    }
}
