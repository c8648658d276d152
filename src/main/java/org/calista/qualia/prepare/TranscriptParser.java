package org.calista.qualia.prepare;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.language.RegexSentenceSegmenter;
import org.calista.qualia.language.SentenceSegmenter;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TranscriptParser — превращает сырой текст транскрипта в {@link Document}.
 *
 * <p>Dialog mode needs at least two distinct {@code Label: } prefixes at line starts; otherwise every
 * non-empty paragraph becomes a {@link Turn#SPEAKER} turn (monologue).</p>
 */
public final class TranscriptParser {
    private static final Logger log = LogManager.getLogger(TranscriptParser.class);

    public static final String MODE_DIALOG = "dialog";
    public static final String MODE_MONOLOGUE = "monologue";

    private static final Pattern LABEL = Pattern.compile("^([A-ZÄÖÜ][A-Za-zäöüßÄÖÜ. \\t]{0,30}?):\\s", Pattern.MULTILINE);
    private static final Pattern INLINE_NAME = Pattern.compile("([A-ZÄÖÜ][a-zäöüß]+):\\s");
    private static final Pattern PARAGRAPH = Pattern.compile("\\n\\s*\\n");
    private static final Pattern WS = Pattern.compile("\\s+");

    private static final Set<String> INTERVIEWER_KEYWORDS = Set.of(
            "interviewer", "interviewerin", "int", "i",
            "moderator", "moderatorin", "mod",
            "researcher", "forscher", "forscherin",
            "fragender", "fragende");

    private static final Set<String> RESPONDENT_KEYWORDS = Set.of(
            "respondent", "interviewee", "befragter", "befragte", "b",
            "participant", "teilnehmer", "teilnehmerin", "p",
            "narrator", "erzähler", "erzählerin");

    private final SentenceSegmenter segmenter;
    private final String interviewerLabel;
    private final Map<String, String> speakerMapping;
    private final boolean preprocess;

    private TranscriptParser(Builder b) {
        this.segmenter = b.segmenter;
        this.interviewerLabel = b.interviewerLabel;
        this.speakerMapping = b.speakerMapping == null ? null : Map.copyOf(b.speakerMapping);
        this.preprocess = b.preprocess;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TranscriptParser defaults() {
        return builder().build();
    }

    // ---------------- parse ----------------

    public Document parse(String documentId, String language, String rawText) {
        Objects.requireNonNull(documentId, "documentId");
        String raw = rawText == null ? "" : rawText.replace("\r\n", "\n");
        String text = preprocess ? preprocessInlineSpeakers(raw) : raw;

        Set<String> labels = detectSpeakers(text);
        Document.Builder doc = Document.builder(documentId)
                .language(language)
                .rawText(rawText == null ? "" : rawText);

        Map<String, String> mapping = Map.of();
        if (labels.size() >= 2) {
            mapping = speakerMapping != null ? speakerMapping : classifySpeakers(text, labels, interviewerLabel);
            doc.turns(parseDialog(text, labels, mapping))
                    .meta(Document.META_PARSE_MODE, MODE_DIALOG)
                    .meta(Document.META_DETECTED_SPEAKERS, List.copyOf(new TreeSet<>(labels)));
        } else {
            doc.turns(parseMonologue(text))
                    .meta(Document.META_PARSE_MODE, MODE_MONOLOGUE)
                    .meta(Document.META_DETECTED_SPEAKERS, List.of());
        }
        doc.meta(Document.META_SPEAKER_MAPPING, mapping)
                .meta(Document.META_HASH, fingerprint(text));

        Document d = doc.build();
        if (log.isDebugEnabled()) {
            log.debug("Parsed {} as {}: {} turns, speakers={}", documentId,
                    d.metadata.get(Document.META_PARSE_MODE), d.turns.size(), mapping);
        }
        return d;
    }

    // ---------------- preprocessing ----------------

    /**
     * Moves inline speaker changes ("... question? Anna: answer") onto their own paragraph.
     * Only names seen at least twice as {@code Name: } qualify.
     */
    static String preprocessInlineSpeakers(String text) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher m = INLINE_NAME.matcher(text);
        while (m.find()) counts.merge(m.group(1), 1, Integer::sum);

        String out = text;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() < 2) continue;
            Pattern p = Pattern.compile("([.!?])[ \\t]+(" + Pattern.quote(e.getKey()) + "):\\s");
            out = p.matcher(out).replaceAll("$1\n\n$2: ");
        }
        return out;
    }

    // ---------------- speakers ----------------

    static Set<String> detectSpeakers(String text) {
        Set<String> labels = new TreeSet<>();
        Matcher m = LABEL.matcher(text);
        while (m.find()) labels.add(m.group(1).strip());
        return labels;
    }

    static Map<String, String> classifySpeakers(String text, Set<String> labels, String explicitInterviewer) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String label : labels) {
            String lower = label.strip().toLowerCase(Locale.ROOT);
            if (explicitInterviewer != null && lower.equals(explicitInterviewer.toLowerCase(Locale.ROOT))) {
                mapping.put(label, Turn.INTERVIEWER);
            } else if (INTERVIEWER_KEYWORDS.contains(lower)) {
                mapping.put(label, Turn.INTERVIEWER);
            } else if (RESPONDENT_KEYWORDS.contains(lower)) {
                mapping.put(label, Turn.RESPONDENT);
            }
        }

        List<String> unclassified = new ArrayList<>();
        for (String l : labels) if (!mapping.containsKey(l)) unclassified.add(l);

        if (!unclassified.isEmpty()) {
            Map<String, double[]> stats = speakerStats(text, labels);
            for (String label : unclassified) {
                double[] own = stats.get(label);
                if (own == null) continue;

                double otherLen = 0;
                double otherQ = 0;
                int others = 0;
                for (Map.Entry<String, double[]> e : stats.entrySet()) {
                    if (e.getKey().equals(label)) continue;
                    otherLen += e.getValue()[0];
                    otherQ += e.getValue()[1];
                    others++;
                }
                if (others == 0) {
                    mapping.put(label, mapping.containsValue(Turn.INTERVIEWER) ? Turn.RESPONDENT : Turn.INTERVIEWER);
                    continue;
                }
                otherLen /= others;
                otherQ /= others;

                boolean interviewer = own[0] < otherLen * 0.5 || own[1] > otherQ * 2 || own[1] > 0.8;
                mapping.put(label, interviewer ? Turn.INTERVIEWER : Turn.RESPONDENT);
            }
        }

        for (String l : labels) {
            if (!mapping.containsKey(l)) {
                mapping.put(l, mapping.containsValue(Turn.INTERVIEWER) ? Turn.RESPONDENT : Turn.INTERVIEWER);
            }
        }
        return mapping;
    }

    /** label -> {average turn length in chars, question marks per turn} */
    private static Map<String, double[]> speakerStats(String text, Set<String> labels) {
        Map<String, StringBuilder> joined = new LinkedHashMap<>();
        Map<String, Integer> turns = new LinkedHashMap<>();
        for (String[] block : blocks(text, labels)) {
            joined.computeIfAbsent(block[0], k -> new StringBuilder());
            StringBuilder sb = joined.get(block[0]);
            if (sb.length() > 0) sb.append(' ');
            sb.append(block[1]);
            turns.merge(block[0], 1, Integer::sum);
        }

        Map<String, double[]> out = new LinkedHashMap<>();
        for (Map.Entry<String, StringBuilder> e : joined.entrySet()) {
            int n = turns.get(e.getKey());
            String all = e.getValue().toString();
            long q = all.chars().filter(c -> c == '?').count();
            out.put(e.getKey(), new double[]{(double) all.length() / n, (double) q / n});
        }
        return out;
    }

    // ---------------- turns ----------------

    private List<Turn> parseDialog(String text, Set<String> labels, Map<String, String> mapping) {
        List<Turn> out = new ArrayList<>();
        for (String[] block : blocks(text, labels)) {
            String clean = normalize(block[1]);
            if (clean.isEmpty()) continue;
            String role = mapping.getOrDefault(block[0], Turn.RESPONDENT);
            out.add(new Turn(out.size() + 1, role, block[0], clean, segmenter.split(clean)));
        }
        return out;
    }

    private List<Turn> parseMonologue(String text) {
        List<String> paragraphs = new ArrayList<>();
        for (String p : PARAGRAPH.split(text)) {
            if (!p.isBlank()) paragraphs.add(p);
        }

        List<Turn> out = new ArrayList<>();
        for (String p : paragraphs) {
            String clean = normalize(p);
            out.add(new Turn(out.size() + 1, Turn.SPEAKER, Turn.SPEAKER, clean, segmenter.split(clean)));
        }
        return out;
    }

    /** {label, content} per speaker block, in text order. Longest labels are tried first. */
    private static List<String[]> blocks(String text, Set<String> labels) {
        List<String> sorted = new ArrayList<>(labels);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        StringBuilder alt = new StringBuilder();
        for (String l : sorted) {
            if (alt.length() > 0) alt.append('|');
            alt.append(Pattern.quote(l));
        }
        Pattern p = Pattern.compile("^(" + alt + "):\\s*(.+?)(?=^(?:" + alt + "):\\s|\\z)",
                Pattern.MULTILINE | Pattern.DOTALL);

        List<String[]> out = new ArrayList<>();
        Matcher m = p.matcher(text);
        while (m.find()) out.add(new String[]{m.group(1), m.group(2)});
        return out;
    }

    private static String normalize(String s) {
        return WS.matcher(s.strip()).replaceAll(" ");
    }

    static String fingerprint(String text) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(text.getBytes(StandardCharsets.UTF_8))).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    // ---------------- builder ----------------

    public static final class Builder {
        private SentenceSegmenter segmenter = RegexSentenceSegmenter.INSTANCE;
        private String interviewerLabel;
        private Map<String, String> speakerMapping;
        private boolean preprocess = true;

        private Builder() {}

        public Builder segmenter(SentenceSegmenter s) {
            this.segmenter = Objects.requireNonNull(s, "segmenter");
            return this;
        }

        /** Label (case-insensitive) that always maps to the interviewer. */
        public Builder interviewerLabel(String label) {
            this.interviewerLabel = label;
            return this;
        }

        /** Fixed label → role mapping; disables classification. */
        public Builder speakerMapping(Map<String, String> mapping) {
            this.speakerMapping = mapping;
            return this;
        }

        public Builder preprocess(boolean on) {
            this.preprocess = on;
            return this;
        }

        public TranscriptParser build() {
            return new TranscriptParser(this);
        }
    }
}
