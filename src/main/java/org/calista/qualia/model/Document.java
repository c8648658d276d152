package org.calista.qualia.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Document — одно интервью: неизменяемые реплики + растущий список аннотаций.
 *
 * <p>Аннотации только добавляются. Запись идёт под локом (проходы могут работать параллельно),
 * чтение всегда возвращает снимок. {@link #revision()} растёт с каждой новой аннотацией и
 * служит ключом для кэшей производных профилей.</p>
 */
public final class Document {

    public static final String META_PARSE_MODE = "parse_mode";
    public static final String META_DETECTED_SPEAKERS = "detected_speakers";
    public static final String META_SPEAKER_MAPPING = "speaker_mapping";
    public static final String META_HASH = "hash";

    public final String id;
    public final String language;
    public final String rawText;
    public final List<Turn> turns;
    public final Map<String, Object> metadata;

    private final Map<Integer, Turn> byId;
    private final Object lock = new Object();
    private final List<Annotation> annotations = new ArrayList<>();

    private Document(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.language = b.language == null || b.language.isBlank() ? "de" : b.language;
        this.rawText = b.rawText == null ? "" : b.rawText;
        this.turns = List.copyOf(b.turns);
        this.metadata = Map.copyOf(b.metadata);

        Map<Integer, Turn> idx = new LinkedHashMap<>();
        for (int i = 0; i < turns.size(); i++) {
            Turn t = turns.get(i);
            if (idx.put(t.turnId, t) != null) {
                throw new IllegalArgumentException("Duplicate turn id " + t.turnId + " in " + id);
            }
            if (t.turnId != i + 1) {
                throw new IllegalArgumentException("Turn ids must run 1.." + turns.size() + " in order; position "
                        + (i + 1) + " has id " + t.turnId + " in " + id);
            }
        }
        this.byId = Map.copyOf(idx);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    // ---------------- turns ----------------

    public Optional<Turn> turn(int turnId) {
        return Optional.ofNullable(byId.get(turnId));
    }

    public List<Turn> respondentTurns() {
        List<Turn> out = new ArrayList<>();
        for (Turn t : turns) if (t.isRespondent()) out.add(t);
        return out;
    }

    public List<Turn> interviewerTurns() {
        List<Turn> out = new ArrayList<>();
        for (Turn t : turns) if (t.isInterviewer()) out.add(t);
        return out;
    }

    // ---------------- annotations ----------------

    /**
     * Appends one annotation after checking it against the owning turn.
     *
     * @throws IllegalArgumentException if the turn is unknown or the span does not match its text
     */
    public void add(Annotation a) {
        validate(a);
        synchronized (lock) {
            annotations.add(a);
        }
    }

    public void addAll(Collection<Annotation> batch) {
        if (batch == null || batch.isEmpty()) return;
        for (Annotation a : batch) validate(a);
        synchronized (lock) {
            annotations.addAll(batch);
        }
    }

    private void validate(Annotation a) {
        Objects.requireNonNull(a, "annotation");
        Turn t = byId.get(a.turnId);
        if (t == null) {
            throw new IllegalArgumentException("Annotation refers to unknown turn " + a.turnId + " in " + id);
        }
        if (a.end > t.text.length()) {
            throw new IllegalArgumentException("Annotation span exceeds turn " + a.turnId + ": " + a);
        }
        if (!t.text.regionMatches(a.start, a.matchedText, 0, a.matchedText.length())) {
            throw new IllegalArgumentException("matchedText differs from turn text at span: " + a);
        }
    }

    /** Monotonic: grows by one per added annotation. */
    public int revision() {
        synchronized (lock) {
            return annotations.size();
        }
    }

    public List<Annotation> annotations() {
        synchronized (lock) {
            return List.copyOf(annotations);
        }
    }

    public List<Annotation> annotations(String module) {
        return annotations(module, null, null);
    }

    public List<Annotation> annotations(String module, int turnId) {
        return annotations(module, null, turnId);
    }

    /**
     * Filtered snapshot. Null filters match everything.
     */
    public List<Annotation> annotations(String module, String category, Integer turnId) {
        List<Annotation> out = new ArrayList<>();
        for (Annotation a : annotations()) {
            if (module != null && !module.equals(a.module)) continue;
            if (category != null && !category.equals(a.category)) continue;
            if (turnId != null && turnId != a.turnId) continue;
            out.add(a);
        }
        return out;
    }

    public DocumentSummary summary() {
        int interviewer = 0;
        int respondent = 0;
        int sentences = 0;
        int words = 0;
        for (Turn t : turns) {
            if (t.isInterviewer()) interviewer++;
            else respondent++;
            sentences += t.sentenceCount();
            words += t.wordCount();
        }

        Map<String, Integer> perModule = new TreeMap<>();
        List<Annotation> snap = annotations();
        for (Annotation a : snap) perModule.merge(a.module, 1, Integer::sum);

        Object mode = metadata.get(META_PARSE_MODE);
        return new DocumentSummary(
                id,
                language,
                turns.size(),
                interviewer,
                respondent,
                sentences,
                words,
                snap.size(),
                perModule,
                mode == null ? "" : String.valueOf(mode)
        );
    }

    @Override
    public String toString() {
        return "Document{" + id + ", lang=" + language + ", turns=" + turns.size() + ", annotations=" + revision() + "}";
    }

    // ---------------- builder ----------------

    public static final class Builder {
        private final String id;
        private String language;
        private String rawText;
        private final List<Turn> turns = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder language(String language) { this.language = language; return this; }
        public Builder rawText(String rawText) { this.rawText = rawText; return this; }

        public Builder turn(Turn t) {
            turns.add(Objects.requireNonNull(t, "turn"));
            return this;
        }

        public Builder turns(Collection<Turn> ts) {
            for (Turn t : Objects.requireNonNull(ts, "turns")) turn(t);
            return this;
        }

        public Builder meta(String key, Object value) {
            if (key != null && value != null) metadata.put(key, value);
            return this;
        }

        public Document build() {
            return new Document(this);
        }
    }
}
