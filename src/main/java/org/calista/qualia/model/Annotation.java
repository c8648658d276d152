package org.calista.qualia.model;

import java.util.Objects;

/**
 * Immutable record of one rule firing on one span of one turn.
 *
 * <p>Offsets are relative to the owning turn's text and {@code matchedText} is always
 * {@code turn.text.substring(start, end)} with original casing. {@link Document#add(Annotation)}
 * enforces that.</p>
 */
public final class Annotation {
    public final String module;
    public final String category;
    public final String ruleId;
    public final String pattern;
    public final String matchedText;
    public final int start;
    public final int end;
    public final String sentence;
    public final int turnId;
    public final Confidence confidence;
    public final String note;
    public final long createdAtEpochMs;

    private Annotation(Builder b) {
        this.module = requireText(b.module, "module");
        this.category = requireText(b.category, "category");
        this.ruleId = b.ruleId == null ? "" : b.ruleId;
        this.pattern = b.pattern == null ? "" : b.pattern;
        this.matchedText = Objects.requireNonNull(b.matchedText, "matchedText");
        this.start = b.start;
        this.end = b.end;
        this.sentence = b.sentence == null ? "" : b.sentence;
        this.turnId = b.turnId;
        this.confidence = Objects.requireNonNull(b.confidence, "confidence");
        this.note = b.note == null ? "" : b.note;
        this.createdAtEpochMs = b.createdAtEpochMs > 0 ? b.createdAtEpochMs : System.currentTimeMillis();

        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + "," + end + ") for " + ruleId);
        }
        if (matchedText.length() != end - start) {
            throw new IllegalArgumentException("matchedText length does not match span for " + ruleId);
        }
        if (turnId < 1) throw new IllegalArgumentException("turnId must be >= 1: " + turnId);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Researcher override: a manually placed annotation at the human tier.
     */
    public static Annotation researcher(String module, String category, Turn turn, int start, int end, String note) {
        Objects.requireNonNull(turn, "turn");
        if (start < 0 || end > turn.text.length() || end < start) {
            throw new IllegalArgumentException("Span [" + start + "," + end + ") outside turn " + turn.turnId);
        }
        return builder()
                .module(module)
                .category(category)
                .ruleId("researcher")
                .pattern("")
                .matchedText(turn.text.substring(start, end))
                .span(start, end)
                .sentence(turn.text.substring(start, end))
                .turnId(turn.turnId)
                .confidence(Confidence.RESEARCHER)
                .note(note)
                .build();
    }

    /** Equality over every field except the creation timestamp. */
    public boolean sameContent(Annotation o) {
        if (o == null) return false;
        return start == o.start
                && end == o.end
                && turnId == o.turnId
                && module.equals(o.module)
                && category.equals(o.category)
                && ruleId.equals(o.ruleId)
                && pattern.equals(o.pattern)
                && matchedText.equals(o.matchedText)
                && sentence.equals(o.sentence)
                && confidence == o.confidence
                && note.equals(o.note);
    }

    @Override
    public String toString() {
        return "Annotation{" + module + "/" + category + " " + ruleId
                + " turn=" + turnId + " [" + start + "," + end + ") '" + matchedText + "'}";
    }

    private static String requireText(String s, String name) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
        return s;
    }

    public static final class Builder {
        private String module;
        private String category;
        private String ruleId;
        private String pattern;
        private String matchedText;
        private int start;
        private int end;
        private String sentence;
        private int turnId;
        private Confidence confidence = Confidence.PATTERN;
        private String note;
        private long createdAtEpochMs;

        private Builder() {}

        public Builder module(String module) { this.module = module; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder ruleId(String ruleId) { this.ruleId = ruleId; return this; }
        public Builder pattern(String pattern) { this.pattern = pattern; return this; }
        public Builder matchedText(String matchedText) { this.matchedText = matchedText; return this; }
        public Builder span(int start, int end) { this.start = start; this.end = end; return this; }
        public Builder sentence(String sentence) { this.sentence = sentence; return this; }
        public Builder turnId(int turnId) { this.turnId = turnId; return this; }
        public Builder confidence(Confidence confidence) { this.confidence = Objects.requireNonNull(confidence, "confidence"); return this; }
        public Builder note(String note) { this.note = note; return this; }
        public Builder createdAtEpochMs(long ts) { this.createdAtEpochMs = ts; return this; }

        public Annotation build() {
            return new Annotation(this);
        }
    }
}
