package org.calista.qualia.model;

import java.util.List;
import java.util.Objects;

/**
 * One speaker contribution. Turn ids are 1-based and dense within a document.
 */
public final class Turn {
    public static final String INTERVIEWER = "Interviewer";
    public static final String RESPONDENT = "Respondent";
    /** Role of monologue paragraphs. */
    public static final String SPEAKER = "Speaker";

    public final int turnId;
    public final String role;
    public final String originalSpeaker;
    public final String text;
    public final List<String> sentences;

    public Turn(int turnId, String role, String originalSpeaker, String text, List<String> sentences) {
        if (turnId < 1) throw new IllegalArgumentException("turnId must be >= 1: " + turnId);
        this.turnId = turnId;
        this.role = Objects.requireNonNull(role, "role");
        this.originalSpeaker = originalSpeaker == null ? role : originalSpeaker;
        this.text = Objects.requireNonNull(text, "text");
        this.sentences = sentences == null ? List.of() : List.copyOf(sentences);
    }

    public boolean isInterviewer() {
        return INTERVIEWER.equals(role);
    }

    /** Every role other than the interviewer counts as respondent. */
    public boolean isRespondent() {
        return !isInterviewer();
    }

    public int wordCount() {
        return countWords(text);
    }

    public int sentenceCount() {
        return sentences.size();
    }

    public static int countWords(String s) {
        if (s == null) return 0;
        String t = s.strip();
        if (t.isEmpty()) return 0;
        return t.split("\\s+").length;
    }

    @Override
    public String toString() {
        return "Turn{" + turnId + ", " + role + ", words=" + wordCount() + "}";
    }
}
