package org.calista.qualia.language;

import java.util.List;

/**
 * Grammatical subject token as reported by a {@link SyntacticAnalyzer}.
 *
 * @param text         surface form, exactly {@code turnText.substring(start, end)}
 * @param lemma        lemma (may equal text)
 * @param start        offset in the analysed text
 * @param end          end offset (exclusive)
 * @param dependency   dependency label of the token (nsubj, sb, nsubj:pass, ...)
 * @param headText     governing token
 * @param headPos      coarse part of speech of the head (VERB, AUX, ...)
 * @param headChildren dependents of the head, used for auxiliary inspection
 * @param sentence     containing sentence
 */
public record ParsedSubject(
        String text,
        String lemma,
        int start,
        int end,
        String dependency,
        String headText,
        String headPos,
        List<Edge> headChildren,
        String sentence
) {
    public ParsedSubject {
        headChildren = headChildren == null ? List.of() : List.copyOf(headChildren);
        lemma = lemma == null || lemma.isBlank() ? text : lemma;
        headPos = headPos == null ? "" : headPos;
        sentence = sentence == null ? "" : sentence;
    }

    /** One dependent of the head token. */
    public record Edge(String dependency, String text) {}
}
