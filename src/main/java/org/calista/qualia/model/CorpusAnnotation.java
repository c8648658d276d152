package org.calista.qualia.model;

/**
 * An annotation with the document it belongs to, for corpus-wide exports.
 */
public record CorpusAnnotation(String documentId, String language, Annotation annotation) {
}
