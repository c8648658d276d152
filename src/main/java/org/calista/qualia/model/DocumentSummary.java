package org.calista.qualia.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat overview of a document: turn counts by role, text volume and annotations per module.
 */
public record DocumentSummary(
        String documentId,
        String language,
        int turns,
        int interviewerTurns,
        int respondentTurns,
        int sentences,
        int words,
        int annotations,
        Map<String, Integer> annotationsByModule,
        String parseMode
) {
    public DocumentSummary {
        annotationsByModule = Collections.unmodifiableMap(new LinkedHashMap<>(annotationsByModule));
    }
}
