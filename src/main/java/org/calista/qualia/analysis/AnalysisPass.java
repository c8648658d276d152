package org.calista.qualia.analysis;

import org.calista.qualia.model.Document;

import java.util.List;

/**
 * One analytic lens over a document.
 *
 * @param <S> per-turn summary row type
 */
public interface AnalysisPass<S> {

    /** Module id stamped on every annotation (e.g. {@code A_narrative}). */
    String moduleId();

    String name();

    /**
     * Appends annotations to the document.
     *
     * @return number of annotations added
     */
    int analyze(Document document);

    /** One row per respondent turn, in turn order. Pure: reads the document only. */
    List<S> summarize(Document document);
}
