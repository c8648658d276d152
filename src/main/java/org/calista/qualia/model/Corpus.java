package org.calista.qualia.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered collection of documents for batch runs.
 */
public final class Corpus {
    public final String name;
    private final Map<String, Document> documents = new LinkedHashMap<>();

    public Corpus(String name) {
        this.name = name == null || name.isBlank() ? "corpus" : name;
    }

    public synchronized void add(Document d) {
        Objects.requireNonNull(d, "document");
        if (documents.putIfAbsent(d.id, d) != null) {
            throw new IllegalArgumentException("Duplicate document id in corpus " + name + ": " + d.id);
        }
    }

    public synchronized Optional<Document> get(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    public synchronized List<Document> documents() {
        return List.copyOf(documents.values());
    }

    public synchronized int size() {
        return documents.size();
    }

    /** All annotations of one module (null = all modules) across documents, in document order. */
    public List<CorpusAnnotation> annotations(String module) {
        List<CorpusAnnotation> out = new ArrayList<>();
        for (Document d : documents()) {
            for (Annotation a : d.annotations(module)) {
                out.add(new CorpusAnnotation(d.id, d.language, a));
            }
        }
        return out;
    }

    public List<DocumentSummary> summaries() {
        List<DocumentSummary> out = new ArrayList<>();
        for (Document d : documents()) out.add(d.summary());
        return out;
    }
}
