package org.calista.qualia.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.model.Corpus;
import org.calista.qualia.model.CorpusAnnotation;
import org.calista.qualia.model.Document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Audit trail export: one annotation per line, snake_case keys, prefixed with {@code doc_id} and {@code language}.
 */
public final class AnnotationJsonlWriter {
    private static final Logger log = LogManager.getLogger(AnnotationJsonlWriter.class);

    private final FileIO io;
    private final ObjectMapper mapper;

    public AnnotationJsonlWriter(FileIO io) {
        this(io, defaultMapper());
    }

    public AnnotationJsonlWriter(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    /** @return number of lines written */
    public int write(Path file, Corpus corpus) throws IOException {
        Objects.requireNonNull(corpus, "corpus");
        return writeAll(file, corpus.annotations(null));
    }

    public int write(Path file, Document document) throws IOException {
        Objects.requireNonNull(document, "document");
        Corpus single = new Corpus(document.id);
        single.add(document);
        return write(file, single);
    }

    private int writeAll(Path file, List<CorpusAnnotation> rows) throws IOException {
        List<String> lines = new ArrayList<>(rows.size());
        for (CorpusAnnotation r : rows) lines.add(toLine(r));
        io.writeLines(file, lines);
        log.info("Wrote {} annotations to {}", lines.size(), file);
        return lines.size();
    }

    public String toLine(CorpusAnnotation row) {
        ObjectNode node = mapper.createObjectNode();
        node.put("doc_id", row.documentId());
        node.put("language", row.language());
        node.setAll((ObjectNode) mapper.valueToTree(row.annotation()));
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize annotation " + row.annotation().ruleId, e);
        }
    }
}
