package org.calista.qualia.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.core.AnalysisResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Pretty JSON report per document (summaries, rankings, claims, justice profile, diagnostics).
 */
public final class ReportWriter {
    private static final Logger log = LogManager.getLogger(ReportWriter.class);

    private final FileIO io;
    private final ObjectMapper mapper;

    public ReportWriter(FileIO io) {
        this(io, defaultMapper());
    }

    public ReportWriter(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String render(AnalysisResult result) {
        Objects.requireNonNull(result, "result");
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize report for " + result.documentId(), e);
        }
    }

    public void write(Path file, AnalysisResult result) throws IOException {
        io.writeString(file, render(result) + System.lineSeparator());
        log.info("Report for {} written to {}", result.documentId(), file);
    }
}
