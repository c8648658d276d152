package org.calista.qualia.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.qualia.Fixtures;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Confidence;
import org.calista.qualia.model.Corpus;
import org.calista.qualia.model.CorpusAnnotation;
import org.calista.qualia.model.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnnotationJsonlWriterTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();
    private AnnotationJsonlWriter writer;
    private Document doc;

    @BeforeEach
    void setUp() {
        writer = new AnnotationJsonlWriter(new FileIO());
        doc = Fixtures.respondentDocument("int-01", "The rent is too high.");
        doc.add(Annotation.builder()
                .module("C_discourse")
                .category("HOUSING")
                .ruleId("c_discourse_housing_00")
                .pattern("\\brent\\b")
                .matchedText("rent")
                .span(4, 8)
                .sentence("The rent is too high.")
                .turnId(1)
                .confidence(Confidence.PATTERN)
                .createdAtEpochMs(1_700_000_000_000L)
                .build());
    }

    @Test
    @DisplayName("should write one snake_case line per annotation with document id and language")
    void shouldWriteSnakeCaseLines() throws Exception {
        Path out = tmp.resolve("out/annotations.jsonl");

        int n = writer.write(out, doc);

        List<String> lines = Files.readAllLines(out);
        assertThat(n).isEqualTo(1);
        assertThat(lines).hasSize(1);

        JsonNode row = mapper.readTree(lines.get(0));
        assertThat(row.get("doc_id").asText()).isEqualTo("int-01");
        assertThat(row.get("language").asText()).isEqualTo("en");
        assertThat(row.get("module").asText()).isEqualTo("C_discourse");
        assertThat(row.get("rule_id").asText()).isEqualTo("c_discourse_housing_00");
        assertThat(row.get("matched_text").asText()).isEqualTo("rent");
        assertThat(row.get("start").asInt()).isEqualTo(4);
        assertThat(row.get("end").asInt()).isEqualTo(8);
        assertThat(row.get("turn_id").asInt()).isEqualTo(1);
        assertThat(row.get("confidence").asText()).isEqualTo("pattern");
        assertThat(row.has("ruleId")).isFalse();
    }

    @Test
    @DisplayName("should keep document order across a corpus")
    void shouldWriteCorpusInOrder() throws Exception {
        Document second = Fixtures.respondentDocument("int-02", "Money matters.");
        second.add(Annotation.researcher("C_discourse", "ECONOMIZATION", second.turns.get(0), 0, 5, "coded by hand"));
        Corpus corpus = new Corpus("batch");
        corpus.add(doc);
        corpus.add(second);
        Path out = tmp.resolve("all.jsonl");

        assertThat(writer.write(out, corpus)).isEqualTo(2);

        List<String> lines = Files.readAllLines(out);
        assertThat(mapper.readTree(lines.get(0)).get("doc_id").asText()).isEqualTo("int-01");
        JsonNode manual = mapper.readTree(lines.get(1));
        assertThat(manual.get("doc_id").asText()).isEqualTo("int-02");
        assertThat(manual.get("confidence").asText()).isEqualTo("researcher");
        assertThat(manual.get("note").asText()).isEqualTo("coded by hand");
    }

    @Test
    @DisplayName("should render a single compact line")
    void shouldRenderCompactLine() {
        String line = writer.toLine(new CorpusAnnotation(doc.id, doc.language, doc.annotations().get(0)));

        assertThat(line).doesNotContain("\n").startsWith("{\"doc_id\":\"int-01\",\"language\":\"en\"");
    }
}
