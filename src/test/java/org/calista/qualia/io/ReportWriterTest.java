package org.calista.qualia.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.qualia.Fixtures;
import org.calista.qualia.core.AnalysisEngine;
import org.calista.qualia.core.AnalysisResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ReportWriterTest {

    private static AnalysisResult result;

    @TempDir
    Path tmp;

    private final ReportWriter writer = new ReportWriter(new FileIO());

    @BeforeAll
    static void analyze() {
        try (AnalysisEngine engine = AnalysisEngine.builder().framebook(Fixtures.framebook()).build()) {
            result = engine.analyze(Fixtures.respondentDocument("rep-01",
                    "I decided to study because I think it is about justice and money.",
                    "Then I was forced to quit. Somehow it felt unfair."));
        }
    }

    @Test
    @DisplayName("should render the result as snake_case JSON")
    void shouldRenderSnakeCase() throws Exception {
        JsonNode root = new ObjectMapper().readTree(writer.render(result));

        assertThat(root.get("document_id").asText()).isEqualTo("rep-01");
        assertThat(root.get("capability_level").asText()).isEqualTo("light");
        assertThat(root.get("annotations_added").has("C_discourse")).isTrue();
        assertThat(root.get("narrative")).hasSize(2);
        assertThat(root.get("integrated").get("turn_profiles")).hasSize(2);
        assertThat(root.get("justice").get("justice_site_count").asInt()).isEqualTo(result.justice().justiceSiteCount());
        assertThat(root.get("justice_turns").get(0).has("normalized_intensity")).isTrue();
        assertThat(root.has("diagnostics")).isTrue();
    }

    @Test
    @DisplayName("should write a pretty-printed report file, creating parent directories")
    void shouldWriteFile() throws Exception {
        Path out = tmp.resolve("reports/rep-01.report.json");

        writer.write(out, result);

        String text = Files.readString(out);
        assertThat(text).startsWith("{").contains("\n  \"document_id\" : \"rep-01\"");
    }
}
