package org.calista.qualia;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.qualia.core.AnalysisResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualiaAppTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();

    private Path config(Path in, Path out) throws Exception {
        ObjectNode root = mapper.createObjectNode();
        root.putObject("framebook").put("path", "").put("overlay", "");
        root.putObject("input").put("dir", in.toString()).put("glob", "*.txt").put("language", "de");
        root.putObject("output").put("dir", out.toString());
        root.putObject("analysis").put("parallel", false);
        Path cfg = tmp.resolve("qualia.json");
        Files.writeString(cfg, mapper.writeValueAsString(root));
        return cfg;
    }

    @Test
    @DisplayName("should analyze every transcript and write the audit trail and reports")
    void shouldRunBatch() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("transcripts"));
        Path out = tmp.resolve("out");
        Files.writeString(in.resolve("int-01.txt"), String.join("\n",
                "I: Wie hat das angefangen?",
                "B: Dann bin ich in die Schule gekommen. Ich musste immer funktionieren, weil das Geld fehlte.",
                "I: Und heute?",
                "B: Heute ist das irgendwie normal, aber es ist nicht gerecht."));
        Files.writeString(in.resolve("int-02.txt"), "B: Ich habe mich entschieden, meinen eigenen Weg zu gehen.");

        List<AnalysisResult> results = new QualiaApp(config(in, out)).run();

        assertThat(results).extracting(AnalysisResult::documentId).containsExactly("int-01", "int-02");
        assertThat(results.get(0).summary().respondentTurns()).isEqualTo(2);
        assertThat(out.resolve("int-01.report.json")).exists();
        assertThat(out.resolve("int-02.report.json")).exists();

        List<String> lines = Files.readAllLines(out.resolve("annotations.jsonl"));
        int total = results.get(0).totalAdded() + results.get(1).totalAdded();
        assertThat(lines).hasSize(total);
        assertThat(lines).allSatisfy(l -> assertThat(mapper.readTree(l).has("doc_id")).isTrue());
    }

    @Test
    @DisplayName("should finish with an empty audit trail when no transcript matches")
    void shouldHandleEmptyInput() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("empty"));
        Path out = tmp.resolve("out");

        List<AnalysisResult> results = new QualiaApp(config(in, out)).run();

        assertThat(results).isEmpty();
        assertThat(Files.readAllLines(out.resolve("annotations.jsonl"))).isEmpty();
    }
}
