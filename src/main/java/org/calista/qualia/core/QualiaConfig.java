package org.calista.qualia.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.qualia.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * QualiaConfig — конфиг пакетного прогона:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class QualiaConfig {

    private static final Logger log = LoggerFactory.getLogger(QualiaConfig.class);

    public FramebookSection framebook = new FramebookSection();
    public Input input = new Input();
    public Output output = new Output();
    public Analysis analysis = new Analysis();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FramebookSection {
        /** Framebook file; blank means the bundled classpath framebook. */
        public String path = "";
        /** Optional overlay merged on top. */
        public String overlay = "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Input {
        public String dir = "transcripts";
        public String glob = "*.txt";
        public String language = "de";
        /** Speaker label that always means the interviewer. Blank: auto-detect. */
        public String interviewerLabel = "";
        /** Fixed speaker label → role mapping. Empty: auto-classify. */
        public Map<String, String> speakerMapping = new LinkedHashMap<>();
        public boolean preprocessInlineSpeakers = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Output {
        public String dir = "out";
        public String annotationsFile = "annotations.jsonl";
        public String reportSuffix = ".report.json";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Analysis {
        public int topN = 5;
        /** Run the four passes of a document concurrently. */
        public boolean parallel = true;
        public Pool pool = new Pool();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Pool {
        /** 0 => one thread per pass. */
        public int parallelism = 0;
        public int queueCapacity = 64;
        public String threadNamePrefix = "qualia-pass-";
        public long shutdownTimeoutMs = 2500;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config; a missing or empty file is replaced by the defaults, written to disk.
     */
    public static QualiaConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            QualiaConfig created = new QualiaConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            QualiaConfig created = new QualiaConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        QualiaConfig cfg = mapper.readValue(json, QualiaConfig.class);
        if (cfg == null) cfg = new QualiaConfig();
        cfg.validate();
        return cfg;
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, QualiaConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (framebook == null) framebook = new FramebookSection();
        if (framebook.path == null) framebook.path = "";
        if (framebook.overlay == null) framebook.overlay = "";

        if (input == null) input = new Input();
        if (input.dir == null || input.dir.isBlank()) input.dir = "transcripts";
        if (input.glob == null || input.glob.isBlank()) input.glob = "*.txt";
        if (input.language == null || input.language.isBlank()) input.language = "de";
        if (input.interviewerLabel == null) input.interviewerLabel = "";
        if (input.speakerMapping == null) input.speakerMapping = new LinkedHashMap<>();

        if (output == null) output = new Output();
        if (output.dir == null || output.dir.isBlank()) output.dir = "out";
        if (output.annotationsFile == null || output.annotationsFile.isBlank()) output.annotationsFile = "annotations.jsonl";
        if (output.reportSuffix == null || output.reportSuffix.isBlank()) output.reportSuffix = ".report.json";

        if (analysis == null) analysis = new Analysis();
        if (analysis.topN < 1) analysis.topN = 1;
        if (analysis.pool == null) analysis.pool = new Pool();
        if (analysis.pool.parallelism < 0) analysis.pool.parallelism = 0;
        if (analysis.pool.queueCapacity < 8) analysis.pool.queueCapacity = 8;
        if (analysis.pool.threadNamePrefix == null || analysis.pool.threadNamePrefix.isBlank())
            analysis.pool.threadNamePrefix = "qualia-pass-";
        if (analysis.pool.shutdownTimeoutMs < 250) analysis.pool.shutdownTimeoutMs = 250;
    }
}
