package org.calista.qualia;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.core.AnalysisEngine;
import org.calista.qualia.core.AnalysisResult;
import org.calista.qualia.core.QualiaConfig;
import org.calista.qualia.diagnostics.Diagnostic;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.Framebook;
import org.calista.qualia.framebook.FramebookLoader;
import org.calista.qualia.io.AnnotationJsonlWriter;
import org.calista.qualia.io.FileIO;
import org.calista.qualia.io.LogFmt;
import org.calista.qualia.io.ReportWriter;
import org.calista.qualia.language.LanguageCapabilityProvider;
import org.calista.qualia.language.ServiceLoaderCapabilityProvider;
import org.calista.qualia.model.Corpus;
import org.calista.qualia.model.Document;
import org.calista.qualia.prepare.TranscriptParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * QualiaApp — пакетный прогон по папке транскриптов.
 *
 * Lifecycle:
 *  1) load config (created with defaults if absent)
 *  2) load framebook (+ overlay)
 *  3) parse every transcript into the corpus
 *  4) analyze the corpus, write the JSONL audit trail and one report per document
 *  5) close the engine (owns its pass pool)
 */
public final class QualiaApp {

    private static final Logger log = LogManager.getLogger(QualiaApp.class);

    private final Path cfgPath;
    private final FileIO io = new FileIO();
    private final Diagnostics diagnostics = new Diagnostics();

    public QualiaApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public static void main(String[] args) throws IOException {
        Path cfg = Path.of(args.length > 0 ? args[0] : "config/qualia.json");
        new QualiaApp(cfg).run();
    }

    public List<AnalysisResult> run() throws IOException {
        ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        QualiaConfig cfg = QualiaConfig.loadOrCreate(io, cfgPath, mapper);

        Framebook fb = loadFramebook(cfg);
        LanguageCapabilityProvider caps = new ServiceLoaderCapabilityProvider(diagnostics);

        try (AnalysisEngine engine = AnalysisEngine.builder()
                .framebook(fb)
                .diagnostics(diagnostics)
                .capabilities(caps)
                .config(cfg.analysis)
                .build()) {

            Corpus corpus = readCorpus(cfg, engine);
            List<AnalysisResult> results = engine.analyzeCorpus(corpus);

            Path outDir = Path.of(cfg.output.dir);
            int lines = new AnnotationJsonlWriter(io).write(outDir.resolve(cfg.output.annotationsFile), corpus);
            ReportWriter reports = new ReportWriter(io);
            for (AnalysisResult r : results) {
                reports.write(outDir.resolve(r.documentId() + cfg.output.reportSuffix), r);
            }

            logSummary(corpus, results, lines);
            return results;
        }
    }

    private Framebook loadFramebook(QualiaConfig cfg) {
        FramebookLoader loader = new FramebookLoader(io, diagnostics);
        Path overlay = cfg.framebook.overlay.isBlank() ? null : Path.of(cfg.framebook.overlay);
        if (cfg.framebook.path.isBlank()) {
            return loader.loadResource(FramebookLoader.DEFAULT_RESOURCE, overlay);
        }
        return loader.load(Path.of(cfg.framebook.path), overlay);
    }

    private Corpus readCorpus(QualiaConfig cfg, AnalysisEngine engine) throws IOException {
        String lang = cfg.input.language;
        TranscriptParser parser = TranscriptParser.builder()
                .segmenter(engine.capabilities(lang).segmenterOrDefault())
                .interviewerLabel(cfg.input.interviewerLabel.isBlank() ? null : cfg.input.interviewerLabel)
                .speakerMapping(cfg.input.speakerMapping.isEmpty() ? null : cfg.input.speakerMapping)
                .preprocess(cfg.input.preprocessInlineSpeakers)
                .build();

        Corpus corpus = new Corpus(cfg.input.dir);
        for (Path file : io.glob(Path.of(cfg.input.dir), cfg.input.glob)) {
            String id = stripExtension(file.getFileName().toString());
            Document d = parser.parse(id, lang, io.readString(file));
            corpus.add(d);
            log.debug("Loaded {} ({} turns)", file, d.turns.size());
        }
        if (corpus.size() == 0) {
            diagnostics.warn("app.no-input", "QualiaApp",
                    "No transcripts matching " + cfg.input.glob + " in " + cfg.input.dir);
        }
        return corpus;
    }

    private void logSummary(Corpus corpus, List<AnalysisResult> results, int lines) {
        if (!log.isInfoEnabled()) return;
        int warn = 0;
        int err = 0;
        for (Diagnostic d : diagnostics.snapshot()) {
            if (d.severity() == Diagnostic.Severity.WARN) warn++;
            if (d.severity() == Diagnostic.Severity.ERROR) err++;
        }
        final int warnings = warn;
        final int errors = err;
        log.info("\n{}", LogFmt.box("Qualia run", b -> {
            b.align(12)
                    .kv("documents", corpus.size())
                    .kv("analyzed", results.size())
                    .kv("annotations", lines)
                    .kv("warnings", warnings)
                    .kv("errors", errors)
                    .sep();
            for (AnalysisResult r : results) {
                b.line(String.format(Locale.ROOT, "%s: justice %.2f (%s), %d claims",
                        r.documentId(), r.justice().justiceScore(), r.justice().trajectory(),
                        r.integrated().claims().size() + r.justiceClaims().size()));
            }
        }));
    }

    private static String stripExtension(String name) {
        String n = name.endsWith(".gz") ? name.substring(0, name.length() - 3) : name;
        int dot = n.lastIndexOf('.');
        return dot > 0 ? n.substring(0, dot) : n;
    }
}
