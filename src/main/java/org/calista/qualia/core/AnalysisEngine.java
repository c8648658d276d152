package org.calista.qualia.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.analysis.AnalysisPass;
import org.calista.qualia.analysis.affect.AffectPass;
import org.calista.qualia.analysis.discourse.DiscoursePass;
import org.calista.qualia.analysis.narrative.NarrativePass;
import org.calista.qualia.analysis.position.PositionPass;
import org.calista.qualia.annotate.PatternAnnotator;
import org.calista.qualia.diagnostics.Diagnostic;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.Framebook;
import org.calista.qualia.integrate.IntegratedReport;
import org.calista.qualia.integrate.Integrator;
import org.calista.qualia.io.LogFmt;
import org.calista.qualia.justice.AxisLabels;
import org.calista.qualia.justice.FrameRoles;
import org.calista.qualia.justice.JusticeEngine;
import org.calista.qualia.language.LanguageCapabilities;
import org.calista.qualia.language.LanguageCapabilityProvider;
import org.calista.qualia.language.LanguageGate;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Confidence;
import org.calista.qualia.model.Corpus;
import org.calista.qualia.model.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AnalysisEngine — сборка и прогон: четыре прохода, затем интегратор и justice.
 *
 * <p>Design goals:
 * <ul>
 *   <li>one shared {@link PatternAnnotator}, one pass set per language</li>
 *   <li>passes of one document may run concurrently; each writes only its own module</li>
 *   <li>aggregation starts only after every pass has finished</li>
 *   <li>the engine owns its pool unless one is injected, and closes only what it owns</li>
 * </ul>
 */
public final class AnalysisEngine implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(AnalysisEngine.class);

    private final Framebook framebook;
    private final Diagnostics diagnostics;
    private final LanguageCapabilityProvider capabilities;
    private final PatternAnnotator annotator;
    private final FrameRoles roles;
    private final AxisLabels axisLabels;
    private final int topN;

    private final boolean parallel;
    private final ExecutorService pool;
    private final boolean ownsPool;
    private final long shutdownTimeoutMs;

    private final Map<String, Passes> passesByLanguage = new ConcurrentHashMap<>();

    /** The four passes bound to one language. */
    private record Passes(LanguageCapabilities capabilities, NarrativePass narrative, PositionPass position,
                          DiscoursePass discourse, AffectPass affect) {
        List<AnalysisPass<?>> all() {
            return List.of(narrative, position, discourse, affect);
        }
    }

    private AnalysisEngine(Builder b) {
        this.framebook = Objects.requireNonNull(b.framebook, "framebook");
        this.diagnostics = b.diagnostics != null ? b.diagnostics : new Diagnostics();
        this.capabilities = b.capabilities != null ? b.capabilities : LanguageCapabilityProvider.patternOnly();
        this.annotator = new PatternAnnotator(diagnostics);
        this.roles = FrameRoles.from(framebook, diagnostics);
        this.axisLabels = AxisLabels.from(framebook);
        this.topN = Math.max(1, b.topN);
        this.parallel = b.parallel;
        this.shutdownTimeoutMs = Math.max(250, b.shutdownTimeoutMs);

        this.ownsPool = parallel && b.executor == null;
        this.pool = !parallel ? null : (ownsPool ? createPool(b) : b.executor);

        if (log.isInfoEnabled()) {
            log.info("\n{}", LogFmt.box("AnalysisEngine", x -> x
                    .align(18)
                    .kv("framebook", framebook.version.isEmpty() ? "(unversioned)" : framebook.version)
                    .kv("textTypes", framebook.textTypes.size())
                    .kv("processStructures", framebook.processStructures.size())
                    .kv("frames", framebook.frames.size())
                    .kv("topoi", framebook.topoi.size())
                    .kv("affectDimensions", framebook.affectDimensions.size())
                    .sep()
                    .kv("justice roles", roles.fromFramebook() ? "framebook" : "built-in defaults")
                    .kv("topN", topN)
                    .kv("parallel", parallel ? (ownsPool ? "owned pool" : "injected pool") : "off")
                    .kv("config warnings", diagnostics.size())));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public Framebook framebook() {
        return framebook;
    }

    public LanguageCapabilities capabilities(String language) {
        return passesFor(language).capabilities();
    }

    // ---------------- single document ----------------

    /**
     * Runs all passes and aggregations on one document.
     *
     * <p>A pass whose module already carries machine annotations on the document is not run again;
     * its existing annotations are reused.</p>
     */
    public AnalysisResult analyze(Document document) {
        Objects.requireNonNull(document, "document");
        long t0 = System.nanoTime();
        int diagBefore = diagnostics.size();

        Passes p = passesFor(document.language);
        Map<String, Integer> added = runPasses(document, p.all());

        Integrator integrator = new Integrator(document, p.narrative(), p.position(), p.discourse(), p.affect(), topN);
        IntegratedReport report = integrator.report();

        JusticeEngine justice = new JusticeEngine(document, p.position(), p.discourse(), p.affect(), roles, axisLabels);

        List<Diagnostic> all = diagnostics.snapshot();
        List<Diagnostic> mine = diagBefore >= all.size() ? List.of() : all.subList(diagBefore, all.size());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        AnalysisResult r = new AnalysisResult(
                document.id,
                document.language,
                p.capabilities().level(),
                document.summary(),
                added,
                p.narrative().summarize(document),
                p.position().summarize(document),
                p.discourse().summarize(document),
                p.affect().summarize(document),
                p.discourse().frameCourse(document),
                report,
                justice.interviewProfile(),
                justice.turnProfiles(),
                justice.claims(),
                mine,
                elapsedMs
        );

        if (log.isInfoEnabled()) {
            log.info("Analyzed {} [{} / {}]: +{} annotations, {} claims, justice sites {}/{} in {} ms",
                    document.id, document.language, r.capabilityLevel(), r.totalAdded(),
                    report.claims().size() + r.justiceClaims().size(),
                    r.justice().justiceSiteCount(), r.justice().totalTurns(), elapsedMs);
        }
        return r;
    }

    private Map<String, Integer> runPasses(Document document, List<AnalysisPass<?>> passes) {
        Map<String, Integer> added = new LinkedHashMap<>();
        List<AnalysisPass<?>> todo = new ArrayList<>();
        for (AnalysisPass<?> pass : passes) {
            if (alreadyAnnotated(document, pass.moduleId())) {
                diagnostics.warn("engine.already-annotated", "AnalysisEngine",
                        document.id + " already has " + pass.moduleId() + " annotations; pass not re-run");
                added.put(pass.moduleId(), 0);
            } else {
                todo.add(pass);
            }
        }

        if (pool == null || todo.size() < 2) {
            for (AnalysisPass<?> pass : todo) added.put(pass.moduleId(), pass.analyze(document));
            return ordered(passes, added);
        }

        List<Future<Integer>> futures = new ArrayList<>(todo.size());
        for (AnalysisPass<?> pass : todo) futures.add(pool.submit(() -> pass.analyze(document)));

        // every pass is settled before a failure is rethrown: nothing writes to the document afterwards
        Throwable failure = null;
        for (int i = 0; i < todo.size(); i++) {
            try {
                added.put(todo.get(i).moduleId(), await(futures.get(i), todo.get(i), document));
            } catch (RuntimeException | Error e) {
                if (failure == null) failure = e;
                else if (failure != e) failure.addSuppressed(e);
                if (Thread.currentThread().isInterrupted()) {
                    cancelFrom(futures, i + 1);
                    break;
                }
            }
        }
        if (failure instanceof RuntimeException re) throw re;
        if (failure instanceof Error err) throw err;
        return ordered(passes, added);
    }

    private static void cancelFrom(List<Future<Integer>> futures, int from) {
        for (int i = from; i < futures.size(); i++) futures.get(i).cancel(true);
    }

    private static Map<String, Integer> ordered(List<AnalysisPass<?>> passes, Map<String, Integer> added) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (AnalysisPass<?> p : passes) out.put(p.moduleId(), added.getOrDefault(p.moduleId(), 0));
        return out;
    }

    private static int await(Future<Integer> f, AnalysisPass<?> pass, Document document) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + pass.name() + " on " + document.id, e);
        } catch (ExecutionException e) {
            Throwable c = e.getCause();
            if (c instanceof RuntimeException re) throw re;
            if (c instanceof Error err) throw err;
            throw new IllegalStateException(pass.name() + " failed on " + document.id, c);
        }
    }

    private static boolean alreadyAnnotated(Document document, String module) {
        for (Annotation a : document.annotations(module)) {
            if (a.confidence != Confidence.RESEARCHER) return true;
        }
        return false;
    }

    // ---------------- corpus ----------------

    /**
     * Analyzes every document in order. A failing document is recorded as an ERROR diagnostic and skipped.
     */
    public List<AnalysisResult> analyzeCorpus(Corpus corpus) {
        Objects.requireNonNull(corpus, "corpus");
        List<AnalysisResult> out = new ArrayList<>(corpus.size());
        int failed = 0;
        for (Document d : corpus.documents()) {
            try {
                out.add(analyze(d));
            } catch (RuntimeException e) {
                failed++;
                diagnostics.error("engine.document-failed", "AnalysisEngine",
                        "Analysis of " + d.id + " failed: " + e.getMessage());
                log.error("Analysis of {} failed", d.id, e);
            }
        }
        log.info("Corpus {}: {} analyzed, {} failed", corpus.name, out.size(), failed);
        return out;
    }

    // ---------------- passes ----------------

    private Passes passesFor(String language) {
        String lang = language == null || language.isBlank() ? "de" : language;
        return passesByLanguage.computeIfAbsent(lang, l -> {
            LanguageCapabilities caps = capabilities.forLanguage(l);
            LanguageGate gate = new LanguageGate(l, framebook, diagnostics);
            log.debug("Pass set for '{}': {}", l, caps);
            return new Passes(
                    caps,
                    new NarrativePass(annotator, gate, diagnostics),
                    new PositionPass(annotator, gate, caps, diagnostics),
                    new DiscoursePass(annotator, gate),
                    new AffectPass(annotator, gate));
        });
    }

    // ---------------- pool ----------------

    private static ExecutorService createPool(Builder b) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = b.parallelism > 0 ? b.parallelism : 4;
        final String prefix = b.threadNamePrefix;

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, prefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(8, b.queueCapacity)),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    @Override
    public void close() {
        if (!ownsPool) {
            log.debug("AnalysisEngine.close(): pool is externally owned or absent; skipping shutdown");
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
                pool.awaitTermination(Math.max(250, shutdownTimeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    // ---------------- builder ----------------

    public static final class Builder {
        private Framebook framebook;
        private Diagnostics diagnostics;
        private LanguageCapabilityProvider capabilities;
        private int topN = Integrator.DEFAULT_TOP_N;

        private boolean parallel = false;
        private ExecutorService executor;
        private int parallelism = 0;
        private int queueCapacity = 64;
        private String threadNamePrefix = "qualia-pass-";
        private long shutdownTimeoutMs = 2500;

        private Builder() {}

        public Builder framebook(Framebook fb) { this.framebook = Objects.requireNonNull(fb, "framebook"); return this; }
        public Builder diagnostics(Diagnostics d) { this.diagnostics = Objects.requireNonNull(d, "diagnostics"); return this; }
        public Builder capabilities(LanguageCapabilityProvider p) { this.capabilities = Objects.requireNonNull(p, "capabilities"); return this; }
        public Builder topN(int n) { this.topN = n; return this; }

        public Builder parallel(boolean on) { this.parallel = on; return this; }

        /** External pool; never shut down by the engine. Implies parallel. */
        public Builder executor(ExecutorService es) {
            this.executor = Objects.requireNonNull(es, "executor");
            this.parallel = true;
            return this;
        }

        public Builder parallelism(int n) { this.parallelism = n; return this; }
        public Builder queueCapacity(int n) { this.queueCapacity = n; return this; }

        public Builder threadNamePrefix(String p) {
            if (p != null && !p.isBlank()) this.threadNamePrefix = p;
            return this;
        }

        public Builder shutdownTimeoutMs(long ms) { this.shutdownTimeoutMs = ms; return this; }

        /** Applies the {@code analysis} section of a batch config. */
        public Builder config(QualiaConfig.Analysis a) {
            Objects.requireNonNull(a, "analysis");
            topN(a.topN);
            parallel(a.parallel);
            parallelism(a.pool.parallelism);
            queueCapacity(a.pool.queueCapacity);
            threadNamePrefix(a.pool.threadNamePrefix);
            shutdownTimeoutMs(a.pool.shutdownTimeoutMs);
            return this;
        }

        public AnalysisEngine build() {
            return new AnalysisEngine(this);
        }
    }
}
