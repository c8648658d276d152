package org.calista.qualia.language;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.diagnostics.Diagnostics;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probes {@link SyntacticAnalyzer.Factory} implementations on the classpath once per language.
 * Anything that fails to load degrades that language to pattern-only.
 */
public final class ServiceLoaderCapabilityProvider implements LanguageCapabilityProvider {
    private static final Logger log = LogManager.getLogger(ServiceLoaderCapabilityProvider.class);

    private final Diagnostics diagnostics;
    private final ClassLoader classLoader;
    private final Map<String, LanguageCapabilities> probed = new ConcurrentHashMap<>();

    public ServiceLoaderCapabilityProvider(Diagnostics diagnostics) {
        this(diagnostics, Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderCapabilityProvider(Diagnostics diagnostics, ClassLoader classLoader) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.classLoader = classLoader;
    }

    @Override
    public LanguageCapabilities forLanguage(String language) {
        String lang = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
        return probed.computeIfAbsent(lang, this::probe);
    }

    private LanguageCapabilities probe(String lang) {
        try {
            for (SyntacticAnalyzer.Factory f : ServiceLoader.load(SyntacticAnalyzer.Factory.class, classLoader)) {
                if (!f.supports(lang)) continue;
                SyntacticAnalyzer analyzer = f.create(lang);
                if (analyzer == null) continue;
                log.info("Syntactic analyzer for '{}': {}", lang, f.getClass().getName());
                return LanguageCapabilities.of(lang, RegexSentenceSegmenter.INSTANCE, analyzer);
            }
        } catch (ServiceConfigurationError | RuntimeException e) {
            diagnostics.warn("language.probe-failed", "ServiceLoaderCapabilityProvider",
                    "Syntactic analyzer for '" + lang + "' could not be loaded: " + e.getMessage());
        }
        diagnostics.warnOnce("nosyntax:" + lang, "language.no-syntax", "ServiceLoaderCapabilityProvider",
                "No syntactic analyzer for '" + lang + "'; running pattern-only");
        return LanguageCapabilities.patternOnly(lang);
    }
}
