package org.calista.qualia.language;

import java.util.Objects;
import java.util.Optional;

/**
 * What is available for one language. Fixed at construction; passes never re-probe.
 */
public final class LanguageCapabilities {
    public final String language;
    public final boolean hasSentenceSegmenter;
    public final boolean hasSyntax;

    private final SentenceSegmenter segmenter;
    private final SyntacticAnalyzer syntax;

    private LanguageCapabilities(String language, SentenceSegmenter segmenter, SyntacticAnalyzer syntax) {
        this.language = Objects.requireNonNull(language, "language");
        this.segmenter = segmenter;
        this.syntax = syntax;
        this.hasSentenceSegmenter = segmenter != null;
        this.hasSyntax = syntax != null;
    }

    public static LanguageCapabilities patternOnly(String language) {
        return new LanguageCapabilities(language, RegexSentenceSegmenter.INSTANCE, null);
    }

    public static LanguageCapabilities of(String language, SentenceSegmenter segmenter, SyntacticAnalyzer syntax) {
        return new LanguageCapabilities(language, segmenter, syntax);
    }

    public Optional<SentenceSegmenter> segmenter() {
        return Optional.ofNullable(segmenter);
    }

    public Optional<SyntacticAnalyzer> syntax() {
        return Optional.ofNullable(syntax);
    }

    /** Segmenter or the regex fallback. */
    public SentenceSegmenter segmenterOrDefault() {
        return segmenter != null ? segmenter : RegexSentenceSegmenter.INSTANCE;
    }

    /** "full" with syntax, "light" otherwise. */
    public String level() {
        return hasSyntax ? "full" : "light";
    }

    @Override
    public String toString() {
        return "LanguageCapabilities{" + language + ", level=" + level() + "}";
    }
}
