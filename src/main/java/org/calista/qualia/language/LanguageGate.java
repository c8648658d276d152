package org.calista.qualia.language;

import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.CategoryDef;
import org.calista.qualia.framebook.Framebook;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-language view of the framebook. Missing pattern lists are reported once per
 * category and then silently yield an empty list.
 */
public final class LanguageGate {
    private final String language;
    private final Framebook framebook;
    private final Diagnostics diagnostics;

    public LanguageGate(String language, Framebook framebook, Diagnostics diagnostics) {
        this.language = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
        this.framebook = Objects.requireNonNull(framebook, "framebook");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public String language() {
        return language;
    }

    public Framebook framebook() {
        return framebook;
    }

    public List<String> patterns(String section, String category, CategoryDef def) {
        List<String> p = def == null ? List.of() : def.patterns(language);
        if (p.isEmpty()) {
            diagnostics.warnOnce("nopatterns:" + language + ":" + section + ":" + category,
                    "language.no-patterns", "LanguageGate",
                    "No " + section + " patterns for '" + category + "' in language '" + language + "'");
        }
        return p;
    }

    /** Pronoun label → patterns. */
    public Map<String, List<String>> pronouns() {
        Map<String, List<String>> p = framebook.pronouns(language);
        if (p.isEmpty()) {
            diagnostics.warnOnce("nopronouns:" + language, "language.no-pronouns", "LanguageGate",
                    "No pronoun list for language '" + language + "'");
        }
        return p;
    }
}
