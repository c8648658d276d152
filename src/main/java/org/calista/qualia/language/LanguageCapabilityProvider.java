package org.calista.qualia.language;

/**
 * Resolves capabilities for a language code (de, en, fr, ...).
 */
@FunctionalInterface
public interface LanguageCapabilityProvider {
    LanguageCapabilities forLanguage(String language);

    static LanguageCapabilityProvider patternOnly() {
        return LanguageCapabilities::patternOnly;
    }
}
