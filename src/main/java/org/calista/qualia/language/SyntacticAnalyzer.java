package org.calista.qualia.language;

import java.util.List;

/**
 * Optional dependency-parse capability. Only subjects are needed by the position pass.
 */
public interface SyntacticAnalyzer {

    /**
     * @return subject tokens with offsets relative to {@code text}
     * @throws RuntimeException on parser failure; callers degrade to pattern-only
     */
    List<ParsedSubject> subjects(String text);

    /**
     * Discovered through {@link java.util.ServiceLoader} by {@link ServiceLoaderCapabilityProvider}.
     */
    interface Factory {
        boolean supports(String language);

        SyntacticAnalyzer create(String language);
    }
}
