package org.calista.qualia.language;

import java.util.List;

/**
 * Splits turn text into sentences. Implementations must be pure.
 */
@FunctionalInterface
public interface SentenceSegmenter {
    List<String> split(String text);
}
