package org.calista.qualia.language;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Fallback segmentation: a sentence ends after '.', '!' or '?' followed by whitespace.
 */
public final class RegexSentenceSegmenter implements SentenceSegmenter {
    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    public static final RegexSentenceSegmenter INSTANCE = new RegexSentenceSegmenter();

    @Override
    public List<String> split(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String s : BOUNDARY.split(text.strip())) {
            String t = s.strip();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
