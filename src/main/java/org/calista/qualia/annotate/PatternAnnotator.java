package org.calista.qualia.annotate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.model.Annotation;
import org.calista.qualia.model.Confidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * PatternAnnotator — единственное место, где регулярки превращаются в аннотации.
 *
 * <p>Design goals:
 * <ul>
 *   <li>case-insensitive scan, spans keep the original casing</li>
 *   <li>non-overlapping matches, left to right, patterns in list order</li>
 *   <li>rule id = {@code prefix_NN} by pattern index</li>
 *   <li>compiled patterns are cached; invalid ones are skipped with one diagnostic</li>
 * </ul>
 * One instance is shared by all passes; it holds no per-document state.
 */
public final class PatternAnnotator {
    private static final Logger log = LogManager.getLogger(PatternAnnotator.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final Diagnostics diagnostics;
    private final Map<String, Optional<Pattern>> cache = new ConcurrentHashMap<>();

    public PatternAnnotator(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Scans the whole text.
     */
    public List<Annotation> annotate(String module, String text, String category,
                                     List<String> patterns, int turnId, String rulePrefix) {
        return annotateRegion(module, text, 0, text == null ? 0 : text.length(), null,
                category, patterns, turnId, rulePrefix);
    }

    /**
     * Scans {@code text[regionStart, regionEnd)}; offsets stay relative to {@code text}.
     *
     * @param sentence sentence to record on each annotation; null resolves it from the text
     */
    public List<Annotation> annotateRegion(String module, String text, int regionStart, int regionEnd, String sentence,
                                           String category, List<String> patterns, int turnId, String rulePrefix) {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(category, "category");
        if (text == null || text.isEmpty() || patterns == null || patterns.isEmpty()) return List.of();
        if (regionStart < 0 || regionEnd > text.length() || regionStart > regionEnd) {
            throw new IllegalArgumentException("Invalid region [" + regionStart + "," + regionEnd + ") for text of length " + text.length());
        }

        String prefix = (rulePrefix == null || rulePrefix.isBlank())
                ? module + "_" + category.toLowerCase(Locale.ROOT)
                : rulePrefix;

        List<Annotation> out = new ArrayList<>();
        for (int i = 0; i < patterns.size(); i++) {
            String raw = patterns.get(i);
            Optional<Pattern> compiled = compile(raw, category);
            if (compiled.isEmpty()) continue;

            String ruleId = String.format(Locale.ROOT, "%s_%02d", prefix, i);
            Matcher m = compiled.get().matcher(text);
            m.region(regionStart, regionEnd);
            while (m.find()) {
                int s = m.start();
                int e = m.end();
                out.add(Annotation.builder()
                        .module(module)
                        .category(category)
                        .ruleId(ruleId)
                        .pattern(raw)
                        .matchedText(text.substring(s, e))
                        .span(s, e)
                        .sentence(sentence != null ? sentence : containingSentence(text, s))
                        .turnId(turnId)
                        .confidence(Confidence.PATTERN)
                        .build());
            }
        }

        if (log.isTraceEnabled() && !out.isEmpty()) {
            log.trace("{} {} turn={} -> {} matches", module, category, turnId, out.size());
        }
        return out;
    }

    /**
     * Sentence around {@code position}: from just after the nearest preceding terminator
     * ('.', '!', '?', newline) up to and including the next one, trimmed.
     */
    public static String containingSentence(String text, int position) {
        if (text == null || text.isEmpty()) return "";
        int pos = Math.max(0, Math.min(position, text.length()));

        int left = 0;
        if (pos > 0) {
            for (char c : new char[]{'\n', '.', '!', '?'}) {
                int idx = text.lastIndexOf(c, pos - 1);
                if (idx + 1 > left) left = idx + 1;
            }
        }

        int right = text.length();
        for (char c : new char[]{'.', '!', '?', '\n'}) {
            int idx = text.indexOf(c, pos);
            if (idx >= 0 && idx + 1 < right) right = idx + 1;
        }
        if (right < left) right = left;
        return text.substring(left, right).strip();
    }

    private Optional<Pattern> compile(String raw, String category) {
        if (raw == null || raw.isEmpty()) return Optional.empty();
        return cache.computeIfAbsent(raw, p -> {
            try {
                return Optional.of(Pattern.compile(p, FLAGS));
            } catch (PatternSyntaxException e) {
                diagnostics.warn("pattern.invalid", "PatternAnnotator",
                        "Invalid pattern in '" + category + "' skipped: " + p + " (" + e.getDescription() + ")");
                return Optional.empty();
            }
        });
    }
}
