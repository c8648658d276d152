package org.calista.qualia.analysis;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small helpers shared by the passes.
 */
public final class Summaries {

    /** Placeholder for "no dominant category". */
    public static final String NONE = "-";

    private static final int PREVIEW_CHARS = 150;

    private Summaries() {}

    /** Markers per 100 words, one decimal; 0 when there are no words. */
    public static double density(int count, int words) {
        if (words <= 0) return 0.0;
        return round1(count * 100.0 / words);
    }

    public static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    public static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    public static String preview(String text) {
        if (text == null) return "";
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS);
    }

    /**
     * Category with the highest count; ties go to the category that comes first in {@code order}.
     * Returns {@link #NONE} when every count is zero.
     */
    public static String dominant(Map<String, Integer> counts, List<String> order) {
        String best = NONE;
        int bestCount = 0;
        for (String c : order) {
            int n = counts.getOrDefault(c, 0);
            if (n > bestCount) {
                best = c;
                bestCount = n;
            }
        }
        return best;
    }

    /** Sorted-by-value view, descending, stable on insertion order. */
    public static <K> Map<K, Integer> sortedDesc(Map<K, Integer> in) {
        Map<K, Integer> out = new LinkedHashMap<>();
        in.entrySet().stream()
                .sorted(Map.Entry.<K, Integer>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> out.put(e.getKey(), e.getValue()));
        return out;
    }
}
