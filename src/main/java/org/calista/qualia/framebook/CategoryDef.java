package org.calista.qualia.framebook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One category: a description and indicator patterns per language code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CategoryDef {
    public String description = "";
    public Map<String, List<String>> indicators = new LinkedHashMap<>();

    public CategoryDef() {}

    public static CategoryDef of(String language, String... patterns) {
        CategoryDef d = new CategoryDef();
        d.indicators.put(language, new ArrayList<>(List.of(patterns)));
        return d;
    }

    /** Patterns for the language, or an empty list. */
    public List<String> patterns(String language) {
        if (indicators == null || language == null) return List.of();
        List<String> p = indicators.get(language.toLowerCase(Locale.ROOT));
        return p == null ? List.of() : List.copyOf(p);
    }

    /** Appends patterns that are not present yet. */
    void mergeIndicators(CategoryDef other) {
        if (other == null || other.indicators == null) return;
        for (Map.Entry<String, List<String>> e : other.indicators.entrySet()) {
            List<String> target = indicators.computeIfAbsent(e.getKey(), k -> new ArrayList<>());
            if (e.getValue() == null) continue;
            for (String p : e.getValue()) {
                if (p != null && !target.contains(p)) target.add(p);
            }
        }
        if ((description == null || description.isBlank()) && other.description != null) {
            description = other.description;
        }
    }

    void normalize() {
        if (description == null) description = "";
        if (indicators == null) indicators = new LinkedHashMap<>();
        Map<String, List<String>> norm = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : indicators.entrySet()) {
            if (e.getKey() == null) continue;
            List<String> ps = new ArrayList<>();
            if (e.getValue() != null) {
                for (String p : e.getValue()) if (p != null && !p.isEmpty()) ps.add(p);
            }
            norm.put(e.getKey().toLowerCase(Locale.ROOT), ps);
        }
        indicators = norm;
    }
}
