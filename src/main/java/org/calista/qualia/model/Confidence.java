package org.calista.qualia.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an annotation came from. Researcher annotations are the human-override tier.
 */
public enum Confidence {
    PATTERN("pattern"),
    SYNTACTIC("syntactic"),
    RESEARCHER("researcher");

    private final String wireName;

    Confidence(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Confidence fromWire(String s) {
        if (s == null) return PATTERN;
        String k = s.trim().toLowerCase(Locale.ROOT);
        for (Confidence c : values()) {
            if (c.wireName.equals(k)) return c;
        }
        throw new IllegalArgumentException("Unknown confidence: " + s);
    }
}
