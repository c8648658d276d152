package org.calista.qualia.justice;

import org.calista.qualia.framebook.Framebook;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.calista.qualia.justice.FrameRoles.*;

/**
 * Readable names for claim × structure axes. Framebook {@code axisLabels} ("CLAIM|STRUCTURE" keys)
 * override the built-in ones; unknown pairs render as {@code "CLAIM × STRUCTURE"}.
 */
public final class AxisLabels {

    private static final Map<String, String> DEFAULTS = new LinkedHashMap<>();

    static {
        put(LEGITIMACY_JUSTICE, ECONOMIZATION, "Fairness vs. market logic");
        put(LEGITIMACY_JUSTICE, EXCLUSION_OTHERING, "Rights vs. exclusion");
        put(LEGITIMACY_JUSTICE, BUREAUCRATIC_ORDER, "Dignity vs. procedure");
        put(LEGITIMACY_JUSTICE, INSTITUTIONAL_LOGIC, "Justice vs. system logic");
        put(AUTONOMY_SELF_DETERMINATION, ECONOMIZATION, "Self-determination vs. cost pressure");
        put(AUTONOMY_SELF_DETERMINATION, BUREAUCRATIC_ORDER, "Agency vs. bureaucracy");
        put(AUTONOMY_SELF_DETERMINATION, EXCLUSION_OTHERING, "Participation vs. exclusion");
        put(AUTONOMY_SELF_DETERMINATION, INSTITUTIONAL_LOGIC, "Autonomy vs. systemic constraint");
        put(SOLIDARITY_COMMUNITY, ECONOMIZATION, "Community vs. market logic");
        put(SOLIDARITY_COMMUNITY, EXCLUSION_OTHERING, "Cohesion vs. division");
        put(SOLIDARITY_COMMUNITY, BUREAUCRATIC_ORDER, "Solidarity vs. procedural logic");
        put(SOLIDARITY_COMMUNITY, INSTITUTIONAL_LOGIC, "Community vs. system");
    }

    private static void put(String claim, String structure, String label) {
        DEFAULTS.put(key(claim, structure), label);
    }

    private final Map<String, String> labels;

    private AxisLabels(Map<String, String> labels) {
        this.labels = labels;
    }

    public static AxisLabels defaults() {
        return new AxisLabels(new LinkedHashMap<>(DEFAULTS));
    }

    public static AxisLabels from(Framebook framebook) {
        Map<String, String> m = new LinkedHashMap<>(DEFAULTS);
        if (framebook != null && framebook.axisLabels != null) {
            framebook.axisLabels.forEach((k, v) -> {
                if (k != null && v != null && !v.isBlank()) m.put(k, v);
            });
        }
        return new AxisLabels(m);
    }

    public static String key(String claim, String structure) {
        return claim + "|" + structure;
    }

    public String label(String claim, String structure) {
        String l = labels.get(key(claim, structure));
        return l != null ? l : claim + " × " + structure;
    }
}
