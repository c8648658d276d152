package org.calista.qualia.justice;

import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.FrameClassification;
import org.calista.qualia.framebook.Framebook;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Disjoint frame roles used by the justice engine.
 *
 * <p>Source is the framebook's {@code frameClassification}; without one the built-in sets apply.
 * A frame listed under several roles keeps the first of claim, structure, amplifying, dampening, neutral.</p>
 */
public final class FrameRoles {

    public static final String LEGITIMACY_JUSTICE = "LEGITIMACY_JUSTICE";
    public static final String AUTONOMY_SELF_DETERMINATION = "AUTONOMY_SELF_DETERMINATION";
    public static final String SOLIDARITY_COMMUNITY = "SOLIDARITY_COMMUNITY";

    public static final String ECONOMIZATION = "ECONOMIZATION";
    public static final String BUREAUCRATIC_ORDER = "BUREAUCRATIC_ORDER";
    public static final String EXCLUSION_OTHERING = "EXCLUSION_OTHERING";
    public static final String INSTITUTIONAL_LOGIC = "INSTITUTIONAL_LOGIC";

    public static final String VULNERABILITY = "VULNERABILITY";
    public static final String NORMALIZATION = "NORMALIZATION";

    private final Set<String> claim;
    private final Set<String> structure;
    private final Set<String> amplifying;
    private final Set<String> dampening;
    private final Set<String> neutral;
    private final boolean fromFramebook;

    private FrameRoles(Set<String> claim, Set<String> structure, Set<String> amplifying,
                       Set<String> dampening, Set<String> neutral, boolean fromFramebook) {
        this.claim = Set.copyOf(claim);
        this.structure = Set.copyOf(structure);
        this.amplifying = Set.copyOf(amplifying);
        this.dampening = Set.copyOf(dampening);
        this.neutral = Set.copyOf(neutral);
        this.fromFramebook = fromFramebook;
    }

    public static FrameRoles defaults() {
        return new FrameRoles(
                Set.of(LEGITIMACY_JUSTICE, AUTONOMY_SELF_DETERMINATION, SOLIDARITY_COMMUNITY),
                Set.of(ECONOMIZATION, BUREAUCRATIC_ORDER, EXCLUSION_OTHERING, INSTITUTIONAL_LOGIC),
                Set.of(VULNERABILITY),
                Set.of(NORMALIZATION),
                Set.of(),
                false);
    }

    /**
     * Roles from the framebook classification, or {@link #defaults()} when the framebook has none.
     */
    public static FrameRoles from(Framebook framebook, Diagnostics diagnostics) {
        FrameClassification fc = framebook == null ? null : framebook.frameClassification;
        if (fc == null) return defaults();

        Set<String> seen = new LinkedHashSet<>();
        Set<String> claim = take(fc.claim, seen, "claim", diagnostics);
        Set<String> structure = take(fc.structure, seen, "structure", diagnostics);
        FrameClassification.Context ctx = fc.context == null ? new FrameClassification.Context() : fc.context;
        Set<String> amplifying = take(ctx.amplifying, seen, "amplifying", diagnostics);
        Set<String> dampening = take(ctx.dampening, seen, "dampening", diagnostics);
        Set<String> neutral = take(ctx.neutral, seen, "neutral", diagnostics);
        return new FrameRoles(claim, structure, amplifying, dampening, neutral, true);
    }

    private static Set<String> take(List<String> frames, Set<String> seen, String role, Diagnostics diagnostics) {
        Set<String> out = new LinkedHashSet<>();
        if (frames == null) return out;
        for (String f : frames) {
            if (f == null || f.isBlank()) continue;
            if (!seen.add(f)) {
                diagnostics.warn("justice.role-overlap", "FrameRoles",
                        "Frame '" + f + "' has more than one role; ignored as " + role);
                continue;
            }
            out.add(f);
        }
        return out;
    }

    public boolean isClaim(String frame) {
        return claim.contains(frame);
    }

    public boolean isStructure(String frame) {
        return structure.contains(frame);
    }

    public boolean isAmplifying(String frame) {
        return amplifying.contains(frame);
    }

    public boolean isDampening(String frame) {
        return dampening.contains(frame);
    }

    /** Frames with no justice role at all; they contextualize axes as tags. */
    public boolean isContextTag(String frame) {
        return !claim.contains(frame) && !structure.contains(frame) && !amplifying.contains(frame)
                && !dampening.contains(frame) && !neutral.contains(frame);
    }

    public Set<String> claim() {
        return claim;
    }

    public Set<String> structure() {
        return structure;
    }

    public Set<String> amplifying() {
        return amplifying;
    }

    public Set<String> dampening() {
        return dampening;
    }

    public Set<String> neutral() {
        return neutral;
    }

    public boolean fromFramebook() {
        return fromFramebook;
    }
}
