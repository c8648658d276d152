package org.calista.qualia.justice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Justice tension of one respondent turn.
 *
 * @param base                sqrt(claimTotal × structureTotal); 0 means not a justice site
 * @param normalizedIntensity intensity per 1000 characters of turn text
 * @param axes                claim × structure axes, strongest first
 * @param contextFrames       amplifying/dampening frames present
 * @param contextTags         frames present that have no justice role
 * @param strong              at or above the interview's 75th percentile
 */
public record JusticeTurnProfile(
        int turnId,
        Map<String, Integer> claimFrames,
        Map<String, Integer> structureFrames,
        int claimTotal,
        int structureTotal,
        double base,
        double affectMultiplier,
        double agencyMultiplier,
        String agencyLabel,
        double contextMultiplier,
        List<String> contextFrames,
        double intensity,
        double normalizedIntensity,
        List<TensionAxis> axes,
        List<String> contextTags,
        boolean justiceSite,
        boolean strong,
        String preview
) {
    public JusticeTurnProfile {
        claimFrames = Collections.unmodifiableMap(new LinkedHashMap<>(claimFrames));
        structureFrames = Collections.unmodifiableMap(new LinkedHashMap<>(structureFrames));
        contextFrames = List.copyOf(contextFrames);
        axes = List.copyOf(axes);
        contextTags = List.copyOf(contextTags);
    }

    JusticeTurnProfile withStrong(boolean s) {
        return new JusticeTurnProfile(turnId, claimFrames, structureFrames, claimTotal, structureTotal, base,
                affectMultiplier, agencyMultiplier, agencyLabel, contextMultiplier, contextFrames, intensity,
                normalizedIntensity, axes, contextTags, justiceSite, s, preview);
    }
}
