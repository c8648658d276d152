package org.calista.qualia.framebook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * If {@code ifPresent} occurs in a turn, the count of {@code downweight} is multiplied by {@code factor}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FrameConflict {
    public String ifPresent;
    public String downweight;
    public double factor = 0.5;

    public FrameConflict() {}

    public FrameConflict(String ifPresent, String downweight, double factor) {
        this.ifPresent = ifPresent;
        this.downweight = downweight;
        this.factor = factor;
    }
}
