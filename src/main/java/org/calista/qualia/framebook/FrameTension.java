package org.calista.qualia.framebook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Declared tension between two frames, reported when both occur in a turn.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FrameTension {
    public String frameA;
    public String frameB;
    public String description = "";

    public FrameTension() {}

    public FrameTension(String frameA, String frameB, String description) {
        this.frameA = frameA;
        this.frameB = frameB;
        this.description = description;
    }
}
