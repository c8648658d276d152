package org.calista.qualia.framebook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Frame roles for the justice engine: normative claims, structural forces, context modifiers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FrameClassification {
    public List<String> claim = new ArrayList<>();
    public List<String> structure = new ArrayList<>();
    public Context context = new Context();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Context {
        public List<String> amplifying = new ArrayList<>();
        public List<String> dampening = new ArrayList<>();
        public List<String> neutral = new ArrayList<>();
    }

    void normalize() {
        if (claim == null) claim = new ArrayList<>();
        if (structure == null) structure = new ArrayList<>();
        if (context == null) context = new Context();
        if (context.amplifying == null) context.amplifying = new ArrayList<>();
        if (context.dampening == null) context.dampening = new ArrayList<>();
        if (context.neutral == null) context.neutral = new ArrayList<>();
    }

    List<String> allReferenced() {
        List<String> all = new ArrayList<>(claim);
        all.addAll(structure);
        all.addAll(context.amplifying);
        all.addAll(context.dampening);
        all.addAll(context.neutral);
        return all;
    }
}
