package org.calista.qualia.framebook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.qualia.diagnostics.Diagnostics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Framebook — конфигурация паттернов для всех проходов.
 *
 * <p>POJO под Jackson: дефолты в полях, порядок секций сохраняется (LinkedHashMap),
 * {@link #validate(Diagnostics)} нормализует null-секции и пишет предупреждения вместо исключений.</p>
 *
 * Sections:
 * - textTypes / processStructures: narrative pass
 * - pronouns (language → label → patterns) / agency: position pass
 * - frames / topoi / frameTensions / framePriorities / frameConflicts: discourse pass
 * - affectDimensions: affect pass
 * - frameClassification / axisLabels: justice engine
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Framebook {

    public static final int DEFAULT_PRIORITY = 10;

    public String version = "";
    public String description = "";

    public Map<String, CategoryDef> textTypes = new LinkedHashMap<>();
    public Map<String, CategoryDef> processStructures = new LinkedHashMap<>();
    public Map<String, Map<String, List<String>>> pronouns = new LinkedHashMap<>();
    public Map<String, CategoryDef> agency = new LinkedHashMap<>();
    public Map<String, CategoryDef> frames = new LinkedHashMap<>();
    public Map<String, CategoryDef> topoi = new LinkedHashMap<>();
    public List<FrameTension> frameTensions = new ArrayList<>();
    public Map<String, CategoryDef> affectDimensions = new LinkedHashMap<>();
    public Map<String, Integer> framePriorities = new LinkedHashMap<>();
    public List<FrameConflict> frameConflicts = new ArrayList<>();

    /** Null means "use the built-in roles". */
    public FrameClassification frameClassification;

    /** Optional "CLAIM|STRUCTURE" → display label overrides. */
    public Map<String, String> axisLabels = new LinkedHashMap<>();

    // -------------------- Lookup --------------------

    public int priority(String frame) {
        Integer p = framePriorities == null ? null : framePriorities.get(frame);
        return p == null ? DEFAULT_PRIORITY : p;
    }

    /** Pronoun label → patterns for one language, empty if the language has no list. */
    public Map<String, List<String>> pronouns(String language) {
        if (pronouns == null || language == null) return Map.of();
        Map<String, List<String>> m = pronouns.get(language.toLowerCase(Locale.ROOT));
        return m == null ? Map.of() : m;
    }

    // -------------------- Overlay --------------------

    /**
     * Merges an overlay into this framebook. Existing frames/topoi get their indicators extended
     * (no duplicates), new ones are added; tensions and conflicts are appended; priorities overwritten.
     */
    public void merge(Framebook overlay) {
        if (overlay == null) return;
        mergeCategories(frames, overlay.frames);
        mergeCategories(topoi, overlay.topoi);
        mergeCategories(textTypes, overlay.textTypes);
        mergeCategories(processStructures, overlay.processStructures);
        mergeCategories(agency, overlay.agency);
        mergeCategories(affectDimensions, overlay.affectDimensions);

        if (overlay.frameTensions != null) frameTensions.addAll(overlay.frameTensions);
        if (overlay.frameConflicts != null) frameConflicts.addAll(overlay.frameConflicts);
        if (overlay.framePriorities != null) framePriorities.putAll(overlay.framePriorities);
        if (overlay.axisLabels != null) axisLabels.putAll(overlay.axisLabels);
        if (overlay.frameClassification != null) frameClassification = overlay.frameClassification;
    }

    private static void mergeCategories(Map<String, CategoryDef> base, Map<String, CategoryDef> extra) {
        if (extra == null) return;
        for (Map.Entry<String, CategoryDef> e : extra.entrySet()) {
            CategoryDef cur = base.get(e.getKey());
            if (cur == null) {
                CategoryDef fresh = new CategoryDef();
                fresh.mergeIndicators(e.getValue());
                base.put(e.getKey(), fresh);
            } else {
                cur.mergeIndicators(e.getValue());
            }
        }
    }

    // -------------------- Validation / Normalization --------------------

    /**
     * Normalizes null sections and reports configuration problems. Never throws.
     */
    public void validate(Diagnostics diagnostics) {
        if (version == null) version = "";
        if (description == null) description = "";

        textTypes = required(textTypes, "textTypes", diagnostics);
        processStructures = required(processStructures, "processStructures", diagnostics);
        frames = required(frames, "frames", diagnostics);
        affectDimensions = required(affectDimensions, "affectDimensions", diagnostics);
        agency = optional(agency);
        topoi = optional(topoi);

        if (pronouns == null) pronouns = new LinkedHashMap<>();
        Map<String, Map<String, List<String>>> pron = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<String>>> e : pronouns.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            pron.put(e.getKey().toLowerCase(Locale.ROOT), new LinkedHashMap<>(e.getValue()));
        }
        pronouns = pron;

        if (frameTensions == null) frameTensions = new ArrayList<>();
        if (frameConflicts == null) frameConflicts = new ArrayList<>();
        if (framePriorities == null) framePriorities = new LinkedHashMap<>();
        if (axisLabels == null) axisLabels = new LinkedHashMap<>();
        if (frameClassification != null) frameClassification.normalize();

        Set<String> known = new LinkedHashSet<>(frames.keySet());

        for (String f : framePriorities.keySet()) {
            unknownFrame(known, f, "framePriorities", diagnostics);
        }

        List<FrameTension> tensions = new ArrayList<>();
        for (FrameTension t : frameTensions) {
            if (t == null || t.frameA == null || t.frameB == null) {
                diagnostics.warn("framebook.invalid-tension", "Framebook", "Tension without both frames ignored");
                continue;
            }
            unknownFrame(known, t.frameA, "frameTensions", diagnostics);
            unknownFrame(known, t.frameB, "frameTensions", diagnostics);
            if (t.description == null) t.description = "";
            tensions.add(t);
        }
        frameTensions = tensions;

        List<FrameConflict> conflicts = new ArrayList<>();
        for (FrameConflict c : frameConflicts) {
            if (c == null || c.ifPresent == null || c.downweight == null) {
                diagnostics.warn("framebook.invalid-conflict", "Framebook", "Conflict without trigger/target ignored");
                continue;
            }
            unknownFrame(known, c.ifPresent, "frameConflicts", diagnostics);
            unknownFrame(known, c.downweight, "frameConflicts", diagnostics);
            if (!Double.isFinite(c.factor) || c.factor < 0.0 || c.factor > 1.0) {
                double clamped = Double.isFinite(c.factor) ? Math.max(0.0, Math.min(1.0, c.factor)) : 1.0;
                diagnostics.warn("framebook.factor-out-of-range", "Framebook",
                        "Conflict " + c.ifPresent + " -> " + c.downweight + " factor " + c.factor + " clamped to " + clamped);
                c.factor = clamped;
            }
            conflicts.add(c);
        }
        frameConflicts = conflicts;

        if (frameClassification != null) {
            for (String f : frameClassification.allReferenced()) {
                unknownFrame(known, f, "frameClassification", diagnostics);
            }
        }
    }

    private static Map<String, CategoryDef> required(Map<String, CategoryDef> m, String name, Diagnostics d) {
        if (m == null || m.isEmpty()) {
            d.warn("framebook.missing-section", "Framebook", "Section '" + name + "' is missing or empty");
        }
        return optional(m);
    }

    private static Map<String, CategoryDef> optional(Map<String, CategoryDef> m) {
        Map<String, CategoryDef> out = new LinkedHashMap<>();
        if (m == null) return out;
        for (Map.Entry<String, CategoryDef> e : m.entrySet()) {
            if (e.getKey() == null) continue;
            CategoryDef def = e.getValue() == null ? new CategoryDef() : e.getValue();
            def.normalize();
            out.put(e.getKey(), def);
        }
        return out;
    }

    private static void unknownFrame(Set<String> known, String frame, String section, Diagnostics d) {
        if (!known.contains(frame)) {
            d.warn("framebook.unknown-frame", "Framebook", section + " references undeclared frame '" + frame + "'");
        }
    }
}
