package org.calista.qualia.core;

import org.calista.qualia.analysis.AnalyticClaim;
import org.calista.qualia.analysis.affect.AffectTurnSummary;
import org.calista.qualia.analysis.discourse.DiscourseTurnSummary;
import org.calista.qualia.analysis.discourse.FrameCourse;
import org.calista.qualia.analysis.narrative.NarrativeTurnSummary;
import org.calista.qualia.analysis.position.PositionTurnSummary;
import org.calista.qualia.diagnostics.Diagnostic;
import org.calista.qualia.integrate.IntegratedReport;
import org.calista.qualia.justice.JusticeProfile;
import org.calista.qualia.justice.JusticeTurnProfile;
import org.calista.qualia.model.DocumentSummary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one engine run produced for one document. Plain data, ready for {@code ReportWriter}.
 *
 * @param annotationsAdded annotations written by each pass in this run, keyed by module id
 * @param diagnostics      entries recorded while this document was analyzed
 */
public record AnalysisResult(
        String documentId,
        String language,
        String capabilityLevel,
        DocumentSummary summary,
        Map<String, Integer> annotationsAdded,
        List<NarrativeTurnSummary> narrative,
        List<PositionTurnSummary> position,
        List<DiscourseTurnSummary> discourse,
        List<AffectTurnSummary> affect,
        FrameCourse frameCourse,
        IntegratedReport integrated,
        JusticeProfile justice,
        List<JusticeTurnProfile> justiceTurns,
        List<AnalyticClaim> justiceClaims,
        List<Diagnostic> diagnostics,
        long elapsedMs
) {
    public AnalysisResult {
        annotationsAdded = Collections.unmodifiableMap(new LinkedHashMap<>(annotationsAdded));
        narrative = List.copyOf(narrative);
        position = List.copyOf(position);
        discourse = List.copyOf(discourse);
        affect = List.copyOf(affect);
        justiceTurns = List.copyOf(justiceTurns);
        justiceClaims = List.copyOf(justiceClaims);
        diagnostics = List.copyOf(diagnostics);
    }

    public int totalAdded() {
        int n = 0;
        for (int v : annotationsAdded.values()) n += v;
        return n;
    }
}
