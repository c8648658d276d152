package org.calista.qualia.integrate;

import org.calista.qualia.analysis.AnalyticClaim;

import java.util.List;

/**
 * Everything the integrator derives for one document.
 */
public record IntegratedReport(
        List<TurnProfile> turnProfiles,
        List<SaliencySite> saliencySites,
        List<TriangulationMatch> triangulations,
        List<Hypothesis> hypotheses,
        List<AnalyticClaim> claims
) {
    public IntegratedReport {
        turnProfiles = List.copyOf(turnProfiles);
        saliencySites = List.copyOf(saliencySites);
        triangulations = List.copyOf(triangulations);
        hypotheses = List.copyOf(hypotheses);
        claims = List.copyOf(claims);
    }

    public static IntegratedReport empty() {
        return new IntegratedReport(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
