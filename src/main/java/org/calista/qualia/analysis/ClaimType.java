package org.calista.qualia.analysis;

/**
 * Kinds of analytic claims produced by the discourse pass, the integrator and the justice engine.
 */
public enum ClaimType {
    CO_OCCURRENCE,
    TRAJECTORY_SHIFT,
    TRAJECTORY_GROWING,
    TRAJECTORY_SHRINKING,
    TENSION,
    DOMINANCE,
    TURNING_POINT,
    AFFECT_CONDENSATION,
    JUSTICE_DOMINANCE,
    JUSTICE_TRAJECTORY,
    JUSTICE_PEAK,
    JUSTICE_DENSITY,
    JUSTICE_CONTEXT
}
