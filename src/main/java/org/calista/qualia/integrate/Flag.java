package org.calista.qualia.integrate;

/**
 * Cross-module signals raised on a turn profile.
 */
public enum Flag {
    /** Trajectory-of-suffering process structure present. */
    TRAJECTORY_CURVE,
    /** Transformation process structure present. */
    TRANSFORMATION,
    /** Affect density above 5 per 100 words. */
    HIGH_AFFECT,
    /** Passive-suffering agency dominates. */
    PASSIVE,
    /** Three or more frames active. */
    MULTI_FRAME,
    /** Two or more text type transitions. */
    TEXT_TYPE_SHIFT
}
