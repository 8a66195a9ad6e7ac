package com.fieldops.scheduling.engine;

/**
 * First constraint a route violated during evaluation.
 */
public enum InfeasibilityKind {
    CAPACITY,
    SKILL,
    UNAVAILABLE,
    TRAVEL_LIMIT,
    /** Would finish after the job window closes. */
    WINDOW,
    /** Would finish after the shift end, or after the overtime end when overtime is allowed. */
    WORKING_HOURS,
    /** Would start later than the repair bound allows. */
    DELAY,
    /** Cannot reach a pinned stop by its committed start. */
    PINNED_START
}
