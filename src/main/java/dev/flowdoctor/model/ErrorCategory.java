package dev.flowdoctor.model;

/**
 * Broad classes of failure the engine distinguishes.
 */
public enum ErrorCategory {
    /** Unparseable row structure. Repaired or dropped, never fatal. */
    MALFORMED_INPUT,
    /** Orphans, dead ends, routing gaps, scope and format violations. Repairable by rule. */
    STRUCTURAL_VIOLATION,
    /** Authoritative rejection from the semantic validator. */
    EXTERNAL_VALIDATION,
    /** Network, timeout or authentication failure talking to a collaborator. */
    EXTERNAL_SERVICE_FAILURE,
    /** Iterations exhausted or an unbreakable stuck loop. */
    CONVERGENCE_FAILURE
}
