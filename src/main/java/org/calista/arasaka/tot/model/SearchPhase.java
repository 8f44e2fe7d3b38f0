package org.calista.arasaka.tot.model;

/**
 * Orchestrator states.
 *
 * INITIALIZING -> GENERATING -> EVALUATING -> PRUNING -> CHECKING_TERMINATION
 *   -> (GENERATING | FINALIZING) -> COMPLETED | FAILED
 *
 * EVALUATING may jump straight to FINALIZING on a terminal evaluation.
 * Any state may end in FAILED on a fatal error.
 */
public enum SearchPhase {
    INITIALIZING,
    GENERATING,
    EVALUATING,
    PRUNING,
    CHECKING_TERMINATION,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isDone() {
        return this == COMPLETED || this == FAILED;
    }
}
