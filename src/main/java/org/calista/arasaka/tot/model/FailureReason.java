package org.calista.arasaka.tot.model;

/** Whole-search fatal errors. Per-candidate failures never surface here. */
public enum FailureReason {
    /** Generation from the problem statement produced zero usable branches. */
    NO_INITIAL_BRANCHES,
    /** Checkpoint or journal integrity could not be guaranteed. */
    SUBSTRATE_FAULT
}
