package org.calista.arasaka.tot.model;

/**
 * Lifecycle of a branch. Transitions only move forward:
 * PENDING -> EVALUATED -> {PRUNED | EXPANDED | TERMINAL}, plus PENDING -> PRUNED
 * for a candidate whose evaluation was dropped.
 */
public enum BranchStatus {
    PENDING(0),
    EVALUATED(1),
    PRUNED(2),
    EXPANDED(2),
    TERMINAL(2);

    private final int rank;

    BranchStatus(int rank) {
        this.rank = rank;
    }

    public boolean isFinal() {
        return rank == 2;
    }

    public boolean canMoveTo(BranchStatus next) {
        if (next == null) return false;
        if (next == PENDING) return false;
        // EXPANDED / TERMINAL require a score
        if (this == PENDING) return next == EVALUATED || next == PRUNED;
        return next.rank > this.rank;
    }
}
