package org.calista.arasaka.tot.durable;

/** Kind of collaborator call recorded in the journal. */
public enum CallKind {
    /** First approaches generated from the problem statement. */
    GENERATE_ROOT,
    /** Children generated from a surviving branch. */
    EXPAND,
    EVALUATE
}
