package org.calista.arasaka.tot.durable;

import java.util.Objects;

/**
 * Stable identity of one collaborator call: (searchId, depth, subject, kind).
 *
 * <p>subject is the parent branch id for generation ({@code "root"} for the problem statement)
 * and the evaluated branch id for evaluation. Identical across replays of the same search.</p>
 */
public final class CallKey {

    public static final String ROOT_SUBJECT = "root";

    public final String searchId;
    public final int depth;
    public final String subject;
    public final CallKind kind;

    private final String id;

    public CallKey(String searchId, int depth, String subject, CallKind kind) {
        this.searchId = Objects.requireNonNull(searchId, "searchId");
        this.depth = depth;
        this.subject = Objects.requireNonNull(subject, "subject");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = searchId + "/" + depth + "/" + kind.name() + "/" + subject;
    }

    public static CallKey generateRoot(String searchId) {
        return new CallKey(searchId, 0, ROOT_SUBJECT, CallKind.GENERATE_ROOT);
    }

    public static CallKey expand(String searchId, int depth, String parentId) {
        return new CallKey(searchId, depth, parentId, CallKind.EXPAND);
    }

    public static CallKey evaluate(String searchId, int depth, String branchId) {
        return new CallKey(searchId, depth, branchId, CallKind.EVALUATE);
    }

    public String id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallKey k)) return false;
        return id.equals(k.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
