package org.calista.arasaka.tot.search.collaborator;

import java.util.Objects;

/**
 * Input of one generation call.
 *
 * {@code parentContent} is the parent's full reasoning chain, or {@code null} when
 * generating first approaches straight from the problem statement.
 */
public final class GenerationRequest {

    public final String problem;
    public final String parentContent;
    public final int count;

    public GenerationRequest(String problem, String parentContent, int count) {
        this.problem = Objects.requireNonNull(problem, "problem");
        this.parentContent = parentContent;
        if (count <= 0) throw new IllegalArgumentException("count must be > 0: " + count);
        this.count = count;
    }

    public static GenerationRequest root(String problem, int count) {
        return new GenerationRequest(problem, null, count);
    }

    public static GenerationRequest expand(String problem, String parentContent, int count) {
        return new GenerationRequest(problem, Objects.requireNonNull(parentContent, "parentContent"), count);
    }

    public boolean isRoot() {
        return parentContent == null;
    }

    @Override
    public String toString() {
        return "GenerationRequest{root=" + isRoot() + ", count=" + count + '}';
    }
}
