package org.calista.arasaka.tot.search.engine;

import org.calista.arasaka.tot.model.Branch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Beam selection over one depth's scored branches.
 *
 * <p>Pure: same input list (same scores, same order) always yields the same survivors.
 * The orchestrator may run it again on replay.</p>
 */
public final class Pruner {

    private static final Comparator<Branch> BY_SCORE_DESC =
            Comparator.comparingDouble((Branch b) -> b.score).reversed();

    private Pruner() {}

    /**
     * Drops unscored branches and those with {@code score < minScoreThreshold}, sorts the rest by
     * score descending (stable: ties keep generation order) and keeps the first {@code beamWidth}.
     *
     * @param scoredBranches branches in generation order
     * @return new list, never larger than {@code beamWidth}
     */
    public static List<Branch> prune(List<Branch> scoredBranches, int beamWidth, double minScoreThreshold) {
        if (beamWidth <= 0) throw new IllegalArgumentException("beamWidth must be > 0: " + beamWidth);
        if (scoredBranches == null || scoredBranches.isEmpty()) return List.of();

        ArrayList<Branch> passing = new ArrayList<>(scoredBranches.size());
        for (Branch b : scoredBranches) {
            if (b == null || !b.isScored()) continue;
            if (b.score < minScoreThreshold) continue;
            passing.add(b);
        }

        // List.sort is a stable merge sort
        passing.sort(BY_SCORE_DESC);

        if (passing.size() > beamWidth) {
            return List.copyOf(passing.subList(0, beamWidth));
        }
        return List.copyOf(passing);
    }
}
