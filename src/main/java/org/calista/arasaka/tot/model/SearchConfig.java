package org.calista.arasaka.tot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Shape of one search: tree depth, fan-out, beam and pruning threshold.
 *
 * <p>{@code maxDepth} counts depth levels: a search explores depths {@code 0..maxDepth-1}, so
 * {@code maxDepth=1} scores the root branches and stops without expanding them, and the default
 * of 3 expands twice. A runner whose depth setting means "expand this many times" (depths
 * {@code 0..depth}) maps to {@code maxDepth = depth + 1}.
 * {@code beamWidth <= branchesPerNode} is expected but not enforced.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SearchConfig {

    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_BRANCHES_PER_NODE = 3;
    public static final int DEFAULT_BEAM_WIDTH = 2;
    public static final double DEFAULT_MIN_SCORE_THRESHOLD = 0.3;

    public final int maxDepth;
    public final int branchesPerNode;
    public final int beamWidth;
    public final double minScoreThreshold;

    @JsonCreator
    public SearchConfig(@JsonProperty("maxDepth") int maxDepth,
                        @JsonProperty("branchesPerNode") int branchesPerNode,
                        @JsonProperty("beamWidth") int beamWidth,
                        @JsonProperty("minScoreThreshold") double minScoreThreshold) {
        this.maxDepth = maxDepth;
        this.branchesPerNode = branchesPerNode;
        this.beamWidth = beamWidth;
        this.minScoreThreshold = minScoreThreshold;
    }

    public static SearchConfig defaults() {
        return new SearchConfig(DEFAULT_MAX_DEPTH, DEFAULT_BRANCHES_PER_NODE, DEFAULT_BEAM_WIDTH, DEFAULT_MIN_SCORE_THRESHOLD);
    }

    public static SearchConfig of(int maxDepth, int branchesPerNode, int beamWidth, double minScoreThreshold) {
        return new SearchConfig(maxDepth, branchesPerNode, beamWidth, minScoreThreshold).validate();
    }

    /**
     * @return this, if every option is in range
     * @throws IllegalArgumentException naming the first offending option
     */
    public SearchConfig validate() {
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0: " + maxDepth);
        if (branchesPerNode <= 0) throw new IllegalArgumentException("branchesPerNode must be > 0: " + branchesPerNode);
        if (beamWidth <= 0) throw new IllegalArgumentException("beamWidth must be > 0: " + beamWidth);
        if (!Branch.isValidScore(minScoreThreshold)) {
            throw new IllegalArgumentException("minScoreThreshold must be in [0,1]: " + minScoreThreshold);
        }
        return this;
    }

    public SearchConfig withMaxDepth(int v) {
        return new SearchConfig(v, branchesPerNode, beamWidth, minScoreThreshold);
    }

    public SearchConfig withBranchesPerNode(int v) {
        return new SearchConfig(maxDepth, v, beamWidth, minScoreThreshold);
    }

    public SearchConfig withBeamWidth(int v) {
        return new SearchConfig(maxDepth, branchesPerNode, v, minScoreThreshold);
    }

    public SearchConfig withMinScoreThreshold(double v) {
        return new SearchConfig(maxDepth, branchesPerNode, beamWidth, v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchConfig c)) return false;
        return maxDepth == c.maxDepth
                && branchesPerNode == c.branchesPerNode
                && beamWidth == c.beamWidth
                && Double.compare(minScoreThreshold, c.minScoreThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxDepth, branchesPerNode, beamWidth, minScoreThreshold);
    }

    @Override
    public String toString() {
        return "SearchConfig{maxDepth=" + maxDepth
                + ", branchesPerNode=" + branchesPerNode
                + ", beamWidth=" + beamWidth
                + ", minScoreThreshold=" + minScoreThreshold + '}';
    }
}
