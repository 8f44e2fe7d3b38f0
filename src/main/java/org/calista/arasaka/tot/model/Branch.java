package org.calista.arasaka.tot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Branch: one node of the reasoning tree.
 *
 * Immutable: evaluation and status changes return a new instance.
 * Contracts:
 * - ids are derived from (parentId, childIndex), so a replayed search rebuilds identical ids
 * - branches generated from the problem statement have depth 0 and no parent
 * - score is set once, in [0,1]
 * - status only moves forward (see {@link BranchStatus#canMoveTo})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Branch {

    public final String id;
    public final String parentId;
    public final int depth;
    public final String content;
    public final Double score;
    public final BranchStatus status;

    /** Final answer text supplied by the evaluator (optional). */
    public final String answer;

    @JsonCreator
    public Branch(@JsonProperty("id") String id,
                  @JsonProperty("parentId") String parentId,
                  @JsonProperty("depth") int depth,
                  @JsonProperty("content") String content,
                  @JsonProperty("score") Double score,
                  @JsonProperty("status") BranchStatus status,
                  @JsonProperty("answer") String answer) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("branch id is blank");
        if (depth < 0) throw new IllegalArgumentException("depth < 0: " + depth);
        if (score != null && !isValidScore(score)) {
            throw new IllegalArgumentException("score out of [0,1]: " + score);
        }
        this.id = id;
        this.parentId = parentId;
        this.depth = depth;
        this.content = content == null ? "" : content;
        this.score = score;
        this.status = status == null ? BranchStatus.PENDING : status;
        this.answer = answer;
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    /** Branch generated directly from the problem statement. */
    public static Branch root(int childIndex, String content) {
        return new Branch("b" + childIndex, null, 0, content, null, BranchStatus.PENDING, null);
    }

    public static Branch child(Branch parent, int childIndex, String content) {
        Objects.requireNonNull(parent, "parent");
        return new Branch(parent.id + "." + childIndex, parent.id, parent.depth + 1,
                content, null, BranchStatus.PENDING, null);
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    public Branch withEvaluation(double score, String answer) {
        if (this.score != null) {
            throw new IllegalStateException("score already set for " + id);
        }
        if (!status.canMoveTo(BranchStatus.EVALUATED)) {
            throw new IllegalStateException("cannot evaluate " + id + " in status " + status);
        }
        return new Branch(id, parentId, depth, content, score, BranchStatus.EVALUATED, answer);
    }

    public Branch withStatus(BranchStatus next) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("illegal transition " + status + " -> " + next + " for " + id);
        }
        if ((next == BranchStatus.EXPANDED || next == BranchStatus.TERMINAL) && score == null) {
            throw new IllegalStateException(next + " requires a score: " + id);
        }
        return new Branch(id, parentId, depth, content, score, next, answer);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    @JsonIgnore
    public boolean isScored() {
        return score != null;
    }

    @JsonIgnore
    public double scoreOr(double fallback) {
        return score == null ? fallback : score;
    }

    @JsonIgnore
    public boolean isRootLevel() {
        return parentId == null;
    }

    public static boolean isValidScore(double s) {
        return !Double.isNaN(s) && s >= 0.0 && s <= 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Branch b)) return false;
        return depth == b.depth
                && id.equals(b.id)
                && Objects.equals(parentId, b.parentId)
                && content.equals(b.content)
                && Objects.equals(score, b.score)
                && status == b.status
                && Objects.equals(answer, b.answer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parentId, depth, content, score, status, answer);
    }

    @Override
    public String toString() {
        return "Branch{id=" + id + ", d=" + depth + ", score=" + score + ", status=" + status + "}";
    }
}
