package org.calista.arasaka.tot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final output of a search.
 *
 * {@code path} is the ancestor chain of the winning branch, root-first, ending with the winner.
 * {@code answer} is the evaluator's answer text when it supplied one, otherwise the winner's content.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SearchResult {

    public final String searchId;
    public final String problem;
    public final String answer;
    public final String content;
    public final double score;
    public final int depth;
    public final List<Branch> path;
    public final int totalBranchesExplored;
    public final int depthReached;
    public final boolean fallback;

    @JsonCreator
    public SearchResult(@JsonProperty("searchId") String searchId,
                        @JsonProperty("problem") String problem,
                        @JsonProperty("answer") String answer,
                        @JsonProperty("content") String content,
                        @JsonProperty("score") double score,
                        @JsonProperty("depth") int depth,
                        @JsonProperty("path") List<Branch> path,
                        @JsonProperty("totalBranchesExplored") int totalBranchesExplored,
                        @JsonProperty("depthReached") int depthReached,
                        @JsonProperty("fallback") boolean fallback) {
        this.searchId = searchId;
        this.problem = problem;
        this.answer = answer == null ? "" : answer;
        this.content = content == null ? "" : content;
        this.score = score;
        this.depth = depth;
        this.path = path == null ? List.of() : List.copyOf(path);
        this.totalBranchesExplored = totalBranchesExplored;
        this.depthReached = depthReached;
        this.fallback = fallback;
    }

    public static SearchResult of(SearchState state, Branch winner, boolean fallback) {
        String answer = (winner.answer != null && !winner.answer.isBlank()) ? winner.answer : winner.content;
        return new SearchResult(
                state.searchId,
                state.problem,
                answer,
                winner.content,
                winner.scoreOr(0.0),
                winner.depth,
                state.pathTo(winner.id),
                state.totalExplored,
                state.currentDepth,
                fallback
        );
    }

    /** Id of the winning branch (last element of the path). */
    public String branchId() {
        return path.isEmpty() ? null : path.get(path.size() - 1).id;
    }

    @Override
    public String toString() {
        return "SearchResult{id=" + searchId
                + ", score=" + score
                + ", depth=" + depth
                + ", explored=" + totalBranchesExplored
                + ", fallback=" + fallback + '}';
    }
}
