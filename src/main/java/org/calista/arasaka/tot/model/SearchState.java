package org.calista.arasaka.tot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SearchState: durable state of one in-flight search.
 *
 * Rules:
 * - owned and mutated by the orchestrator only; everyone else reads checkpoints
 * - public fields for Jackson: a checkpoint is this object serialized as-is
 * - {@code branches} keeps every branch ever created, in generation order, so the
 *   ancestor path of any branch can be rebuilt after pruning
 * - {@code frontier} / {@code pending} hold ids, in generation order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SearchState {

    public String searchId;
    public String problem;
    public SearchConfig config;

    public SearchPhase phase = SearchPhase.INITIALIZING;
    public int currentDepth = 0;

    /** Surviving beam at the active depth (ids). */
    public List<String> frontier = new ArrayList<>();

    /** Branches generated at the active depth, awaiting evaluation/pruning (ids). */
    public List<String> pending = new ArrayList<>();

    public Map<String, Branch> branches = new LinkedHashMap<>();

    /** Highest-scoring branch ever observed, pruned or not. */
    public String bestSoFarId;

    /** Winning branch, fixed once FINALIZING is reached. */
    public String terminalId;

    /** True when the winner was chosen by a fallback rule, not a terminal evaluation. */
    public boolean fallback;

    public int totalExplored;

    public FailureReason failureReason;
    public String failureMessage;

    public long createdAtEpochMs;
    public long updatedAtEpochMs;

    public static SearchState create(String searchId, String problem, SearchConfig config, long nowEpochMs) {
        SearchState s = new SearchState();
        s.searchId = Objects.requireNonNull(searchId, "searchId");
        s.problem = Objects.requireNonNull(problem, "problem");
        s.config = Objects.requireNonNull(config, "config");
        s.createdAtEpochMs = nowEpochMs;
        s.updatedAtEpochMs = nowEpochMs;
        return s;
    }

    // ---------------------------------------------------------------------
    // Branch access
    // ---------------------------------------------------------------------

    public Branch branch(String id) {
        Branch b = id == null ? null : branches.get(id);
        if (b == null && id != null) throw new IllegalStateException("unknown branch id: " + id);
        return b;
    }

    public void put(Branch b) {
        branches.put(b.id, b);
    }

    public List<Branch> frontierBranches() {
        return resolveAll(frontier);
    }

    public List<Branch> pendingBranches() {
        return resolveAll(pending);
    }

    public Branch bestSoFar() {
        return bestSoFarId == null ? null : branch(bestSoFarId);
    }

    public Branch terminal() {
        return terminalId == null ? null : branch(terminalId);
    }

    /**
     * Replaces bestSoFar if {@code candidate} scores strictly higher. Ties keep the earlier branch.
     */
    public boolean offerBest(Branch candidate) {
        if (candidate == null || !candidate.isScored()) return false;
        Branch cur = bestSoFar();
        if (cur == null || candidate.score > cur.score) {
            bestSoFarId = candidate.id;
            return true;
        }
        return false;
    }

    /**
     * Ancestor chain root-first, ending with the branch itself.
     */
    public List<Branch> pathTo(String id) {
        ArrayList<Branch> out = new ArrayList<>();
        Branch cur = branch(id);
        int guard = branches.size() + 1;
        while (cur != null && guard-- > 0) {
            out.add(cur);
            cur = cur.parentId == null ? null : branch(cur.parentId);
        }
        Collections.reverse(out);
        return out;
    }

    /**
     * Contents along the ancestor chain, joined the way collaborators read a line of reasoning.
     */
    public String reasoningChain(String id) {
        StringBuilder sb = new StringBuilder();
        for (Branch b : pathTo(id)) {
            if (sb.length() > 0) sb.append("\n\n→ ");
            sb.append(b.content);
        }
        return sb.toString();
    }

    private List<Branch> resolveAll(List<String> ids) {
        ArrayList<Branch> out = new ArrayList<>(ids.size());
        for (String id : ids) out.add(branch(id));
        return out;
    }

    @Override
    public String toString() {
        return "SearchState{id=" + searchId
                + ", phase=" + phase
                + ", depth=" + currentDepth
                + ", frontier=" + frontier.size()
                + ", pending=" + pending.size()
                + ", branches=" + branches.size()
                + ", best=" + bestSoFarId + '}';
    }
}
