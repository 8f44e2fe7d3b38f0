package org.calista.arasaka.tot.search.collaborator;

import org.calista.arasaka.tot.model.Evaluation;

/**
 * Scores how promising a line of reasoning is for the problem.
 *
 * <h3>Contract</h3>
 * - {@code branchContent} is the branch's full reasoning chain
 * - score must be in [0,1]; anything else (or NaN) is treated as a failed call
 * - {@code terminal=true} marks a complete final answer and ends the search
 * - same retry / non-idempotency rules as {@link BranchGenerator}
 */
public interface BranchEvaluator {

    Evaluation evaluate(String branchContent, String problem);
}
