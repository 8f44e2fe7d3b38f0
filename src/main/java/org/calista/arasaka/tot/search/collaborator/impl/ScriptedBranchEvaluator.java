package org.calista.arasaka.tot.search.collaborator.impl;

import org.calista.arasaka.tot.model.Evaluation;
import org.calista.arasaka.tot.search.collaborator.BranchEvaluator;

import java.util.Objects;

/** Evaluator answering from a {@link CollaboratorScript}; falls back to its default score. */
public final class ScriptedBranchEvaluator implements BranchEvaluator {

    private final CollaboratorScript script;

    public ScriptedBranchEvaluator(CollaboratorScript script) {
        this.script = Objects.requireNonNull(script, "script");
    }

    @Override
    public Evaluation evaluate(String branchContent, String problem) {
        Evaluation e = script.lookup(script.evaluate, branchContent);
        return e != null ? e : Evaluation.of(script.defaultScore);
    }
}
