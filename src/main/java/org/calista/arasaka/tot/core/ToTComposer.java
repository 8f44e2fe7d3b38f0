package org.calista.arasaka.tot.core;

import org.calista.arasaka.tot.model.Evaluation;
import org.calista.arasaka.tot.search.TreeOfThoughts;
import org.calista.arasaka.tot.search.collaborator.BranchEvaluator;
import org.calista.arasaka.tot.search.collaborator.BranchGenerator;
import org.calista.arasaka.tot.search.collaborator.impl.CollaboratorScript;
import org.calista.arasaka.tot.search.collaborator.impl.ScriptedBranchEvaluator;
import org.calista.arasaka.tot.search.collaborator.impl.ScriptedBranchGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ToTComposer: собирает коллабораторов и TreeOfThoughts из конфига ядра.
 */
public final class ToTComposer {

    private static final Logger log = LoggerFactory.getLogger(ToTComposer.class);

    private final ToTKernel kernel;

    public ToTComposer(ToTKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
    }

    /**
     * Caller owns the returned instance (it owns its call pool) and must close it.
     */
    public TreeOfThoughts buildTreeOfThoughts() throws IOException {
        ToTConfig cfg = kernel.config();
        Collaborators c = buildCollaborators(cfg.collaborators);

        TreeOfThoughts.Config totCfg = new TreeOfThoughts.Config();
        totCfg.search = cfg.toSearchConfig();
        totCfg.callPolicy = cfg.toCallPolicy();
        totCfg.parallelism = cfg.pool.parallelism;
        totCfg.threadNamePrefix = cfg.pool.threadNamePrefix;
        totCfg.shutdownTimeoutMs = cfg.pool.shutdownTimeoutMs;

        log.info("Building TreeOfThoughts: collaborators={}", cfg.collaborators.kind);
        return TreeOfThoughts.builder(kernel.store(), c.generator, c.evaluator)
                .config(totCfg)
                .build();
    }

    Collaborators buildCollaborators(ToTConfig.Collaborators cc) throws IOException {
        switch (cc.kind) {
            case "scripted": {
                Path file = kernel.io().resolve(cc.scriptFile);
                if (!kernel.io().exists(file)) writeSampleScript(file);
                CollaboratorScript script = CollaboratorScript.load(kernel.io(), file, kernel.mapper());
                log.info("Scripted collaborators loaded from {}: generate={} evaluate={}",
                        file, script.generate.size(), script.evaluate.size());
                return new Collaborators(new ScriptedBranchGenerator(script), new ScriptedBranchEvaluator(script));
            }
            default:
                throw new IllegalArgumentException("Unknown collaborators.kind: " + cc.kind);
        }
    }

    private void writeSampleScript(Path file) throws IOException {
        CollaboratorScript sample = new CollaboratorScript()
                .onGenerate(null, "Work backwards from the goal", "Split the problem into cases")
                .onGenerate("Work backwards from the goal", "Check the last step against the goal")
                .onEvaluate("Work backwards from the goal", Evaluation.of(0.7))
                .onEvaluate("Split the problem into cases", Evaluation.of(0.5))
                .onEvaluate("Check the last step against the goal", Evaluation.terminal(0.9, "Verified by working backwards"));
        sample.defaultScore = 0.4;
        kernel.io().writeString(file, kernel.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(sample));
        log.warn("Collaborator script {} not found. Wrote a sample script.", file);
    }

    static final class Collaborators {
        final BranchGenerator generator;
        final BranchEvaluator evaluator;

        Collaborators(BranchGenerator generator, BranchEvaluator evaluator) {
            this.generator = generator;
            this.evaluator = evaluator;
        }
    }
}
