package org.calista.arasaka.tot.search.collaborator.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.tot.search.collaborator.BranchGenerator;
import org.calista.arasaka.tot.search.collaborator.GenerationRequest;

import java.util.List;
import java.util.Objects;

/** Generator answering from a {@link CollaboratorScript}. Unknown parents yield no children. */
public final class ScriptedBranchGenerator implements BranchGenerator {

    private static final Logger log = LogManager.getLogger(ScriptedBranchGenerator.class);

    private final CollaboratorScript script;

    public ScriptedBranchGenerator(CollaboratorScript script) {
        this.script = Objects.requireNonNull(script, "script");
    }

    @Override
    public List<String> generate(GenerationRequest request) {
        List<String> out = script.lookup(script.generate, request.parentContent);
        if (out == null) {
            log.debug("no scripted children for {}", request);
            return List.of();
        }
        return out.size() > request.count ? out.subList(0, request.count) : out;
    }
}
