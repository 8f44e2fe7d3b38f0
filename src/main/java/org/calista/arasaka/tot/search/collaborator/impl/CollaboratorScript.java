package org.calista.arasaka.tot.search.collaborator.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.model.Evaluation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CollaboratorScript: canned collaborator answers, loaded from JSON.
 *
 * <pre>
 * {
 *   "generate": { "$root": ["approach A", "approach B"], "approach A": ["step A1"] },
 *   "evaluate": { "approach A": {"score": 0.8}, "step A1": {"score": 0.95, "terminal": true, "answer": "42"} },
 *   "defaultScore": 0.0
 * }
 * </pre>
 *
 * Keys are matched against the full reasoning chain first, then against its last step.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CollaboratorScript {

    /** Key under {@code generate} used for the call made from the problem statement. */
    public static final String ROOT_KEY = "$root";

    public Map<String, List<String>> generate = new LinkedHashMap<>();
    public Map<String, Evaluation> evaluate = new LinkedHashMap<>();

    /** Score returned for content without an {@code evaluate} entry. */
    public double defaultScore = 0.0;

    public static CollaboratorScript load(FileIO io, Path file, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(mapper, "mapper");

        String json = io.readString(file);
        CollaboratorScript s = mapper.readValue(json, CollaboratorScript.class);
        if (s == null) s = new CollaboratorScript();
        if (s.generate == null) s.generate = new LinkedHashMap<>();
        if (s.evaluate == null) s.evaluate = new LinkedHashMap<>();
        return s;
    }

    public CollaboratorScript onGenerate(String parent, String... children) {
        generate.put(parent == null ? ROOT_KEY : parent, List.of(children));
        return this;
    }

    public CollaboratorScript onEvaluate(String content, Evaluation evaluation) {
        evaluate.put(content, evaluation);
        return this;
    }

    <T> T lookup(Map<String, T> table, String chain) {
        if (chain == null) return table.get(ROOT_KEY);
        T hit = table.get(chain);
        if (hit != null) return hit;
        return table.get(lastStep(chain));
    }

    static String lastStep(String chain) {
        int i = chain.lastIndexOf("\n\n→ ");
        return i < 0 ? chain : chain.substring(i + "\n\n→ ".length());
    }
}
