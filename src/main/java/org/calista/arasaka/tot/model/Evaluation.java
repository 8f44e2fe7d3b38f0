package org.calista.arasaka.tot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Evaluator verdict for one branch.
 *
 * - score: viability in [0,1]
 * - terminal: collaborator says the branch is a complete final answer
 * - answer: final answer text (optional, meaningful when terminal)
 * - rationale: short explanation, telemetry only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Evaluation {

    public final double score;
    public final boolean terminal;
    public final String answer;
    public final String rationale;

    @JsonCreator
    public Evaluation(@JsonProperty("score") double score,
                      @JsonProperty("terminal") boolean terminal,
                      @JsonProperty("answer") String answer,
                      @JsonProperty("rationale") String rationale) {
        this.score = score;
        this.terminal = terminal;
        this.answer = answer;
        this.rationale = rationale;
    }

    public static Evaluation of(double score) {
        return new Evaluation(score, false, null, null);
    }

    public static Evaluation terminal(double score, String answer) {
        return new Evaluation(score, true, answer, null);
    }

    @JsonIgnore
    public boolean isValid() {
        return Branch.isValidScore(score);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Evaluation e)) return false;
        return Double.compare(score, e.score) == 0
                && terminal == e.terminal
                && Objects.equals(answer, e.answer)
                && Objects.equals(rationale, e.rationale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, terminal, answer, rationale);
    }

    @Override
    public String toString() {
        return "Evaluation{score=" + score + ", terminal=" + terminal + '}';
    }
}
