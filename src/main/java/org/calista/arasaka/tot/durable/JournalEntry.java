package org.calista.arasaka.tot.durable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.calista.arasaka.tot.model.Evaluation;

import java.util.List;

/**
 * One committed call outcome, one JSONL line in {@code journal.jsonl}.
 * A failed call is committed too, so a replay sees the same failure instead of calling again.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class JournalEntry {
    public String key;
    public CallKind kind;
    public int depth;
    public String subject;
    public boolean ok;
    public List<String> contents;    // GENERATE_ROOT / EXPAND
    public Evaluation evaluation;    // EVALUATE
    public String error;
    public int attempts;
    public long tsEpochMs;

    static JournalEntry base(CallKey k, boolean ok, String error, int attempts, long tsEpochMs) {
        JournalEntry e = new JournalEntry();
        e.key = k.id();
        e.kind = k.kind;
        e.depth = k.depth;
        e.subject = k.subject;
        e.ok = ok;
        e.error = error;
        e.attempts = attempts;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
