package org.calista.arasaka.tot.durable;

import org.calista.arasaka.tot.model.Evaluation;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a call outcome to its journal line and back.
 */
public interface CallCodec<T> {

    JournalEntry encode(CallKey key, CallOutcome<T> outcome, long tsEpochMs);

    CallOutcome<T> decode(JournalEntry entry);

    CallCodec<List<String>> GENERATION = new CallCodec<>() {
        @Override
        public JournalEntry encode(CallKey key, CallOutcome<List<String>> o, long ts) {
            JournalEntry e = JournalEntry.base(key, o.ok, o.error, o.attempts, ts);
            if (o.ok) e.contents = o.value == null ? List.of() : new ArrayList<>(o.value);
            return e;
        }

        @Override
        public CallOutcome<List<String>> decode(JournalEntry e) {
            if (!e.ok) return CallOutcome.failure(e.error, e.attempts);
            return CallOutcome.success(e.contents == null ? List.<String>of() : new ArrayList<>(e.contents), e.attempts);
        }
    };

    CallCodec<Evaluation> EVALUATION = new CallCodec<>() {
        @Override
        public JournalEntry encode(CallKey key, CallOutcome<Evaluation> o, long ts) {
            JournalEntry e = JournalEntry.base(key, o.ok, o.error, o.attempts, ts);
            if (o.ok) e.evaluation = o.value;
            return e;
        }

        @Override
        public CallOutcome<Evaluation> decode(JournalEntry e) {
            if (!e.ok || e.evaluation == null) {
                return CallOutcome.failure(e.error == null ? "missing evaluation" : e.error, e.attempts);
            }
            return CallOutcome.success(e.evaluation, e.attempts);
        }
    };
}
