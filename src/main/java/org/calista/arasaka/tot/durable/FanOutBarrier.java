package org.calista.arasaka.tot.durable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * FanOutBarrier: runs a set of independent calls concurrently and waits until every one of
 * them has settled, or until a stop condition closes the barrier early.
 *
 * Contracts:
 * - a call already in the journal is never issued again: its stored outcome is used
 * - journaled outcomes are settled first, in call order, before anything new is issued;
 *   if one of them satisfies the stop condition no new call is issued at all
 * - a result is journaled only while the barrier is open: whatever arrives after it
 *   closed is discarded and leaves no trace
 * - outstanding calls are cancelled once the barrier closes
 * - a journal failure closes the barrier and is rethrown as {@link SubstrateException}
 * - an interrupted call never settles: the barrier is aborted and {@link #run} throws
 *   {@link SearchInterruptedException}, leaving the call unjournaled so a resume issues it again
 */
public final class FanOutBarrier<T> {

    private static final Logger log = LogManager.getLogger(FanOutBarrier.class);

    /** One call of the fan-out. */
    public static final class Call<T> {
        public final CallKey key;
        public final Supplier<CallOutcome<T>> invoke;

        public Call(CallKey key, Supplier<CallOutcome<T>> invoke) {
            this.key = Objects.requireNonNull(key, "key");
            this.invoke = Objects.requireNonNull(invoke, "invoke");
        }
    }

    /** Outcomes aligned with the submitted calls; {@code null} = not settled (barrier closed first). */
    public static final class Round<T> {
        public final List<CallOutcome<T>> outcomes;
        public final int replayed;
        public final int issued;
        public final boolean stoppedEarly;

        Round(List<CallOutcome<T>> outcomes, int replayed, int issued, boolean stoppedEarly) {
            this.outcomes = Collections.unmodifiableList(outcomes);
            this.replayed = replayed;
            this.issued = issued;
            this.stoppedEarly = stoppedEarly;
        }
    }

    private final CallJournal journal;
    private final ExecutorService pool;
    private final CallCodec<T> codec;
    private final Predicate<CallOutcome<T>> stopWhen;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // guarded by lock
    private boolean closed;
    private int remaining;
    private boolean stopped;
    private boolean aborted;
    private SubstrateException fault;

    public FanOutBarrier(CallJournal journal, ExecutorService pool, CallCodec<T> codec,
                         Predicate<CallOutcome<T>> stopWhen, Clock clock) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.stopWhen = stopWhen == null ? o -> false : stopWhen;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Single use: one barrier per fan-out.
     *
     * @throws SubstrateException          if an outcome could not be journaled
     * @throws SearchInterruptedException  if the calling thread is interrupted while waiting
     */
    public Round<T> run(List<Call<T>> calls) {
        Objects.requireNonNull(calls, "calls");
        lock.lock();
        try {
            if (aborted) throw new SearchInterruptedException("fan-out aborted before it started");
        } finally {
            lock.unlock();
        }
        int n = calls.size();
        ArrayList<CallOutcome<T>> settled = new ArrayList<>(Collections.nCopies(n, null));

        int replayed = 0;
        for (int i = 0; i < n; i++) {
            JournalEntry e = journal.lookup(calls.get(i).key);
            if (e == null) continue;
            CallOutcome<T> o = codec.decode(e);
            settled.set(i, o);
            replayed++;
            if (stopWhen.test(o)) {
                log.debug("fan-out: replayed stop outcome key={}", calls.get(i).key);
                return new Round<>(settled, replayed, 0, true);
            }
        }

        ArrayList<Future<?>> futures = new ArrayList<>();
        int issued = 0;
        lock.lock();
        try {
            if (aborted) throw new SearchInterruptedException("fan-out aborted before it started");
            if (closed) throw new IllegalStateException("barrier already used");
            remaining = n - replayed;
        } finally {
            lock.unlock();
        }
        if (remaining == 0) {
            close();
            return new Round<>(settled, replayed, 0, false);
        }

        for (int i = 0; i < n; i++) {
            if (settled.get(i) != null) continue;
            final int idx = i;
            final Call<T> c = calls.get(i);
            try {
                futures.add(pool.submit(() -> runOne(idx, c, settled)));
            } catch (RejectedExecutionException e) {
                abort();
                cancelAll(futures);
                throw new SearchInterruptedException("fan-out pool is shut down", e);
            }
            issued++;
        }

        try {
            lock.lock();
            try {
                while (!closed && remaining > 0) changed.await();
                closed = true;
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException ie) {
            close();
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new SearchInterruptedException("interrupted while waiting for fan-out", ie);
        }

        cancelAll(futures);

        lock.lock();
        try {
            if (fault != null) throw fault;
            if (aborted) {
                throw new SearchInterruptedException("fan-out aborted with " + remaining + " call(s) unsettled");
            }
            return new Round<>(new ArrayList<>(settled), replayed, issued, stopped);
        } finally {
            lock.unlock();
        }
    }

    private void runOne(int idx, Call<T> c, List<CallOutcome<T>> settled) {
        CallOutcome<T> o;
        try {
            o = c.invoke.get();
            if (o == null) o = CallOutcome.failure("no outcome", 0);
        } catch (SearchInterruptedException e) {
            log.debug("fan-out: call interrupted key={}", c.key);
            abort();
            return;
        } catch (Throwable t) {
            o = CallOutcome.failure(t.getClass().getSimpleName() + ": " + t.getMessage(), 0);
        }
        if (Thread.currentThread().isInterrupted()) {
            // cancelled or shut down while the call ran: its outcome is not trusted
            log.debug("fan-out: outcome of interrupted call dropped key={}", c.key);
            abort();
            return;
        }
        settle(idx, c.key, o, settled);
    }

    private void settle(int idx, CallKey key, CallOutcome<T> o, List<CallOutcome<T>> settled) {
        lock.lock();
        try {
            if (closed) {
                log.debug("fan-out: discard late outcome key={}", key);
                return;
            }
            try {
                journal.commit(codec.encode(key, o, clock.millis()));
            } catch (SubstrateException e) {
                fault = e;
                closed = true;
                changed.signalAll();
                return;
            }
            settled.set(idx, o);
            remaining--;
            if (stopWhen.test(o)) {
                stopped = true;
                closed = true;
            }
            if (remaining == 0) closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the barrier without a result. Later outcomes are discarded and {@link #run} throws
     * {@link SearchInterruptedException}. No-op once the barrier closed on its own.
     * Returns only once no journal commit is in progress.
     */
    public void abort() {
        lock.lock();
        try {
            if (closed) return;
            aborted = true;
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private static void cancelAll(List<Future<?>> futures) {
        for (Future<?> f : futures) {
            if (!f.isDone()) f.cancel(true);
        }
    }
}
