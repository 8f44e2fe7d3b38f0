package org.calista.arasaka.tot.durable;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.model.Evaluation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FanOutBarrierTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService pool = Executors.newCachedThreadPool();
    private FileIO io;
    private CallJournal journal;

    @BeforeEach
    void setUp() {
        io = new FileIO(dir);
        journal = CallJournal.open(io, mapper, io.resolve("journal.jsonl"));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private FanOutBarrier<Evaluation> barrier() {
        return new FanOutBarrier<>(journal, pool, CallCodec.EVALUATION, o -> o.ok && o.value.terminal, null);
    }

    private static CallKey key(int i) {
        return CallKey.evaluate("s1", 0, "b" + i);
    }

    private static FanOutBarrier.Call<Evaluation> scoring(int i, double score, AtomicInteger counter) {
        return new FanOutBarrier.Call<>(key(i), () -> {
            counter.incrementAndGet();
            return CallOutcome.success(Evaluation.of(score), 1);
        });
    }

    @Test
    void everyCallSettlesAndIsJournaledInCallOrderSlots() {
        AtomicInteger issued = new AtomicInteger();
        List<FanOutBarrier.Call<Evaluation>> calls = List.of(
                scoring(0, 0.1, issued), scoring(1, 0.2, issued), scoring(2, 0.3, issued));

        FanOutBarrier.Round<Evaluation> r = barrier().run(calls);

        assertEquals(3, issued.get());
        assertEquals(3, r.issued);
        assertEquals(0, r.replayed);
        assertFalse(r.stoppedEarly);
        for (int i = 0; i < 3; i++) {
            assertEquals(0.1 * (i + 1), r.outcomes.get(i).value.score, 1e-9);
            assertTrue(journal.contains(key(i)));
        }
    }

    @Test
    void journaledCallsAreNotIssuedAgain() {
        journal.commit(CallCodec.EVALUATION.encode(key(0), CallOutcome.success(Evaluation.of(0.7), 1), 0L));
        AtomicInteger issued = new AtomicInteger();

        FanOutBarrier.Round<Evaluation> r = barrier().run(List.of(scoring(0, 0.1, issued), scoring(1, 0.2, issued)));

        assertEquals(1, issued.get());
        assertEquals(1, r.replayed);
        assertEquals(1, r.issued);
        assertEquals(0.7, r.outcomes.get(0).value.score);
        assertEquals(0.2, r.outcomes.get(1).value.score);
    }

    @Test
    void journaledStopOutcomeIssuesNothing() {
        journal.commit(CallCodec.EVALUATION.encode(key(1), CallOutcome.success(Evaluation.terminal(0.9, "done"), 1), 0L));
        AtomicInteger issued = new AtomicInteger();

        FanOutBarrier.Round<Evaluation> r = barrier().run(
                List.of(scoring(0, 0.1, issued), scoring(1, 0.2, issued), scoring(2, 0.3, issued)));

        assertEquals(0, issued.get());
        assertTrue(r.stoppedEarly);
        assertNull(r.outcomes.get(0));
        assertTrue(r.outcomes.get(1).value.terminal);
        assertNull(r.outcomes.get(2));
    }

    @Test
    void terminalOutcomeClosesBarrierAndLateSiblingLeavesNoTrace() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch siblingStarted = new CountDownLatch(1);
        CountDownLatch siblingDone = new CountDownLatch(1);

        FanOutBarrier.Call<Evaluation> terminal = new FanOutBarrier.Call<>(key(0), () -> {
            try {
                siblingStarted.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CallOutcome.success(Evaluation.terminal(0.95, "answer"), 1);
        });
        FanOutBarrier.Call<Evaluation> slow = new FanOutBarrier.Call<>(key(1), () -> {
            siblingStarted.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
                return CallOutcome.success(Evaluation.of(0.99), 1);
            } catch (InterruptedException e) {
                return CallOutcome.failure("interrupted", 1);
            } finally {
                siblingDone.countDown();
            }
        });

        FanOutBarrier.Round<Evaluation> r = barrier().run(List.of(terminal, slow));
        release.countDown();

        assertTrue(r.stoppedEarly);
        assertTrue(r.outcomes.get(0).value.terminal);
        assertNull(r.outcomes.get(1));

        assertTrue(siblingDone.await(5, TimeUnit.SECONDS));
        assertTrue(journal.contains(key(0)));
        assertFalse(journal.contains(key(1)));
        assertFalse(CallJournal.open(io, mapper, journal.file()).contains(key(1)));
    }

    @Test
    void abortedFanOutJournalsNothingEvenIfTheCallReturnsLater() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        FanOutBarrier<Evaluation> b = barrier();
        FanOutBarrier.Call<Evaluation> blocked = new FanOutBarrier.Call<>(key(0), () -> {
            started.countDown();
            try {
                new CountDownLatch(1).await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                // ignores the interrupt and still hands back a value
            } finally {
                done.countDown();
            }
            return CallOutcome.success(Evaluation.of(0.5), 1);
        });

        Thread aborter = new Thread(() -> {
            try {
                if (started.await(5, TimeUnit.SECONDS)) b.abort();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        aborter.start();

        assertThrows(SearchInterruptedException.class, () -> b.run(List.of(blocked)));
        aborter.join(5_000);

        assertTrue(done.await(5, TimeUnit.SECONDS));
        Thread.sleep(50);
        assertFalse(journal.contains(key(0)));
        assertFalse(CallJournal.open(io, mapper, journal.file()).contains(key(0)));
    }

    @Test
    void interruptedCallIsNotJournaledAndAbortsTheRound() {
        AtomicInteger issued = new AtomicInteger();
        FanOutBarrier.Call<Evaluation> interrupted = new FanOutBarrier.Call<>(key(0), () -> {
            throw new SearchInterruptedException("call pool is shut down");
        });

        assertThrows(SearchInterruptedException.class,
                () -> barrier().run(List.of(interrupted, scoring(1, 0.3, issued))));
        assertFalse(journal.contains(key(0)));
    }

    @Test
    void abortBeforeRunIssuesNothing() {
        AtomicInteger issued = new AtomicInteger();
        FanOutBarrier<Evaluation> b = barrier();
        b.abort();

        assertThrows(SearchInterruptedException.class, () -> b.run(List.of(scoring(0, 0.1, issued))));
        assertEquals(0, issued.get());
    }

    @Test
    void abortAfterCompletionChangesNothing() {
        AtomicInteger issued = new AtomicInteger();
        FanOutBarrier<Evaluation> b = barrier();
        FanOutBarrier.Round<Evaluation> r = b.run(List.of(scoring(0, 0.1, issued)));
        b.abort();

        assertEquals(0.1, r.outcomes.get(0).value.score);
        assertTrue(journal.contains(key(0)));
    }

    @Test
    void journalFailureSurfacesAsSubstrateException() throws Exception {
        Files.createDirectories(journal.file());
        AtomicInteger issued = new AtomicInteger();

        assertThrows(SubstrateException.class, () -> barrier().run(List.of(scoring(0, 0.1, issued))));
    }

    @Test
    void throwingCallBecomesAFailedOutcome() {
        List<FanOutBarrier.Call<Evaluation>> calls = new ArrayList<>();
        calls.add(new FanOutBarrier.Call<>(key(0), () -> {
            throw new IllegalStateException("boom");
        }));

        FanOutBarrier.Round<Evaluation> r = barrier().run(calls);

        assertFalse(r.outcomes.get(0).ok);
        assertFalse(journal.lookup(key(0)).ok);
    }

    @Test
    void barrierIsSingleUse() {
        FanOutBarrier<Evaluation> b = barrier();
        AtomicInteger issued = new AtomicInteger();
        b.run(List.of(scoring(0, 0.1, issued)));
        assertThrows(IllegalStateException.class, () -> b.run(List.of(scoring(1, 0.1, issued))));
    }
}
