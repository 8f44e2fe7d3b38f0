package org.calista.arasaka.tot.search.engine;

import org.calista.arasaka.tot.SearchFixture;
import org.calista.arasaka.tot.durable.CallCodec;
import org.calista.arasaka.tot.durable.CallJournal;
import org.calista.arasaka.tot.durable.CallKey;
import org.calista.arasaka.tot.durable.CallOutcome;
import org.calista.arasaka.tot.model.Branch;
import org.calista.arasaka.tot.model.BranchStatus;
import org.calista.arasaka.tot.model.Evaluation;
import org.calista.arasaka.tot.model.FailureReason;
import org.calista.arasaka.tot.model.SearchConfig;
import org.calista.arasaka.tot.model.SearchOutcome;
import org.calista.arasaka.tot.model.SearchPhase;
import org.calista.arasaka.tot.model.SearchResult;
import org.calista.arasaka.tot.model.SearchState;
import org.calista.arasaka.tot.search.collaborator.BranchEvaluator;
import org.calista.arasaka.tot.search.collaborator.BranchGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SearchOrchestratorTest {

    @TempDir
    Path dir;

    private SearchFixture fx;

    @BeforeEach
    void setUp() {
        fx = new SearchFixture(dir);
    }

    @AfterEach
    void tearDown() throws Exception {
        fx.close();
    }

    /** Last step of a reasoning chain, as handed to collaborators. */
    private static String last(String chain) {
        int i = chain.lastIndexOf("→ ");
        return i < 0 ? chain : chain.substring(i + 2);
    }

    /** Root request answers {@code root}; expansions are keyed by the parent's own content. */
    private static BranchGenerator tree(List<String> root, Map<String, List<String>> children) {
        return req -> req.isRoot() ? root : children.getOrDefault(last(req.parentContent), List.of());
    }

    private static BranchEvaluator scores(Map<String, Double> byContent) {
        return (chain, problem) -> {
            Double s = byContent.get(last(chain));
            if (s == null) throw new IllegalStateException("no score for " + chain);
            return Evaluation.of(s);
        };
    }

    private SearchOutcome run(String id, SearchConfig cfg, BranchGenerator gen, BranchEvaluator eval) {
        SearchState s = fx.newSearch(id, "problem " + id, cfg);
        return fx.orchestrator(s, gen, eval).run();
    }

    @Test
    void beamKeepsBestAndDepthLimitPicksIt() {
        SearchOutcome out = run("a", SearchConfig.of(1, 2, 1, 0.0),
                tree(List.of("A", "B"), Map.of()),
                scores(Map.of("A", 0.9, "B", 0.4)));

        assertTrue(out.isCompleted());
        SearchResult r = out.result;
        assertEquals("A", r.answer);
        assertEquals(0.9, r.score);
        assertFalse(r.fallback);
        assertEquals(2, r.totalBranchesExplored);
        assertEquals(0, r.depth);

        SearchState st = fx.store.checkpoints("a").load().orElseThrow();
        assertEquals(SearchPhase.COMPLETED, st.phase);
        assertEquals(BranchStatus.TERMINAL, st.branch("b0").status);
        assertEquals(BranchStatus.PRUNED, st.branch("b1").status);
    }

    @Test
    void allBelowThresholdFallsBackToBestSoFar() {
        SearchOutcome out = run("b", SearchConfig.of(3, 2, 2, 0.3),
                tree(List.of("A", "B"), Map.of()),
                scores(Map.of("A", 0.1, "B", 0.1)));

        assertTrue(out.isCompleted());
        assertEquals("A", out.result.answer);
        assertEquals(0.1, out.result.score);
        assertTrue(out.result.fallback);
        assertEquals("b0", out.result.branchId());
    }

    @Test
    void terminalEvaluationStopsSiblingsAndOnlyItIsJournaled() throws Exception {
        CountDownLatch siblingStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BranchEvaluator eval = (chain, problem) -> {
            try {
                if (chain.equals("A")) {
                    siblingStarted.await(5, TimeUnit.SECONDS);
                    return Evaluation.terminal(0.95, "42");
                }
                siblingStarted.countDown();
                release.await(10, TimeUnit.SECONDS);
                return Evaluation.of(0.99);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        };

        try {
            SearchOutcome out = run("c", SearchConfig.of(3, 2, 2, 0.0), tree(List.of("A", "B"), Map.of()), eval);

            assertTrue(out.isCompleted());
            assertEquals("42", out.result.answer);
            assertEquals(0.95, out.result.score);
            assertFalse(out.result.fallback);

            CallJournal journal = fx.store.journal("c");
            assertTrue(journal.contains(CallKey.evaluate("c", 0, "b0")));
            assertFalse(journal.contains(CallKey.evaluate("c", 0, "b1")));

            SearchState st = fx.store.checkpoints("c").load().orElseThrow();
            assertEquals(BranchStatus.TERMINAL, st.branch("b0").status);
            assertEquals(BranchStatus.PRUNED, st.branch("b1").status);
        } finally {
            release.countDown();
        }
    }

    @Test
    void multiDepthFollowsBeamAndKeepsFrontierWithinWidth() {
        BranchGenerator gen = tree(List.of("A", "B"), Map.of(
                "A", List.of("A1", "A2"),
                "A2", List.of("A2x", "A2y")));
        BranchEvaluator eval = scores(Map.of(
                "A", 0.6, "B", 0.5,
                "A1", 0.3, "A2", 0.7,
                "A2x", 0.8, "A2y", 0.2));

        SearchState s = fx.newSearch("m", "multi", SearchConfig.of(3, 2, 1, 0.0));
        SearchOrchestrator o = fx.orchestrator(s, gen, eval);
        while (!o.state().phase.isDone()) {
            o.step();
            assertTrue(o.state().frontier.size() <= 1, "frontier " + o.state().frontier);
            assertTrue(o.state().currentDepth < 3);
        }

        SearchResult r = o.outcome().result;
        List<String> path = new ArrayList<>();
        for (Branch b : r.path) path.add(b.content);
        assertEquals(List.of("A", "A2", "A2x"), path);
        assertEquals(0.8, r.score);
        assertEquals(2, r.depth);
        assertEquals(6, r.totalBranchesExplored);
        for (Branch b : o.state().branches.values()) assertTrue(b.depth < 3);
        assertEquals(BranchStatus.EXPANDED, o.state().branch("b0").status);
        assertEquals(BranchStatus.EXPANDED, o.state().branch("b0.1").status);
    }

    @Test
    void failingEvaluationIsDroppedNotFatal() {
        BranchEvaluator eval = (chain, problem) -> {
            if (chain.equals("B")) throw new IllegalStateException("evaluator down");
            return Evaluation.of(chain.equals("A") ? 0.8 : 0.5);
        };

        SearchOutcome out = run("d", SearchConfig.of(1, 3, 2, 0.0), tree(List.of("A", "B", "C"), Map.of()), eval);

        assertTrue(out.isCompleted());
        assertEquals("A", out.result.answer);
        SearchState st = fx.store.checkpoints("d").load().orElseThrow();
        assertEquals(BranchStatus.PRUNED, st.branch("b1").status);
        assertFalse(st.branch("b1").isScored());
        assertEquals(BranchStatus.EVALUATED, st.branch("b2").status);
        assertFalse(fx.store.journal("d").lookup(CallKey.evaluate("d", 0, "b1")).ok);
    }

    @Test
    void outOfRangeScoreIsTreatedAsFailedEvaluation() {
        BranchEvaluator eval = (chain, problem) -> Evaluation.of(chain.equals("A") ? 1.5 : 0.4);

        SearchOutcome out = run("r", SearchConfig.of(1, 2, 2, 0.0), tree(List.of("A", "B"), Map.of()), eval);

        assertEquals("B", out.result.answer);
        assertEquals(0.4, out.result.score);
    }

    @Test
    void failingExpansionDropsOnlyThatParent() {
        BranchGenerator gen = req -> {
            if (req.isRoot()) return List.of("A", "B");
            if (last(req.parentContent).equals("A")) throw new IllegalStateException("generator down");
            return List.of("B1");
        };
        BranchEvaluator eval = scores(Map.of("A", 0.9, "B", 0.6, "B1", 0.5));

        SearchOutcome out = run("e", SearchConfig.of(2, 2, 2, 0.0), gen, eval);

        assertTrue(out.isCompleted());
        assertEquals("B1", out.result.answer);
        assertEquals(1, out.result.depth);
        SearchState st = fx.store.checkpoints("e").load().orElseThrow();
        assertEquals(BranchStatus.EXPANDED, st.branch("b0").status);
        assertEquals(3, st.totalExplored);
    }

    @Test
    void emptyExpansionFallsBackToBestSoFar() {
        SearchOutcome out = run("f", SearchConfig.of(3, 2, 2, 0.0),
                tree(List.of("A"), Map.of()),
                scores(Map.of("A", 0.6)));

        assertTrue(out.isCompleted());
        assertEquals("A", out.result.answer);
        assertTrue(out.result.fallback);
        assertEquals(1, out.result.depthReached);
    }

    @Test
    void emptyRootGenerationFails() {
        SearchOutcome out = run("g", SearchConfig.defaults(), tree(List.of(" ", ""), Map.of()), scores(Map.of()));

        assertFalse(out.isCompleted());
        assertEquals(FailureReason.NO_INITIAL_BRANCHES, out.reason);
        assertEquals(SearchPhase.FAILED, fx.store.checkpoints("g").load().orElseThrow().phase);
    }

    @Test
    void throwingRootGenerationFails() {
        BranchGenerator gen = req -> {
            throw new IllegalStateException("no model");
        };

        SearchOutcome out = run("h", SearchConfig.defaults(), gen, scores(Map.of()));

        assertEquals(FailureReason.NO_INITIAL_BRANCHES, out.reason);
        assertTrue(out.message.contains("no model"), out.message);
    }

    @Test
    void noEvaluatedBranchFails() {
        BranchEvaluator eval = (chain, problem) -> {
            throw new IllegalStateException("down");
        };

        SearchOutcome out = run("i", SearchConfig.defaults(), tree(List.of("A", "B"), Map.of()), eval);

        assertEquals(FailureReason.NO_INITIAL_BRANCHES, out.reason);
    }

    @Test
    void rootGenerationIsTruncatedToBranchesPerNode() {
        SearchOutcome out = run("t", SearchConfig.of(1, 2, 2, 0.0),
                tree(List.of("A", "B", "C", "D"), Map.of()),
                scores(Map.of("A", 0.2, "B", 0.3)));

        assertEquals("B", out.result.answer);
        assertEquals(2, out.result.totalBranchesExplored);
    }

    @Test
    void unwritableJournalIsASubstrateFault() throws Exception {
        SearchState s = fx.newSearch("j", "problem", SearchConfig.defaults());
        SearchOrchestrator o = fx.orchestrator(s, tree(List.of("A"), Map.of()), scores(Map.of("A", 0.5)));
        Files.createDirectories(fx.store.searchDir("j").resolve("journal.jsonl"));

        SearchOutcome out = o.run();

        assertEquals(FailureReason.SUBSTRATE_FAULT, out.reason);
        assertEquals(SearchPhase.FAILED, fx.store.checkpoints("j").load().orElseThrow().phase);
    }

    @Test
    void outcomeOfRunningSearchIsRejected() {
        SearchState s = fx.newSearch("k", "problem", SearchConfig.defaults());
        SearchOrchestrator o = fx.orchestrator(s, tree(List.of("A"), Map.of()), scores(Map.of("A", 0.5)));
        assertThrows(IllegalStateException.class, o::outcome);
    }

    @Test
    void replayFromAnyCheckpointReachesSameOutcomeWithoutCalls() throws Exception {
        BranchGenerator gen = tree(List.of("A", "B"), Map.of(
                "A", List.of("A1", "A2"),
                "B", List.of("B1"),
                "A2", List.of("A2x")));
        BranchEvaluator eval = scores(Map.of(
                "A", 0.6, "B", 0.5, "A1", 0.3, "A2", 0.7, "B1", 0.4, "A2x", 0.8));

        SearchState s = fx.newSearch("p", "replay", SearchConfig.of(3, 2, 2, 0.0));
        List<SearchState> snapshots = new ArrayList<>();
        snapshots.add(fx.copy(s));
        SearchOrchestrator o = fx.orchestrator(s, gen, eval);
        while (!o.state().phase.isDone()) {
            o.step();
            snapshots.add(fx.copy(o.state()));
        }
        String expected = fx.mapper.writeValueAsString(o.outcome());

        for (SearchState snap : snapshots) {
            BranchGenerator g = mock(BranchGenerator.class);
            BranchEvaluator e = mock(BranchEvaluator.class);
            SearchOutcome replayed = fx.orchestrator(fx.copy(snap), g, e).run();

            assertEquals(expected, fx.mapper.writeValueAsString(replayed), "from " + snap.phase);
            verifyNoInteractions(g, e);
        }
    }

    @Test
    void partialJournalIssuesOnlyMissingCalls() {
        String id = "q";
        SearchState s = fx.newSearch(id, "partial", SearchConfig.of(1, 2, 2, 0.0));
        CallJournal journal = fx.store.journal(id);
        journal.commit(CallCodec.GENERATION.encode(CallKey.generateRoot(id),
                CallOutcome.success(List.of("A", "B"), 1), 0L));
        journal.commit(CallCodec.EVALUATION.encode(CallKey.evaluate(id, 0, "b0"),
                CallOutcome.success(Evaluation.of(0.9), 1), 0L));

        BranchGenerator gen = mock(BranchGenerator.class);
        BranchEvaluator eval = mock(BranchEvaluator.class);
        when(eval.evaluate(eq("B"), anyString())).thenReturn(Evaluation.of(0.4));

        SearchOutcome out = fx.orchestrator(s, gen, eval).run();

        assertEquals("A", out.result.answer);
        verify(gen, never()).generate(any());
        verify(eval, never()).evaluate(eq("A"), anyString());
        verify(eval).evaluate(eq("B"), anyString());
    }
}
