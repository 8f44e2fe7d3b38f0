package org.calista.arasaka.tot.search.engine;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.tot.durable.CallCodec;
import org.calista.arasaka.tot.durable.CallJournal;
import org.calista.arasaka.tot.durable.CallKey;
import org.calista.arasaka.tot.durable.CallOutcome;
import org.calista.arasaka.tot.durable.CheckpointStore;
import org.calista.arasaka.tot.durable.DurableCallExecutor;
import org.calista.arasaka.tot.durable.FanOutBarrier;
import org.calista.arasaka.tot.durable.SearchInterruptedException;
import org.calista.arasaka.tot.durable.SubstrateException;
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
import org.calista.arasaka.tot.search.collaborator.CollaboratorException;
import org.calista.arasaka.tot.search.collaborator.GenerationRequest;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Predicate;

/**
 * SearchOrchestrator: explicit state machine driving one search.
 *
 * <pre>
 * INITIALIZING -> GENERATING -> EVALUATING -> PRUNING -> CHECKING_TERMINATION
 *                     ^                                        |
 *                     +------------ next depth ----------------+--> FINALIZING -> COMPLETED
 * (EVALUATING -> FINALIZING on a terminal evaluation; any state -> FAILED)
 * </pre>
 *
 * <p>Every control-flow decision is a function of the checkpointed {@link SearchState} and
 * the outcomes recorded in the {@link CallJournal}. Restarting from any checkpoint with the
 * same journal replays to the same state without calling collaborators again for committed
 * calls.</p>
 *
 * <p>Не владеет пулами и хранилищем: их lifecycle в TreeOfThoughts.</p>
 */
public final class SearchOrchestrator {

    private static final Logger log = LogManager.getLogger(SearchOrchestrator.class);

    private final SearchState state;
    private final CheckpointStore checkpoints;
    private final CallJournal journal;
    private final BranchGenerator generator;
    private final BranchEvaluator evaluator;
    private final DurableCallExecutor calls;
    private final ExecutorService fanOutPool;
    private final Clock clock;

    private volatile boolean aborted;
    private volatile FanOutBarrier<?> openBarrier;

    public SearchOrchestrator(SearchState state,
                              CheckpointStore checkpoints,
                              CallJournal journal,
                              BranchGenerator generator,
                              BranchEvaluator evaluator,
                              DurableCallExecutor calls,
                              ExecutorService fanOutPool,
                              Clock clock) {
        this.state = Objects.requireNonNull(state, "state");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.calls = Objects.requireNonNull(calls, "calls");
        this.fanOutPool = Objects.requireNonNull(fanOutPool, "fanOutPool");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public SearchState state() {
        return state;
    }

    /**
     * Steps until COMPLETED or FAILED. A substrate fault ends the search as
     * {@code FAILED(SUBSTRATE_FAULT)}; no partial result is produced.
     *
     * @throws SearchInterruptedException if the search was aborted or interrupted; it stays
     *                                    at its last checkpoint and can be resumed
     */
    public SearchOutcome run() {
        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("search", state.searchId)) {
            log.info("search.start id={} phase={} depth={} {}", state.searchId, state.phase, state.currentDepth, state.config);
            try {
                while (!state.phase.isDone()) step();
            } catch (SearchInterruptedException e) {
                log.warn("search.interrupted id={} phase={} depth={}: {}",
                        state.searchId, state.phase, state.currentDepth, e.getMessage());
                throw e;
            } catch (SubstrateException e) {
                log.error("search.fault id={} phase={}", state.searchId, state.phase, e);
                fail(FailureReason.SUBSTRATE_FAULT, e.getMessage());
                try {
                    checkpoints.save(state);
                } catch (SubstrateException again) {
                    log.error("search.fault checkpoint not written id={}", state.searchId, again);
                }
            }
            SearchOutcome out = outcome();
            log.info("search.done id={} {}", state.searchId, out);
            return out;
        }
    }

    /**
     * Executes one transition and commits the checkpoint. No-op once the search is done.
     *
     * @return phase after the transition
     */
    public SearchPhase step() {
        if (aborted) throw new SearchInterruptedException("search " + state.searchId + " aborted");
        SearchPhase from = state.phase;
        switch (from) {
            case INITIALIZING -> initialize();
            case GENERATING -> generate();
            case EVALUATING -> evaluate();
            case PRUNING -> prune();
            case CHECKING_TERMINATION -> checkTermination();
            case FINALIZING -> finish();
            case COMPLETED, FAILED -> {
                return from;
            }
        }
        state.updatedAtEpochMs = clock.millis();
        checkpoints.save(state);
        log.debug("step {} -> {} depth={} frontier={} pending={}", from, state.phase, state.currentDepth,
                state.frontier.size(), state.pending.size());
        return state.phase;
    }

    /**
     * Stops the search from another thread: the open fan-out, if any, is aborted without
     * journaling its unsettled calls and no further step runs. Returns once no journal commit
     * is in progress, so the caller may then shut the pools down.
     */
    public void abort() {
        aborted = true;
        FanOutBarrier<?> b = openBarrier;
        if (b != null) b.abort();
    }

    /**
     * Outcome of a finished search, rebuilt from state.
     *
     * @throws IllegalStateException if the search is still running
     */
    public SearchOutcome outcome() {
        return switch (state.phase) {
            case COMPLETED -> SearchOutcome.completed(SearchResult.of(state, state.terminal(), state.fallback));
            case FAILED -> SearchOutcome.failed(state.searchId, state.failureReason, state.failureMessage);
            default -> throw new IllegalStateException("search " + state.searchId + " is still " + state.phase);
        };
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    private void initialize() {
        state.config.validate();
        state.currentDepth = 0;
        state.frontier = new ArrayList<>();
        state.pending = new ArrayList<>();
        state.phase = SearchPhase.GENERATING;
    }

    private void generate() {
        SearchConfig cfg = state.config;
        int depth = state.currentDepth;

        if (depth == 0) {
            CallKey key = CallKey.generateRoot(state.searchId);
            GenerationRequest req = GenerationRequest.root(state.problem, cfg.branchesPerNode);
            List<FanOutBarrier.Call<List<String>>> one = List.of(generationCall(key, req));
            CallOutcome<List<String>> o = barrier(CallCodec.GENERATION, null).run(one).outcomes.get(0);

            List<String> contents = (o == null || !o.ok) ? List.of() : usable(o.value, cfg.branchesPerNode);
            if (contents.isEmpty()) {
                fail(FailureReason.NO_INITIAL_BRANCHES,
                        o != null && !o.ok ? "root generation failed: " + o.error : "root generation returned no branches");
                return;
            }
            ArrayList<String> ids = new ArrayList<>(contents.size());
            for (int i = 0; i < contents.size(); i++) {
                Branch b = Branch.root(i, contents.get(i));
                state.put(b);
                ids.add(b.id);
            }
            state.pending = ids;
            state.totalExplored += ids.size();
            state.phase = SearchPhase.EVALUATING;
            return;
        }

        List<Branch> parents = state.frontierBranches();
        ArrayList<FanOutBarrier.Call<List<String>>> batch = new ArrayList<>(parents.size());
        for (Branch p : parents) {
            CallKey key = CallKey.expand(state.searchId, depth, p.id);
            GenerationRequest req = GenerationRequest.expand(state.problem, state.reasoningChain(p.id), cfg.branchesPerNode);
            batch.add(generationCall(key, req));
        }
        FanOutBarrier.Round<List<String>> round = barrier(CallCodec.GENERATION, null).run(batch);

        ArrayList<String> ids = new ArrayList<>();
        for (int i = 0; i < parents.size(); i++) {
            Branch parent = parents.get(i);
            state.put(parent.withStatus(BranchStatus.EXPANDED));

            CallOutcome<List<String>> o = round.outcomes.get(i);
            if (o == null || !o.ok) {
                log.warn("expand dropped parent={} error={}", parent.id, o == null ? "cancelled" : o.error);
                continue;
            }
            List<String> contents = usable(o.value, cfg.branchesPerNode);
            for (int c = 0; c < contents.size(); c++) {
                Branch child = Branch.child(parent, c, contents.get(c));
                state.put(child);
                ids.add(child.id);
            }
        }
        state.frontier = new ArrayList<>();
        state.pending = ids;
        state.totalExplored += ids.size();
        state.phase = SearchPhase.EVALUATING;
    }

    private void evaluate() {
        List<Branch> candidates = state.pendingBranches();
        ArrayList<FanOutBarrier.Call<Evaluation>> batch = new ArrayList<>(candidates.size());
        for (Branch b : candidates) {
            CallKey key = CallKey.evaluate(state.searchId, state.currentDepth, b.id);
            String chain = state.reasoningChain(b.id);
            batch.add(new FanOutBarrier.Call<>(key, () -> calls.execute(key.id(), () -> checkedEvaluation(chain))));
        }

        FanOutBarrier.Round<Evaluation> round =
                barrier(CallCodec.EVALUATION, o -> o.ok && o.value.terminal).run(batch);

        Branch terminal = null;
        for (int i = 0; i < candidates.size(); i++) {
            Branch b = candidates.get(i);
            CallOutcome<Evaluation> o = round.outcomes.get(i);
            if (o == null || !o.ok) {
                // cancelled after an early stop, or failed for good: dropped
                state.put(b.withStatus(BranchStatus.PRUNED));
                if (o != null) log.warn("evaluation dropped branch={} error={}", b.id, o.error);
                continue;
            }
            Branch scored = b.withEvaluation(o.value.score, o.value.answer);
            state.put(scored);
            state.offerBest(scored);
            if (o.value.terminal && (terminal == null || scored.score > terminal.score)) {
                terminal = scored;
            }
        }

        if (terminal != null) {
            log.info("terminal evaluation branch={} score={} depth={}", terminal.id, terminal.score, terminal.depth);
            state.put(terminal.withStatus(BranchStatus.TERMINAL));
            state.terminalId = terminal.id;
            state.fallback = false;
            state.pending = new ArrayList<>();
            state.phase = SearchPhase.FINALIZING;
            return;
        }
        state.phase = SearchPhase.PRUNING;
    }

    private void prune() {
        SearchConfig cfg = state.config;
        ArrayList<Branch> scored = new ArrayList<>();
        for (Branch b : state.pendingBranches()) {
            if (b.status == BranchStatus.EVALUATED) scored.add(b);
        }

        List<Branch> survivors = Pruner.prune(scored, cfg.beamWidth, cfg.minScoreThreshold);
        ArrayList<String> frontier = new ArrayList<>(survivors.size());
        for (Branch s : survivors) frontier.add(s.id);

        for (Branch b : scored) {
            if (!frontier.contains(b.id)) state.put(b.withStatus(BranchStatus.PRUNED));
        }

        state.frontier = frontier;
        state.pending = new ArrayList<>();
        state.phase = SearchPhase.CHECKING_TERMINATION;
    }

    private void checkTermination() {
        if (state.frontier.isEmpty()) {
            Branch best = state.bestSoFar();
            if (best == null) {
                fail(FailureReason.NO_INITIAL_BRANCHES, "no branch could be evaluated");
                return;
            }
            log.info("frontier empty at depth={}, falling back to best={} score={}", state.currentDepth, best.id, best.score);
            if (best.status == BranchStatus.EVALUATED) state.put(best.withStatus(BranchStatus.TERMINAL));
            state.terminalId = best.id;
            state.fallback = true;
            state.phase = SearchPhase.FINALIZING;
            return;
        }

        if (state.currentDepth + 1 >= state.config.maxDepth) {
            // frontier is sorted by score, ties in generation order
            Branch best = state.branch(state.frontier.get(0));
            log.info("depth limit reached depth={}, best={} score={}", state.currentDepth, best.id, best.score);
            state.put(best.withStatus(BranchStatus.TERMINAL));
            state.terminalId = best.id;
            state.fallback = false;
            state.phase = SearchPhase.FINALIZING;
            return;
        }

        state.currentDepth++;
        state.phase = SearchPhase.GENERATING;
    }

    private void finish() {
        Branch winner = state.terminal();
        if (winner == null) throw new IllegalStateException("FINALIZING without a winner: " + state.searchId);
        state.phase = SearchPhase.COMPLETED;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void fail(FailureReason reason, String message) {
        log.warn("search.failed id={} reason={} message={}", state.searchId, reason, message);
        state.failureReason = reason;
        state.failureMessage = message;
        state.phase = SearchPhase.FAILED;
    }

    private <T> FanOutBarrier<T> barrier(CallCodec<T> codec, Predicate<CallOutcome<T>> stopWhen) {
        FanOutBarrier<T> b = new FanOutBarrier<>(journal, fanOutPool, codec, stopWhen, clock);
        openBarrier = b;
        // abort() may have run before openBarrier was published
        if (aborted) b.abort();
        return b;
    }

    private FanOutBarrier.Call<List<String>> generationCall(CallKey key, GenerationRequest req) {
        return new FanOutBarrier.Call<>(key, () -> calls.execute(key.id(), () -> {
            List<String> out = generator.generate(req);
            return out == null ? List.<String>of() : new ArrayList<>(out);
        }));
    }

    private Evaluation checkedEvaluation(String chain) {
        Evaluation e = evaluator.evaluate(chain, state.problem);
        if (e == null) throw new CollaboratorException("evaluator returned nothing");
        if (!e.isValid()) throw new CollaboratorException("score out of [0,1]: " + e.score);
        return e;
    }

    /** Drops blank items, then truncates to {@code max}. */
    static List<String> usable(List<String> raw, int max) {
        if (raw == null || raw.isEmpty()) return List.of();
        ArrayList<String> out = new ArrayList<>(Math.min(raw.size(), max));
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            out.add(s.trim());
            if (out.size() >= max) break;
        }
        return out;
    }
}
