package org.calista.arasaka.tot.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.tot.durable.CallJournal;
import org.calista.arasaka.tot.durable.CallPolicy;
import org.calista.arasaka.tot.durable.CheckpointStore;
import org.calista.arasaka.tot.durable.DurableCallExecutor;
import org.calista.arasaka.tot.durable.SearchInterruptedException;
import org.calista.arasaka.tot.durable.SearchStore;
import org.calista.arasaka.tot.durable.SubstrateException;
import org.calista.arasaka.tot.model.FailureReason;
import org.calista.arasaka.tot.model.SearchConfig;
import org.calista.arasaka.tot.model.SearchOutcome;
import org.calista.arasaka.tot.model.SearchPhase;
import org.calista.arasaka.tot.model.SearchState;
import org.calista.arasaka.tot.search.collaborator.BranchEvaluator;
import org.calista.arasaka.tot.search.collaborator.BranchGenerator;
import org.calista.arasaka.tot.search.engine.SearchOrchestrator;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.CRC32;

/**
 * TreeOfThoughts: точка входа: принимает задачу, ведёт durable-поиск, возвращает исход.
 *
 * Ownership:
 *  - владеет callPool (попытки вызовов коллабораторов) и workerPool (ожидание fan-out,
 *    асинхронные поиски), если они не переданы снаружи
 *  - SearchStore и коллабораторы принадлежат вызывающему
 *
 * Search ids:
 *  - default id: "tot-" + 6 hex of the problem hash
 *  - id in flight with the same problem: resumed; archived: stored outcome returned;
 *    bound to another problem: rejected
 */
public final class TreeOfThoughts implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(TreeOfThoughts.class);

    private final Config config;
    private final SearchStore store;
    private final BranchGenerator generator;
    private final BranchEvaluator evaluator;
    private final Clock clock;

    private final ExecutorService callPool;
    private final boolean ownsCallPool;
    private final ExecutorService workerPool;

    private final DurableCallExecutor calls;

    /** Searches driven by this instance right now. */
    private final Map<String, SearchHandle> active = new ConcurrentHashMap<>();
    private final Map<String, SearchOrchestrator> running = new ConcurrentHashMap<>();

    private volatile boolean closed;

    private TreeOfThoughts(Builder b) {
        this.store = Objects.requireNonNull(b.store, "store");
        this.generator = Objects.requireNonNull(b.generator, "generator");
        this.evaluator = Objects.requireNonNull(b.evaluator, "evaluator");
        this.config = Objects.requireNonNull(b.config, "config").freezeAndValidate();
        this.clock = b.clock;

        this.ownsCallPool = (b.callPool == null);
        this.callPool = ownsCallPool ? createCallPool(config) : b.callPool;
        this.workerPool = createWorkerPool(config);

        this.calls = new DurableCallExecutor(config.callPolicy, callPool);

        logCreation();
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    public SearchOutcome submit(String problem) {
        return submit(problem, config.search);
    }

    public SearchOutcome submit(String problem, SearchConfig searchConfig) {
        return submit(defaultSearchId(problem), problem, searchConfig);
    }

    /**
     * Runs the search to completion on the calling thread.
     *
     * @throws IllegalArgumentException blank problem, invalid config, or id bound to another problem
     */
    public SearchOutcome submit(String searchId, String problem, SearchConfig searchConfig) {
        SearchHandle running = active.get(searchId);
        if (running != null) return running.future().join();
        return drive(searchId, prepare(searchId, problem, searchConfig));
    }

    public SearchHandle start(String problem) {
        return start(defaultSearchId(problem), problem, config.search);
    }

    public SearchHandle start(String problem, SearchConfig searchConfig) {
        return start(defaultSearchId(problem), problem, searchConfig);
    }

    /**
     * Starts the search on the worker pool. Validation errors are thrown here, not through the handle.
     */
    public SearchHandle start(String searchId, String problem, SearchConfig searchConfig) {
        SearchHandle running = active.get(searchId);
        if (running != null) return running;

        Prepared p = prepare(searchId, problem, searchConfig);
        if (p.outcome != null) return new SearchHandle(searchId, CompletableFuture.completedFuture(p.outcome));

        CompletableFuture<SearchOutcome> f = new CompletableFuture<>();
        SearchHandle h = new SearchHandle(searchId, f);
        SearchHandle prev = active.putIfAbsent(searchId, h);
        if (prev != null) return prev;

        workerPool.execute(() -> {
            try {
                f.complete(runAndArchive(p.state));
            } catch (Throwable t) {
                f.completeExceptionally(t);
            } finally {
                active.remove(searchId, h);
            }
        });
        return h;
    }

    /**
     * Continues an interrupted search from its checkpoint and journal.
     *
     * @return outcome; the stored one when the search already finished
     * @throws IllegalArgumentException if nothing is known about {@code searchId}
     */
    public SearchOutcome resume(String searchId) {
        SearchStore.checkSearchId(searchId);
        SearchHandle running = active.get(searchId);
        if (running != null) return running.future().join();

        Optional<SearchOutcome> archived = store.archivedOutcome(searchId);
        if (archived.isPresent()) return archived.get();

        Optional<SearchOutcome> pending = store.pendingOutcome(searchId);
        if (pending.isPresent()) {
            log.info("resume: search={} finished before archiving, archiving now", searchId);
            archiveQuietly(pending.get());
            return pending.get();
        }

        if (!store.isInFlight(searchId)) throw new IllegalArgumentException("unknown search id: " + searchId);
        SearchState state = loadState(store.checkpoints(searchId));
        log.info("resume: search={} phase={} depth={}", searchId, state.phase, state.currentDepth);
        return drive(searchId, Prepared.of(state));
    }

    /** Searches with a checkpoint that are not archived yet. */
    public List<String> inFlightSearchIds() {
        return store.inFlightIds();
    }

    public static String defaultSearchId(String problem) {
        Objects.requireNonNull(problem, "problem");
        CRC32 crc = new CRC32();
        crc.update(problem.trim().getBytes(StandardCharsets.UTF_8));
        return String.format("tot-%06x", crc.getValue() & 0xFFFFFFL);
    }

    public Config getConfig() { return config; }

    public SearchStore getStore() { return store; }

    public ExecutorService getCallPool() { return callPool; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Aborts running searches first, so nothing they had in flight is journaled, then shuts the
     * pools down. Aborted searches stay in flight and are picked up by {@link #resume}.
     */
    @Override
    public void close() {
        closed = true;
        for (SearchOrchestrator o : running.values()) {
            log.info("close: aborting search={} at phase={}", o.state().searchId, o.state().phase);
            o.abort();
        }
        shutdownExecutor(workerPool, config.shutdownTimeoutMs);
        if (ownsCallPool) {
            shutdownExecutor(callPool, config.shutdownTimeoutMs);
        } else {
            log.debug("TreeOfThoughts.close(): callPool is externally owned; skipping shutdown");
        }
    }

    // ---------------------------------------------------------------------
    // Builder / Config
    // ---------------------------------------------------------------------

    public static Builder builder(SearchStore store, BranchGenerator generator, BranchEvaluator evaluator) {
        return new Builder(store, generator, evaluator);
    }

    public static final class Builder {
        private final SearchStore store;
        private final BranchGenerator generator;
        private final BranchEvaluator evaluator;

        private Config config = new Config();
        private Clock clock = Clock.systemUTC();
        private ExecutorService callPool;

        private Builder(SearchStore store, BranchGenerator generator, BranchEvaluator evaluator) {
            this.store = Objects.requireNonNull(store, "store");
            this.generator = Objects.requireNonNull(generator, "generator");
            this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        }

        public Builder config(Config cfg) {
            this.config = Objects.requireNonNull(cfg, "config");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Внешний пул для попыток вызовов. Если не задан, TreeOfThoughts создаст и закроет сам.
         */
        public Builder callPool(ExecutorService pool) {
            this.callPool = Objects.requireNonNull(pool, "callPool");
            return this;
        }

        public TreeOfThoughts build() {
            return new TreeOfThoughts(this);
        }
    }

    public static final class Config {
        /** Used when a submission carries no config of its own. */
        public SearchConfig search = SearchConfig.defaults();
        public CallPolicy callPolicy = CallPolicy.defaults();

        /** Max concurrent collaborator attempts; 0 = number of processors (min 2). */
        public int parallelism = 0;
        public String threadNamePrefix = "tot-call-";
        public long shutdownTimeoutMs = 2500;

        private boolean frozen = false;

        public Config freezeAndValidate() {
            if (frozen) return this;
            if (search == null) search = SearchConfig.defaults();
            search.validate();
            if (callPolicy == null) callPolicy = CallPolicy.defaults();
            if (parallelism <= 0) parallelism = Math.max(2, Runtime.getRuntime().availableProcessors());
            if (threadNamePrefix == null || threadNamePrefix.isBlank()) threadNamePrefix = "tot-call-";
            shutdownTimeoutMs = Math.max(250, shutdownTimeoutMs);
            frozen = true;
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    /** Either a state to drive or an outcome that is already known. */
    private static final class Prepared {
        final SearchState state;
        final SearchOutcome outcome;

        private Prepared(SearchState state, SearchOutcome outcome) {
            this.state = state;
            this.outcome = outcome;
        }

        static Prepared of(SearchState s) { return new Prepared(s, null); }

        static Prepared done(SearchOutcome o) { return new Prepared(null, o); }
    }

    private Prepared prepare(String searchId, String problem, SearchConfig searchConfig) {
        SearchStore.checkSearchId(searchId);
        if (problem == null || problem.isBlank()) throw new IllegalArgumentException("problem is blank");
        SearchConfig cfg = Objects.requireNonNull(searchConfig, "searchConfig").validate();

        if (store.isArchived(searchId)) {
            SearchState archived = loadState(store.archivedCheckpoints(searchId));
            requireSameProblem(archived, problem);
            log.info("submit: search={} already finished, returning stored outcome", searchId);
            return Prepared.done(store.archivedOutcome(searchId).orElseThrow());
        }

        if (store.isInFlight(searchId)) {
            SearchState s = loadState(store.checkpoints(searchId));
            requireSameProblem(s, problem);
            Optional<SearchOutcome> pending = store.pendingOutcome(searchId);
            if (pending.isPresent()) {
                archiveQuietly(pending.get());
                return Prepared.done(pending.get());
            }
            if (!s.config.equals(cfg)) {
                log.warn("submit: search={} resumes with its original {} (requested {})", searchId, s.config, cfg);
            }
            log.info("submit: search={} in flight, resuming at phase={} depth={}", searchId, s.phase, s.currentDepth);
            return Prepared.of(s);
        }

        SearchState s = SearchState.create(searchId, problem, cfg, clock.millis());
        store.checkpoints(searchId).save(s);
        log.info("submit: search={} created {}", searchId, cfg);
        return Prepared.of(s);
    }

    private SearchOutcome drive(String searchId, Prepared p) {
        if (p.outcome != null) return p.outcome;
        CompletableFuture<SearchOutcome> f = new CompletableFuture<>();
        SearchHandle h = new SearchHandle(searchId, f);
        SearchHandle prev = active.putIfAbsent(searchId, h);
        if (prev != null) return prev.future().join();
        try {
            SearchOutcome out = runAndArchive(p.state);
            f.complete(out);
            return out;
        } catch (RuntimeException | Error e) {
            f.completeExceptionally(e);
            throw e;
        } finally {
            active.remove(searchId, h);
        }
    }

    private SearchOutcome runAndArchive(SearchState state) {
        if (closed) {
            throw new SearchInterruptedException(
                    "TreeOfThoughts is closed; search " + state.searchId + " left in flight");
        }
        CheckpointStore checkpoints = store.checkpoints(state.searchId);
        SearchOutcome out;
        CallJournal journal = null;
        try {
            journal = store.journal(state.searchId);
        } catch (SubstrateException e) {
            log.error("search={} journal cannot be trusted", state.searchId, e);
            out = SearchOutcome.failed(state.searchId, FailureReason.SUBSTRATE_FAULT, e.getMessage());
            markFailed(state, checkpoints, out);
            archiveQuietly(out);
            return out;
        }

        SearchOrchestrator orchestrator = new SearchOrchestrator(
                state, checkpoints, journal, generator, evaluator, calls, workerPool, clock);
        running.put(state.searchId, orchestrator);
        try {
            if (closed) orchestrator.abort();
            out = orchestrator.run();
        } finally {
            running.remove(state.searchId, orchestrator);
        }
        archiveQuietly(out);
        return out;
    }

    private void markFailed(SearchState state, CheckpointStore checkpoints, SearchOutcome out) {
        state.phase = SearchPhase.FAILED;
        state.failureReason = out.reason;
        state.failureMessage = out.message;
        state.updatedAtEpochMs = clock.millis();
        try {
            checkpoints.save(state);
        } catch (SubstrateException e) {
            log.error("search={} failed state not checkpointed", state.searchId, e);
        }
    }

    /** Archive failure leaves the search in flight; resume returns the same outcome. */
    private void archiveQuietly(SearchOutcome out) {
        try {
            store.archive(out);
        } catch (SubstrateException e) {
            log.error("search={} not archived, will be archived on resume", out.searchId, e);
        }
    }

    private static SearchState loadState(CheckpointStore checkpoints) {
        return checkpoints.load().orElseThrow(() ->
                new SubstrateException("checkpoint missing: " + checkpoints.file()));
    }

    private static void requireSameProblem(SearchState s, String problem) {
        if (!s.problem.equals(problem)) {
            throw new IllegalArgumentException("search id " + s.searchId + " is bound to a different problem");
        }
    }

    private static ExecutorService createCallPool(Config cfg) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = Math.max(1, cfg.parallelism);

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, cfg.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        // unbounded queue: a caller-runs fallback would run the attempt outside its time limit
        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                tf
        );
    }

    /** Threads here only wait (fan-out settlement, async searches), so the pool is elastic. */
    private static ExecutorService createWorkerPool(Config cfg) {
        final AtomicLong tid = new AtomicLong(1);
        final String prefix = cfg.threadNamePrefix + "worker-";

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, prefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(0, Integer.MAX_VALUE, 30L, TimeUnit.SECONDS, new SynchronousQueue<>(), tf);
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        if (es == null) return;

        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }

    private void logCreation() {
        if (!log.isInfoEnabled()) return;

        String msg = SearchLogFmt.box("TreeOfThoughts initialized", b -> {
            b.kv("generator", generator.getClass().getName());
            b.kv("evaluator", evaluator.getClass().getName());
            b.sep();
            b.kv("maxDepth", config.search.maxDepth);
            b.kv("branchesPerNode", config.search.branchesPerNode);
            b.kv("beamWidth", config.search.beamWidth);
            b.kv("minScoreThreshold", config.search.minScoreThreshold);
            b.sep();
            b.kv("callPolicy", config.callPolicy);
            b.kv("parallelism", config.parallelism);
            b.kv("threadNamePrefix", config.threadNamePrefix);
            b.kv("callPoolOwnership", ownsCallPool ? "owned" : "external");
            b.sep();
            b.kv("inFlight", store.inFlightIds().size());
        });
        log.info("\n{}", msg);
    }
}
