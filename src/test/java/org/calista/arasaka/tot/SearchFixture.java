package org.calista.arasaka.tot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.durable.CallJournal;
import org.calista.arasaka.tot.durable.CallPolicy;
import org.calista.arasaka.tot.durable.CheckpointStore;
import org.calista.arasaka.tot.durable.DurableCallExecutor;
import org.calista.arasaka.tot.durable.SearchStore;
import org.calista.arasaka.tot.model.SearchConfig;
import org.calista.arasaka.tot.model.SearchState;
import org.calista.arasaka.tot.search.collaborator.BranchEvaluator;
import org.calista.arasaka.tot.search.collaborator.BranchGenerator;
import org.calista.arasaka.tot.search.engine.SearchOrchestrator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Durable store + pools in a temp directory, fast retry policy.
 */
public final class SearchFixture implements AutoCloseable {

    public static final CallPolicy FAST_POLICY =
            new CallPolicy(2, Duration.ofMillis(1), 2.0, Duration.ofMillis(4), Duration.ofSeconds(5));

    public final ObjectMapper mapper = new ObjectMapper();
    public final FileIO io;
    public final SearchStore store;
    public final ExecutorService callPool = Executors.newCachedThreadPool();
    public final ExecutorService fanOutPool = Executors.newCachedThreadPool();
    public final DurableCallExecutor calls;

    public SearchFixture(Path dir) {
        this(dir, FAST_POLICY);
    }

    public SearchFixture(Path dir, CallPolicy policy) {
        this.io = new FileIO(dir);
        this.store = new SearchStore(io, mapper, "searches", "archive");
        this.calls = new DurableCallExecutor(policy, callPool);
    }

    public SearchState newSearch(String id, String problem, SearchConfig config) {
        SearchState s = SearchState.create(id, problem, config, 0L);
        store.checkpoints(id).save(s);
        return s;
    }

    public SearchOrchestrator orchestrator(SearchState state, BranchGenerator generator, BranchEvaluator evaluator) {
        CheckpointStore cp = store.checkpoints(state.searchId);
        CallJournal journal = store.journal(state.searchId);
        return new SearchOrchestrator(state, cp, journal, generator, evaluator, calls, fanOutPool, null);
    }

    /** Deep copy through the checkpoint format. */
    public SearchState copy(SearchState s) throws Exception {
        return mapper.readValue(mapper.writeValueAsString(s), SearchState.class);
    }

    @Override
    public void close() throws InterruptedException {
        fanOutPool.shutdownNow();
        callPool.shutdownNow();
        fanOutPool.awaitTermination(2, TimeUnit.SECONDS);
        callPool.awaitTermination(2, TimeUnit.SECONDS);
    }
}
