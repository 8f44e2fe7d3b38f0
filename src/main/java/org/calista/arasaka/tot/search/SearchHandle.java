package org.calista.arasaka.tot.search;

import org.calista.arasaka.tot.model.SearchOutcome;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle of a search started with {@link TreeOfThoughts#start}.
 * Observes either the final outcome or nothing; never a partial result.
 */
public final class SearchHandle {

    private final String searchId;
    private final CompletableFuture<SearchOutcome> future;

    SearchHandle(String searchId, CompletableFuture<SearchOutcome> future) {
        this.searchId = Objects.requireNonNull(searchId, "searchId");
        this.future = Objects.requireNonNull(future, "future");
    }

    public String searchId() {
        return searchId;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /** Outcome if the search finished, empty otherwise. */
    public Optional<SearchOutcome> poll() {
        if (!future.isDone() || future.isCompletedExceptionally()) return Optional.empty();
        return Optional.ofNullable(future.getNow(null));
    }

    /**
     * Blocks until the search finishes.
     *
     * @throws IllegalStateException if the search driver died (interrupted, pool shut down)
     */
    public SearchOutcome await() throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException | CancellationException e) {
            throw aborted(e);
        }
    }

    /**
     * @return outcome, or empty if the search is still running after {@code timeout}
     */
    public Optional<SearchOutcome> await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException | CancellationException e) {
            throw aborted(e);
        }
    }

    CompletableFuture<SearchOutcome> future() {
        return future;
    }

    private IllegalStateException aborted(Exception e) {
        Throwable cause = e;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return new IllegalStateException("search " + searchId + " aborted before an outcome: " + cause, cause);
    }
}
