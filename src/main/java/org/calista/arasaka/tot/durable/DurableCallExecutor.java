package org.calista.arasaka.tot.durable;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.tot.search.collaborator.CollaboratorException;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one collaborator call under the {@link CallPolicy}: each attempt is bounded by a
 * TimeLimiter, failed attempts are retried with exponential backoff.
 *
 * <p>The result is a {@link CallOutcome}, success or permanent failure. Attempts run on
 * {@code attemptPool}; the calling thread only waits, so a retrying call never holds a worker
 * while it backs off. A timed-out attempt is cancelled with an interrupt and frees its thread.</p>
 *
 * <p>Interruption is not an outcome: if the waiting thread is interrupted, or the pool refuses
 * the attempt because it is shut down, {@link SearchInterruptedException} is thrown and
 * nothing should be recorded for the call.</p>
 */
public final class DurableCallExecutor {

    private static final Logger log = LogManager.getLogger(DurableCallExecutor.class);

    private final CallPolicy policy;
    private final ExecutorService attemptPool;
    private final RetryConfig retryConfig;
    private final TimeLimiter timeLimiter;

    public DurableCallExecutor(CallPolicy policy, ExecutorService attemptPool) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.attemptPool = Objects.requireNonNull(attemptPool, "attemptPool");

        this.retryConfig = RetryConfig.custom()
                .maxAttempts(policy.maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        policy.initialInterval, policy.backoffMultiplier, policy.maxInterval))
                .retryOnException(DurableCallExecutor::isRetryable)
                .build();

        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(policy.timeout)
                .cancelRunningFuture(true)
                .build());
    }

    public CallPolicy policy() {
        return policy;
    }

    /**
     * @param name  call key, used for the retry instance name and logs
     * @param call  one attempt; throwing means the attempt failed
     * @throws SearchInterruptedException if the call was interrupted before it settled
     */
    public <T> CallOutcome<T> execute(String name, Supplier<T> call) {
        Objects.requireNonNull(call, "call");
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Future<T>> inFlight = new AtomicReference<>();
        Callable<T> task = call::get;

        Callable<T> attempt = () -> {
            int n = attempts.incrementAndGet();
            if (n > 1) log.debug("call retry name={} attempt={}", name, n);
            return timeLimiter.executeFutureSupplier(() -> {
                Future<T> f;
                try {
                    f = attemptPool.submit(task);
                } catch (RejectedExecutionException e) {
                    throw new SearchInterruptedException("call pool is shut down", e);
                }
                inFlight.set(f);
                return f;
            });
        };

        Retry retry = Retry.of(name, retryConfig);
        try {
            T v = Retry.decorateCallable(retry, attempt).call();
            return CallOutcome.success(v, attempts.get());
        } catch (Exception e) {
            Throwable root = unwrap(e);
            if (isInterruption(root) || Thread.currentThread().isInterrupted()) {
                Future<T> f = inFlight.get();
                if (f != null) f.cancel(true);
                if (root instanceof InterruptedException) Thread.currentThread().interrupt();
                log.debug("call interrupted name={} attempts={}", name, attempts.get());
                if (root instanceof SearchInterruptedException sie) throw sie;
                throw new SearchInterruptedException("call " + name + " interrupted", root);
            }
            String msg = describe(root);
            log.warn("call failed permanently name={} attempts={} error={}", name, attempts.get(), msg);
            return CallOutcome.failure(msg, attempts.get());
        }
    }

    static boolean isRetryable(Throwable t) {
        Throwable root = unwrap(t);
        if (isInterruption(root)) return false;
        if (root instanceof CollaboratorException ce) return ce.isRetryable();
        return true;
    }

    /** Attempt abandoned rather than failed: the caller was interrupted or the pool is closing. */
    static boolean isInterruption(Throwable t) {
        return t instanceof InterruptedException || t instanceof SearchInterruptedException;
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof ExecutionException || cur instanceof CompletionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static String describe(Throwable t) {
        if (t instanceof TimeoutException) return "timeout";
        String m = t.getMessage();
        return t.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
    }
}
