package org.calista.arasaka.tot.durable;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry/timeout budget applied to every collaborator call.
 * Exponential backoff: initialInterval * multiplier^(attempt-1), capped at maxInterval.
 */
public final class CallPolicy {

    public final int maxAttempts;
    public final Duration initialInterval;
    public final double backoffMultiplier;
    public final Duration maxInterval;
    public final Duration timeout;

    public CallPolicy(int maxAttempts, Duration initialInterval, double backoffMultiplier,
                      Duration maxInterval, Duration timeout) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1: " + backoffMultiplier);
        this.maxAttempts = maxAttempts;
        this.initialInterval = positive(initialInterval, "initialInterval");
        this.backoffMultiplier = backoffMultiplier;
        this.maxInterval = positive(maxInterval, "maxInterval");
        this.timeout = positive(timeout, "timeout");
        if (maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval < initialInterval");
        }
    }

    public static CallPolicy defaults() {
        return new CallPolicy(4, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30), Duration.ofMinutes(2));
    }

    private static Duration positive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0: " + d);
        return d;
    }

    @Override
    public String toString() {
        return "CallPolicy{attempts=" + maxAttempts
                + ", backoff=" + initialInterval.toMillis() + "ms*" + backoffMultiplier
                + "<=" + maxInterval.toMillis() + "ms"
                + ", timeout=" + timeout.toMillis() + "ms}";
    }
}
