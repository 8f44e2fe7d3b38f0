package org.calista.arasaka.tot.durable;

/**
 * Settled result of one call after its retry budget: a value or a permanent failure.
 */
public final class CallOutcome<T> {

    public final boolean ok;
    public final T value;
    public final String error;
    public final int attempts;

    private CallOutcome(boolean ok, T value, String error, int attempts) {
        this.ok = ok;
        this.value = value;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> CallOutcome<T> success(T value, int attempts) {
        return new CallOutcome<>(true, value, null, attempts);
    }

    public static <T> CallOutcome<T> failure(String error, int attempts) {
        return new CallOutcome<>(false, null, error == null ? "unknown error" : error, attempts);
    }

    @Override
    public String toString() {
        return ok ? "ok(attempts=" + attempts + ")" : "failed(" + error + ", attempts=" + attempts + ")";
    }
}
