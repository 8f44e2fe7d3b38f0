package org.calista.arasaka.tot.durable;

/**
 * A fan-out was abandoned before every call settled: the driving thread was interrupted, a call
 * was interrupted mid-flight, or the search was aborted on shutdown. Nothing unsettled is journaled;
 * the search is left at its last checkpoint and can be resumed. It is not a failure.
 */
public class SearchInterruptedException extends RuntimeException {

    public SearchInterruptedException(String message) {
        super(message);
    }

    public SearchInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
