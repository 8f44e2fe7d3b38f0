package org.calista.arasaka.tot.search.collaborator;

/**
 * Failure raised by a collaborator. {@code retryable=false} skips the remaining attempts.
 */
public class CollaboratorException extends RuntimeException {

    private final boolean retryable;

    public CollaboratorException(String message) {
        this(message, true, null);
    }

    public CollaboratorException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    public CollaboratorException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
