package org.calista.arasaka.tot.durable;

/**
 * The durable layer cannot guarantee checkpoint/journal integrity. Fatal for the search.
 */
public class SubstrateException extends RuntimeException {

    public SubstrateException(String message) {
        super(message);
    }

    public SubstrateException(String message, Throwable cause) {
        super(message, cause);
    }
}
