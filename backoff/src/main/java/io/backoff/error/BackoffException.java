package io.backoff.error;

/**
 * Base type for errors raised by the backoff engine itself (as opposed to the guarded operation).
 * These indicate programmer error and are never retried.
 */
public class BackoffException extends RuntimeException {
    public BackoffException(String message) {
        super(message);
    }
}
