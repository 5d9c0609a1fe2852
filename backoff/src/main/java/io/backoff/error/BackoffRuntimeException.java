package io.backoff.error;

/**
 * Protocol violations detected while a backoff is being used.
 */
public class BackoffRuntimeException extends BackoffException {
    public BackoffRuntimeException(String message) {
        super(message);
    }

    public static BackoffRuntimeException callbackAlgorithmGaveInvalidValue(Object value) {
        return new BackoffRuntimeException("The CallbackBackoffAlgorithm callback gave an invalid return value: " + value);
    }

    public static BackoffRuntimeException attemptToChangeAfterStart(String method) {
        return new BackoffRuntimeException("Backoff strategies cannot be reconfigured after starting - attempted to call \"" + method + "\"");
    }

    public static BackoffRuntimeException startOfAttemptNotAllowed() {
        return new BackoffRuntimeException("Method startOfAttempt() cannot be called after the Backoff has stopped");
    }

    public static BackoffRuntimeException attemptLogHasNotStarted() {
        return new BackoffRuntimeException("Method endOfAttempt() was called without startOfAttempt() being called first");
    }
}
