package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;
import io.backoff.error.BackoffRuntimeException;

import java.util.Objects;

/**
 * Delegates the delay calculation to a user function. The function returns a {@link Number},
 * or null to stop retrying.
 */
public class CallbackBackoffAlgorithm implements BackoffAlgorithm {

    @FunctionalInterface
    public interface DelayFunction {
        Object delay(int retryNumber, Double previousBaseDelay);
    }

    private final DelayFunction callback;

    public CallbackBackoffAlgorithm(DelayFunction callback) {
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        Object delay = callback.delay(retryNumber, previousBaseDelay);
        if (delay == null) return null;
        if (delay instanceof Number n) return n.doubleValue();
        throw BackoffRuntimeException.callbackAlgorithmGaveInvalidValue(delay);
    }
}
