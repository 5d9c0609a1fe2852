package io.backoff.jitter;

import io.backoff.core.Jitter;

import java.util.Objects;

/**
 * Lets a user function jitter the delay. A null answer counts as a delay of 1.
 */
public class CallbackJitter implements Jitter {

    @FunctionalInterface
    public interface JitterFunction {
        Number apply(double baseDelay, int retryNumber);
    }

    private final JitterFunction callback;

    public CallbackJitter(JitterFunction callback) {
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    @Override
    public double apply(double baseDelay, int retryNumber) {
        Number jittered = callback.apply(baseDelay, retryNumber);
        return jittered == null ? 1 : jittered.doubleValue();
    }
}
