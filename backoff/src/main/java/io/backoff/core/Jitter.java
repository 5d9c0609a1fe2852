package io.backoff.core;

/**
 * Randomizes a base delay. Only called with delays greater than 0.
 */
@FunctionalInterface
public interface Jitter {
    double apply(double baseDelay, int retryNumber);
}
