package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

/**
 * Fibonacci sequence scaled so the first term is the initial delay.
 * With includeFirst the sequence starts [d, d, 2d, 3d, 5d...], without it [d, 2d, 3d, 5d...].
 */
public class FibonacciBackoffAlgorithm implements BackoffAlgorithm {
    private final double initialDelay;
    private final boolean includeFirst;

    public FibonacciBackoffAlgorithm(double initialDelay) {
        this(initialDelay, true);
    }

    public FibonacciBackoffAlgorithm(double initialDelay, boolean includeFirst) {
        this.initialDelay = initialDelay;
        this.includeFirst = includeFirst;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        double delay = 0;
        double next = initialDelay;
        int steps = includeFirst ? retryNumber : retryNumber + 1;
        for (int i = 0; i < steps; i++) {
            double sum = next + delay;
            delay = next;
            next = sum;
        }
        return delay;
    }
}
