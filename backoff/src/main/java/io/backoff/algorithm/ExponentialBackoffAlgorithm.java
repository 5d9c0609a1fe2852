package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

/** Delays multiplied by a constant factor each retry. */
public class ExponentialBackoffAlgorithm implements BackoffAlgorithm {
    public static final double DEFAULT_FACTOR = 2.0;

    private final double initialDelay;
    private final double factor;

    public ExponentialBackoffAlgorithm(double initialDelay) {
        this(initialDelay, DEFAULT_FACTOR);
    }

    public ExponentialBackoffAlgorithm(double initialDelay, double factor) {
        this.initialDelay = initialDelay;
        this.factor = factor;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        return initialDelay * Math.pow(factor, retryNumber - 1);
    }
}
