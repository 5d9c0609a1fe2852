package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

/** The same delay before every retry. */
public class FixedBackoffAlgorithm implements BackoffAlgorithm {
    private final double delay;

    public FixedBackoffAlgorithm(double delay) {
        this.delay = delay;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        return delay;
    }
}
