package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

/** Delays growing by a constant increment: first, first + increment, first + 2 * increment... */
public class LinearBackoffAlgorithm implements BackoffAlgorithm {
    private final double initialDelay;
    private final double delayIncrease;

    public LinearBackoffAlgorithm(double initialDelay) {
        this(initialDelay, initialDelay);
    }

    public LinearBackoffAlgorithm(double initialDelay, double delayIncrease) {
        this.initialDelay = initialDelay;
        this.delayIncrease = delayIncrease;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        return initialDelay + (retryNumber - 1) * delayIncrease;
    }
}
