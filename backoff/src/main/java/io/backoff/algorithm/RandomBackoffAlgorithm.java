package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;
import io.backoff.core.Uniform;
import io.backoff.error.BackoffInitialisationException;

import java.util.random.RandomGenerator;

/** A uniformly random delay between min and max for every retry. Never jittered. */
public class RandomBackoffAlgorithm implements BackoffAlgorithm {
    private final double minDelay;
    private final double maxDelay;
    private final RandomGenerator random;

    public RandomBackoffAlgorithm(double minDelay, double maxDelay) {
        this(minDelay, maxDelay, null);
    }

    /**
     * @param random source of randomness, null for the process-level generator
     * @throws BackoffInitialisationException when minDelay is greater than maxDelay
     */
    public RandomBackoffAlgorithm(double minDelay, double maxDelay, RandomGenerator random) {
        if (minDelay > maxDelay) throw BackoffInitialisationException.minGreaterThanMax(minDelay, maxDelay);
        this.minDelay = Math.max(0, minDelay);
        this.maxDelay = Math.max(0, maxDelay);
        this.random = random;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        return Uniform.between(random, minDelay, maxDelay);
    }

    @Override
    public boolean jitterMayBeApplied() { return false; }
}
