package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;
import io.backoff.core.Uniform;

import java.util.random.RandomGenerator;

/**
 * Decorrelated backoff: each delay is drawn between the base delay and the previous delay times the multiplier.
 * Already randomized, so jitter is never layered on top.
 */
public class DecorrelatedBackoffAlgorithm implements BackoffAlgorithm {
    public static final double DEFAULT_MULTIPLIER = 3.0;

    private final double baseDelay;
    private final double multiplier;
    private final RandomGenerator random;

    public DecorrelatedBackoffAlgorithm(double baseDelay) {
        this(baseDelay, DEFAULT_MULTIPLIER, null);
    }

    public DecorrelatedBackoffAlgorithm(double baseDelay, double multiplier) {
        this(baseDelay, multiplier, null);
    }

    /** @param random source of randomness, null for the process-level generator */
    public DecorrelatedBackoffAlgorithm(double baseDelay, double multiplier, RandomGenerator random) {
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.random = random;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        double max = (previousBaseDelay != null ? previousBaseDelay : baseDelay) * multiplier;
        return Uniform.between(random, baseDelay, Math.max(baseDelay, max));
    }

    @Override
    public boolean jitterMayBeApplied() { return false; }
}
