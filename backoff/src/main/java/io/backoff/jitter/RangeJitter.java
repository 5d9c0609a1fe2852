package io.backoff.jitter;

import io.backoff.core.Jitter;
import io.backoff.core.Uniform;
import io.backoff.error.BackoffInitialisationException;

import java.util.random.RandomGenerator;

/**
 * Picks a delay uniformly between baseDelay * min and baseDelay * max.
 * Factors above 1 are allowed, so a jittered delay may exceed the base delay.
 */
public class RangeJitter implements Jitter {
    private final double min;
    private final double max;
    private final RandomGenerator random;

    public RangeJitter(double min, double max) {
        this(min, max, null);
    }

    /**
     * @param min lower bound as a factor of the base delay, e.g. 0.75
     * @param max upper bound as a factor of the base delay, e.g. 1.25
     * @param random source of randomness, null for the process-level generator
     * @throws BackoffInitialisationException when min is greater than max
     */
    public RangeJitter(double min, double max, RandomGenerator random) {
        if (min > max) throw BackoffInitialisationException.minGreaterThanMax(min, max);
        this.min = Math.max(0, min);
        this.max = Math.max(0, max);
        this.random = random;
    }

    @Override
    public double apply(double baseDelay, int retryNumber) {
        return Uniform.between(random, min * baseDelay, max * baseDelay);
    }

    public double min() { return min; }
    public double max() { return max; }
}
