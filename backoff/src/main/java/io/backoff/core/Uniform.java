package io.backoff.core;

import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/** Uniform draws used by the randomized algorithms and jitters. */
public final class Uniform {
    private Uniform() {}

    /**
     * Draw uniformly from [min, max]. A null generator means the process-level one.
     * Returns min when the range is empty.
     */
    public static double between(RandomGenerator random, double min, double max) {
        if (!(max > min)) return min;
        RandomGenerator r = random == null ? ThreadLocalRandom.current() : random;
        return min + (max - min) * r.nextDouble();
    }
}
