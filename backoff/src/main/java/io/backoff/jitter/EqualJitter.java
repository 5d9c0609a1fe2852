package io.backoff.jitter;

import java.util.random.RandomGenerator;

/** Between half the base delay and the full base delay. */
public class EqualJitter extends RangeJitter {
    public EqualJitter() { this(null); }
    public EqualJitter(RandomGenerator random) { super(0.5, 1, random); }
}
