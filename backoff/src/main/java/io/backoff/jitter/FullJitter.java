package io.backoff.jitter;

import java.util.random.RandomGenerator;

/** Anywhere between 0 and the base delay. */
public class FullJitter extends RangeJitter {
    public FullJitter() { this(null); }
    public FullJitter(RandomGenerator random) { super(0, 1, random); }
}
