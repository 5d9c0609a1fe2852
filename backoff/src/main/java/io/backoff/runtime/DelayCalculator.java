package io.backoff.runtime;

import io.backoff.core.BackoffAlgorithm;
import io.backoff.core.DelayUnit;
import io.backoff.core.Jitter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Combines an algorithm, an optional jitter and the bounds into per-retry delays.
 * <p>
 * Indices are retry numbers: 0 is the initial attempt (nothing precedes it, so its delay is always null),
 * n is the delay applied before attempt n + 1. Every delay is calculated once and cached, so the same
 * retry always reports the same value until {@link #reset()} is called.
 */
public class DelayCalculator {
    private final BackoffAlgorithm algorithm;
    private final Jitter jitter;
    private final Integer maxAttempts;
    private final Double maxDelay;
    private final DelayUnit unit;
    private final boolean immediateFirstRetry;
    private final boolean delaysEnabled;

    private Map<Integer, Double> baseDelays = new HashMap<>();
    private Map<Integer, Double> jitteredDelays = new HashMap<>();

    /**
     * @param unitToken one of seconds, milliseconds, microseconds
     * @throws io.backoff.error.BackoffInitialisationException when the unit is not recognised
     */
    public DelayCalculator(BackoffAlgorithm algorithm,
                           Jitter jitter,
                           Integer maxAttempts,
                           Double maxDelay,
                           String unitToken,
                           boolean immediateFirstRetry,
                           boolean delaysEnabled) {
        this(algorithm, jitter, maxAttempts, maxDelay, DelayUnit.fromToken(unitToken), immediateFirstRetry, delaysEnabled);
    }

    /**
     * @param jitter null for no jitter
     * @param maxAttempts total attempts allowed including the first one, null for no limit
     * @param maxDelay upper bound for base delays, null for no bound
     */
    public DelayCalculator(BackoffAlgorithm algorithm,
                           Jitter jitter,
                           Integer maxAttempts,
                           Double maxDelay,
                           DelayUnit unit,
                           boolean immediateFirstRetry,
                           boolean delaysEnabled) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.jitter = jitter;
        this.maxAttempts = maxAttempts;
        this.maxDelay = maxDelay;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.immediateFirstRetry = immediateFirstRetry;
        this.delaysEnabled = delaysEnabled;
    }

    /** Forget every calculated delay so that a fresh sequence is drawn. */
    public DelayCalculator reset() {
        baseDelays = new HashMap<>();
        jitteredDelays = new HashMap<>();
        return this;
    }

    /**
     * The bounded delay before the given retry, without jitter.
     *
     * @return null when no retry should happen
     */
    public Double getBaseDelay(int retryNumber) {
        if (retryNumber <= 0) return null;
        if (baseDelays.containsKey(retryNumber)) return baseDelays.get(retryNumber);

        // fill in order, the algorithm may depend on the previous delay
        for (int retry = 1; retry <= retryNumber; retry++) {
            if (!baseDelays.containsKey(retry)) {
                baseDelays.put(retry, calculateBaseDelay(retry));
            }
            if (baseDelays.get(retry) == null) return null;
        }
        return baseDelays.get(retryNumber);
    }

    /**
     * The base delay with jitter applied, the value that is actually waited for.
     *
     * @return null when no retry should happen
     */
    public Double getJitteredDelay(int retryNumber) {
        if (jitteredDelays.containsKey(retryNumber)) return jitteredDelays.get(retryNumber);

        Double jittered = applyJitter(getBaseDelay(retryNumber), retryNumber);
        jitteredDelays.put(retryNumber, jittered);
        return jittered;
    }

    public boolean shouldStop(int retryNumber) {
        if (retryNumber <= 0) return false;
        return getBaseDelay(retryNumber) == null;
    }

    private Double calculateBaseDelay(int retry) {
        if (maxAttempts != null && retry >= maxAttempts) return null;

        Double previous = retry > 1 ? baseDelays.get(retry - 1) : null;
        Double delay;
        if (immediateFirstRetry) {
            if (retry == 1) {
                delay = 0.0;
            } else {
                // the inserted 0 is not part of the algorithm's own chain
                delay = algorithm.nextBaseDelay(retry - 1, retry == 2 ? null : previous);
            }
        } else {
            delay = algorithm.nextBaseDelay(retry, previous);
        }

        if (delay == null) return null;
        if (!delaysEnabled) return 0.0;
        return enforceBounds(delay);
    }

    private Double applyJitter(Double delay, int retry) {
        if (delay == null) return null;
        if (jitter == null || !algorithm.jitterMayBeApplied() || delay <= 0) return delay;
        double jittered = jitter.apply(delay, retry);
        return Double.isNaN(jittered) ? 0.0 : Math.max(0, jittered);
    }

    private double enforceBounds(double delay) {
        if (Double.isNaN(delay)) return 0;
        if (maxDelay != null) delay = Math.min(delay, maxDelay);
        return Math.max(0, delay);
    }

    public BackoffAlgorithm algorithm() { return algorithm; }
    public Jitter jitter() { return jitter; }
    public Integer maxAttempts() { return maxAttempts; }
    public Double maxDelay() { return maxDelay; }
    public DelayUnit unit() { return unit; }
    public boolean immediateFirstRetry() { return immediateFirstRetry; }
    public boolean delaysEnabled() { return delaysEnabled; }
}
