package io.backoff.core;

/**
 * A backoff algorithm maps a retry number to the base delay to wait before that retry.
 * Implementations should be stateless apart from their construction-time parameters, so that
 * calculating the same retry twice is safe.
 */
public interface BackoffAlgorithm {
    /**
     * Calculate the delay before a retry.
     *
     * @param retryNumber starts at 1 for the first retry and increases by one per retry
     * @param previousBaseDelay the delay used before the previous retry, null before the first one
     * @return the delay in the configured unit, or null to signal that no more retries should happen
     */
    Double nextBaseDelay(int retryNumber, Double previousBaseDelay);

    /** Whether jitter may be layered on top of this algorithm's delays. */
    default boolean jitterMayBeApplied() { return true; }
}
