package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

/** Never retries: the first attempt is the only one. */
public class NoBackoffAlgorithm implements BackoffAlgorithm {
    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        return null;
    }

    @Override
    public boolean jitterMayBeApplied() { return false; }
}
