package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

/** Retries straight away, forever. Something else (max attempts, a result match) has to end the loop. */
public class NoopBackoffAlgorithm implements BackoffAlgorithm {
    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        return 0.0;
    }
}
