package io.backoff.runtime;

import java.util.List;

/**
 * What a backoff would have waited for while stepping through its loop, recorded instead of slept.
 */
public record DelaySequence(
        List<Double> delays,
        List<Double> delaysInSeconds,
        List<Double> delaysInMs,
        List<Double> delaysInUs,
        int sleepCallCount,
        int actualTimesSlept
) {
}
