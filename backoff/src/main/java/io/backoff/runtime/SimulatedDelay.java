package io.backoff.runtime;

import io.backoff.core.DelayUnit;

/**
 * The base and jittered delay a backoff produces before one retry.
 */
public record SimulatedDelay(int retryNumber, Double baseDelay, Double jitteredDelay, DelayUnit unit) {
    public Double baseDelayInSeconds() { return unit.convert(baseDelay, DelayUnit.SECONDS); }
    public Double baseDelayInMs() { return unit.convert(baseDelay, DelayUnit.MILLISECONDS); }
    public Double baseDelayInUs() { return unit.convert(baseDelay, DelayUnit.MICROSECONDS); }

    public Double jitteredDelayInSeconds() { return unit.convert(jitteredDelay, DelayUnit.SECONDS); }
    public Double jitteredDelayInMs() { return unit.convert(jitteredDelay, DelayUnit.MILLISECONDS); }
    public Double jitteredDelayInUs() { return unit.convert(jitteredDelay, DelayUnit.MICROSECONDS); }

    public boolean stops() { return baseDelay == null; }
}
