package io.backoff.runtime;

import io.backoff.core.DelayUnit;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one attempt. Times and delays are in {@link #unit()}.
 * An open entry (created by startOfAttempt) has no working time yet; closing it produces a new instance.
 */
public final class AttemptLog {
    private final int attemptNumber;
    private final Integer maxAttempts;
    private final Instant firstAttemptOccurredAt;
    private final Instant thisAttemptOccurredAt;
    private final Double workingTime;
    private final Double overallWorkingTime;
    private final Double prevDelay;
    private final Double nextDelay;
    private final Double overallDelay;
    private final DelayUnit unit;
    private final AttemptOutcome outcome;

    public AttemptLog(int attemptNumber,
                      Integer maxAttempts,
                      Instant firstAttemptOccurredAt,
                      Instant thisAttemptOccurredAt,
                      Double workingTime,
                      Double overallWorkingTime,
                      Double prevDelay,
                      Double nextDelay,
                      Double overallDelay,
                      DelayUnit unit,
                      AttemptOutcome outcome) {
        this.attemptNumber = attemptNumber;
        this.maxAttempts = maxAttempts;
        this.firstAttemptOccurredAt = Objects.requireNonNull(firstAttemptOccurredAt);
        this.thisAttemptOccurredAt = Objects.requireNonNull(thisAttemptOccurredAt);
        this.workingTime = workingTime;
        this.overallWorkingTime = overallWorkingTime;
        this.prevDelay = prevDelay;
        this.nextDelay = nextDelay;
        this.overallDelay = overallDelay;
        this.unit = Objects.requireNonNull(unit);
        this.outcome = Objects.requireNonNull(outcome);
    }

    /** A copy of this entry with the attempt's timings and outcome filled in. */
    public AttemptLog closed(double workingTime, double overallWorkingTime, AttemptOutcome outcome) {
        return new AttemptLog(attemptNumber, maxAttempts, firstAttemptOccurredAt, thisAttemptOccurredAt,
                workingTime, overallWorkingTime, prevDelay, nextDelay, overallDelay, unit, outcome);
    }

    public boolean isOpen() { return workingTime == null; }

    /** 1 for the first attempt. */
    public int attemptNumber() { return attemptNumber; }
    /** 0 for the first attempt, 1 for the first retry. */
    public int retryNumber() { return attemptNumber - 1; }
    public Integer maxAttempts() { return maxAttempts; }
    public boolean willRetry() { return nextDelay != null; }
    public Instant firstAttemptOccurredAt() { return firstAttemptOccurredAt; }
    public Instant thisAttemptOccurredAt() { return thisAttemptOccurredAt; }
    public DelayUnit unit() { return unit; }
    public AttemptOutcome outcome() { return outcome; }

    public Double workingTime() { return workingTime; }
    public Double workingTimeInSeconds() { return unit.convert(workingTime, DelayUnit.SECONDS); }
    public Double workingTimeInMs() { return unit.convert(workingTime, DelayUnit.MILLISECONDS); }
    public Double workingTimeInUs() { return unit.convert(workingTime, DelayUnit.MICROSECONDS); }

    public Double overallWorkingTime() { return overallWorkingTime; }
    public Double overallWorkingTimeInSeconds() { return unit.convert(overallWorkingTime, DelayUnit.SECONDS); }
    public Double overallWorkingTimeInMs() { return unit.convert(overallWorkingTime, DelayUnit.MILLISECONDS); }
    public Double overallWorkingTimeInUs() { return unit.convert(overallWorkingTime, DelayUnit.MICROSECONDS); }

    /** The delay that was applied before this attempt, null for the first attempt. */
    public Double prevDelay() { return prevDelay; }
    public Double prevDelayInSeconds() { return unit.convert(prevDelay, DelayUnit.SECONDS); }
    public Double prevDelayInMs() { return unit.convert(prevDelay, DelayUnit.MILLISECONDS); }
    public Double prevDelayInUs() { return unit.convert(prevDelay, DelayUnit.MICROSECONDS); }

    /** The delay that will be applied if this attempt fails, null when no retry follows. */
    public Double nextDelay() { return nextDelay; }
    public Double nextDelayInSeconds() { return unit.convert(nextDelay, DelayUnit.SECONDS); }
    public Double nextDelayInMs() { return unit.convert(nextDelay, DelayUnit.MILLISECONDS); }
    public Double nextDelayInUs() { return unit.convert(nextDelay, DelayUnit.MICROSECONDS); }

    /** Sum of the delays applied so far, null before any delay. */
    public Double overallDelay() { return overallDelay; }
    public Double overallDelayInSeconds() { return unit.convert(overallDelay, DelayUnit.SECONDS); }
    public Double overallDelayInMs() { return unit.convert(overallDelay, DelayUnit.MILLISECONDS); }
    public Double overallDelayInUs() { return unit.convert(overallDelay, DelayUnit.MICROSECONDS); }

    @Override
    public String toString() {
        return "AttemptLog{" +
                "attemptNumber=" + attemptNumber +
                ", maxAttempts=" + maxAttempts +
                ", prevDelay=" + prevDelay +
                ", nextDelay=" + nextDelay +
                ", workingTime=" + workingTime +
                ", unit=" + unit +
                ", outcome=" + outcome.kind() +
                '}';
    }
}
