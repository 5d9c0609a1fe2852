package io.backoff.runtime;

import com.codahale.metrics.MetricRegistry;
import io.backoff.algorithm.CallbackBackoffAlgorithm;
import io.backoff.algorithm.DecorrelatedBackoffAlgorithm;
import io.backoff.algorithm.ExponentialBackoffAlgorithm;
import io.backoff.algorithm.FibonacciBackoffAlgorithm;
import io.backoff.algorithm.FixedBackoffAlgorithm;
import io.backoff.algorithm.LinearBackoffAlgorithm;
import io.backoff.algorithm.NoBackoffAlgorithm;
import io.backoff.algorithm.NoopBackoffAlgorithm;
import io.backoff.algorithm.PolynomialBackoffAlgorithm;
import io.backoff.algorithm.RandomBackoffAlgorithm;
import io.backoff.algorithm.SequenceBackoffAlgorithm;
import io.backoff.callback.BackoffCallback;
import io.backoff.callback.CallbackArgument;
import io.backoff.callback.CallbackDispatcher;
import io.backoff.callback.Callbacks;
import io.backoff.core.BackoffAlgorithm;
import io.backoff.core.DelayUnit;
import io.backoff.core.Jitter;
import io.backoff.core.Sleeper;
import io.backoff.error.BackoffException;
import io.backoff.error.BackoffRuntimeException;
import io.backoff.jitter.CallbackJitter;
import io.backoff.jitter.EqualJitter;
import io.backoff.jitter.FullJitter;
import io.backoff.jitter.RangeJitter;
import io.backoff.metrics.BackoffMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A backoff strategy and the loop that applies it.
 * <p>
 * Used directly as a loop driver:
 * <pre>{@code
 * Backoff backoff = Backoff.exponential(100).unitMs().maxAttempts(5).fullJitter();
 * do {
 *     if (tryIt()) break;
 * } while (backoff.step());
 * }</pre>
 * or as a runner, where the operation, result checks and callbacks are handled for you:
 * <pre>{@code
 * String body = Backoff.exponential(1).maxAttempts(5)
 *         .retryExceptions(IOException.class)
 *         .attempt(() -> client.fetch(), "fallback");
 * }</pre>
 * The configuration is fixed once the first step is taken. Delays are handed to a {@link Sleeper}, the
 * engine never blocks by itself. Not thread-safe: one thread drives a backoff at a time.
 */
public class Backoff {
    private static final Logger log = LoggerFactory.getLogger(Backoff.class);

    // strategy settings
    private BackoffAlgorithm algorithm;
    private Jitter jitter;
    private Integer maxAttempts;
    private Double maxDelay;
    private DelayUnit unit = DelayUnit.SECONDS;
    private boolean runsAtStartOfLoop = false;
    private boolean immediateFirstRetry = false;
    private boolean delaysEnabled = true;
    private boolean retriesEnabled = true;
    private Sleeper sleeper = Sleeper.blocking();
    private Clock clock = Clock.systemUTC();
    private BackoffMetrics metrics = new BackoffMetrics(new MetricRegistry());

    // runner settings
    private final List<RetryMatch> retryExceptions = new ArrayList<>();
    private boolean exceptionsRetried = true;
    private DefaultValue exceptionDefault;
    private final List<RetryMatch> retryWhenResult = new ArrayList<>();
    private final List<RetryMatch> retryUntilResult = new ArrayList<>();
    private final List<BackoffCallback> exceptionCallbacks = new ArrayList<>();
    private final List<BackoffCallback> invalidResultCallbacks = new ArrayList<>();
    private final List<BackoffCallback> successCallbacks = new ArrayList<>();
    private final List<BackoffCallback> failureCallbacks = new ArrayList<>();
    private final List<BackoffCallback> finallyCallbacks = new ArrayList<>();

    // working state
    private boolean started;
    private boolean stopped;
    private Integer attemptNumber;
    private DelayCalculator delayCalculator;
    private Instant firstAttemptOccurredAt;
    private Double overallDelay;
    private final Map<Integer, AttemptLog> attemptLogs = new LinkedHashMap<>();

    // recording instead of sleeping, see generateTestSequence()
    private boolean recordForTest;
    private List<Double> recordedDelays = new ArrayList<>();
    private int sleepCallCount;
    private int actualTimesSlept;

    public enum State { UNSTARTED, RUNNING, STOPPED }

    public Backoff(BackoffAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        reset();
    }

    public static Backoff of(BackoffAlgorithm algorithm) { return new Backoff(algorithm); }

    public static Backoff fixed(double delay) { return new Backoff(new FixedBackoffAlgorithm(delay)); }
    public static Backoff linear(double initialDelay) { return new Backoff(new LinearBackoffAlgorithm(initialDelay)); }
    public static Backoff linear(double initialDelay, double delayIncrease) { return new Backoff(new LinearBackoffAlgorithm(initialDelay, delayIncrease)); }
    public static Backoff exponential(double initialDelay) { return new Backoff(new ExponentialBackoffAlgorithm(initialDelay)); }
    public static Backoff exponential(double initialDelay, double factor) { return new Backoff(new ExponentialBackoffAlgorithm(initialDelay, factor)); }
    public static Backoff polynomial(double initialDelay) { return new Backoff(new PolynomialBackoffAlgorithm(initialDelay)); }
    public static Backoff polynomial(double initialDelay, double power) { return new Backoff(new PolynomialBackoffAlgorithm(initialDelay, power)); }
    public static Backoff fibonacci(double initialDelay) { return new Backoff(new FibonacciBackoffAlgorithm(initialDelay)); }
    public static Backoff fibonacci(double initialDelay, boolean includeFirst) { return new Backoff(new FibonacciBackoffAlgorithm(initialDelay, includeFirst)); }
    public static Backoff decorrelated(double baseDelay) { return new Backoff(new DecorrelatedBackoffAlgorithm(baseDelay)); }
    public static Backoff decorrelated(double baseDelay, double multiplier) { return new Backoff(new DecorrelatedBackoffAlgorithm(baseDelay, multiplier)); }
    public static Backoff random(double minDelay, double maxDelay) { return new Backoff(new RandomBackoffAlgorithm(minDelay, maxDelay)); }
    public static Backoff sequence(List<? extends Number> delays) { return new Backoff(new SequenceBackoffAlgorithm(delays)); }
    public static Backoff sequence(List<? extends Number> delays, boolean repeatLast) { return new Backoff(new SequenceBackoffAlgorithm(delays, repeatLast)); }
    public static Backoff callback(CallbackBackoffAlgorithm.DelayFunction callback) { return new Backoff(new CallbackBackoffAlgorithm(callback)); }
    public static Backoff custom(BackoffAlgorithm algorithm) { return new Backoff(algorithm); }
    public static Backoff noop() { return new Backoff(new NoopBackoffAlgorithm()); }
    public static Backoff none() { return new Backoff(new NoBackoffAlgorithm()); }

    // ---- configuration ----

    public Backoff algorithm(BackoffAlgorithm algorithm) {
        ensureNotStarted("algorithm");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        return this;
    }

    public Backoff fullJitter() { return customJitter("fullJitter", new FullJitter()); }
    public Backoff equalJitter() { return customJitter("equalJitter", new EqualJitter()); }
    public Backoff jitterRange(double min, double max) { return customJitter("jitterRange", new RangeJitter(min, max)); }
    public Backoff jitterCallback(CallbackJitter.JitterFunction callback) { return customJitter("jitterCallback", new CallbackJitter(callback)); }
    public Backoff customJitter(Jitter jitter) { return customJitter("customJitter", jitter); }
    public Backoff noJitter() { return customJitter("noJitter", null); }

    private Backoff customJitter(String method, Jitter jitter) {
        ensureNotStarted(method);
        this.jitter = jitter;
        return this;
    }

    /** Total number of attempts including the first one, null for no limit. */
    public Backoff maxAttempts(Integer maxAttempts) {
        ensureNotStarted("maxAttempts");
        this.maxAttempts = maxAttempts;
        assessInitialStoppedState();
        return this;
    }

    public Backoff noMaxAttempts() {
        ensureNotStarted("noMaxAttempts");
        return maxAttempts(null);
    }

    public Backoff noAttemptLimit() {
        ensureNotStarted("noAttemptLimit");
        return maxAttempts(null);
    }

    public Backoff maxDelay(Double maxDelay) {
        ensureNotStarted("maxDelay");
        this.maxDelay = maxDelay;
        return this;
    }

    public Backoff noMaxDelay() {
        ensureNotStarted("noMaxDelay");
        return maxDelay(null);
    }

    public Backoff noDelayLimit() {
        ensureNotStarted("noDelayLimit");
        return maxDelay(null);
    }

    /** @throws io.backoff.error.BackoffInitialisationException for an unknown unit token */
    public Backoff unit(String unit) {
        ensureNotStarted("unit");
        this.unit = DelayUnit.fromToken(unit);
        return this;
    }

    public Backoff unit(DelayUnit unit) {
        ensureNotStarted("unit");
        this.unit = Objects.requireNonNull(unit, "unit");
        return this;
    }

    public Backoff unitSeconds() { ensureNotStarted("unitSeconds"); return unit(DelayUnit.SECONDS); }
    public Backoff unitMs() { ensureNotStarted("unitMs"); return unit(DelayUnit.MILLISECONDS); }
    public Backoff unitUs() { ensureNotStarted("unitUs"); return unit(DelayUnit.MICROSECONDS); }

    /** Whether step() is also called before the first attempt (as in {@code while (backoff.step()) {...}}). */
    public Backoff runsAtStartOfLoop(boolean runsAtStartOfLoop) {
        ensureNotStarted("runsAtStartOfLoop");
        this.runsAtStartOfLoop = runsAtStartOfLoop;
        return this;
    }

    public Backoff runsAtStartOfLoop() { return runsAtStartOfLoop(true); }

    public Backoff runsAtEndOfLoop() {
        ensureNotStarted("runsAtEndOfLoop");
        return runsAtStartOfLoop(false);
    }

    /** Insert a 0 delay as the first retry, shifting the algorithm's delays along by one. */
    public Backoff immediateFirstRetry(boolean immediateFirstRetry) {
        ensureNotStarted("immediateFirstRetry");
        this.immediateFirstRetry = immediateFirstRetry;
        return this;
    }

    public Backoff immediateFirstRetry() { return immediateFirstRetry(true); }

    public Backoff noImmediateFirstRetry() {
        ensureNotStarted("noImmediateFirstRetry");
        return immediateFirstRetry(false);
    }

    /** When false, retries still happen but without waiting in between. */
    public Backoff onlyDelayWhen(boolean condition) {
        ensureNotStarted("onlyDelayWhen");
        this.delaysEnabled = condition;
        return this;
    }

    /** When false, only the first attempt is made. */
    public Backoff onlyRetryWhen(boolean condition) {
        ensureNotStarted("onlyRetryWhen");
        this.retriesEnabled = condition;
        return this;
    }

    public Backoff sleeper(Sleeper sleeper) {
        ensureNotStarted("sleeper");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        return this;
    }

    public Backoff clock(Clock clock) {
        ensureNotStarted("clock");
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public Backoff metrics(MetricRegistry registry) {
        ensureNotStarted("metrics");
        this.metrics = new BackoffMetrics(Objects.requireNonNull(registry, "registry"));
        return this;
    }

    private void ensureNotStarted(String method) {
        if (started) throw BackoffRuntimeException.attemptToChangeAfterStart(method);
    }

    // ---- runner configuration ----

    /**
     * Retry only these exception types. Calling it again adds to the list. No types means every exception.
     */
    @SafeVarargs
    public final Backoff retryExceptions(Class<? extends Exception>... types) {
        return addRetryExceptions(List.of(types), null);
    }

    /** Retry these exception types, returning the default when the attempts run out because of them. */
    public Backoff retryExceptions(List<Class<? extends Exception>> types, Object defaultValue) {
        return addRetryExceptions(types, DefaultValue.of(defaultValue));
    }

    /** Retry the exceptions the predicate accepts. */
    public Backoff retryExceptions(Predicate<? super Exception> predicate) {
        resetExceptionRules();
        retryExceptions.add(RetryMatch.predicate(predicate, null));
        return this;
    }

    public Backoff retryExceptions(Predicate<? super Exception> predicate, Object defaultValue) {
        resetExceptionRules();
        retryExceptions.add(RetryMatch.predicate(predicate, DefaultValue.of(defaultValue)));
        return this;
    }

    public Backoff retryAllExceptions() {
        return addRetryExceptions(List.of(), null);
    }

    public Backoff retryAllExceptions(Object defaultValue) {
        return addRetryExceptions(List.of(), DefaultValue.of(defaultValue));
    }

    /** Exceptions end the run straight away and are re-thrown. */
    public Backoff dontRetryExceptions() {
        retryExceptions.clear();
        exceptionsRetried = false;
        exceptionDefault = null;
        return this;
    }

    /** Exceptions end the run straight away, and the default is returned instead. */
    public Backoff dontRetryExceptions(Object defaultValue) {
        dontRetryExceptions();
        exceptionDefault = DefaultValue.of(defaultValue);
        return this;
    }

    private Backoff addRetryExceptions(List<Class<? extends Exception>> types, DefaultValue defaultValue) {
        resetExceptionRules();
        if (types.isEmpty()) {
            retryExceptions.add(RetryMatch.all(defaultValue));
        } else {
            for (Class<? extends Exception> type : types) retryExceptions.add(RetryMatch.type(type, defaultValue));
        }
        return this;
    }

    private void resetExceptionRules() {
        exceptionsRetried = true;
        exceptionDefault = null;
    }

    /** Results equal to this value are invalid and retried. Replaces any retryUntil() rules. */
    public Backoff retryWhen(Object value) { return retryWhen(value, false); }

    public Backoff retryWhen(Object value, boolean strict) {
        retryUntilResult.clear();
        retryWhenResult.add(RetryMatch.value(value, strict, null));
        return this;
    }

    public Backoff retryWhen(Object value, boolean strict, Object defaultValue) {
        retryUntilResult.clear();
        retryWhenResult.add(RetryMatch.value(value, strict, DefaultValue.of(defaultValue)));
        return this;
    }

    /** Results the predicate accepts are invalid and retried. A bare null retries null results. */
    public Backoff retryWhen(Predicate<?> predicate) {
        retryUntilResult.clear();
        retryWhenResult.add(resultMatch(predicate, null));
        return this;
    }

    public Backoff retryWhen(Predicate<?> predicate, Object defaultValue) {
        retryUntilResult.clear();
        retryWhenResult.add(resultMatch(predicate, DefaultValue.of(defaultValue)));
        return this;
    }

    /** Only results equal to this value are valid, anything else is retried. Replaces any retryWhen() rules. */
    public Backoff retryUntil(Object value) { return retryUntil(value, false); }

    public Backoff retryUntil(Object value, boolean strict) {
        retryWhenResult.clear();
        retryUntilResult.add(RetryMatch.value(value, strict, null));
        return this;
    }

    /** Only results the predicate accepts are valid. A bare null accepts only null results. */
    public Backoff retryUntil(Predicate<?> predicate) {
        retryWhenResult.clear();
        retryUntilResult.add(resultMatch(predicate, null));
        return this;
    }

    // retryWhen(null) resolves to the predicate overloads
    private static RetryMatch resultMatch(Predicate<?> predicate, DefaultValue defaultValue) {
        return predicate == null ? RetryMatch.value(null, false, defaultValue) : RetryMatch.predicate(predicate, defaultValue);
    }

    /** Called for every exception thrown by the operation. Offers: Exception, Boolean willRetry, AttemptLog, AttemptLogs. */
    public Backoff exceptionCallback(Object... callbacks) {
        exceptionCallbacks.addAll(Callbacks.flatten(callbacks));
        return this;
    }

    /** Called for every invalid result. Offers: Object result, Boolean willRetry, AttemptLog, AttemptLogs. */
    public Backoff invalidResultCallback(Object... callbacks) {
        invalidResultCallbacks.addAll(Callbacks.flatten(callbacks));
        return this;
    }

    /** Called once when the operation succeeds. Offers: Object result, AttemptLog, AttemptLogs. */
    public Backoff successCallback(Object... callbacks) {
        successCallbacks.addAll(Callbacks.flatten(callbacks));
        return this;
    }

    /** Called once when every attempt failed. Offers: AttemptLog, AttemptLogs. */
    public Backoff failureCallback(Object... callbacks) {
        failureCallbacks.addAll(Callbacks.flatten(callbacks));
        return this;
    }

    /** Alias of {@link #failureCallback(Object...)}. */
    public Backoff fallbackCallback(Object... callbacks) {
        return failureCallback(callbacks);
    }

    /** Called once at the end of every run, after the success or failure callbacks. Offers: AttemptLog, AttemptLogs. */
    public Backoff finallyCallback(Object... callbacks) {
        finallyCallbacks.addAll(Callbacks.flatten(callbacks));
        return this;
    }

    // ---- the loop ----

    /** Put the backoff back into its unstarted state. The configuration is kept. */
    public Backoff reset() {
        started = false;
        assessInitialStoppedState();
        attemptNumber = null;
        delayCalculator = null;
        firstAttemptOccurredAt = null;
        overallDelay = null;

        recordForTest = false;
        recordedDelays = new ArrayList<>();
        sleepCallCount = 0;
        actualTimesSlept = 0;
        return this;
    }

    private void assessInitialStoppedState() {
        stopped = maxAttempts != null && maxAttempts <= 0;
    }

    DelayCalculator delayCalculator() {
        if (delayCalculator == null) {
            delayCalculator = new DelayCalculator(algorithm, jitter, maxAttempts, maxDelay, unit, immediateFirstRetry, delaysEnabled);
        }
        return delayCalculator;
    }

    private void start() {
        if (!started) attemptLogs.clear();
        started = true;
    }

    /**
     * Work out whether another attempt should happen and wait the delay before it.
     *
     * @return false when no more attempts should be made
     */
    public boolean step() {
        calculate();
        return sleep();
    }

    /** The decision half of {@link #step()}: moves on to the next attempt, or stops. */
    public boolean calculate() {
        start();
        if (stopped) return false;

        // the step before the first attempt has no delay
        if (runsAtStartOfLoop && attemptNumber == null) {
            attemptNumber = 1;
            return true;
        }

        attemptNumber = (attemptNumber == null ? 1 : attemptNumber) + 1;
        if (!canContinue()) {
            stopped = true;
            return false;
        }
        return true;
    }

    /** The waiting half of {@link #step()}: hands the current delay to the sleeper. */
    public boolean sleep() {
        start();
        if (recordForTest) sleepCallCount++;
        if (stopped) return false;

        Double delay = getDelay();
        if (recordForTest) recordedDelays.add(delay);
        if (delay == null) return true;

        overallDelay = (overallDelay == null ? 0 : overallDelay) + delay;
        metrics.meter(BackoffMetrics.RETRIES).mark();
        metrics.histogram(BackoffMetrics.DELAY_US).update(unit.convert(delay, DelayUnit.MICROSECONDS).longValue());

        if (recordForTest) {
            actualTimesSlept++;
        } else {
            sleeper.sleep(delay, unit);
            // an interrupted wait ends the loop, the flag stays set for the caller
            if (Thread.currentThread().isInterrupted()) {
                log.debug("interrupted while waiting before attempt {}, stopping", currentAttemptNumber());
                stopped = true;
                return false;
            }
        }
        return true;
    }

    private boolean canContinue() {
        if (!retriesEnabled) return false;
        return !delayCalculator().shouldStop(attemptNumber - 1);
    }

    /** Open the log entry for the current attempt. */
    public Backoff startOfAttempt() {
        start();
        if (stopped) throw BackoffRuntimeException.startOfAttemptNotAllowed();

        int number = currentAttemptNumber();
        if (number <= 1) attemptLogs.clear();

        Instant now = clock.instant();
        if (number == 1 || firstAttemptOccurredAt == null) firstAttemptOccurredAt = now;

        DelayCalculator calculator = delayCalculator();
        Double prevDelay = calculator.getJitteredDelay(number - 1);
        Double nextDelay = retriesEnabled ? calculator.getJitteredDelay(number) : null;
        attemptLogs.put(number, new AttemptLog(number, maxAttempts, firstAttemptOccurredAt, now,
                null, null, prevDelay, nextDelay, overallDelay, unit, AttemptOutcome.pending()));
        metrics.meter(BackoffMetrics.ATTEMPTS).mark();
        return this;
    }

    public Backoff endOfAttempt() {
        return endOfAttempt(AttemptOutcome.pending());
    }

    /**
     * Close the log entry for the current attempt. Closing an already closed entry keeps its first values.
     *
     * @throws BackoffRuntimeException when {@link #startOfAttempt()} wasn't called for this attempt
     */
    public Backoff endOfAttempt(AttemptOutcome outcome) {
        Instant finishedAt = clock.instant();
        AttemptLog current = started ? attemptLogs.get(currentAttemptNumber()) : null;
        if (current == null) throw BackoffRuntimeException.attemptLogHasNotStarted();
        closeAttempt(finishedAt, Objects.requireNonNull(outcome, "outcome"));
        return this;
    }

    private void closeAttempt(Instant finishedAt, AttemptOutcome outcome) {
        int number = currentAttemptNumber();
        AttemptLog current = attemptLogs.get(number);
        if (current == null || !current.isOpen()) return;

        long nanos = Math.max(0, Duration.between(current.thisAttemptOccurredAt(), finishedAt).toNanos());
        double workingTime = DelayUnit.MICROSECONDS.convert(nanos / 1_000.0, unit);
        AttemptLog previous = attemptLogs.get(number - 1);
        double overall = workingTime + (previous != null && previous.overallWorkingTime() != null ? previous.overallWorkingTime() : 0);

        attemptLogs.put(number, current.closed(workingTime, overall, outcome));
        metrics.timer(BackoffMetrics.ATTEMPT_TIME).update(nanos, TimeUnit.NANOSECONDS);
    }

    /** Every attempt of the current (or last) run, in order. */
    public AttemptLogs logs() {
        return new AttemptLogs(new ArrayList<>(attemptLogs.values()));
    }

    /** The log of the attempt in progress, null before starting or after stopping. */
    public AttemptLog currentLog() {
        if (!started || stopped) return null;
        return attemptLogs.get(currentAttemptNumber());
    }

    public State state() {
        if (!started) return State.UNSTARTED;
        return stopped ? State.STOPPED : State.RUNNING;
    }

    public boolean hasStopped() { return stopped; }

    public int currentAttemptNumber() { return attemptNumber == null ? 1 : attemptNumber; }

    public boolean isFirstAttempt() { return currentAttemptNumber() == 1; }

    public boolean isLastAttempt() {
        start();
        if (stopped || !retriesEnabled) return true;
        return delayCalculator().shouldStop(currentAttemptNumber());
    }

    public DelayUnit getUnit() { return unit; }

    /** The delay applied before the current attempt, null for the first attempt or once stopped. */
    public Double getDelay() {
        start();
        return stopped ? null : delayCalculator().getJitteredDelay(currentAttemptNumber() - 1);
    }

    public Double getDelayInSeconds() { return unit.convert(getDelay(), DelayUnit.SECONDS); }
    public Double getDelayInMs() { return unit.convert(getDelay(), DelayUnit.MILLISECONDS); }
    public Double getDelayInUs() { return unit.convert(getDelay(), DelayUnit.MICROSECONDS); }

    // ---- simulation ----

    /**
     * The jittered delay before a retry, in the configured unit. Repeated calls give the same value until reset().
     */
    public Double simulate(int retryNumber) {
        List<Double> one = simulate(retryNumber, retryNumber, unit);
        return one.isEmpty() ? null : one.get(0);
    }

    /** The jittered delays for retries retryStart..retryStop inclusive, in the configured unit. */
    public List<Double> simulate(int retryStart, int retryStop) { return simulate(retryStart, retryStop, unit); }
    public List<Double> simulateInSeconds(int retryStart, int retryStop) { return simulate(retryStart, retryStop, DelayUnit.SECONDS); }
    public List<Double> simulateInMs(int retryStart, int retryStop) { return simulate(retryStart, retryStop, DelayUnit.MILLISECONDS); }
    public List<Double> simulateInUs(int retryStart, int retryStop) { return simulate(retryStart, retryStop, DelayUnit.MICROSECONDS); }

    private List<Double> simulate(int retryStart, int retryStop, DelayUnit to) {
        List<Double> out = new ArrayList<>();
        if (retryStart < 1 || retryStop < retryStart) return out;
        start();
        for (int retry = retryStart; retry <= retryStop; retry++) {
            out.add(unit.convert(delayCalculator().getJitteredDelay(retry), to));
        }
        return out;
    }

    /**
     * Step through the loop up to maxSteps times, recording each delay instead of waiting for it.
     */
    public DelaySequence generateTestSequence(int maxSteps) {
        recordForTest = true;
        for (int count = 0; count < maxSteps; count++) {
            if (!step()) break;
        }
        return new DelaySequence(
                convertAll(unit),
                convertAll(DelayUnit.SECONDS),
                convertAll(DelayUnit.MILLISECONDS),
                convertAll(DelayUnit.MICROSECONDS),
                sleepCallCount,
                actualTimesSlept);
    }

    private List<Double> convertAll(DelayUnit to) {
        List<Double> out = new ArrayList<>(recordedDelays.size());
        for (Double d : recordedDelays) out.add(unit.convert(d, to));
        return Collections.unmodifiableList(out);
    }

    // ---- the runner ----

    /**
     * Run the operation, retrying it according to this strategy.
     *
     * @return the first valid result; the last invalid result when the attempts run out
     * @throws Exception the last exception, when the attempts run out and no default applies
     */
    public <T> T attempt(Callable<T> operation) throws Exception {
        return run(operation, null);
    }

    /** As {@link #attempt(Callable)}, returning the default (which may be null) instead of failing. */
    public <T> T attempt(Callable<T> operation, T defaultValue) throws Exception {
        return run(operation, DefaultValue.of(defaultValue));
    }

    /** As {@link #attempt(Callable)}, returning the fallback's value instead of failing. */
    public <T> T attemptOrElseGet(Callable<T> operation, Supplier<? extends T> fallback) throws Exception {
        return run(operation, DefaultValue.from(Objects.requireNonNull(fallback, "fallback")));
    }

    private <T> T run(Callable<T> operation, DefaultValue callerDefault) throws Exception {
        Objects.requireNonNull(operation, "operation");
        boolean origRunsAtStartOfLoop = runsAtStartOfLoop;
        reset();
        runsAtStartOfLoop = true;
        try {
            return performAttempt(operation, callerDefault);
        } finally {
            reset();
            runsAtStartOfLoop = origRunsAtStartOfLoop;
        }
    }

    @SuppressWarnings("unchecked")
    private <T> T performAttempt(Callable<T> operation, DefaultValue callerDefault) throws Exception {
        DefaultValue overrideDefault = null;
        Object result = null;
        Exception lastException = null;

        while (step()) {
            overrideDefault = null;
            result = null;
            lastException = null;

            startOfAttempt();
            try {
                result = operation.call();
            } catch (Exception e) {
                if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                endOfAttempt(AttemptOutcome.exception(e));
                metrics.meter(BackoffMetrics.EXCEPTIONS).mark();
                lastException = e;

                RetryMatch match = pickMatchingException(e);
                boolean stop = match == null;
                overrideDefault = match != null ? match.defaultValue() : exceptionDefault;
                stop = stop || isLastAttempt();

                dispatch(exceptionCallbacks,
                        CallbackArgument.of(Exception.class, e),
                        CallbackArgument.of(Boolean.class, !stop));
                if (stop) break;
                log.debug("attempt {} failed with {}, retrying", currentAttemptNumber(), e.toString());
                continue;
            }
            Instant finishedAt = clock.instant();

            boolean successful = true;
            if (!retryWhenResult.isEmpty()) {
                RetryMatch invalid = pickMatchingResult(result, retryWhenResult);
                if (invalid != null) {
                    successful = false;
                    overrideDefault = invalid.defaultValue();
                }
            }
            if (!retryUntilResult.isEmpty()) {
                successful = pickMatchingResult(result, retryUntilResult) != null;
            }

            if (successful) {
                closeAttempt(finishedAt, AttemptOutcome.success(result));
                metrics.meter(BackoffMetrics.SUCCESSES).mark();
                dispatch(successCallbacks, CallbackArgument.of(Object.class, result));
                dispatch(finallyCallbacks);
                return (T) result;
            }

            closeAttempt(finishedAt, AttemptOutcome.invalidResult(result));
            metrics.meter(BackoffMetrics.INVALID_RESULTS).mark();
            boolean willRetry = !isLastAttempt();
            dispatch(invalidResultCallbacks,
                    CallbackArgument.of(Object.class, result),
                    CallbackArgument.of(Boolean.class, willRetry));
            if (willRetry) log.debug("attempt {} gave an invalid result, retrying", currentAttemptNumber());
        }

        metrics.meter(BackoffMetrics.FAILURES).mark();
        log.warn("giving up after {} attempt(s)", attemptLogs.size());
        dispatch(failureCallbacks);
        dispatch(finallyCallbacks);

        if (lastException instanceof BackoffException || lastException instanceof InterruptedException) throw lastException;
        if (overrideDefault != null) return (T) overrideDefault.resolve();
        if (callerDefault != null) return (T) callerDefault.resolve();
        if (lastException != null) throw lastException;
        return (T) result;
    }

    /**
     * Most specific rule first: a type or predicate with a default, any exception with a default,
     * a type or predicate without a default, any exception without a default.
     */
    private RetryMatch pickMatchingException(Exception e) {
        if (e instanceof BackoffException || e instanceof InterruptedException) return null;
        if (!exceptionsRetried) return null;
        if (retryExceptions.isEmpty()) return RetryMatch.all(null);

        for (boolean withDefault : new boolean[]{true, false}) {
            for (boolean matchingAll : new boolean[]{false, true}) {
                for (RetryMatch match : retryExceptions) {
                    if (match.hasDefault() != withDefault || match.matchesAll() != matchingAll) continue;
                    if (match.matchesException(e)) return match;
                }
            }
        }
        return null;
    }

    private static RetryMatch pickMatchingResult(Object result, List<RetryMatch> matches) {
        for (RetryMatch match : matches) {
            if (match.matchesResult(result)) return match;
        }
        return null;
    }

    private void dispatch(List<BackoffCallback> callbacks, CallbackArgument... specific) throws Exception {
        if (callbacks.isEmpty()) return;
        AttemptLogs logs = logs();
        List<CallbackArgument> arguments = new ArrayList<>(List.of(specific));
        AttemptLog latest = logs.last();
        if (latest != null) arguments.add(CallbackArgument.of(AttemptLog.class, latest));
        arguments.add(CallbackArgument.of(AttemptLogs.class, logs));
        CallbackDispatcher.dispatch(callbacks, arguments);
    }
}
