package io.backoff.runtime;

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
import io.backoff.core.BackoffAlgorithm;
import io.backoff.core.DelayUnit;
import io.backoff.core.Jitter;
import io.backoff.error.BackoffInitialisationException;
import io.backoff.jitter.CallbackJitter;
import io.backoff.jitter.FullJitter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class DelayCalculatorTest {

    private static DelayCalculator calc(BackoffAlgorithm algorithm) {
        return calc(algorithm, null, null, null, false, true);
    }

    private static DelayCalculator calc(BackoffAlgorithm algorithm, Jitter jitter, Integer maxAttempts, Double maxDelay,
                                        boolean immediateFirstRetry, boolean delaysEnabled) {
        return new DelayCalculator(algorithm, jitter, maxAttempts, maxDelay, DelayUnit.SECONDS, immediateFirstRetry, delaysEnabled);
    }

    private static List<Double> baseDelays(DelayCalculator c, int count) {
        List<Double> out = new ArrayList<>();
        for (int i = 1; i <= count; i++) out.add(c.getBaseDelay(i));
        return out;
    }

    @Test
    void retry_zero_has_no_delay() {
        DelayCalculator c = calc(new FixedBackoffAlgorithm(5));
        assertNull(c.getBaseDelay(0));
        assertNull(c.getJitteredDelay(0));
        assertFalse(c.shouldStop(0));
    }

    @Test
    void fixed_ten_retries() {
        assertEquals(List.of(5.0, 5.0, 5.0, 5.0, 5.0, 5.0, 5.0, 5.0, 5.0, 5.0), baseDelays(calc(new FixedBackoffAlgorithm(5)), 10));
    }

    @Test
    void linear_ten_retries() {
        assertEquals(List.of(5.0, 15.0, 25.0, 35.0, 45.0, 55.0, 65.0, 75.0, 85.0, 95.0),
                baseDelays(calc(new LinearBackoffAlgorithm(5, 10)), 10));
    }

    @Test
    void sequence_repeating_last() {
        DelayCalculator c = calc(new SequenceBackoffAlgorithm(List.of(9, 8, 7, 6, 5), true));
        assertEquals(List.of(9.0, 8.0, 7.0, 6.0, 5.0, 5.0, 5.0, 5.0, 5.0, 5.0), baseDelays(c, 10));
    }

    @Test
    void max_delay_caps_and_negatives_become_zero() {
        DelayCalculator c = calc(new SequenceBackoffAlgorithm(List.of(1, -1.5, 4, -8)), null, null, 3.0, false, true);
        assertEquals(Arrays.asList(1.0, 0.0, 3.0, 0.0, null), baseDelays(c, 5));
        assertTrue(c.shouldStop(5));
        assertFalse(c.shouldStop(4));
    }

    @Test
    void max_attempts_counts_the_first_attempt() {
        DelayCalculator c = calc(new FixedBackoffAlgorithm(1), null, 3, null, false, true);
        assertEquals(Arrays.asList(1.0, 1.0, null), baseDelays(c, 3));
        assertTrue(c.shouldStop(3));

        assertNull(calc(new FixedBackoffAlgorithm(1), null, 1, null, false, true).getBaseDelay(1));
    }

    @Test
    void immediate_first_retry_shifts_the_algorithm() {
        DelayCalculator c = calc(new LinearBackoffAlgorithm(5, 10), null, null, null, true, true);
        assertEquals(List.of(0.0, 5.0, 15.0, 25.0), baseDelays(c, 4));

        DelayCalculator limited = calc(new LinearBackoffAlgorithm(5, 10), null, 3, null, true, true);
        assertEquals(Arrays.asList(0.0, 5.0, null), baseDelays(limited, 3));
    }

    @Test
    void immediate_first_retry_starts_the_algorithm_chain_fresh() {
        List<Double> previous = new ArrayList<>();
        CallbackBackoffAlgorithm a = new CallbackBackoffAlgorithm((retry, prev) -> {
            previous.add(prev);
            return 2;
        });
        baseDelays(calc(a, null, null, null, true, true), 3);
        assertEquals(Arrays.asList(null, 2.0), previous);
    }

    @Test
    void disabled_delays_are_zero_but_keep_the_stop_point() {
        DelayCalculator c = calc(new SequenceBackoffAlgorithm(List.of(1, 2, 3)), null, null, null, false, false);
        assertEquals(Arrays.asList(0.0, 0.0, 0.0, null), baseDelays(c, 4));
    }

    @Test
    void values_are_cached_until_reset() {
        DelayCalculator c = calc(new FixedBackoffAlgorithm(10), new FullJitter(new Random(42)), null, null, false, true);
        Double first = c.getJitteredDelay(3);
        assertEquals(first, c.getJitteredDelay(3));
        assertEquals(first, c.getJitteredDelay(3));

        c.reset();
        assertNotEquals(first, c.getJitteredDelay(3));
    }

    @Test
    void algorithm_is_called_once_per_retry() {
        AtomicInteger calls = new AtomicInteger();
        DelayCalculator c = calc(new CallbackBackoffAlgorithm((retry, prev) -> {
            calls.incrementAndGet();
            return retry;
        }));
        c.getBaseDelay(4);
        c.getBaseDelay(2);
        c.getBaseDelay(4);
        assertEquals(4, calls.get());
    }

    @Test
    void stopping_is_permanent() {
        DelayCalculator c = calc(new CallbackBackoffAlgorithm((retry, prev) -> retry == 3 ? null : retry));
        assertNull(c.getBaseDelay(5));
        assertNull(c.getBaseDelay(4));
        assertNull(c.getBaseDelay(3));
        assertEquals(2.0, c.getBaseDelay(2));
        assertTrue(c.shouldStop(6));
    }

    @Test
    void jitter_skipped_for_self_randomised_algorithms() {
        DelayCalculator c = calc(new RandomBackoffAlgorithm(2, 2), new CallbackJitter((d, r) -> 1000), null, null, false, true);
        assertEquals(2.0, c.getJitteredDelay(1));
    }

    @Test
    void jitter_skipped_for_zero_delays() {
        DelayCalculator c = calc(new SequenceBackoffAlgorithm(List.of(0, 4)), new CallbackJitter((d, r) -> 99), null, null, false, true);
        assertEquals(0.0, c.getJitteredDelay(1));
        assertEquals(99.0, c.getJitteredDelay(2));
    }

    @Test
    void negative_or_nan_jitter_becomes_zero() {
        assertEquals(0.0, calc(new FixedBackoffAlgorithm(1), new CallbackJitter((d, r) -> -5), null, null, false, true).getJitteredDelay(1));
        assertEquals(0.0, calc(new FixedBackoffAlgorithm(1), new CallbackJitter((d, r) -> Double.NaN), null, null, false, true).getJitteredDelay(1));
    }

    @Test
    void jitter_is_applied_after_the_max_delay() {
        DelayCalculator c = calc(new FixedBackoffAlgorithm(10), new CallbackJitter((d, r) -> d * 2), null, 3.0, false, true);
        assertEquals(3.0, c.getBaseDelay(1));
        assertEquals(6.0, c.getJitteredDelay(1));
    }

    @Test
    void full_jitter_never_exceeds_base() {
        DelayCalculator c = calc(new LinearBackoffAlgorithm(1), new FullJitter(new Random(11)), null, null, false, true);
        for (int i = 1; i <= 30; i++) {
            assertTrue(c.getJitteredDelay(i) <= c.getBaseDelay(i));
            assertTrue(c.getJitteredDelay(i) >= 0);
        }
    }

    @Test
    void unit_token_is_validated() {
        assertThrows(BackoffInitialisationException.class,
                () -> new DelayCalculator(new FixedBackoffAlgorithm(1), null, null, null, "fortnights", false, true));
        assertEquals(DelayUnit.MILLISECONDS,
                new DelayCalculator(new FixedBackoffAlgorithm(1), null, null, null, "milliseconds", false, true).unit());
    }

    static Stream<BackoffAlgorithm> everyAlgorithm() {
        return Stream.of(
                new FixedBackoffAlgorithm(2),
                new LinearBackoffAlgorithm(1, 2),
                new ExponentialBackoffAlgorithm(1, 3),
                new PolynomialBackoffAlgorithm(1, 2),
                new FibonacciBackoffAlgorithm(1),
                new DecorrelatedBackoffAlgorithm(1, 3, new Random(5)),
                new RandomBackoffAlgorithm(1, 4, new Random(9)),
                new SequenceBackoffAlgorithm(List.of(3, 2, 1)),
                new CallbackBackoffAlgorithm((retry, previous) -> retry < 4 ? retry : null),
                new NoopBackoffAlgorithm(),
                new NoBackoffAlgorithm());
    }

    @ParameterizedTest
    @MethodSource("everyAlgorithm")
    void once_stopped_every_later_retry_stays_stopped(BackoffAlgorithm algorithm) {
        for (Integer maxAttempts : Arrays.asList(null, 6)) {
            DelayCalculator c = calc(algorithm, null, maxAttempts, null, false, true);
            assertNull(c.getBaseDelay(0));

            boolean stopped = false;
            for (int i = 1; i <= 30; i++) {
                Double delay = c.getBaseDelay(i);
                if (stopped) assertNull(delay, "retry " + i);
                stopped = delay == null;
                assertEquals(stopped, c.shouldStop(i), "retry " + i);
            }
            if (maxAttempts != null) assertTrue(stopped);
        }
    }
}
