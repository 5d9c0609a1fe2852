package io.backoff.runtime;

import com.codahale.metrics.MetricRegistry;
import io.backoff.core.DelayUnit;
import io.backoff.error.BackoffRuntimeException;
import io.backoff.jitter.FullJitter;
import io.backoff.metrics.BackoffMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class BackoffLoopTest {

    @Test
    void end_of_loop_step_sleeps_between_attempts() {
        List<Double> slept = new ArrayList<>();
        List<DelayUnit> units = new ArrayList<>();
        Backoff backoff = Backoff.fixed(2).unitMs().maxAttempts(4).sleeper((d, u) -> {
            slept.add(d);
            units.add(u);
        });

        int attempts = 0;
        do {
            attempts++;
        } while (backoff.step());

        assertEquals(4, attempts);
        assertEquals(List.of(2.0, 2.0, 2.0), slept);
        assertEquals(List.of(DelayUnit.MILLISECONDS, DelayUnit.MILLISECONDS, DelayUnit.MILLISECONDS), units);
        assertTrue(backoff.hasStopped());
        assertFalse(backoff.step());
    }

    @Test
    void start_of_loop_step_lets_the_first_attempt_through_without_delay() {
        List<Double> slept = new ArrayList<>();
        Backoff backoff = Backoff.fixed(1).maxAttempts(3).runsAtStartOfLoop().sleeper((d, u) -> slept.add(d));

        int attempts = 0;
        while (backoff.step()) attempts++;

        assertEquals(3, attempts);
        assertEquals(List.of(1.0, 1.0), slept);
    }

    @Test
    void test_sequence_records_instead_of_sleeping() {
        Backoff backoff = Backoff.fixed(5).maxAttempts(3).sleeper((d, u) -> fail("should not sleep"));
        DelaySequence seq = backoff.generateTestSequence(10);

        assertEquals(List.of(5.0, 5.0), seq.delays());
        assertEquals(List.of(5000.0, 5000.0), seq.delaysInMs());
        assertEquals(List.of(5_000_000.0, 5_000_000.0), seq.delaysInUs());
        assertEquals(3, seq.sleepCallCount());
        assertEquals(2, seq.actualTimesSlept());
    }

    @Test
    void test_sequence_at_start_of_loop_records_the_first_empty_delay() {
        DelaySequence seq = Backoff.fixed(5).maxAttempts(3).runsAtStartOfLoop().generateTestSequence(10);
        assertEquals(Arrays.asList(null, 5.0, 5.0), seq.delays());
        assertEquals(2, seq.actualTimesSlept());
    }

    @Test
    void test_sequence_limited_by_max_steps() {
        DelaySequence seq = Backoff.linear(1).noMaxAttempts().generateTestSequence(4);
        assertEquals(List.of(1.0, 2.0, 3.0, 4.0), seq.delays());
    }

    @Test
    void zero_max_attempts_never_starts() {
        Backoff backoff = Backoff.fixed(1).maxAttempts(0);
        assertTrue(backoff.hasStopped());
        assertFalse(backoff.step());
        assertThrows(BackoffRuntimeException.class, backoff::startOfAttempt);
    }

    @Test
    void configuration_is_locked_after_the_first_step() {
        Backoff backoff = Backoff.fixed(1).maxAttempts(3).sleeper((d, u) -> {});
        backoff.step();

        BackoffRuntimeException e = assertThrows(BackoffRuntimeException.class, () -> backoff.maxDelay(10.0));
        assertTrue(e.getMessage().contains("maxDelay"));
        assertThrows(BackoffRuntimeException.class, backoff::fullJitter);
        assertThrows(BackoffRuntimeException.class, () -> backoff.unit("ms"));

        backoff.reset();
        assertDoesNotThrow(() -> backoff.maxDelay(10.0));
    }

    @Test
    void simulating_also_locks_the_configuration() {
        Backoff backoff = Backoff.fixed(1);
        backoff.simulate(1);
        assertThrows(BackoffRuntimeException.class, backoff::noJitter);
    }

    @Test
    void retries_disabled_means_one_attempt() {
        Backoff backoff = Backoff.fixed(1).maxAttempts(5).onlyRetryWhen(false).sleeper((d, u) -> fail("no retries"));
        assertFalse(backoff.step());
    }

    @Test
    void delays_disabled_still_retries() {
        DelaySequence seq = Backoff.fixed(5).maxAttempts(3).onlyDelayWhen(false).generateTestSequence(10);
        assertEquals(List.of(0.0, 0.0), seq.delays());
    }

    @Test
    void state_and_attempt_numbers() {
        Backoff backoff = Backoff.fixed(1).maxAttempts(2).runsAtStartOfLoop().sleeper((d, u) -> {});
        assertEquals(Backoff.State.UNSTARTED, backoff.state());

        assertTrue(backoff.step());
        assertEquals(Backoff.State.RUNNING, backoff.state());
        assertTrue(backoff.isFirstAttempt());
        assertFalse(backoff.isLastAttempt());
        assertNull(backoff.getDelay());

        assertTrue(backoff.step());
        assertEquals(2, backoff.currentAttemptNumber());
        assertTrue(backoff.isLastAttempt());
        assertEquals(1.0, backoff.getDelay());
        assertEquals(1000.0, backoff.getDelayInMs());

        assertFalse(backoff.step());
        assertEquals(Backoff.State.STOPPED, backoff.state());
        assertNull(backoff.getDelay());
    }

    @Test
    void simulate_lists_jittered_delays() {
        Backoff backoff = Backoff.exponential(1).maxAttempts(4);
        assertEquals(Arrays.asList(1.0, 2.0, 4.0, null, null), backoff.simulate(1, 5));
        assertEquals(2.0, backoff.simulate(2));
        assertEquals(List.of(1000.0, 2000.0), backoff.simulateInMs(1, 2));
        assertEquals(List.of(), backoff.simulate(3, 2));
    }

    @Test
    void simulation_matches_what_the_loop_waits_for() {
        Backoff backoff = Backoff.exponential(1).fullJitter().maxAttempts(6).sleeper((d, u) -> {});
        List<Double> simulated = backoff.simulate(1, 5);
        assertEquals(simulated, backoff.generateTestSequence(10).delays());
    }

    @Test
    void simulation_table_stops_at_first_missing_retry() {
        List<SimulatedDelay> delays = Simulation.of(Backoff.fixed(3).maxAttempts(3), 10);
        assertEquals(3, delays.size());
        assertEquals(3.0, delays.get(0).baseDelay());
        assertEquals(3000.0, delays.get(1).jitteredDelayInMs());
        assertTrue(delays.get(2).stops());
    }

    @Test
    void reset_draws_new_random_delays() {
        Backoff backoff = Backoff.fixed(10).customJitter(new FullJitter(new Random(1)));
        Double first = backoff.simulate(1);
        assertEquals(first, backoff.simulate(1));
        backoff.reset();
        assertNotEquals(first, backoff.simulate(1));
    }

    @Test
    void attempt_logs_record_times_and_delays() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        Backoff backoff = Backoff.fixed(2).maxAttempts(3).runsAtStartOfLoop().clock(clock).sleeper((d, u) -> clock.advance(Duration.ofSeconds(2)));

        while (backoff.step()) {
            backoff.startOfAttempt();
            clock.advance(Duration.ofMillis(250));
            backoff.endOfAttempt();
        }

        AttemptLogs logs = backoff.logs();
        assertEquals(3, logs.size());

        AttemptLog first = logs.get(0);
        assertEquals(1, first.attemptNumber());
        assertEquals(0, first.retryNumber());
        assertEquals(Integer.valueOf(3), first.maxAttempts());
        assertNull(first.prevDelay());
        assertEquals(2.0, first.nextDelay());
        assertEquals(0.25, first.workingTime(), 1e-9);
        assertEquals(250.0, first.workingTimeInMs(), 1e-6);
        assertTrue(first.willRetry());

        AttemptLog last = logs.last();
        assertEquals(3, last.attemptNumber());
        assertEquals(2.0, last.prevDelay());
        assertNull(last.nextDelay());
        assertFalse(last.willRetry());
        assertEquals(4.0, last.overallDelay());
        assertEquals(0.75, last.overallWorkingTime(), 1e-9);
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), last.firstAttemptOccurredAt());
        assertEquals(Instant.parse("2024-01-01T00:00:04.500Z"), last.thisAttemptOccurredAt());
    }

    @Test
    void ending_an_attempt_twice_keeps_the_first_values() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        Backoff backoff = Backoff.fixed(1).clock(clock).runsAtStartOfLoop();
        backoff.step();
        backoff.startOfAttempt();
        clock.advance(Duration.ofSeconds(1));
        backoff.endOfAttempt(AttemptOutcome.success("x"));
        clock.advance(Duration.ofSeconds(5));
        backoff.endOfAttempt(AttemptOutcome.invalidResult("y"));

        AttemptLog log = backoff.currentLog();
        assertEquals(1.0, log.workingTime(), 1e-9);
        assertTrue(log.outcome().isSuccess());
    }

    @Test
    void ending_an_attempt_that_never_started_fails() {
        Backoff backoff = Backoff.fixed(1);
        assertThrows(BackoffRuntimeException.class, backoff::endOfAttempt);
        backoff.runsAtStartOfLoop(false);
        backoff.step();
        assertThrows(BackoffRuntimeException.class, backoff::endOfAttempt);
    }

    @Test
    void sleeping_reports_metrics() {
        MetricRegistry registry = new MetricRegistry();
        Backoff.fixed(3).unitMs().maxAttempts(4).metrics(registry).sleeper((d, u) -> {}).generateTestSequence(10);

        assertEquals(3, registry.meter(BackoffMetrics.RETRIES).getCount());
        assertEquals(3, registry.histogram(BackoffMetrics.DELAY_US).getCount());
        assertEquals(3000, registry.histogram(BackoffMetrics.DELAY_US).getSnapshot().getMax());
    }

    @Test
    void interrupted_sleep_stops_the_loop() {
        List<Double> slept = new ArrayList<>();
        Backoff backoff = Backoff.fixed(1).maxAttempts(5).sleeper((d, u) -> {
            slept.add(d);
            Thread.currentThread().interrupt();
        });

        try {
            assertFalse(backoff.step());
            assertTrue(backoff.hasStopped());
            assertFalse(backoff.step());
            assertEquals(List.of(1.0), slept);
        } finally {
            assertTrue(Thread.interrupted());
        }
    }
}
