package io.backoff.simulator;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import io.backoff.metrics.BackoffMetrics;
import io.backoff.runtime.SimulatedDelay;

import java.util.List;
import java.util.Locale;

/**
 * Renders simulated delays as a plain text table.
 */
public final class DelayTable {
    private DelayTable() {}

    public static String render(List<SimulatedDelay> delays) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%5s | %12s | %12s | %12s | %14s%n", "retry", "base", "jittered (s)", "jittered (ms)", "jittered (us)"));
        for (SimulatedDelay d : delays) {
            if (d.stops()) {
                sb.append(String.format(Locale.ROOT, "%5d | %12s | %12s | %12s | %14s%n", d.retryNumber(), "stop", "-", "-", "-"));
                continue;
            }
            sb.append(String.format(Locale.ROOT, "%5d | %12s | %12s | %12s | %14s%n",
                    d.retryNumber(),
                    fmt(d.baseDelay()) + " " + d.unit().shortToken(),
                    fmt(d.jitteredDelayInSeconds()),
                    fmt(d.jitteredDelayInMs()),
                    fmt(d.jitteredDelayInUs())));
        }
        return sb.toString();
    }

    /** One line summarising the retries and delays recorded in the registry. */
    public static String metricsSummary(MetricRegistry registry) {
        long retries = registry.meter(BackoffMetrics.RETRIES).getCount();
        Histogram delays = registry.histogram(BackoffMetrics.DELAY_US);
        var s = delays.getSnapshot();
        return "metrics: retries=" + retries +
                " | delay.mean(ms)=" + fmt(s.getMean() / 1_000.0) +
                " | delay.max(ms)=" + fmt(s.getMax() / 1_000.0);
    }

    private static String fmt(Double v) { return v == null ? "-" : String.format(Locale.ROOT, "%.3f", v); }
}
