package io.backoff.metrics;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Names and creates the metrics a backoff reports into a {@link MetricRegistry}.
 */
public class BackoffMetrics {
    public static final String ATTEMPT_TIME = "backoff.attempt.time";
    public static final String ATTEMPTS = "backoff.attempts";
    public static final String RETRIES = "backoff.retries";
    public static final String EXCEPTIONS = "backoff.exceptions";
    public static final String INVALID_RESULTS = "backoff.invalid_results";
    public static final String SUCCESSES = "backoff.successes";
    public static final String FAILURES = "backoff.failures";
    public static final String DELAY_US = "backoff.delay";

    private final MetricRegistry registry;

    public BackoffMetrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }
}
