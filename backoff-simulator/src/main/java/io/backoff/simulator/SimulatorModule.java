package io.backoff.simulator;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.backoff.config.BackoffConfig;
import io.backoff.runtime.Backoff;

public class SimulatorModule extends AbstractModule {
    private final BackoffConfig config;

    public SimulatorModule(BackoffConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(BackoffConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides Backoff backoff(MetricRegistry registry) { return config.toBackoff().metrics(registry); }
}
