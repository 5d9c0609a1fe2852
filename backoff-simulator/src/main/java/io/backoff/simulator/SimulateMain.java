package io.backoff.simulator;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.backoff.config.BackoffConfig;
import io.backoff.error.BackoffException;
import io.backoff.runtime.Backoff;
import io.backoff.runtime.SimulatedDelay;
import io.backoff.runtime.Simulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI printing the delays a backoff configuration would produce. Unset options fall back to the
 * {@code backoff.*} system properties and {@code BACKOFF_*} environment variables.
 */
@CommandLine.Command(name = "backoff-simulate", mixinStandardHelpOptions = true, description = "Print the delays a backoff strategy would wait for")
public final class SimulateMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SimulateMain.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-a", "--algorithm"}, description = "fixed, linear, exponential, polynomial, fibonacci, decorrelated, random, sequence, noop, none")
    String algorithm;

    @CommandLine.Option(names = {"-i", "--initial-delay"}, description = "First delay (minimum for random, base for decorrelated)")
    Double initialDelay;

    @CommandLine.Option(names = {"-p", "--parameter"}, description = "Increase, factor, power, multiplier or random maximum, depending on the algorithm")
    Double parameter;

    @CommandLine.Option(names = {"--sequence"}, split = ",", description = "Delays for the sequence algorithm (comma-separated)")
    List<Double> sequence;

    @CommandLine.Option(names = {"--repeat-last"}, description = "Keep repeating the last sequence delay")
    Boolean repeatLast;

    @CommandLine.Option(names = {"-m", "--max-attempts"}, description = "Total attempts including the first; 0 or less never attempts")
    Integer maxAttempts;

    @CommandLine.Option(names = {"--max-delay"}, description = "Upper bound for the base delay")
    Double maxDelay;

    @CommandLine.Option(names = {"-u", "--unit"}, description = "seconds, milliseconds or microseconds (s, ms, us)")
    String unit;

    @CommandLine.Option(names = {"-j", "--jitter"}, description = "none, full, equal or range")
    String jitter;

    @CommandLine.Option(names = {"--jitter-min"}, description = "Lower factor for range jitter")
    Double jitterMin;

    @CommandLine.Option(names = {"--jitter-max"}, description = "Upper factor for range jitter")
    Double jitterMax;

    @CommandLine.Option(names = {"--immediate-first-retry"}, description = "Retry once straight away before the algorithm's delays")
    Boolean immediateFirstRetry;

    @CommandLine.Option(names = {"--seed"}, description = "Seed for repeatable random delays")
    Long seed;

    @CommandLine.Option(names = {"-r", "--retries"}, description = "Number of retries to show", defaultValue = "10")
    int retries;

    public static void main(String[] args) {
        int code = new CommandLine(new SimulateMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Backoff backoff;
        MetricRegistry registry;
        try {
            Injector injector = Guice.createInjector(new SimulatorModule(resolveConfig()));
            backoff = injector.getInstance(Backoff.class);
            registry = injector.getInstance(MetricRegistry.class);
        } catch (BackoffException | IllegalArgumentException e) {
            return invalid(err, e);
        } catch (ProvisionException e) {
            return invalid(err, e.getCause() != null ? e.getCause() : e);
        }

        List<SimulatedDelay> delays = Simulation.of(backoff, Math.max(0, retries));
        log.debug("simulated {} retries", delays.size());
        out.print(DelayTable.render(delays));

        // replay through the loop so the delays reach the metrics
        backoff.generateTestSequence(Math.max(0, retries));
        out.println(DelayTable.metricsSummary(registry));
        out.flush();
        return 0;
    }

    private static int invalid(PrintWriter err, Throwable cause) {
        err.println("Invalid backoff configuration: " + cause.getMessage());
        err.flush();
        return 2;
    }

    BackoffConfig resolveConfig() {
        BackoffConfig env = BackoffConfig.fromEnv();
        return new BackoffConfig(
                algorithm != null ? algorithm : env.algorithm(),
                initialDelay != null ? initialDelay : env.initialDelay(),
                parameter != null ? parameter : env.parameter(),
                sequence != null ? new ArrayList<>(sequence) : env.sequence(),
                repeatLast != null ? repeatLast : env.repeatLast(),
                maxAttempts != null ? maxAttempts : env.maxAttempts(),
                maxDelay != null ? maxDelay : env.maxDelay(),
                unit != null ? unit : env.unit(),
                jitter != null ? jitter : env.jitter(),
                jitterMin != null ? jitterMin : env.jitterMin(),
                jitterMax != null ? jitterMax : env.jitterMax(),
                immediateFirstRetry != null ? immediateFirstRetry : env.immediateFirstRetry(),
                seed != null ? seed : env.seed());
    }
}
