package io.backoff.config;

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
import io.backoff.jitter.EqualJitter;
import io.backoff.jitter.FullJitter;
import io.backoff.jitter.RangeJitter;
import io.backoff.runtime.Backoff;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Random;

/**
 * A backoff described by plain settings, read from system properties ({@code backoff.*}) falling back to
 * environment variables ({@code BACKOFF_*}).
 *
 * @param algorithm    fixed, linear, exponential, polynomial, fibonacci, decorrelated, random, sequence, noop or none
 * @param initialDelay the first delay (the minimum for random, the base for decorrelated)
 * @param parameter    the algorithm's second argument: linear increase, exponential factor, polynomial power,
 *                     decorrelated multiplier, random maximum. Null for the algorithm's default
 * @param jitter       none, full, equal or range
 * @param seed         seeds the random generator shared by the algorithm and the jitter, null for unseeded
 */
public record BackoffConfig(
        String algorithm,
        double initialDelay,
        Double parameter,
        List<Double> sequence,
        boolean repeatLast,
        Integer maxAttempts,
        Double maxDelay,
        String unit,
        String jitter,
        double jitterMin,
        double jitterMax,
        boolean immediateFirstRetry,
        Long seed
) {
    public static BackoffConfig fromEnv() {
        return from(System.getProperties(), System.getenv());
    }

    public static BackoffConfig from(Properties props, Map<String, String> env) {
        String algorithm = read(props, env, "algorithm", "exponential");
        double initial = Double.parseDouble(read(props, env, "initial", "1"));
        Double parameter = optionalDouble(read(props, env, "parameter", ""));
        List<Double> sequence = parseList(read(props, env, "sequence", ""));
        boolean repeatLast = Boolean.parseBoolean(read(props, env, "repeat_last", "false"));
        String attempts = read(props, env, "max_attempts", "5");
        Integer maxAttempts = attempts.isBlank() ? null : Integer.valueOf(attempts.trim());
        Double maxDelay = optionalDouble(read(props, env, "max_delay", ""));
        String unit = read(props, env, "unit", "seconds");
        String jitter = read(props, env, "jitter", "none");
        double jitterMin = Double.parseDouble(read(props, env, "jitter_min", "0"));
        double jitterMax = Double.parseDouble(read(props, env, "jitter_max", "1"));
        boolean immediate = Boolean.parseBoolean(read(props, env, "immediate_first_retry", "false"));
        String seed = read(props, env, "seed", "");
        Long parsedSeed = seed.isBlank() ? null : Long.valueOf(seed.trim());
        return new BackoffConfig(algorithm, initial, parameter, sequence, repeatLast, maxAttempts, maxDelay,
                unit, jitter, jitterMin, jitterMax, immediate, parsedSeed);
    }

    /** backoff.max_delay as a system property, BACKOFF_MAX_DELAY in the environment. */
    private static String read(Properties props, Map<String, String> env, String key, String def) {
        return props.getProperty("backoff." + key, env.getOrDefault("BACKOFF_" + key.toUpperCase(Locale.ROOT), def));
    }

    private static Double optionalDouble(String value) {
        return value == null || value.isBlank() ? null : Double.valueOf(value.trim());
    }

    private static List<Double> parseList(String value) {
        List<Double> out = new ArrayList<>();
        if (value == null || value.isBlank()) return out;
        for (String part : value.split(",")) {
            if (!part.isBlank()) out.add(Double.valueOf(part.trim()));
        }
        return out;
    }

    /**
     * @throws BackoffInitialisationException for an unknown algorithm, jitter or unit, or an invalid range
     */
    public Backoff toBackoff() {
        Random random = seed == null ? null : new Random(seed);
        return Backoff.of(buildAlgorithm(random))
                .customJitter(buildJitter(random))
                .maxAttempts(maxAttempts)
                .maxDelay(maxDelay)
                .unit(DelayUnit.fromToken(unit))
                .immediateFirstRetry(immediateFirstRetry);
    }

    private BackoffAlgorithm buildAlgorithm(Random random) {
        String name = algorithm == null ? "" : algorithm.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "fixed" -> new FixedBackoffAlgorithm(initialDelay);
            case "linear" -> parameter == null ? new LinearBackoffAlgorithm(initialDelay) : new LinearBackoffAlgorithm(initialDelay, parameter);
            case "exponential" -> parameter == null ? new ExponentialBackoffAlgorithm(initialDelay) : new ExponentialBackoffAlgorithm(initialDelay, parameter);
            case "polynomial" -> parameter == null ? new PolynomialBackoffAlgorithm(initialDelay) : new PolynomialBackoffAlgorithm(initialDelay, parameter);
            case "fibonacci" -> new FibonacciBackoffAlgorithm(initialDelay);
            case "decorrelated" -> new DecorrelatedBackoffAlgorithm(initialDelay, parameter == null ? 3 : parameter, random);
            case "random" -> new RandomBackoffAlgorithm(initialDelay, parameter == null ? initialDelay : parameter, random);
            case "sequence" -> new SequenceBackoffAlgorithm(sequence == null ? List.of() : sequence, repeatLast);
            case "noop" -> new NoopBackoffAlgorithm();
            case "none" -> new NoBackoffAlgorithm();
            default -> throw BackoffInitialisationException.unknownAlgorithm(algorithm);
        };
    }

    private Jitter buildJitter(Random random) {
        String name = jitter == null ? "none" : jitter.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "", "none" -> null;
            case "full" -> new FullJitter(random);
            case "equal" -> new EqualJitter(random);
            case "range" -> new RangeJitter(jitterMin, jitterMax, random);
            default -> throw BackoffInitialisationException.unknownJitter(jitter);
        };
    }
}
