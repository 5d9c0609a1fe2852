package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

/** Delays following initialDelay * retryNumber^power. */
public class PolynomialBackoffAlgorithm implements BackoffAlgorithm {
    public static final double DEFAULT_POWER = 2.0;

    private final double initialDelay;
    private final double power;

    public PolynomialBackoffAlgorithm(double initialDelay) {
        this(initialDelay, DEFAULT_POWER);
    }

    public PolynomialBackoffAlgorithm(double initialDelay, double power) {
        this.initialDelay = initialDelay;
        this.power = power;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        return initialDelay * Math.pow(retryNumber, power);
    }
}
