package io.backoff.error;

/**
 * Invalid static configuration, detected when a component is constructed.
 */
public class BackoffInitialisationException extends BackoffException {
    public BackoffInitialisationException(String message) {
        super(message);
    }

    public static BackoffInitialisationException minGreaterThanMax(double min, double max) {
        return new BackoffInitialisationException("A min value (" + min + ") was given that is greater than the max value (" + max + ")");
    }

    public static BackoffInitialisationException invalidUnit(String unit) {
        return new BackoffInitialisationException("Invalid unit type \"" + unit + "\" was given");
    }

    public static BackoffInitialisationException unknownAlgorithm(String name) {
        return new BackoffInitialisationException("Unknown backoff algorithm \"" + name + "\"");
    }

    public static BackoffInitialisationException unknownJitter(String name) {
        return new BackoffInitialisationException("Unknown jitter \"" + name + "\"");
    }
}
