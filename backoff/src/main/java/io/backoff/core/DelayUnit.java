package io.backoff.core;

import io.backoff.error.BackoffInitialisationException;

import java.util.Locale;

/**
 * The unit all delays of a backoff are expressed in.
 */
public enum DelayUnit {
    SECONDS("seconds", "s", 1_000_000),
    MILLISECONDS("milliseconds", "ms", 1_000),
    MICROSECONDS("microseconds", "us", 1);

    private final String token;
    private final String shortToken;
    private final long micros;

    DelayUnit(String token, String shortToken, long micros) {
        this.token = token;
        this.shortToken = shortToken;
        this.micros = micros;
    }

    public String token() { return token; }
    public String shortToken() { return shortToken; }

    /** Parse a unit token ("seconds", "milliseconds", "microseconds", or the short forms s, ms, us). */
    public static DelayUnit fromToken(String token) {
        if (token == null) throw BackoffInitialisationException.invalidUnit(null);
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "seconds", "s" -> SECONDS;
            case "milliseconds", "ms" -> MILLISECONDS;
            case "microseconds", "us" -> MICROSECONDS;
            default -> throw BackoffInitialisationException.invalidUnit(token);
        };
    }

    /** Convert a delay in this unit to another unit; null stays null. */
    public Double convert(Double delay, DelayUnit to) {
        if (delay == null) return null;
        if (to == this) return delay;
        return delay * micros / to.micros;
    }

    public long toNanos(double delay) {
        return (long) (delay * micros * 1_000);
    }
}
