package io.backoff.runtime;

/**
 * How an attempt ended.
 */
public record AttemptOutcome(Kind kind, Object result, Exception exception) {

    public enum Kind { PENDING, SUCCESS, EXCEPTION, INVALID_RESULT }

    private static final AttemptOutcome PENDING = new AttemptOutcome(Kind.PENDING, null, null);

    public static AttemptOutcome pending() { return PENDING; }
    public static AttemptOutcome success(Object result) { return new AttemptOutcome(Kind.SUCCESS, result, null); }
    public static AttemptOutcome exception(Exception e) { return new AttemptOutcome(Kind.EXCEPTION, null, e); }
    public static AttemptOutcome invalidResult(Object result) { return new AttemptOutcome(Kind.INVALID_RESULT, result, null); }

    public boolean isSuccess() { return kind == Kind.SUCCESS; }
    public boolean isFailure() { return kind == Kind.EXCEPTION || kind == Kind.INVALID_RESULT; }
}
