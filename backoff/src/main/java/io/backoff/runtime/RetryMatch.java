package io.backoff.runtime;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One rule deciding whether an exception or a result should be retried, optionally carrying a default
 * to return when the attempts run out because of it.
 */
final class RetryMatch {
    private final Class<? extends Exception> type;
    private final Predicate<Object> predicate;
    private final Object value;
    private final boolean matchesAll;
    private final boolean strict;
    private final DefaultValue defaultValue;

    private RetryMatch(Class<? extends Exception> type, Predicate<Object> predicate, Object value,
                       boolean matchesAll, boolean strict, DefaultValue defaultValue) {
        this.type = type;
        this.predicate = predicate;
        this.value = value;
        this.matchesAll = matchesAll;
        this.strict = strict;
        this.defaultValue = defaultValue;
    }

    static RetryMatch all(DefaultValue defaultValue) {
        return new RetryMatch(null, null, null, true, false, defaultValue);
    }

    static RetryMatch type(Class<? extends Exception> type, DefaultValue defaultValue) {
        return new RetryMatch(Objects.requireNonNull(type, "type"), null, null, false, false, defaultValue);
    }

    @SuppressWarnings("unchecked")
    static RetryMatch predicate(Predicate<?> predicate, DefaultValue defaultValue) {
        return new RetryMatch(null, (Predicate<Object>) Objects.requireNonNull(predicate, "predicate"), null, false, false, defaultValue);
    }

    static RetryMatch value(Object value, boolean strict, DefaultValue defaultValue) {
        return new RetryMatch(null, null, value, false, strict, defaultValue);
    }

    boolean matchesAll() { return matchesAll; }
    boolean hasDefault() { return defaultValue != null; }
    DefaultValue defaultValue() { return defaultValue; }

    boolean matchesException(Exception e) {
        if (matchesAll) return true;
        if (type != null) return type.isInstance(e);
        return predicate != null && predicate.test(e);
    }

    boolean matchesResult(Object result) {
        if (predicate != null) return predicate.test(result);
        return strict ? Objects.equals(value, result) : looselyEquals(value, result);
    }

    /** Numbers compare by value, and a string equals anything whose string form is the same. */
    static boolean looselyEquals(Object a, Object b) {
        if (Objects.equals(a, b)) return true;
        if (a == null || b == null) return false;
        if (a instanceof Number x && b instanceof Number y) return x.doubleValue() == y.doubleValue();
        if (a instanceof String || b instanceof String) return String.valueOf(a).equals(String.valueOf(b));
        return false;
    }
}
