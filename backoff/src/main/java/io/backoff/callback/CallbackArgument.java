package io.backoff.callback;

import java.util.Objects;

/**
 * A value offered to a callback batch. The kind is what the value is known to be, even when it is null.
 */
public record CallbackArgument(Class<?> kind, Object value) {
    public CallbackArgument {
        Objects.requireNonNull(kind, "kind");
    }

    public static CallbackArgument of(Class<?> kind, Object value) {
        return new CallbackArgument(kind, value);
    }
}
