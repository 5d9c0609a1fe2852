package io.backoff.runtime;

import java.util.function.Supplier;

/**
 * A value to hand back instead of re-throwing once every attempt failed. Holding null is a valid default.
 */
final class DefaultValue {
    private final Supplier<?> supplier;

    private DefaultValue(Supplier<?> supplier) {
        this.supplier = supplier;
    }

    static DefaultValue of(Object value) { return new DefaultValue(() -> value); }

    static DefaultValue from(Supplier<?> supplier) { return new DefaultValue(supplier); }

    Object resolve() { return supplier.get(); }
}
