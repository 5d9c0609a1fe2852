package io.backoff.callback;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Helpers for callback registration. */
public final class Callbacks {
    private Callbacks() {}

    /**
     * Flatten callbacks given individually, as arrays, or as (nested) collections into one ordered list.
     *
     * @throws IllegalArgumentException when an element is neither a callback nor a collection of them
     */
    public static List<BackoffCallback> flatten(Object... callbacks) {
        List<BackoffCallback> out = new ArrayList<>();
        for (Object c : callbacks) add(out, c);
        return out;
    }

    private static void add(List<BackoffCallback> out, Object c) {
        if (c instanceof BackoffCallback cb) {
            out.add(cb);
        } else if (c instanceof Collection<?> many) {
            for (Object o : many) add(out, o);
        } else if (c instanceof Object[] many) {
            for (Object o : many) add(out, o);
        } else {
            throw new IllegalArgumentException("Not a callback: " + c);
        }
    }
}
