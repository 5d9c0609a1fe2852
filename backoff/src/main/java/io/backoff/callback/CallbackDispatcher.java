package io.backoff.callback;

import java.util.List;
import java.util.Optional;

/**
 * Calls a batch of callbacks, giving each one the arguments its declared parameter types ask for.
 */
public final class CallbackDispatcher {
    private CallbackDispatcher() {}

    /**
     * Invoke the callbacks in order. Callbacks whose parameters can't all be satisfied are skipped.
     * An exception thrown by a callback stops the batch and is propagated.
     *
     * @return the number of callbacks that were invoked
     */
    public static int dispatch(List<BackoffCallback> callbacks, List<CallbackArgument> available) throws Exception {
        int called = 0;
        for (BackoffCallback callback : callbacks) {
            Optional<Object[]> args = resolve(callback, available);
            if (args.isEmpty()) continue;
            callback.invoke(args.get());
            called++;
        }
        return called;
    }

    /**
     * Pick an argument for every declared parameter: an argument of exactly that kind first, then one whose
     * kind is a subtype, then one whose (non-null) value is an instance of the parameter type.
     */
    public static Optional<Object[]> resolve(BackoffCallback callback, List<CallbackArgument> available) {
        List<Class<?>> types = callback.parameterTypes();
        Object[] args = new Object[types.size()];
        for (int i = 0; i < types.size(); i++) {
            Optional<CallbackArgument> match = find(types.get(i), available);
            if (match.isEmpty()) return Optional.empty();
            args[i] = match.get().value();
        }
        return Optional.of(args);
    }

    private static Optional<CallbackArgument> find(Class<?> type, List<CallbackArgument> available) {
        for (CallbackArgument arg : available) {
            if (arg.kind() == type) return Optional.of(arg);
        }
        for (CallbackArgument arg : available) {
            if (type.isAssignableFrom(arg.kind())) return Optional.of(arg);
        }
        for (CallbackArgument arg : available) {
            if (arg.value() != null && type.isInstance(arg.value())) return Optional.of(arg);
        }
        return Optional.empty();
    }
}
