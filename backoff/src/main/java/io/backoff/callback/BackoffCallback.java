package io.backoff.callback;

import java.util.List;
import java.util.Objects;

/**
 * A user callback together with the types of the arguments it wants.
 * <p>
 * The engine offers every callback batch a fixed list of arguments (the result, the exception, whether a
 * retry will follow, the current {@link io.backoff.runtime.AttemptLog}, all of the logs...). Each callback
 * only receives the ones matching its declared parameter types, in its own order:
 * <pre>{@code
 * BackoffCallback.of(AttemptLog.class, log -> ...);
 * BackoffCallback.of(Exception.class, Boolean.class, (e, willRetry) -> ...);
 * }</pre>
 * A callback asking for something the batch can't provide is skipped.
 */
public final class BackoffCallback {

    @FunctionalInterface public interface Action0 { void call() throws Exception; }
    @FunctionalInterface public interface Action1<A> { void call(A a) throws Exception; }
    @FunctionalInterface public interface Action2<A, B> { void call(A a, B b) throws Exception; }
    @FunctionalInterface public interface Action3<A, B, C> { void call(A a, B b, C c) throws Exception; }
    @FunctionalInterface public interface Action4<A, B, C, D> { void call(A a, B b, C c, D d) throws Exception; }

    @FunctionalInterface
    interface Invoker {
        void invoke(Object[] args) throws Exception;
    }

    private final List<Class<?>> parameterTypes;
    private final Invoker invoker;

    private BackoffCallback(List<Class<?>> parameterTypes, Invoker invoker) {
        this.parameterTypes = parameterTypes.stream().map(BackoffCallback::boxed).toList();
        this.invoker = invoker;
    }

    public static BackoffCallback of(Action0 action) {
        Objects.requireNonNull(action, "action");
        return new BackoffCallback(List.of(), args -> action.call());
    }

    public static <A> BackoffCallback of(Class<A> a, Action1<? super A> action) {
        Objects.requireNonNull(action, "action");
        return new BackoffCallback(List.of(a), args -> action.call(cast(a, args[0])));
    }

    public static <A, B> BackoffCallback of(Class<A> a, Class<B> b, Action2<? super A, ? super B> action) {
        Objects.requireNonNull(action, "action");
        return new BackoffCallback(List.of(a, b), args -> action.call(cast(a, args[0]), cast(b, args[1])));
    }

    public static <A, B, C> BackoffCallback of(Class<A> a, Class<B> b, Class<C> c, Action3<? super A, ? super B, ? super C> action) {
        Objects.requireNonNull(action, "action");
        return new BackoffCallback(List.of(a, b, c), args -> action.call(cast(a, args[0]), cast(b, args[1]), cast(c, args[2])));
    }

    public static <A, B, C, D> BackoffCallback of(Class<A> a, Class<B> b, Class<C> c, Class<D> d,
                                                  Action4<? super A, ? super B, ? super C, ? super D> action) {
        Objects.requireNonNull(action, "action");
        return new BackoffCallback(List.of(a, b, c, d),
                args -> action.call(cast(a, args[0]), cast(b, args[1]), cast(c, args[2]), cast(d, args[3])));
    }

    public List<Class<?>> parameterTypes() { return parameterTypes; }

    public int arity() { return parameterTypes.size(); }

    void invoke(Object[] args) throws Exception {
        invoker.invoke(args);
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Class<T> type, Object value) {
        return (T) boxed(type).cast(value);
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == boolean.class) return Boolean.class;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }

    @Override
    public String toString() {
        return "BackoffCallback" + parameterTypes.stream().map(Class::getSimpleName).toList();
    }
}
