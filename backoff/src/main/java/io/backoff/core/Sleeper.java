package io.backoff.core;

/**
 * Boundary that actually waits for a computed delay. The engine itself never blocks.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(double delay, DelayUnit unit);

    /** Blocks the calling thread. An interrupt ends the wait early and leaves the interrupt flag set. */
    static Sleeper blocking() {
        return (delay, unit) -> {
            long nanos = unit.toNanos(delay);
            if (nanos <= 0) return;
            try {
                Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        };
    }
}
