package io.backoff.runtime;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * Read-only, insertion-ordered view of the attempts made so far.
 */
public final class AttemptLogs extends AbstractList<AttemptLog> implements RandomAccess {
    private final List<AttemptLog> logs;

    public AttemptLogs(List<AttemptLog> logs) {
        this.logs = List.copyOf(logs);
    }

    @Override
    public AttemptLog get(int index) { return logs.get(index); }

    @Override
    public int size() { return logs.size(); }

    /** The most recent attempt, or null when none was made. */
    public AttemptLog last() { return logs.isEmpty() ? null : logs.get(logs.size() - 1); }
}
