package io.backoff.algorithm;

import io.backoff.core.BackoffAlgorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Uses the given delays in order. Once they run out, either repeats the last one or stops.
 * A null entry ends the sequence at that position.
 */
public class SequenceBackoffAlgorithm implements BackoffAlgorithm {
    private final List<Double> delays;
    private final boolean repeatLast;

    public SequenceBackoffAlgorithm(List<? extends Number> delays) {
        this(delays, false);
    }

    public SequenceBackoffAlgorithm(List<? extends Number> delays, boolean repeatLast) {
        List<Double> copy = new ArrayList<>(delays.size());
        for (Number d : delays) {
            if (d == null) break;
            copy.add(d.doubleValue());
        }
        this.delays = Collections.unmodifiableList(copy);
        this.repeatLast = repeatLast;
    }

    @Override
    public Double nextBaseDelay(int retryNumber, Double previousBaseDelay) {
        int index = retryNumber - 1;
        if (index >= 0 && index < delays.size()) return delays.get(index);
        if (repeatLast && !delays.isEmpty()) return delays.get(delays.size() - 1);
        return null;
    }

    public List<Double> delays() { return delays; }
}
