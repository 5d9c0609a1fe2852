package io.backoff.runtime;

import java.util.ArrayList;
import java.util.List;

/** Lists what a backoff would wait for, without running anything. */
public final class Simulation {
    private Simulation() {}

    /**
     * The base and jittered delays for retries 1..retries. The list ends early, on the first retry that
     * would not happen.
     */
    public static List<SimulatedDelay> of(Backoff backoff, int retries) {
        List<SimulatedDelay> out = new ArrayList<>();
        if (retries < 1) return out;

        List<Double> jittered = backoff.simulate(1, retries);
        DelayCalculator calculator = backoff.delayCalculator();
        for (int retry = 1; retry <= retries; retry++) {
            SimulatedDelay delay = new SimulatedDelay(retry, calculator.getBaseDelay(retry), jittered.get(retry - 1), backoff.getUnit());
            out.add(delay);
            if (delay.stops()) break;
        }
        return out;
    }
}
