package org.prover.saturation;

import java.util.Objects;

/**
 * RISULTATO DELLA SATURAZIONE - Stato finale, numero di passi eseguiti e statistiche
 */
public class SaturationResult {

    private final SZSStatus status;

    /** Numero di passi given-clause completati prima di raggiungere lo stato */
    private final int steps;

    private final SaturationStatistics statistics;

    public SaturationResult(SZSStatus status, int steps, SaturationStatistics statistics) {
        if (steps < 0) {
            throw new IllegalArgumentException("Numero di passi negativo: " + steps);
        }
        this.status = Objects.requireNonNull(status, "status");
        this.steps = steps;
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    public SZSStatus getStatus() {
        return status;
    }

    public int getSteps() {
        return steps;
    }

    public SaturationStatistics getStatistics() {
        return statistics;
    }

    public boolean isUnsat() {
        return status.isUnsat();
    }

    public boolean isSat() {
        return status.isSat();
    }

    @Override
    public String toString() {
        return "SaturationResult[" + status + ", passi=" + steps + "]";
    }
}
