package org.prover.saturation;

/**
 * STATISTICHE DI SATURAZIONE - Contatori del ciclo given-clause
 *
 * Raccoglie le metriche aggiornate da Env e Saturate durante la ricerca e le presenta
 * nel formato a banner usato per il report finale.
 */
public class SaturationStatistics {

    //region CONTATORI CICLO

    /** Clausole estratte da passive e processate come given clause */
    private int givenClauses = 0;

    /** Given clause eliminate dalla semplificazione (ridondanti) */
    private int redundantGiven = 0;

    /** Clausole prodotte dalle regole generative */
    private int generatedClauses = 0;

    /** Clausole semplificate in avanti */
    private int forwardSimplified = 0;

    /** Clausole attive semplificate all'indietro */
    private int backwardSimplified = 0;

    /** Clausole attive sussunte da una given clause */
    private int subsumedActive = 0;

    /** Orfani rimossi da passive */
    private int orphansRemoved = 0;

    /** Clausole eliminate da passive durante la pulizia periodica */
    private int passiveCleaned = 0;

    /** Clausole rimosse dalle regole di eliminazione periodiche */
    private int clausesEliminated = 0;

    //endregion

    //region TIMING

    private long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    /**
     * Avvia immediatamente la misurazione del tempo.
     */
    public SaturationStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public void incrementGivenClauses() {
        givenClauses++;
    }

    public void incrementRedundantGiven() {
        redundantGiven++;
    }

    public void addGeneratedClauses(int n) {
        generatedClauses += n;
    }

    public void incrementForwardSimplified() {
        forwardSimplified++;
    }

    public void addBackwardSimplified(int n) {
        backwardSimplified += n;
    }

    public void addSubsumedActive(int n) {
        subsumedActive += n;
    }

    public void addOrphansRemoved(int n) {
        orphansRemoved += n;
    }

    public void addPassiveCleaned(int n) {
        passiveCleaned += n;
    }

    public void addClausesEliminated(int n) {
        clausesEliminated += n;
    }

    //endregion

    //region TIMING

    /**
     * Ferma il timer; chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    //region ACCESSORS

    public int getGivenClauses() {
        return givenClauses;
    }

    public int getRedundantGiven() {
        return redundantGiven;
    }

    public int getGeneratedClauses() {
        return generatedClauses;
    }

    public int getForwardSimplified() {
        return forwardSimplified;
    }

    public int getBackwardSimplified() {
        return backwardSimplified;
    }

    public int getSubsumedActive() {
        return subsumedActive;
    }

    public int getOrphansRemoved() {
        return orphansRemoved;
    }

    public int getPassiveCleaned() {
        return passiveCleaned;
    }

    public int getClausesEliminated() {
        return clausesEliminated;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("=========================[ SATURATION COMPLETED: SEARCH STATS ]=========================\n");
        output.append("    Given clause:        ").append(givenClauses).append("\n");
        output.append("    Given ridondanti:    ").append(redundantGiven).append("\n");
        output.append("    Clausole generate:   ").append(generatedClauses).append("\n");
        output.append("    Semplif. in avanti:  ").append(forwardSimplified).append("\n");
        output.append("    Semplif. indietro:   ").append(backwardSimplified).append("\n");
        output.append("    Attive sussunte:     ").append(subsumedActive).append("\n");

        if (orphansRemoved > 0) {
            output.append("    Orfani rimossi:      ").append(orphansRemoved).append("\n");
        }
        if (passiveCleaned > 0) {
            output.append("    Passive ripulite:    ").append(passiveCleaned).append("\n");
        }
        if (clausesEliminated > 0) {
            output.append("    Clausole eliminate:  ").append(clausesEliminated).append("\n");
        }

        output.append("    Tempo:               ").append(getExecutionTimeMs()).append("ms\n");
        output.append("========================================================================================\n");

        return output.toString();
    }

    /**
     * Formato su singola riga per i log.
     */
    public String toCompactString() {
        return String.format("Stats[Given:%d, Redund:%d, Gen:%d, Fwd:%d, Bwd:%d, Subs:%d, Time:%dms]",
                givenClauses, redundantGiven, generatedClauses, forwardSimplified,
                backwardSimplified, subsumedActive, getExecutionTimeMs());
    }

    //endregion
}
