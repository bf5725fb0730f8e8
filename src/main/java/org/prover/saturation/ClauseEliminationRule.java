package org.prover.saturation;

/**
 * Regola di eliminazione invocata periodicamente dal ciclo di saturazione.
 */
@FunctionalInterface
public interface ClauseEliminationRule {

    /**
     * @return numero di clausole rimosse
     */
    int eliminate(Env env);
}
