package org.prover.saturation;

import org.prover.support.Clause;

import java.util.List;

/**
 * Regola generativa senza given clause, invocata quando passive si esaurisce.
 */
@FunctionalInterface
public interface GenerateRule {

    /**
     * @param full true nel controllo finale di saturazione
     */
    List<Clause> generate(Env env, boolean full);
}
