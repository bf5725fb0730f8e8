package org.prover.saturation;

import org.prover.support.Clause;

/**
 * Semplificazione unaria: restituisce la clausola stessa se non cambia nulla,
 * altrimenti un sostituto giustificato da un passo SIMPLIFICATION.
 */
@FunctionalInterface
public interface SimplificationRule {

    Clause simplify(Env env, Clause c);
}
