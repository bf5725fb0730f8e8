package org.prover.saturation;

import org.prover.support.Clause;

import java.util.Collection;

/**
 * Individua le clausole attive che potrebbero essere semplificate usando la given clause.
 * La semplificazione effettiva è poi svolta dalle regole in avanti.
 */
@FunctionalInterface
public interface BackwardSimplificationRule {

    Collection<Clause> candidates(Env env, Clause given);
}
