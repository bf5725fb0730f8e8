package org.prover.saturation;

import org.prover.support.Clause;

/**
 * Riconosce clausole ridondanti rispetto allo stato corrente.
 */
@FunctionalInterface
public interface RedundancyCheck {

    boolean isRedundant(Env env, Clause c);
}
