package org.prover.saturation;

import org.prover.support.Clause;

/**
 * Riconosce clausole banalmente vere (tautologie), da scartare.
 */
@FunctionalInterface
public interface TrivialityCheck {

    boolean isTrivial(Clause c);
}
