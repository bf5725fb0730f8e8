package org.prover.saturation;

import org.prover.support.Clause;

/**
 * Predicato di sussunzione: vero se {@code subsumer} sussume {@code subsumed}.
 */
@FunctionalInterface
public interface SubsumptionCheck {

    boolean subsumes(Clause subsumer, Clause subsumed);
}
