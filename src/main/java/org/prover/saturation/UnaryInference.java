package org.prover.saturation;

import org.prover.support.Clause;

import java.util.List;

/**
 * Inferenza generativa che usa solo la given clause.
 */
@FunctionalInterface
public interface UnaryInference {

    List<Clause> infer(Clause c);
}
