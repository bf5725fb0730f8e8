package org.prover.saturation;

import org.prover.support.Clause;

import java.util.List;

/**
 * Inferenza generativa fra la given clause e l'insieme active (given inclusa).
 */
@FunctionalInterface
public interface BinaryInference {

    List<Clause> infer(Env env, Clause given);
}
