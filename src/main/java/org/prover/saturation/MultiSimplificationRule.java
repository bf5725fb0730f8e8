package org.prover.saturation;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Clause;

import java.util.List;

/**
 * Semplificazione che può sostituire una clausola con più clausole.
 */
@FunctionalInterface
public interface MultiSimplificationRule {

    /**
     * @return null se la regola non si applica; altrimenti i sostituti (lista vuota = cancellazione)
     */
    @Nullable List<Clause> simplify(Env env, Clause c);
}
