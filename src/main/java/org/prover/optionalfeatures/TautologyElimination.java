package org.prover.optionalfeatures;

import org.prover.saturation.TrivialityCheck;
import org.prover.support.Clause;
import org.prover.support.Literal;

import java.util.List;

/**
 * Riconosce le tautologie: un letterale ⊤ o t = t, oppure due letterali complementari.
 */
public class TautologyElimination implements TrivialityCheck {

    @Override
    public boolean isTrivial(Clause c) {
        List<Literal> lits = c.getLiterals();
        for (int i = 0; i < lits.size(); i++) {
            Literal a = lits.get(i);
            if (a.isTrivial()) return true;
            for (int j = i + 1; j < lits.size(); j++) {
                if (a.isComplementOf(lits.get(j))) return true;
            }
        }
        return false;
    }
}
