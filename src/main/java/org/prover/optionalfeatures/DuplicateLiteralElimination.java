package org.prover.optionalfeatures;

import org.prover.saturation.Env;
import org.prover.saturation.SimplificationRule;
import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.ProofStep;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Elimina i letterali ripetuti, mantenendo la prima occorrenza.
 */
public class DuplicateLiteralElimination implements SimplificationRule {

    public static final String RULE_NAME = "duplicate_literals";

    @Override
    public Clause simplify(Env env, Clause c) {
        LinkedHashSet<Literal> distinct = new LinkedHashSet<>(c.getLiterals());
        if (distinct.size() == c.size()) {
            return c;
        }
        return env.getContext().mkClause(new ArrayList<>(distinct),
                ProofStep.mkSimplification(RULE_NAME, List.of(c)));
    }
}
