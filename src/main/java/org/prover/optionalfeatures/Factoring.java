package org.prover.optionalfeatures;

import org.prover.saturation.Context;
import org.prover.saturation.UnaryInference;
import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.ProofStep;
import org.prover.support.Substitution;

import java.util.ArrayList;
import java.util.List;

/**
 * Fattorizzazione positiva: da C ∨ L ∨ L' con σ = mgu(L, L') deriva (C ∨ L)σ.
 */
public class Factoring implements UnaryInference {

    public static final String RULE_NAME = "factoring";

    private final Unifier unifier;
    private final Context context;

    public Factoring(Unifier unifier, Context context) {
        this.unifier = unifier;
        this.context = context;
    }

    @Override
    public List<Clause> infer(Clause c) {
        List<Clause> result = new ArrayList<>();
        List<Literal> lits = c.getLiterals();
        for (int i = 0; i < lits.size(); i++) {
            Literal a = lits.get(i);
            if (!a.isPositive() || !a.isPredicateLit() || !unifier.isSupported(a.getAtom())) continue;
            for (int j = i + 1; j < lits.size(); j++) {
                Literal b = lits.get(j);
                if (!b.isPositive() || !b.isPredicateLit() || !unifier.isSupported(b.getAtom())) continue;
                Substitution sigma = unifier.unify(a.getAtom(), b.getAtom());
                if (sigma == null) continue;
                List<Literal> out = new ArrayList<>(lits.size() - 1);
                for (int k = 0; k < lits.size(); k++) {
                    if (k != j) out.add(lits.get(k).apply(unifier.getFactory(), sigma));
                }
                result.add(context.mkClause(out, ProofStep.mkInference(RULE_NAME, List.of(c))));
            }
        }
        return result;
    }
}
