package org.prover.optionalfeatures;

import org.jetbrains.annotations.Nullable;
import org.prover.saturation.BinaryInference;
import org.prover.saturation.Context;
import org.prover.saturation.Env;
import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.ProofStep;
import org.prover.support.Substitution;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * RISOLUZIONE BINARIA - Inferenza fra la given clause e ogni clausola attiva
 *
 * Da C ∨ L e D ∨ ¬L' con σ = mgu(L, L') deriva (C ∨ D)σ. La clausola attiva viene
 * rinominata per separarne le variabili da quelle della given; la given stessa è fra
 * le clausole attive, quindi si ottengono anche le autorisoluzioni.
 * I letterali che non rispettano la restrizione dei pattern vengono ignorati.
 */
public class BinaryResolution implements BinaryInference {

    private static final Logger LOGGER = Logger.getLogger(BinaryResolution.class.getName());

    public static final String RULE_NAME = "resolution";

    private final Unifier unifier;

    public BinaryResolution(Unifier unifier) {
        this.unifier = unifier;
    }

    @Override
    public List<Clause> infer(Env env, Clause given) {
        Context ctx = env.getContext();
        List<Clause> result = new ArrayList<>();
        for (Clause partner : env.getProofState().getActive().snapshot()) {
            resolve(ctx, given, partner, result);
        }
        LOGGER.finest(() -> "Risoluzione su " + given.getId() + ": " + result.size() + " risolventi");
        return result;
    }

    private void resolve(Context ctx, Clause given, Clause partner, List<Clause> out) {
        int offset = given.maxVarId() + 1;
        List<Literal> renamed = new ArrayList<>(partner.size());
        for (Literal lit : partner.getLiterals()) {
            renamed.add(unifier.shiftVars(lit, offset));
        }
        List<Literal> givenLits = given.getLiterals();
        for (int i = 0; i < givenLits.size(); i++) {
            Literal a = givenLits.get(i);
            if (!isResolvable(a)) continue;
            for (int j = 0; j < renamed.size(); j++) {
                Literal b = renamed.get(j);
                if (!isResolvable(b) || a.isPositive() == b.isPositive() || a.getKind() != b.getKind()) continue;
                Substitution sigma = unifyLiterals(a, b);
                if (sigma == null) continue;

                List<Literal> lits = new ArrayList<>();
                for (int k = 0; k < givenLits.size(); k++) {
                    if (k != i) lits.add(givenLits.get(k).apply(unifier.getFactory(), sigma));
                }
                for (int k = 0; k < renamed.size(); k++) {
                    if (k != j) lits.add(renamed.get(k).apply(unifier.getFactory(), sigma));
                }
                List<Clause> parents = given == partner ? List.of(given) : List.of(given, partner);
                out.add(ctx.mkClause(lits, ProofStep.mkInference(RULE_NAME, parents)));
            }
        }
    }

    private boolean isResolvable(Literal lit) {
        if (lit.getKind() != Literal.Kind.PROP && lit.getKind() != Literal.Kind.EQUATION) {
            return false;
        }
        return lit.terms().stream().allMatch(unifier::isSupported);
    }

    /**
     * Unificatore di due letterali dello stesso tipo (segno ignorato), null se non esiste.
     */
    @Nullable Substitution unifyLiterals(Literal a, Literal b) {
        if (a.getKind() == Literal.Kind.PROP) {
            return unifier.unify(a.getAtom(), b.getAtom());
        }
        Substitution direct = new Substitution();
        if (unifier.unifyInto(a.getLhs(), b.getLhs(), direct) && unifier.unifyInto(a.getRhs(), b.getRhs(), direct)) {
            return direct;
        }
        Substitution swapped = new Substitution();
        if (unifier.unifyInto(a.getLhs(), b.getRhs(), swapped) && unifier.unifyInto(a.getRhs(), b.getLhs(), swapped)) {
            return swapped;
        }
        return null;
    }
}
