package org.prover.optionalfeatures;

import org.jetbrains.annotations.Nullable;
import org.prover.saturation.BackwardSimplificationRule;
import org.prover.saturation.Env;
import org.prover.saturation.SimplificationRule;
import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.ProofStep;
import org.prover.support.Substitution;

import java.util.ArrayList;
import java.util.List;

/**
 * SEMPLIFICAZIONE UNITARIA - Rimozione di letterali contraddetti da clausole unitarie
 *
 * Se l'insieme simpl contiene una clausola unitaria {M} e un letterale L della clausola
 * è un'istanza di ¬M, L viene rimosso: la nuova clausola ha come genitori la clausola
 * originale e le unitarie usate.
 *
 * In versione all'indietro, una given clause unitaria segnala come candidate le clausole
 * attive che contengono un letterale che essa contraddice.
 */
public class UnitSimplifyReflect implements SimplificationRule, BackwardSimplificationRule {

    public static final String RULE_NAME = "unit_simplify_reflect";

    private final Unifier unifier;

    public UnitSimplifyReflect(Unifier unifier) {
        this.unifier = unifier;
    }

    @Override
    public Clause simplify(Env env, Clause c) {
        if (c.hasNoLiterals()) {
            return c;
        }
        List<Clause> units = new ArrayList<>();
        for (Clause d : env.getProofState().getSimpl()) {
            if (d.isUnit() && d != c && !d.isRedundant()) units.add(d);
        }
        if (units.isEmpty()) {
            return c;
        }
        List<Literal> kept = new ArrayList<>(c.size());
        List<Clause> parents = new ArrayList<>();
        parents.add(c);
        for (Literal lit : c.getLiterals()) {
            Clause unit = findContradicting(units, lit);
            if (unit == null) {
                kept.add(lit);
            } else if (!parents.contains(unit)) {
                parents.add(unit);
            }
        }
        if (parents.size() == 1) {
            return c;
        }
        return env.getContext().mkClause(kept, ProofStep.mkSimplification(RULE_NAME, parents));
    }

    @Override
    public List<Clause> candidates(Env env, Clause given) {
        List<Clause> result = new ArrayList<>();
        if (!given.isUnit()) {
            return result;
        }
        List<Clause> unit = List.of(given);
        for (Clause d : env.getProofState().getActive()) {
            if (d == given) continue;
            for (Literal lit : d.getLiterals()) {
                if (findContradicting(unit, lit) != null) {
                    result.add(d);
                    break;
                }
            }
        }
        return result;
    }

    private @Nullable Clause findContradicting(List<Clause> units, Literal lit) {
        if (lit.getKind() != Literal.Kind.PROP && lit.getKind() != Literal.Kind.EQUATION) {
            return null;
        }
        for (Clause u : units) {
            Literal pattern = u.getLiterals().get(0).negate();
            if (unifier.matchLiteral(pattern, lit, new Substitution())) {
                return u;
            }
        }
        return null;
    }
}
