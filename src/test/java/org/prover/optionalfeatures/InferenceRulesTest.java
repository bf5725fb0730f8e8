package org.prover.optionalfeatures;

import org.junit.jupiter.api.Test;
import org.prover.TestSignature;
import org.prover.saturation.Context;
import org.prover.saturation.Env;
import org.prover.saturation.EtaMode;
import org.prover.saturation.SaturationConfiguration;
import org.prover.support.Clause;
import org.prover.support.Literal;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InferenceRulesTest {

    private final TestSignature s = new TestSignature();
    private final Context context = new Context(s.factory, new KnuthBendixOrdering(), EtaMode.REDUCE);
    private final Env env = new Env(context, new FifoSelection(), SaturationConfiguration.defaults());
    private final Unifier unifier = new Unifier(context.getLambda());

    //region RISOLUZIONE

    @Test
    void resolutionWithActivePartner() {
        Clause fact = s.clause("fact", s.pos(s.app(s.p, s.app(s.f, s.a))));
        Clause rule = s.clause("rule", s.neg(s.app(s.p, s.x0)), s.pos(s.app(s.q, s.x0)));
        env.addActive(fact);
        env.addActive(rule);

        List<Clause> resolvents = new BinaryResolution(unifier).infer(env, rule);
        assertEquals(1, resolvents.size());
        Clause resolvent = resolvents.get(0);
        assertEquals(List.of(s.pos(s.app(s.q, s.app(s.f, s.a)))), resolvent.getLiterals());
        assertEquals(List.of(rule, fact), resolvent.getParents());
        assertEquals(BinaryResolution.RULE_NAME, resolvent.getProof().getRuleName());
    }

    @Test
    void partnerVariablesAreRenamedApart() {
        Clause given = s.clause("given", s.pos(s.app(s.r, s.x0, s.a)));
        Clause partner = s.clause("partner", s.neg(s.app(s.r, s.b, s.x0)), s.pos(s.app(s.p, s.x0)));
        env.addActive(partner);
        env.addActive(given);

        List<Clause> resolvents = new BinaryResolution(unifier).infer(env, given);
        assertEquals(1, resolvents.size());
        assertEquals(List.of(s.pos(s.app(s.p, s.a))), resolvents.get(0).getLiterals());
    }

    @Test
    void equationalLiteralsResolveInEitherOrientation() {
        Clause given = s.clause("given", s.eq(s.app(s.f, s.x0), s.b));
        Clause partner = s.clause("partner", s.neq(s.b, s.app(s.f, s.a)));
        env.addActive(partner);
        env.addActive(given);

        List<Clause> resolvents = new BinaryResolution(unifier).infer(env, given);
        assertEquals(1, resolvents.size());
        assertTrue(resolvents.get(0).isEmpty());
    }

    @Test
    void selfResolutionHasSingleParent() {
        Clause given = s.clause("given", s.neg(s.app(s.p, s.x0)), s.pos(s.app(s.p, s.app(s.f, s.x0))));
        env.addActive(given);
        List<Clause> resolvents = new BinaryResolution(unifier).infer(env, given);
        assertFalse(resolvents.isEmpty());
        assertTrue(resolvents.stream().allMatch(c -> c.getParents().equals(List.of(given))));
    }

    //endregion

    @Test
    void factoringMergesUnifiablePositiveLiterals() {
        Clause c = s.clause("c", s.pos(s.app(s.p, s.x0)), s.pos(s.app(s.p, s.a)), s.neg(s.app(s.q, s.x0)));
        List<Clause> factors = new Factoring(unifier, context).infer(c);
        assertEquals(1, factors.size());
        assertEquals(List.of(s.pos(s.app(s.p, s.a)), s.neg(s.app(s.q, s.a))), factors.get(0).getLiterals());
        assertTrue(new Factoring(unifier, context).infer(s.clause("neg",
                s.neg(s.app(s.p, s.x0)), s.neg(s.app(s.p, s.a)))).isEmpty());
    }

    @Test
    void tautologiesAreRecognised() {
        TautologyElimination tautology = new TautologyElimination();
        assertTrue(tautology.isTrivial(s.clause("t1", s.pos(s.app(s.q, s.a)), s.neg(s.app(s.q, s.a)))));
        assertTrue(tautology.isTrivial(s.clause("t2", s.eq(s.b, s.b))));
        assertTrue(tautology.isTrivial(s.clause("t3", Literal.mkTrue())));
        assertFalse(tautology.isTrivial(s.clause("t4", s.pos(s.app(s.q, s.a)), s.neg(s.app(s.q, s.b)))));
    }

    @Test
    void duplicateLiteralsAreDropped() {
        DuplicateLiteralElimination duplicates = new DuplicateLiteralElimination();
        Clause c = s.clause("c", s.pos(s.app(s.p, s.a)), s.neg(s.app(s.q, s.b)), s.pos(s.app(s.p, s.a)));
        Clause simplified = duplicates.simplify(env, c);
        assertEquals(List.of(s.pos(s.app(s.p, s.a)), s.neg(s.app(s.q, s.b))), simplified.getLiterals());
        Clause clean = s.clause("clean", s.pos(s.app(s.p, s.a)));
        assertSame(clean, duplicates.simplify(env, clean));
    }

    @Test
    void unitSimplificationUsesSimplSet() {
        UnitSimplifyReflect unit = new UnitSimplifyReflect(unifier);
        Clause fact = s.clause("fact", s.pos(s.app(s.p, s.x0)));
        Clause c = s.clause("c", s.neg(s.app(s.p, s.b)), s.pos(s.app(s.q, s.a)));
        assertSame(c, unit.simplify(env, c));

        env.addSimpl(fact);
        Clause simplified = unit.simplify(env, c);
        assertEquals(List.of(s.pos(s.app(s.q, s.a))), simplified.getLiterals());
        assertEquals(List.of(c, fact), simplified.getParents());

        fact.markRedundant();
        assertSame(c, unit.simplify(env, c));
    }

    @Test
    void unitCandidatesForBackwardSimplification() {
        UnitSimplifyReflect unit = new UnitSimplifyReflect(unifier);
        Clause target = s.clause("target", s.neg(s.app(s.p, s.a)), s.pos(s.app(s.q, s.a)));
        Clause other = s.clause("other", s.pos(s.app(s.q, s.b)));
        env.addActive(target);
        env.addActive(other);

        Clause given = s.clause("given", s.pos(s.app(s.p, s.x0)));
        assertEquals(List.of(target), unit.candidates(env, given));
        Clause nonUnit = s.clause("nonUnit", s.pos(s.app(s.p, s.x0)), s.pos(s.app(s.q, s.x0)));
        assertTrue(unit.candidates(env, nonUnit).isEmpty());
    }
}
