package org.prover.saturation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.prover.optionalfeatures.BinaryResolution;
import org.prover.optionalfeatures.DefaultCalculus;
import org.prover.optionalfeatures.Unifier;
import org.prover.support.Clause;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SaturateTest extends AbstractSaturationTest {

    private Clause pa;
    private Clause pImpliesQ;
    private Clause notQa;

    private Env chainProblem(Env env) {
        pa = input("pa", s.pos(s.app(s.p, s.a)));
        pImpliesQ = input("rule", s.neg(s.app(s.p, s.x0)), s.pos(s.app(s.q, s.x0)));
        notQa = input("goal", s.neg(s.app(s.q, s.a)));
        env.addPassive(List.of(pa, pImpliesQ, notQa));
        return env;
    }

    //region ESITI

    @Test
    void refutesChainWithDefaultCalculus() {
        Env env = newEnv();
        DefaultCalculus.install(env);
        SaturationResult result = new Saturate(chainProblem(env)).givenClause();

        assertTrue(result.isUnsat());
        assertEquals(2, result.getSteps());
        Clause empty = result.getStatus().getEmptyClause();
        assertTrue(empty.isEmpty());

        ProofGenerator proof = ProofGenerator.of(result.getStatus());
        assertTrue(proof.isWellFounded());
        assertTrue(proof.getLeaves().containsAll(List.of(pa, pImpliesQ, notQa)));
        assertEquals(3, result.getStatistics().getGivenClauses());
    }

    @Test
    void refutesChainWithResolutionOnly() {
        Env env = newEnv();
        env.addBinaryInference(BinaryResolution.RULE_NAME,
                new BinaryResolution(new Unifier(context.getLambda())));
        SaturationResult result = new Saturate(chainProblem(env)).givenClause();

        assertTrue(result.isUnsat());
        assertEquals(3, result.getSteps());
        assertTrue(ProofGenerator.of(result.getStatus()).isWellFounded());
    }

    @Test
    void saturatedSetIsSatisfiable() {
        Env env = newEnv();
        DefaultCalculus.install(env);
        env.addPassive(input("pa", s.pos(s.app(s.p, s.a))));
        SaturationResult result = new Saturate(env).givenClause();

        assertTrue(result.isSat());
        assertEquals(1, result.getSteps());
        assertEquals(1, env.getProofState().getActive().size());
    }

    @Test
    void emptyInputIsSatisfiable() {
        SaturationResult result = new Saturate(newEnv()).givenClause();
        assertTrue(result.isSat());
        assertEquals(0, result.getSteps());
    }

    @Test
    void emptyInputClauseIsRefutedImmediately() {
        Env env = newEnv();
        env.addPassive(input("false"));
        SaturationResult result = new Saturate(env).givenClause();
        assertTrue(result.isUnsat());
        assertEquals(0, result.getSteps());
    }

    @Test
    void deadlineIsCheckedBeforeEachStep() {
        Env env = newEnv();
        DefaultCalculus.install(env);
        Saturate saturate = new Saturate(chainProblem(env), () -> 1_000L);
        SaturationResult result = saturate.givenClause(true, null, 1_000L);

        assertEquals(SZSStatus.Kind.TIMEOUT, result.getStatus().getKind());
        assertEquals(0, result.getSteps());
        assertEquals(3, env.getProofState().getPassive().size());
    }

    @Test
    void deadlineInTheFutureDoesNotInterrupt() {
        Env env = newEnv();
        DefaultCalculus.install(env);
        SaturationResult result = new Saturate(chainProblem(env), () -> 0L).givenClause(true, null, 1_000L);
        assertTrue(result.isUnsat());
    }

    @Test
    void stepBudgetGivesUnknown() {
        Env env = newEnv();
        DefaultCalculus.install(env);
        SaturationResult result = new Saturate(chainProblem(env)).givenClause(true, 1, null);

        assertEquals(SZSStatus.Kind.UNKNOWN, result.getStatus().getKind());
        assertEquals(1, result.getSteps());
        assertTrue(env.isActive(pa));
    }

    @Test
    void givenSubsumedByActiveClauseIsDropped() {
        Env env = newEnv();
        DefaultCalculus.install(env);
        Clause general = input("general", s.pos(s.app(s.p, s.x0)));
        Clause instance = input("instance", s.pos(s.app(s.p, s.a)), s.pos(s.app(s.q, s.b)));
        env.addPassive(List.of(general, instance));
        SaturationResult result = new Saturate(env).givenClause();

        assertTrue(result.isSat());
        assertEquals(1, result.getStatistics().getGivenClauses());
        assertEquals(1, result.getStatistics().getRedundantGiven());
        assertTrue(instance.isRedundant());
        assertEquals(List.of(general), env.getProofState().getActive().snapshot());
    }

    @Test
    void presaturationOnlySimplifies() {
        Env env = newEnv();
        DefaultCalculus.install(env);
        env.addPassive(List.of(
                input("pa", s.pos(s.app(s.p, s.a))),
                input("rule", s.neg(s.app(s.p, s.x0)), s.pos(s.app(s.q, s.x0))),
                input("instance", s.neg(s.app(s.p, s.a)), s.pos(s.app(s.q, s.b)))));
        SaturationResult result = new Saturate(env).presaturate();

        assertTrue(result.isSat());
        assertEquals(3, result.getSteps());
        assertEquals(0, result.getStatistics().getGeneratedClauses());
        assertTrue(env.getProofState().getActive().snapshot().stream()
                .anyMatch(c -> c.getLiterals().equals(List.of(s.pos(s.app(s.q, s.b))))));
    }

    //endregion

    //region ERRORI E INVARIANTI

    @Test
    void invariantViolationGivesError() {
        Env env = newEnv(SaturationConfiguration.defaults().withCheckInvariants(true));
        DefaultCalculus.install(env);
        chainProblem(env);
        env.addStepInit(() -> {
            if (env.isActive(pa)) pa.markRedundant();
        });
        SaturationResult result = new Saturate(env).givenClause();

        assertEquals(SZSStatus.Kind.ERROR, result.getStatus().getKind());
        assertEquals(1, result.getSteps());
        assertNotNull(result.getStatus().getMessage());
    }

    private Env problem(String name) {
        Env env = newEnv(SaturationConfiguration.defaults().withCheckInvariants(true));
        DefaultCalculus.install(env);
        switch (name) {
            case "chain" -> chainProblem(env);
            case "cases" -> env.addPassive(List.of(
                    input("either", s.pos(s.app(s.p, s.a)), s.pos(s.app(s.p, s.b))),
                    input("rule", s.neg(s.app(s.p, s.x0)), s.pos(s.app(s.q, s.x0))),
                    input("notQa", s.neg(s.app(s.q, s.a))),
                    input("notQb", s.neg(s.app(s.q, s.b))),
                    input("filler", s.pos(s.app(s.r, s.a, s.b)))));
            case "sat" -> env.addPassive(List.of(
                    input("pa", s.pos(s.app(s.p, s.a))),
                    input("rule", s.neg(s.app(s.p, s.x0)), s.pos(s.app(s.q, s.x0))),
                    input("filler", s.pos(s.app(s.r, s.a, s.b)))));
            default -> throw new IllegalArgumentException(name);
        }
        return env;
    }

    /**
     * Ogni clausola raggiungibile risalendo i genitori da active o passive è viva
     * oppure marcata ridondante.
     */
    private void assertAncestorsAccountedFor(Env env) {
        ProofState state = env.getProofState();
        Deque<Clause> todo = new ArrayDeque<>(state.getActive().snapshot());
        todo.addAll(state.getPassive().snapshot());
        Set<Clause> seen = new HashSet<>();
        while (!todo.isEmpty()) {
            Clause c = todo.poll();
            if (!seen.add(c)) continue;
            assertTrue(state.isActive(c) || state.isPassive(c) || c.isRedundant(),
                    "antenato perso: " + c);
            todo.addAll(c.getParents());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"chain", "cases", "sat"})
    void everyStepKeepsTheProofStateConsistent(String name) {
        Env env = problem(name);
        Saturate saturate = new Saturate(env);
        SZSStatus status = SZSStatus.unknown();
        int num = 0;
        while (status.getKind() == SZSStatus.Kind.UNKNOWN && num < 200) {
            status = saturate.givenClauseStep(true, num++);
            assertNotEquals(SZSStatus.Kind.ERROR, status.getKind());
            assertTrue(env.getProofState().activePassiveIntersection().isEmpty());
            assertAncestorsAccountedFor(env);
        }
        assertEquals(name.equals("sat") ? SZSStatus.Kind.SAT : SZSStatus.Kind.UNSAT, status.getKind());
    }

    @Test
    void ruleFailurePropagates() {
        Env env = newEnv();
        env.addBinaryInference("broken", (e, given) -> {
            throw new IllegalStateException("regola rotta");
        });
        chainProblem(env);
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new Saturate(env).givenClause());
        assertEquals("regola rotta", e.getMessage());
    }

    //endregion

    //region CADENZE PERIODICHE

    private Env unrelatedUnits(SaturationConfiguration configuration) {
        Env env = newEnv(configuration);
        env.addPassive(List.of(
                input("u1", s.pos(s.app(s.p, s.a))),
                input("u2", s.pos(s.app(s.p, s.b))),
                input("u3", s.pos(s.app(s.q, s.a))),
                input("u4", s.pos(s.app(s.q, s.b)))));
        return env;
    }

    @Test
    void clauseEliminationSkipsFirstStep() {
        Env env = unrelatedUnits(SaturationConfiguration.defaults().withClauseEliminationInterval(1));
        AtomicInteger calls = new AtomicInteger();
        env.addClauseEliminationRule(0, "counter", e -> {
            calls.incrementAndGet();
            return 0;
        });
        SaturationResult result = new Saturate(env).givenClause(true, 3, null);

        assertEquals(SZSStatus.Kind.UNKNOWN, result.getStatus().getKind());
        assertEquals(2, calls.get());
    }

    @Test
    void passiveCleaningFollowsInterval() {
        Env frequent = unrelatedUnits(SaturationConfiguration.defaults().withCleanPassiveInterval(2));
        Clause last = frequent.getProofState().getPassive().snapshot().get(3);
        frequent.addStepInit(last::markRedundant);
        new Saturate(frequent).givenClause(true, 3, null);
        assertEquals(1, frequent.getStatistics().getPassiveCleaned());
        assertTrue(frequent.getProofState().getPassive().isEmpty());

        Env rare = unrelatedUnits(SaturationConfiguration.defaults());
        Clause rareLast = rare.getProofState().getPassive().snapshot().get(3);
        rare.addStepInit(rareLast::markRedundant);
        new Saturate(rare).givenClause(true, 3, null);
        assertEquals(0, rare.getStatistics().getPassiveCleaned());
        assertEquals(1, rare.getProofState().getPassive().size());
    }

    //endregion
}
