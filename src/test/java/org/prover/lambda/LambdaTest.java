package org.prover.lambda;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.prover.TestSignature;
import org.prover.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LambdaTest {

    private final TestSignature s = new TestSignature();
    private final Lambda lambda = new Lambda(s.factory);

    //region WHNF

    @Test
    void betaReducesSingleRedex() {
        Term redex = s.app(s.lam(s.app(s.f, s.db(0))), s.a);
        assertSame(s.app(s.f, s.a), lambda.whnf(redex));
    }

    @Test
    void argumentsAreConsumedInOrder() {
        Term twoBinders = s.lam(s.lam(s.app(s.g, s.db(0), s.db(1))));
        assertSame(s.app(s.g, s.b, s.a), lambda.whnf(s.app(twoBinders, s.a, s.b)));
    }

    @Test
    void partialApplicationLeavesRemainingBinder() {
        Term twoBinders = s.lam(s.lam(s.app(s.g, s.db(0), s.db(1))));
        assertSame(s.lam(s.app(s.g, s.db(0), s.a)), lambda.whnf(s.app(twoBinders, s.a)));
    }

    @Test
    void nonRedexesAreReturnedUnchanged() {
        Term t = s.app(s.g, s.a, s.x0);
        assertSame(t, lambda.whnf(t));
        Term abstraction = s.lam(s.app(s.f, s.db(0)));
        assertSame(abstraction, lambda.whnf(abstraction));
    }

    @Test
    void illTypedRedexIsRejected() {
        Term identityOnProps = s.factory.lambda(s.o, s.factory.bvar(0, s.o));
        Term redex = s.app(identityOnProps, s.a);
        assertThrows(IllegalStateException.class, () -> lambda.whnf(redex));
    }

    @Test
    void whnfListAppliesWithoutBuildingRedex() {
        Term expanded = lambda.etaExpand(s.f);
        assertSame(s.app(s.f, s.b), lambda.whnfList(expanded, List.of(s.b)));
    }

    //endregion

    //region SNF

    @Test
    void snfReducesUnderBinders() {
        Term inner = s.lam(s.app(s.g, s.db(0), s.db(1)));
        Term t = s.lam(s.app(inner, s.a));
        assertSame(s.lam(s.app(s.g, s.a, s.db(0))), lambda.snf(t));
    }

    @Test
    void snfReducesInsideArguments() {
        Term redex = s.app(s.lam(s.app(s.f, s.db(0))), s.c);
        Term t = s.app(s.g, redex, s.app(s.f, redex));
        assertSame(s.app(s.g, s.app(s.f, s.c), s.app(s.f, s.app(s.f, s.c))), lambda.snf(t));
    }

    @Test
    void snfSharesNormalTerms() {
        Term t = s.app(s.g, s.app(s.f, s.a), s.x1);
        assertSame(t, lambda.snf(t));
    }

    //endregion

    //region ETA

    @Test
    void etaExpandAddsMissingBinders() {
        assertSame(s.lam(s.app(s.f, s.db(0))), lambda.etaExpand(s.f));
        assertSame(s.lam(s.lam(s.app(s.g, s.db(1), s.db(0)))), lambda.etaExpand(s.g));
        assertSame(s.lam(s.app(s.g, s.a, s.db(0))), lambda.etaExpand(s.app(s.g, s.a)));
        assertSame(s.a, lambda.etaExpand(s.a));
    }

    @Test
    void etaReduceContractsTrailingBoundArguments() {
        assertSame(s.g, lambda.etaReduce(s.lam(s.lam(s.app(s.g, s.db(1), s.db(0))))));
        assertSame(s.app(s.g, s.a), lambda.etaReduce(s.lam(s.app(s.g, s.a, s.db(0)))));
    }

    @Test
    void etaReduceKeepsBodiesUsingTheVariable() {
        Term t = s.lam(s.app(s.g, s.db(0), s.db(0)));
        assertSame(t, lambda.etaReduce(t));
    }

    @Test
    void etaQuickReduceDropsRedundantSuffix() {
        assertSame(s.g, lambda.etaQuickReduce(s.lam(s.lam(s.app(s.g, s.db(1), s.db(0))))));
        Term t = s.lam(s.app(s.g, s.db(0), s.db(0)));
        assertSame(t, lambda.etaQuickReduce(t));
    }

    @ParameterizedTest
    @ValueSource(strings = {"f", "g", "ga", "P", "a"})
    void etaExpandThenReduceIsIdentityOnShortTerms(String name) {
        Term t = switch (name) {
            case "f" -> s.f;
            case "g" -> s.g;
            case "ga" -> s.app(s.g, s.a);
            case "P" -> s.p;
            default -> s.a;
        };
        assertSame(lambda.snf(t), lambda.snf(lambda.etaReduce(lambda.etaExpand(t))));
    }

    //endregion

    //region PROPRIETÀ

    /** Termini di esempio, con e senza redessi */
    private Term sample(String name) {
        Term idF = s.lam(s.app(s.f, s.db(0)));
        Term swapG = s.lam(s.lam(s.app(s.g, s.db(0), s.db(1))));
        return switch (name) {
            case "redex" -> s.app(idF, s.a);
            case "nested" -> s.lam(s.app(s.lam(s.app(s.g, s.db(0), s.db(1))), s.a));
            case "args" -> s.app(s.g, s.app(idF, s.c), s.app(s.f, s.app(idF, s.x0)));
            case "partial" -> s.app(swapG, s.a);
            case "full" -> s.app(swapG, s.a, s.b);
            case "normal" -> s.app(s.g, s.app(s.f, s.a), s.x1);
            case "f" -> s.f;
            case "g" -> s.g;
            case "ga" -> s.app(s.g, s.a);
            case "idF" -> idF;
            case "curried" -> s.lam(s.lam(s.app(s.g, s.db(1), s.db(0))));
            default -> throw new IllegalArgumentException(name);
        };
    }

    @ParameterizedTest
    @ValueSource(strings = {"redex", "nested", "args", "partial", "full", "normal", "idF", "curried"})
    void whnfIsIdempotent(String name) {
        Term once = lambda.whnf(sample(name));
        assertSame(once, lambda.whnf(once));
    }

    @ParameterizedTest
    @ValueSource(strings = {"redex", "nested", "args", "partial", "full", "normal", "idF", "curried"})
    void snfIsAFixpointOfWhnf(String name) {
        Term normal = lambda.snf(sample(name));
        assertSame(normal, lambda.whnf(normal));
        assertSame(normal, lambda.snf(normal));
    }

    @ParameterizedTest
    @ValueSource(strings = {"f", "g", "ga", "idF", "partial", "curried"})
    void etaExpansionBehavesLikeTheOriginalOnFreshArguments(String name) {
        Term t = sample(name);
        List<Term> argTypes = t.getTypeExn().arrowArgs();
        assertFalse(argTypes.isEmpty());
        List<Term> fresh = new ArrayList<>();
        for (int k = 0; k < argTypes.size(); k++) {
            fresh.add(s.factory.var(20 + k, argTypes.get(k)));
        }
        Term expandedApplied = lambda.whnfList(lambda.etaExpand(t), fresh);
        assertSame(lambda.snf(s.factory.app(t, fresh)), lambda.snf(expandedApplied));
    }

    //endregion

    //region TERMINI PROFONDI E CONDIVISI

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void longReductionChainRunsWithoutRecursion() {
        Term id = s.lam(s.db(0));
        Term chain = s.a;
        for (int k = 0; k < 20_000; k++) {
            chain = s.app(id, chain);
        }
        assertSame(s.a, lambda.whnf(chain));
        assertSame(s.a, lambda.snf(chain));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void manyBindersConsumeTheirArgumentsIteratively() {
        int n = 2_000;
        Term t = s.db(0);
        for (int k = 0; k < n; k++) {
            t = s.lam(t);
        }
        List<Term> args = new ArrayList<>();
        for (int k = 0; k < n - 1; k++) {
            args.add(s.a);
        }
        args.add(s.b);
        assertSame(s.b, lambda.whnfList(t, args));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void sharedBoundVariableIsSubstitutedOncePerNode() {
        // u(k+1) = g u(k) u(k): 31 nodi distinti, albero espanso di 2^31 nodi
        Term body = s.db(0);
        Term expected = s.a;
        for (int k = 0; k < 30; k++) {
            body = s.app(s.g, body, body);
            expected = s.app(s.g, expected, expected);
        }
        Term reduced = lambda.whnf(s.app(s.lam(body), s.a));
        assertTrue(reduced == expected, "la β-riduzione deve preservare la condivisione");
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void snfVisitsSharedSubtermsOnce() {
        Term leaf = s.app(s.lam(s.app(s.f, s.db(0))), s.a);
        Term t = leaf;
        Term expected = s.app(s.f, s.a);
        for (int k = 0; k < 30; k++) {
            t = s.app(s.g, t, t);
            expected = s.app(s.g, expected, expected);
        }
        Term normal = lambda.snf(t);
        assertTrue(normal == expected, "forma normale forte inattesa");
        assertTrue(lambda.etaReduce(normal) == normal);
        assertTrue(lambda.etaQuickReduce(normal) == normal);
        assertTrue(lambda.etaExpand(normal) == normal);
        assertTrue(lambda.isLambdaPattern(normal));
    }

    //endregion

    @Test
    void lambdaPatterns() {
        Term fx = s.factory.var(7, s.i2i);
        Term gx = s.factory.var(8, s.ii2i);
        assertTrue(lambda.isLambdaPattern(s.lam(s.app(fx, s.db(0)))));
        assertTrue(lambda.isLambdaPattern(s.app(s.g, s.x0, s.a)));
        assertFalse(lambda.isLambdaPattern(s.app(fx, s.a)));
        assertFalse(lambda.isLambdaPattern(s.lam(s.app(gx, s.db(0), s.db(0)))));
    }
}
