package org.prover;

import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.ProofStep;
import org.prover.term.Term;
import org.prover.term.TermFactory;

import java.util.List;

/**
 * Firma comune ai test: individui a, b, c; funzioni f (unaria) e g (binaria);
 * predicati P, Q (unari) e R (binario); variabili X0, X1, X2 di tipo individuo.
 */
public class TestSignature {

    public final TermFactory factory = new TermFactory();

    public final Term i = factory.tyIndividual();
    public final Term o = factory.tyProp();
    public final Term i2i = factory.arrow(i, i);
    public final Term ii2i = factory.arrow(List.of(i, i), i);
    public final Term i2o = factory.arrow(i, o);
    public final Term ii2o = factory.arrow(List.of(i, i), o);

    public final Term a = factory.constant("a", i);
    public final Term b = factory.constant("b", i);
    public final Term c = factory.constant("c", i);
    public final Term f = factory.constant("f", i2i);
    public final Term g = factory.constant("g", ii2i);
    public final Term p = factory.constant("P", i2o);
    public final Term q = factory.constant("Q", i2o);
    public final Term r = factory.constant("R", ii2o);

    public final Term x0 = factory.var(0, i);
    public final Term x1 = factory.var(1, i);
    public final Term x2 = factory.var(2, i);

    public Term app(Term head, Term... args) {
        return factory.app(head, args);
    }

    public Term db(int index) {
        return factory.bvar(index, i);
    }

    public Term lam(Term body) {
        return factory.lambda(i, body);
    }

    public Literal pos(Term atom) {
        return Literal.mkProp(atom, true);
    }

    public Literal neg(Term atom) {
        return Literal.mkProp(atom, false);
    }

    public Literal eq(Term lhs, Term rhs) {
        return Literal.mkEq(lhs, rhs, true);
    }

    public Literal neq(Term lhs, Term rhs) {
        return Literal.mkEq(lhs, rhs, false);
    }

    /** Clausola in ingresso senza normalizzazione */
    public Clause clause(String name, Literal... lits) {
        return Clause.create(List.of(lits), ProofStep.mkAssert(new ProofStep.Source("test", name)));
    }
}
