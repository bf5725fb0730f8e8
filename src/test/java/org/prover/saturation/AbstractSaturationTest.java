package org.prover.saturation;

import org.prover.TestSignature;
import org.prover.optionalfeatures.FifoSelection;
import org.prover.optionalfeatures.KnuthBendixOrdering;
import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.ProofStep;

import java.util.List;

/**
 * Base comune: firma di test, contesto con KBO e costruzione dell'ambiente con selezione FIFO.
 */
abstract class AbstractSaturationTest {

    protected final TestSignature s = new TestSignature();
    protected final Context context = new Context(s.factory, new KnuthBendixOrdering(), EtaMode.REDUCE);

    protected Env newEnv() {
        return newEnv(SaturationConfiguration.defaults());
    }

    protected Env newEnv(SaturationConfiguration configuration) {
        return new Env(context, new FifoSelection(), configuration);
    }

    protected Clause input(String name, Literal... lits) {
        return context.mkAssert(List.of(lits), new ProofStep.Source("test", name));
    }

    protected Clause inferred(String rule, List<Clause> parents, Literal... lits) {
        return context.mkClause(List.of(lits), ProofStep.mkInference(rule, parents));
    }
}
