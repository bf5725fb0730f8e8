package org.prover.saturation;

import org.prover.lambda.Lambda;
import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.ProofStep;
import org.prover.support.TermOrdering;
import org.prover.support.Trail;
import org.prover.term.Term;
import org.prover.term.TermFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CONTESTO - Risorse condivise da tutte le regole di una stessa esecuzione
 *
 * Raccoglie la fabbrica dei termini, il normalizzatore lambda e l'ordinamento, e costruisce
 * le clausole in forma normale: ogni termine dei letterali viene portato in forma normale
 * forte, poi η-ridotto o η-espanso secondo la modalità, e le equazioni vengono orientate.
 */
public class Context {

    private final TermFactory factory;
    private final Lambda lambda;
    private final TermOrdering ordering;
    private final EtaMode etaMode;

    public Context(TermFactory factory, TermOrdering ordering, EtaMode etaMode) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.lambda = new Lambda(factory);
        this.ordering = Objects.requireNonNull(ordering, "ordering");
        this.etaMode = Objects.requireNonNull(etaMode, "etaMode");
    }

    public TermFactory getFactory() {
        return factory;
    }

    public Lambda getLambda() {
        return lambda;
    }

    public TermOrdering getOrdering() {
        return ordering;
    }

    public EtaMode getEtaMode() {
        return etaMode;
    }

    //region NORMALIZZAZIONE

    public Term normalizeTerm(Term t) {
        Term nf = lambda.snf(t);
        return switch (etaMode) {
            case REDUCE -> lambda.etaReduce(nf);
            case EXPAND -> lambda.etaExpand(nf);
            case NONE -> nf;
        };
    }

    public Literal normalizeLiteral(Literal lit) {
        return lit.map(this::normalizeTerm).orient(ordering);
    }

    //endregion

    //region COSTRUZIONE CLAUSOLE

    /**
     * Clausola derivata: trail e penalità ereditati dai genitori del passo di prova.
     */
    public Clause mkClause(List<Literal> literals, ProofStep proof) {
        return Clause.derive(normalizeAll(literals), proof);
    }

    public Clause mkClause(List<Literal> literals, ProofStep proof, Trail trail, int penalty) {
        return Clause.create(normalizeAll(literals), proof, trail, penalty);
    }

    /**
     * Clausola in ingresso, giustificata da un'asserzione.
     */
    public Clause mkAssert(List<Literal> literals, ProofStep.Source source) {
        return Clause.create(normalizeAll(literals), ProofStep.mkAssert(source));
    }

    private List<Literal> normalizeAll(List<Literal> literals) {
        List<Literal> out = new ArrayList<>(literals.size());
        for (Literal lit : literals) out.add(normalizeLiteral(lit));
        return out;
    }

    //endregion
}
