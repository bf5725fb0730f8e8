package org.prover.support;

import org.prover.term.Term;

/**
 * Ordinamento sui termini fornito dall'esterno, usato per orientare le equazioni
 * e per i controlli di ridondanza.
 */
@FunctionalInterface
public interface TermOrdering {

    Comparison compare(Term a, Term b);

    /** Nome dell'ordinamento, per i log */
    default String name() {
        return getClass().getSimpleName();
    }
}
