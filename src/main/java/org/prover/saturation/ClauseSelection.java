package org.prover.saturation;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Clause;

/**
 * STRATEGIA DI SELEZIONE - Coda delle clausole passive
 *
 * Decide quale clausola passiva diventa la prossima given clause. Il ciclo di saturazione
 * non conosce la strategia concreta (FIFO, per peso, a classi di priorità).
 *
 * CONTRATTO:
 * • add/remove mantengono esattamente l'insieme delle clausole inserite e non ancora estratte
 * • next estrae e rimuove una clausola, null se la coda è vuota
 */
public interface ClauseSelection {

    void add(Clause c);

    /**
     * @return true se la clausola era presente
     */
    boolean remove(Clause c);

    @Nullable Clause next();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
