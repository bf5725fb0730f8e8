package org.prover.optionalfeatures;

import org.jetbrains.annotations.Nullable;
import org.prover.saturation.ClauseSelection;
import org.prover.support.Clause;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Selezione in ordine di inserimento.
 */
public class FifoSelection implements ClauseSelection {

    private final Map<Integer, Clause> queue = new LinkedHashMap<>();

    @Override
    public void add(Clause c) {
        queue.putIfAbsent(c.getId(), c);
    }

    @Override
    public boolean remove(Clause c) {
        return queue.remove(c.getId()) != null;
    }

    @Override
    public @Nullable Clause next() {
        Iterator<Clause> it = queue.values().iterator();
        if (!it.hasNext()) {
            return null;
        }
        Clause c = it.next();
        it.remove();
        return c;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public String name() {
        return "fifo";
    }
}
