package org.prover.saturation;

import org.prover.support.Clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insieme di clausole indicizzato per id, con segnali di inserimento e rimozione.
 * L'ordine di iterazione è quello di inserimento.
 */
public class ClauseSet implements Iterable<Clause> {

    private final String name;
    private final Map<Integer, Clause> clauses = new LinkedHashMap<>();
    private final Signal<Clause> onAddClause = new Signal<>();
    private final Signal<Clause> onRemoveClause = new Signal<>();

    public ClauseSet(String name) {
        this.name = name;
    }

    /**
     * @return true se la clausola non era già presente
     */
    public boolean add(Clause c) {
        if (clauses.putIfAbsent(c.getId(), c) != null) {
            return false;
        }
        onAddClause.send(c);
        return true;
    }

    public boolean remove(Clause c) {
        if (clauses.remove(c.getId()) == null) {
            return false;
        }
        onRemoveClause.send(c);
        return true;
    }

    public boolean contains(Clause c) {
        return clauses.get(c.getId()) == c;
    }

    public int size() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /** Copia delle clausole, sicura da iterare mentre l'insieme viene modificato */
    public List<Clause> snapshot() {
        return new ArrayList<>(clauses.values());
    }

    @Override
    public Iterator<Clause> iterator() {
        return Collections.unmodifiableCollection(clauses.values()).iterator();
    }

    public Signal<Clause> onAddClause() {
        return onAddClause;
    }

    public Signal<Clause> onRemoveClause() {
        return onRemoveClause;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + clauses.values();
    }
}
