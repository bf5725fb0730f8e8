package org.prover.saturation;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Clause;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Insieme passivo: appartenenza per id più la coda di selezione collegabile.
 * Ogni clausola membro è presente anche nella coda, e viceversa.
 */
public class PassiveSet {

    private final ClauseSelection selection;
    private final Map<Integer, Clause> members = new LinkedHashMap<>();
    private final Signal<Clause> onAddClause = new Signal<>();
    private final Signal<Clause> onRemoveClause = new Signal<>();

    public PassiveSet(ClauseSelection selection) {
        this.selection = Objects.requireNonNull(selection, "selection");
    }

    public boolean add(Clause c) {
        if (members.putIfAbsent(c.getId(), c) != null) {
            return false;
        }
        selection.add(c);
        onAddClause.send(c);
        return true;
    }

    public boolean remove(Clause c) {
        if (members.remove(c.getId()) == null) {
            return false;
        }
        if (!selection.remove(c)) {
            throw new IllegalStateException("Clausola " + c + " presente in passive ma non nella coda "
                    + selection.name());
        }
        onRemoveClause.send(c);
        return true;
    }

    /**
     * Estrae la prossima clausola secondo la strategia, null se l'insieme è vuoto.
     */
    public @Nullable Clause next() {
        Clause c = selection.next();
        if (c == null) {
            return null;
        }
        if (members.remove(c.getId()) == null) {
            throw new IllegalStateException("La coda " + selection.name() + " ha restituito " + c
                    + " che non appartiene a passive");
        }
        onRemoveClause.send(c);
        return c;
    }

    public boolean contains(Clause c) {
        return members.get(c.getId()) == c;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public List<Clause> snapshot() {
        return new ArrayList<>(members.values());
    }

    public ClauseSelection getSelection() {
        return selection;
    }

    public Signal<Clause> onAddClause() {
        return onAddClause;
    }

    public Signal<Clause> onRemoveClause() {
        return onRemoveClause;
    }
}
