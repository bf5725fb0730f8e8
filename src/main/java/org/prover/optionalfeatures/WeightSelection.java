package org.prover.optionalfeatures;

import org.jetbrains.annotations.Nullable;
import org.prover.saturation.ClauseSelection;
import org.prover.support.Clause;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * SELEZIONE PER PESO - Heap binario intrusivo
 *
 * Ogni clausola in coda ha un record con la propria posizione nello heap, così che la
 * rimozione di una clausola arbitraria costi O(log n). Un record rimosso passa allo stato
 * DELETED e non viene più toccato, anche se qualcuno ne conserva un riferimento.
 *
 * A parità di peso viene estratta la clausola più vecchia (id minore).
 */
public class WeightSelection implements ClauseSelection {

    enum EntryState { QUEUED, DELETED }

    /**
     * Record intrusivo: chiave di priorità e posizione corrente nello heap.
     */
    static final class Entry {
        final Clause clause;
        final int weight;
        int heapIndex;
        EntryState state = EntryState.QUEUED;

        Entry(Clause clause, int weight) {
            this.clause = clause;
            this.weight = weight;
        }
    }

    private final ToIntFunction<Clause> weightFunction;
    private final List<Entry> heap = new ArrayList<>();
    private final Map<Integer, Entry> entries = new HashMap<>();

    /**
     * Peso di default: peso dei letterali moltiplicato per la penalità.
     */
    public WeightSelection() {
        this(c -> c.weight() * c.getPenalty());
    }

    public WeightSelection(ToIntFunction<Clause> weightFunction) {
        this.weightFunction = weightFunction;
    }

    @Override
    public void add(Clause c) {
        if (entries.containsKey(c.getId())) {
            return;
        }
        Entry e = new Entry(c, weightFunction.applyAsInt(c));
        entries.put(c.getId(), e);
        e.heapIndex = heap.size();
        heap.add(e);
        siftUp(e.heapIndex);
    }

    @Override
    public boolean remove(Clause c) {
        Entry e = entries.remove(c.getId());
        if (e == null) {
            return false;
        }
        removeAt(e.heapIndex);
        e.state = EntryState.DELETED;
        return true;
    }

    @Override
    public @Nullable Clause next() {
        if (heap.isEmpty()) {
            return null;
        }
        Entry top = heap.get(0);
        removeAt(0);
        entries.remove(top.clause.getId());
        top.state = EntryState.DELETED;
        return top.clause;
    }

    @Override
    public int size() {
        return heap.size();
    }

    @Override
    public String name() {
        return "weight";
    }

    /** Record della clausola in coda, null se assente */
    @Nullable Entry entryOf(Clause c) {
        return entries.get(c.getId());
    }

    //region HEAP

    private void removeAt(int i) {
        int last = heap.size() - 1;
        if (i != last) {
            swap(i, last);
        }
        heap.remove(last);
        if (i < heap.size()) {
            siftDown(i);
            siftUp(i);
        }
    }

    private boolean less(Entry a, Entry b) {
        if (a.weight != b.weight) return a.weight < b.weight;
        return a.clause.getId() < b.clause.getId();
    }

    private void siftUp(int i) {
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (!less(heap.get(i), heap.get(parent))) break;
            swap(i, parent);
            i = parent;
        }
    }

    private void siftDown(int i) {
        int n = heap.size();
        while (true) {
            int left = 2 * i + 1;
            int right = left + 1;
            int smallest = i;
            if (left < n && less(heap.get(left), heap.get(smallest))) smallest = left;
            if (right < n && less(heap.get(right), heap.get(smallest))) smallest = right;
            if (smallest == i) return;
            swap(i, smallest);
            i = smallest;
        }
    }

    private void swap(int i, int j) {
        Entry a = heap.get(i);
        Entry b = heap.get(j);
        heap.set(i, b);
        heap.set(j, a);
        a.heapIndex = j;
        b.heapIndex = i;
    }

    //endregion
}
