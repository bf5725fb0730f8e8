package org.prover.optionalfeatures;

import org.jetbrains.annotations.Nullable;
import org.prover.saturation.ClauseSelection;
import org.prover.support.Clause;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SELEZIONE A CLASSI DI PRIORITÀ - Round-robin pesato su più code
 *
 * Ogni clausola viene inserita in tutte le code; la coda di turno viene usata per
 * {@code ratio} estrazioni consecutive prima di passare alla successiva. La clausola
 * estratta viene tolta da tutte le altre code.
 */
public class PriorityClassSelection implements ClauseSelection {

    private static final class WeightedQueue {
        final ClauseSelection queue;
        final int ratio;

        WeightedQueue(ClauseSelection queue, int ratio) {
            this.queue = queue;
            this.ratio = ratio;
        }
    }

    private final List<WeightedQueue> queues = new ArrayList<>();
    private int current = 0;
    private int takenFromCurrent = 0;

    /**
     * Aggiunge una coda; deve essere vuota e non condivisa.
     *
     * @param ratio estrazioni consecutive per turno (> 0)
     */
    public PriorityClassSelection addQueue(ClauseSelection queue, int ratio) {
        if (ratio <= 0) {
            throw new IllegalArgumentException("Il rapporto di una coda deve essere > 0, ricevuto: " + ratio);
        }
        if (!queue.isEmpty()) {
            throw new IllegalArgumentException("La coda " + queue.name() + " deve essere vuota");
        }
        queues.add(new WeightedQueue(queue, ratio));
        return this;
    }

    /**
     * Combinazione classica: {@code weightRatio} clausole leggere per ogni clausola più vecchia.
     */
    public static PriorityClassSelection weightAndFifo(int weightRatio) {
        return new PriorityClassSelection()
                .addQueue(new WeightSelection(), weightRatio)
                .addQueue(new FifoSelection(), 1);
    }

    @Override
    public void add(Clause c) {
        requireQueues();
        for (WeightedQueue wq : queues) wq.queue.add(c);
    }

    @Override
    public boolean remove(Clause c) {
        boolean removed = false;
        for (WeightedQueue wq : queues) {
            removed |= wq.queue.remove(c);
        }
        return removed;
    }

    @Override
    public @Nullable Clause next() {
        requireQueues();
        if (queues.get(0).queue.isEmpty()) {
            return null;
        }
        if (takenFromCurrent >= queues.get(current).ratio) {
            current = (current + 1) % queues.size();
            takenFromCurrent = 0;
        }
        Clause c = queues.get(current).queue.next();
        takenFromCurrent++;
        if (c == null) {
            throw new IllegalStateException("Coda " + queues.get(current).queue.name() + " disallineata");
        }
        for (int i = 0; i < queues.size(); i++) {
            if (i != current) queues.get(i).queue.remove(c);
        }
        return c;
    }

    @Override
    public int size() {
        return queues.isEmpty() ? 0 : queues.get(0).queue.size();
    }

    @Override
    public String name() {
        return queues.stream()
                .map(wq -> wq.queue.name() + "×" + wq.ratio)
                .collect(Collectors.joining("+", "priority(", ")"));
    }

    private void requireQueues() {
        if (queues.isEmpty()) {
            throw new IllegalStateException("PriorityClassSelection senza code");
        }
    }
}
