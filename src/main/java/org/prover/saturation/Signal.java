package org.prover.saturation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Lista di osservatori invocati in modo sincrono, nell'ordine di registrazione.
 *
 * @param <T> tipo dell'evento
 */
public class Signal<T> {

    private final List<Consumer<? super T>> listeners = new ArrayList<>();

    public void on(Consumer<? super T> listener) {
        listeners.add(listener);
    }

    public void send(T event) {
        for (Consumer<? super T> listener : listeners) {
            listener.accept(event);
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
