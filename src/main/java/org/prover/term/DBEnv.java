package org.prover.term;

import org.jetbrains.annotations.Nullable;

/**
 * Ambiente De Bruijn: lista immutabile, a sola aggiunta, indice -> termine sostituito.
 *
 * L'indice 0 è la variabile legata più interna; ogni push sposta concettualmente di un
 * livello le voci esistenti. I termini memorizzati sono espressi nel contesto esterno
 * a tutti i legatori eliminati dall'ambiente.
 */
public final class DBEnv {

    private static final DBEnv EMPTY = new DBEnv(null, null, 0);

    private final @Nullable Term top;
    private final @Nullable DBEnv rest;
    private final int size;

    private DBEnv(@Nullable Term top, @Nullable DBEnv rest, int size) {
        this.top = top;
        this.rest = rest;
        this.size = size;
    }

    public static DBEnv empty() {
        return EMPTY;
    }

    /**
     * Nuovo ambiente in cui {@code t} occupa l'indice 0.
     */
    public DBEnv push(Term t) {
        if (t == null) {
            throw new IllegalArgumentException("Non si può inserire un termine null nell'ambiente");
        }
        return new DBEnv(t, this, size + 1);
    }

    /**
     * @return il termine associato all'indice n, null se n è fuori dall'ambiente
     */
    public @Nullable Term find(int n) {
        if (n < 0 || n >= size) {
            return null;
        }
        DBEnv cur = this;
        for (int i = 0; i < n; i++) {
            cur = cur.rest;
        }
        return cur.top;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        DBEnv cur = this;
        for (int i = 0; i < size; i++) {
            if (i > 0) sb.append(", ");
            sb.append(i).append(" ↦ ").append(cur.top);
            cur = cur.rest;
        }
        return sb.append(']').toString();
    }
}
