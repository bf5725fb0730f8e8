package org.prover.support;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * TRAIL - Insieme immutabile di letterali booleani di decisione
 *
 * Registra i rami di case-split da cui dipende una clausola. I letterali seguono la
 * convenzione DIMACS già usata dal solutore SAT: intero positivo per la variabile vera,
 * negativo per la variabile falsa, mai zero.
 *
 * INVARIANTI:
 * • letterali ordinati per valore e senza duplicati
 * • un trail che contiene sia l ed il suo opposto è banale (clausola ridondante)
 */
public final class Trail {

    private static final Trail EMPTY = new Trail(new int[0]);

    private final int[] lits;

    private Trail(int[] sortedDistinct) {
        this.lits = sortedDistinct;
    }

    public static Trail empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException se compare il letterale 0
     */
    public static Trail of(int... literals) {
        if (literals.length == 0) return EMPTY;
        for (int l : literals) {
            if (l == 0) {
                throw new IllegalArgumentException("Il letterale 0 non è ammesso in un trail");
            }
        }
        return new Trail(Arrays.stream(literals).sorted().distinct().toArray());
    }

    public boolean isEmpty() {
        return lits.length == 0;
    }

    public int size() {
        return lits.length;
    }

    public boolean contains(int literal) {
        return Arrays.binarySearch(lits, literal) >= 0;
    }

    /** Contiene una coppia di letterali opposti */
    public boolean isTrivial() {
        for (int l : lits) {
            if (l > 0) break;
            if (contains(-l)) return true;
        }
        return false;
    }

    public Trail merge(Trail other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        int[] all = new int[lits.length + other.lits.length];
        System.arraycopy(lits, 0, all, 0, lits.length);
        System.arraycopy(other.lits, 0, all, lits.length, other.lits.length);
        return new Trail(Arrays.stream(all).sorted().distinct().toArray());
    }

    public boolean subsetOf(Trail other) {
        for (int l : lits) {
            if (!other.contains(l)) return false;
        }
        return true;
    }

    public int[] toArray() {
        return lits.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Trail && Arrays.equals(lits, ((Trail) o).lits);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(lits);
    }

    @Override
    public String toString() {
        return Arrays.stream(lits).mapToObj(Integer::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
