package org.prover.support;

/**
 * Esito del confronto fra due termini secondo un ordinamento (anche parziale).
 */
public enum Comparison {
    LESS_THAN,
    GREATER_THAN,
    EQUAL,
    INCOMPARABLE;

    /**
     * Esito del confronto con gli argomenti scambiati.
     */
    public Comparison opposite() {
        return switch (this) {
            case LESS_THAN -> GREATER_THAN;
            case GREATER_THAN -> LESS_THAN;
            case EQUAL, INCOMPARABLE -> this;
        };
    }
}
