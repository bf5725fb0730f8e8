package org.prover.term;

/**
 * Tipi di legatori supportati dai termini.
 * Il corpo di ogni legatore vede la variabile legata come indice De Bruijn 0.
 */
public enum Binder {
    LAMBDA("λ"),    // Astrazione: λx. t
    FORALL("∀"),    // Quantificatore universale
    EXISTS("∃");    // Quantificatore esistenziale

    private final String symbol;

    Binder(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
