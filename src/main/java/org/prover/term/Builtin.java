package org.prover.term;

/**
 * Operatori predefiniti applicabili tramite nodi APP_BUILTIN.
 *
 * ARROW è riservato ai tipi funzionali: gli argomenti sono i tipi dei parametri,
 * l'ultimo elemento è il tipo di ritorno.
 */
public enum Builtin {
    ARROW("→", true),
    TRUE("⊤", false),
    FALSE("⊥", false),
    NOT("¬", false),
    AND("∧", true),
    OR("∨", true),
    IMPLY("⇒", true),
    EQUIV("⇔", true),
    EQ("=", true),
    NEQ("≠", true);

    private final String symbol;
    private final boolean infix;

    Builtin(String symbol, boolean infix) {
        this.symbol = symbol;
        this.infix = infix;
    }

    public String getSymbol() {
        return symbol;
    }

    /** true se l'operatore viene stampato tra gli argomenti */
    public boolean isInfix() {
        return infix;
    }
}
