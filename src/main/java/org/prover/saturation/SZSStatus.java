package org.prover.saturation;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Clause;

import java.util.Objects;

/**
 * STATO DELLA SATURAZIONE - Esito di un passo o di un'intera esecuzione
 *
 * STATI:
 * • UNKNOWN: non terminale, il ciclo continua
 * • SAT: passive esaurito e nessuna nuova clausola derivabile
 * • UNSAT: derivata la clausola vuota, che porta con sé la prova
 * • TIMEOUT: scadenza superata (terminale, inconcludente)
 * • ERROR: terminale, anomalo, con messaggio
 */
public final class SZSStatus {

    public enum Kind { UNKNOWN, SAT, UNSAT, TIMEOUT, ERROR }

    private static final SZSStatus UNKNOWN = new SZSStatus(Kind.UNKNOWN, null, null);
    private static final SZSStatus SAT = new SZSStatus(Kind.SAT, null, null);
    private static final SZSStatus TIMEOUT = new SZSStatus(Kind.TIMEOUT, null, null);

    private final Kind kind;
    private final @Nullable Clause emptyClause;
    private final @Nullable String message;

    private SZSStatus(Kind kind, @Nullable Clause emptyClause, @Nullable String message) {
        this.kind = kind;
        this.emptyClause = emptyClause;
        this.message = message;
    }

    //region FACTORY METHODS

    public static SZSStatus unknown() {
        return UNKNOWN;
    }

    public static SZSStatus sat() {
        return SAT;
    }

    public static SZSStatus timeout() {
        return TIMEOUT;
    }

    /**
     * @param emptyClause clausola vuota derivata, radice della prova
     * @throws IllegalArgumentException se la clausola non è vuota
     */
    public static SZSStatus unsat(Clause emptyClause) {
        Objects.requireNonNull(emptyClause, "emptyClause");
        if (!emptyClause.isEmpty()) {
            throw new IllegalArgumentException("UNSAT richiede la clausola vuota, ricevuta " + emptyClause);
        }
        return new SZSStatus(Kind.UNSAT, emptyClause, null);
    }

    public static SZSStatus error(String message) {
        return new SZSStatus(Kind.ERROR, null, Objects.requireNonNull(message, "message"));
    }

    //endregion

    public Kind getKind() {
        return kind;
    }

    public boolean isTerminal() {
        return kind != Kind.UNKNOWN;
    }

    public boolean isUnsat() {
        return kind == Kind.UNSAT;
    }

    public boolean isSat() {
        return kind == Kind.SAT;
    }

    /**
     * @throws IllegalStateException se lo stato non è UNSAT
     */
    public Clause getEmptyClause() {
        if (emptyClause == null) {
            throw new IllegalStateException("Lo stato " + kind + " non ha una prova");
        }
        return emptyClause;
    }

    public @Nullable String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SZSStatus)) return false;
        SZSStatus other = (SZSStatus) o;
        return kind == other.kind && Objects.equals(emptyClause, other.emptyClause)
                && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, emptyClause, message);
    }

    /** Nomi SZS standard */
    @Override
    public String toString() {
        return switch (kind) {
            case UNKNOWN -> "GaveUp";
            case SAT -> "Satisfiable";
            case UNSAT -> "Unsatisfiable (" + emptyClause + ")";
            case TIMEOUT -> "Timeout";
            case ERROR -> "Error: " + message;
        };
    }
}
