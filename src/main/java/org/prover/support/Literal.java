package org.prover.support;

import org.jetbrains.annotations.Nullable;
import org.prover.term.Term;
import org.prover.term.TermFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.function.UnaryOperator;

/**
 * LETTERALE - Equazione, predicato o costante logica all'interno di una clausola
 *
 * FORME AMMESSE:
 * • TRUE / FALSE: letterali costanti (⊤ rende banale la clausola, ⊥ è eliminabile)
 * • EQUATION: lhs = rhs oppure lhs ≠ rhs secondo il segno
 * • PROP: atomo predicativo con segno (P(a) oppure ¬P(a))
 *
 * I letterali sono valori immutabili; ogni trasformazione restituisce un nuovo letterale,
 * oppure lo stesso oggetto quando nulla cambia.
 */
public final class Literal {

    public enum Kind { TRUE, FALSE, EQUATION, PROP }

    private static final Literal TRUE_LIT = new Literal(Kind.TRUE, null, null, true);
    private static final Literal FALSE_LIT = new Literal(Kind.FALSE, null, null, false);

    private final Kind kind;
    private final @Nullable Term lhs;
    private final @Nullable Term rhs;
    private final boolean sign;

    private Literal(Kind kind, @Nullable Term lhs, @Nullable Term rhs, boolean sign) {
        this.kind = kind;
        this.lhs = lhs;
        this.rhs = rhs;
        this.sign = sign;
    }

    //region COSTRUZIONE

    public static Literal mkTrue() {
        return TRUE_LIT;
    }

    public static Literal mkFalse() {
        return FALSE_LIT;
    }

    /**
     * Equazione fra due termini dello stesso tipo.
     *
     * @throws IllegalArgumentException se i tipi dei due lati differiscono
     */
    public static Literal mkEq(Term lhs, Term rhs, boolean sign) {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
        if (!Objects.equals(lhs.getType(), rhs.getType())) {
            throw new IllegalArgumentException("Equazione mal tipata: " + lhs + " : " + lhs.getType()
                    + " e " + rhs + " : " + rhs.getType());
        }
        return new Literal(Kind.EQUATION, lhs, rhs, sign);
    }

    public static Literal mkProp(Term atom, boolean sign) {
        Objects.requireNonNull(atom, "atom");
        return new Literal(Kind.PROP, atom, null, sign);
    }

    //endregion

    //region ACCESSO

    public Kind getKind() {
        return kind;
    }

    /** Atomo di un PROP oppure lato sinistro di un'equazione */
    public Term getLhs() {
        if (lhs == null) throw new IllegalStateException("Il letterale " + this + " non ha termini");
        return lhs;
    }

    public Term getRhs() {
        if (rhs == null) throw new IllegalStateException("Il letterale " + this + " non è un'equazione");
        return rhs;
    }

    public Term getAtom() {
        if (kind != Kind.PROP) throw new IllegalStateException("Il letterale " + this + " non è predicativo");
        return lhs;
    }

    public boolean isPositive() {
        return sign;
    }

    /** Vero per letterali positivi e per ⊤ */
    public boolean isPositivoid() {
        return sign;
    }

    public boolean isPredicateLit() {
        return kind == Kind.PROP;
    }

    public boolean isEquation() {
        return kind == Kind.EQUATION;
    }

    /** ⊤ oppure t = t */
    public boolean isTrivial() {
        return kind == Kind.TRUE || (kind == Kind.EQUATION && sign && lhs == rhs);
    }

    /** ⊥ oppure t ≠ t */
    public boolean isAbsurd() {
        return kind == Kind.FALSE || (kind == Kind.EQUATION && !sign && lhs == rhs);
    }

    /** Termini del letterale (vuota per TRUE/FALSE) */
    public List<Term> terms() {
        return switch (kind) {
            case TRUE, FALSE -> List.of();
            case PROP -> List.of(lhs);
            case EQUATION -> List.of(lhs, rhs);
        };
    }

    /**
     * Due letterali predicativi o equazionali con stessi termini e segni opposti.
     */
    public boolean isComplementOf(Literal other) {
        if (kind != other.kind || sign == other.sign) return false;
        return switch (kind) {
            case TRUE, FALSE -> false;
            case PROP -> lhs == other.lhs;
            case EQUATION -> (lhs == other.lhs && rhs == other.rhs) || (lhs == other.rhs && rhs == other.lhs);
        };
    }

    //endregion

    //region TRASFORMAZIONI

    public Literal negate() {
        return switch (kind) {
            case TRUE -> FALSE_LIT;
            case FALSE -> TRUE_LIT;
            case EQUATION -> new Literal(kind, lhs, rhs, !sign);
            case PROP -> new Literal(kind, lhs, null, !sign);
        };
    }

    /**
     * Applica la funzione a ogni termine; restituisce this se nessun termine cambia.
     */
    public Literal map(UnaryOperator<Term> f) {
        return switch (kind) {
            case TRUE, FALSE -> this;
            case PROP -> {
                Term a = f.apply(lhs);
                yield a == lhs ? this : mkProp(a, sign);
            }
            case EQUATION -> {
                Term l = f.apply(lhs);
                Term r = f.apply(rhs);
                yield (l == lhs && r == rhs) ? this : mkEq(l, r, sign);
            }
        };
    }

    public Literal apply(TermFactory factory, Substitution subst) {
        return map(t -> subst.apply(factory, t));
    }

    /**
     * Orienta l'equazione mettendo a sinistra il lato maggiore, quando l'ordinamento lo stabilisce.
     */
    public Literal orient(TermOrdering ordering) {
        if (kind != Kind.EQUATION) return this;
        if (ordering.compare(lhs, rhs) == Comparison.LESS_THAN) {
            return new Literal(kind, rhs, lhs, sign);
        }
        return this;
    }

    //endregion

    //region MISURE

    /** Peso: somma delle dimensioni dei termini, 1 per le costanti logiche */
    public int weight() {
        return switch (kind) {
            case TRUE, FALSE -> 1;
            case PROP -> lhs.size();
            case EQUATION -> lhs.size() + rhs.size();
        };
    }

    /** Massimo identificatore di variabile libera, -1 se il letterale è ground */
    public int maxVarId() {
        int max = -1;
        for (Term t : terms()) max = Math.max(max, t.maxVarId());
        return max;
    }

    public boolean isGround() {
        for (Term t : terms()) {
            if (!t.isGround()) return false;
        }
        return true;
    }

    //endregion

    //region UGUAGLIANZA E STAMPA

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal other = (Literal) o;
        return kind == other.kind && sign == other.sign
                && Objects.equals(lhs, other.lhs) && Objects.equals(rhs, other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, lhs, rhs, sign);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, id -> "X" + id);
        return sb.toString();
    }

    public void appendTo(StringBuilder sb, IntFunction<String> varName) {
        switch (kind) {
            case TRUE -> sb.append('⊤');
            case FALSE -> sb.append('⊥');
            case PROP -> {
                if (!sign) sb.append('¬');
                lhs.appendTo(sb, varName);
            }
            case EQUATION -> {
                lhs.appendTo(sb, varName);
                sb.append(sign ? " = " : " ≠ ");
                rhs.appendTo(sb, varName);
            }
        }
    }

    //endregion
}
