package org.prover.term;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * TERMINE - Nodo immutabile dell'albero dei termini (e dei tipi)
 *
 * Rappresenta in un'unica struttura sia i termini sia i tipi. Un termine porta
 * sempre il proprio tipo; i tipi invece non hanno tipo ({@link #getType()} null).
 *
 * TIPI DI NODO:
 * • VAR: variabile libera (identificata da un intero)
 * • CONST: simbolo costante (o costruttore di tipo)
 * • DB: variabile legata, codificata come indice De Bruijn
 * • APP: applicazione testa + argomenti (mai annidata: la testa non è APP)
 * • BIND: legatore (λ, ∀, ∃) con tipo della variabile legata e corpo
 * • APP_BUILTIN: operatore predefinito applicato agli argomenti
 *
 * I termini vengono costruiti esclusivamente tramite {@link TermFactory}, che li
 * condivide (hash-consing): due termini della stessa fabbrica strutturalmente uguali
 * sono lo stesso oggetto. L'uguaglianza strutturale resta comunque valida anche fra
 * termini di fabbriche diverse.
 */
public final class Term {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Kind {
        VAR,
        CONST,
        DB,
        APP,
        BIND,
        APP_BUILTIN
    }

    /** Tipo del nodo corrente nell'albero */
    private final Kind kind;

    /** Tipo del termine (null per i tipi stessi) */
    private final @Nullable Term type;

    /** Identificatore per VAR, indice per DB */
    private final int index;

    /** Nome del simbolo (solo CONST) */
    private final @Nullable String symbol;

    /** Testa dell'applicazione (solo APP) */
    private final @Nullable Term head;

    /** Argomenti (APP e APP_BUILTIN), lista vuota altrimenti */
    private final List<Term> args;

    /** Legatore, tipo della variabile legata e corpo (solo BIND) */
    private final @Nullable Binder binder;
    private final @Nullable Term varType;
    private final @Nullable Term body;

    /** Operatore predefinito (solo APP_BUILTIN) */
    private final @Nullable Builtin builtin;

    //endregion

    //region METADATI PRECALCOLATI

    private final int hash;

    /** Numero di nodi (esclusi i tipi) */
    private final int size;

    /** true se il termine non contiene variabili libere VAR */
    private final boolean ground;

    /** 1 + massimo indice De Bruijn libero, 0 se il termine è chiuso */
    private final int looseBound;

    //endregion

    //region COSTRUZIONE

    private Term(Kind kind, @Nullable Term type, int index, @Nullable String symbol, @Nullable Term head,
                 List<Term> args, @Nullable Binder binder, @Nullable Term varType, @Nullable Term body,
                 @Nullable Builtin builtin) {
        this.kind = kind;
        this.type = type;
        this.index = index;
        this.symbol = symbol;
        this.head = head;
        this.args = args;
        this.binder = binder;
        this.varType = varType;
        this.body = body;
        this.builtin = builtin;

        this.hash = computeHash();
        this.size = computeSize();
        this.ground = computeGround();
        this.looseBound = computeLooseBound();
    }

    static Term mkVar(int id, Term type) {
        return new Term(Kind.VAR, type, id, null, null, Collections.emptyList(), null, null, null, null);
    }

    static Term mkConst(String symbol, @Nullable Term type) {
        return new Term(Kind.CONST, type, 0, symbol, null, Collections.emptyList(), null, null, null, null);
    }

    static Term mkBVar(int index, Term type) {
        return new Term(Kind.DB, type, index, null, null, Collections.emptyList(), null, null, null, null);
    }

    static Term mkApp(Term type, Term head, List<Term> args) {
        return new Term(Kind.APP, type, 0, null, head, List.copyOf(args), null, null, null, null);
    }

    static Term mkBind(Binder binder, Term type, Term varType, Term body) {
        return new Term(Kind.BIND, type, 0, null, null, Collections.emptyList(), binder, varType, body, null);
    }

    static Term mkBuiltin(Builtin builtin, @Nullable Term type, List<Term> args) {
        return new Term(Kind.APP_BUILTIN, type, 0, null, null, List.copyOf(args), null, null, null, builtin);
    }

    private int computeHash() {
        int h = Objects.hash(kind, index, symbol, binder, builtin);
        h = 31 * h + (type == null ? 0 : type.hash);
        h = 31 * h + (head == null ? 0 : head.hash);
        h = 31 * h + (varType == null ? 0 : varType.hash);
        h = 31 * h + (body == null ? 0 : body.hash);
        for (Term arg : args) {
            h = 31 * h + arg.hash;
        }
        return h;
    }

    /**
     * Dimensione dell'albero espanso, saturata a Integer.MAX_VALUE: un termine
     * condiviso può essere esponenzialmente più grande del numero dei suoi nodi.
     */
    private int computeSize() {
        long s = switch (kind) {
            case VAR, CONST, DB -> 1L;
            case APP -> {
                long acc = head.size;
                for (Term arg : args) acc += arg.size;
                yield acc;
            }
            case BIND -> 1L + body.size;
            case APP_BUILTIN -> {
                long acc = 1L;
                for (Term arg : args) acc += arg.size;
                yield acc;
            }
        };
        return (int) Math.min(s, Integer.MAX_VALUE);
    }

    private boolean computeGround() {
        return switch (kind) {
            case VAR -> false;
            case CONST, DB -> true;
            case APP -> head.ground && args.stream().allMatch(Term::isGround);
            case BIND -> body.ground;
            case APP_BUILTIN -> args.stream().allMatch(Term::isGround);
        };
    }

    private int computeLooseBound() {
        return switch (kind) {
            case VAR, CONST -> 0;
            case DB -> index + 1;
            case APP -> {
                int m = head.looseBound;
                for (Term arg : args) m = Math.max(m, arg.looseBound);
                yield m;
            }
            case BIND -> Math.max(0, body.looseBound - 1);
            case APP_BUILTIN -> {
                int m = 0;
                for (Term arg : args) m = Math.max(m, arg.looseBound);
                yield m;
            }
        };
    }

    //endregion

    //region ACCESSORS

    public Kind getKind() {
        return kind;
    }

    /**
     * Restituisce il tipo del termine.
     * @return tipo, oppure null se il termine è esso stesso un tipo
     */
    public @Nullable Term getType() {
        return type;
    }

    /**
     * Tipo del termine, che deve esistere.
     * @throws IllegalStateException se il termine è un tipo
     */
    public Term getTypeExn() {
        if (type == null) {
            throw new IllegalStateException("Il termine " + this + " non ha tipo");
        }
        return type;
    }

    public boolean hasType() {
        return type != null;
    }

    public int getVarId() {
        requireKind(Kind.VAR);
        return index;
    }

    public int getIndex() {
        requireKind(Kind.DB);
        return index;
    }

    public String getSymbol() {
        requireKind(Kind.CONST);
        return symbol;
    }

    public Term getHead() {
        requireKind(Kind.APP);
        return head;
    }

    public List<Term> getArgs() {
        return args;
    }

    public Binder getBinder() {
        requireKind(Kind.BIND);
        return binder;
    }

    public Term getVarType() {
        requireKind(Kind.BIND);
        return varType;
    }

    public Term getBody() {
        requireKind(Kind.BIND);
        return body;
    }

    public Builtin getBuiltin() {
        requireKind(Kind.APP_BUILTIN);
        return builtin;
    }

    public int size() {
        return size;
    }

    public boolean isGround() {
        return ground;
    }

    /** true se non ci sono indici De Bruijn liberi */
    public boolean isClosed() {
        return looseBound == 0;
    }

    public int getLooseBound() {
        return looseBound;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Atteso nodo " + expected + ", trovato " + kind + ": " + this);
        }
    }

    //endregion

    //region QUERY STRUTTURALI

    public boolean isVar() {
        return kind == Kind.VAR;
    }

    public boolean isConst() {
        return kind == Kind.CONST;
    }

    public boolean isBVar() {
        return kind == Kind.DB;
    }

    public boolean isBVar(int i) {
        return kind == Kind.DB && index == i;
    }

    public boolean isApp() {
        return kind == Kind.APP;
    }

    public boolean isLambda() {
        return kind == Kind.BIND && binder == Binder.LAMBDA;
    }

    public boolean isBuiltin(Builtin b) {
        return kind == Kind.APP_BUILTIN && builtin == b;
    }

    /** true per i tipi funzionali costruiti con ARROW */
    public boolean isArrow() {
        return isBuiltin(Builtin.ARROW);
    }

    /**
     * Tipi dei parametri di un tipo funzionale; lista vuota per tipi atomici.
     */
    public List<Term> arrowArgs() {
        return isArrow() ? args.subList(0, args.size() - 1) : Collections.emptyList();
    }

    /**
     * Tipo di ritorno di un tipo funzionale; il tipo stesso se atomico.
     */
    public Term arrowReturn() {
        return isArrow() ? args.get(args.size() - 1) : this;
    }

    /**
     * Testa del termine: la testa per APP, il termine stesso altrimenti.
     */
    public Term headTerm() {
        return kind == Kind.APP ? head : this;
    }

    /**
     * Verifica se la variabile libera con identificatore dato compare nel termine.
     */
    public boolean containsVar(int varId) {
        if (ground) return false;
        return switch (kind) {
            case VAR -> index == varId;
            case CONST, DB -> false;
            case APP -> head.containsVar(varId) || args.stream().anyMatch(a -> a.containsVar(varId));
            case BIND -> body.containsVar(varId);
            case APP_BUILTIN -> args.stream().anyMatch(a -> a.containsVar(varId));
        };
    }

    /**
     * Massimo identificatore di variabile libera, -1 se il termine è ground.
     */
    public int maxVarId() {
        if (ground) return -1;
        return switch (kind) {
            case VAR -> index;
            case CONST, DB -> -1;
            case APP -> {
                int m = head.maxVarId();
                for (Term arg : args) m = Math.max(m, arg.maxVarId());
                yield m;
            }
            case BIND -> body.maxVarId();
            case APP_BUILTIN -> {
                int m = -1;
                for (Term arg : args) m = Math.max(m, arg.maxVarId());
                yield m;
            }
        };
    }

    //endregion

    //region UGUAGLIANZA E HASH

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Term)) return false;
        Term other = (Term) o;
        return hash == other.hash
                && kind == other.kind
                && index == other.index
                && binder == other.binder
                && builtin == other.builtin
                && Objects.equals(symbol, other.symbol)
                && Objects.equals(type, other.type)
                && Objects.equals(head, other.head)
                && Objects.equals(varType, other.varType)
                && Objects.equals(body, other.body)
                && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, id -> "X" + id);
        return sb.toString();
    }

    /**
     * Scrive il termine usando la funzione data per nominare le variabili libere.
     * Usato per stampare clausole a meno di rinomina.
     */
    public void appendTo(StringBuilder sb, IntFunction<String> varName) {
        switch (kind) {
            case VAR -> sb.append(varName.apply(index));
            case CONST -> sb.append(symbol);
            case DB -> sb.append('#').append(index);
            case APP -> {
                boolean simpleHead = head.kind == Kind.CONST || head.kind == Kind.VAR;
                if (!simpleHead) sb.append('(');
                head.appendTo(sb, varName);
                if (!simpleHead) sb.append(')');
                sb.append('(');
                for (int i = 0; i < args.size(); i++) {
                    if (i > 0) sb.append(',');
                    args.get(i).appendTo(sb, varName);
                }
                sb.append(')');
            }
            case BIND -> {
                sb.append(binder.getSymbol()).append("#:");
                varType.appendTo(sb, varName);
                sb.append(". ");
                body.appendTo(sb, varName);
            }
            case APP_BUILTIN -> appendBuiltin(sb, varName);
        }
    }

    private void appendBuiltin(StringBuilder sb, IntFunction<String> varName) {
        if (args.isEmpty()) {
            sb.append(builtin.getSymbol());
        } else if (builtin.isInfix() && args.size() > 1) {
            sb.append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ').append(builtin.getSymbol()).append(' ');
                args.get(i).appendTo(sb, varName);
            }
            sb.append(')');
        } else {
            sb.append(builtin.getSymbol());
            sb.append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(',');
                args.get(i).appendTo(sb, varName);
            }
            sb.append(')');
        }
    }

    //endregion
}
