package org.prover.term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Operazioni sugli indici De Bruijn liberi: spostamento, ricerca e valutazione
 * in un ambiente di sostituzioni pendenti.
 *
 * Tutte le operazioni lasciano invariati (e restituiscono identici) i sottotermini
 * che non contengono indici liberi interessati.
 *
 * CONDIVISIONE:
 * I termini sono condivisi (hash-consing), quindi lo stesso nodo può comparire molte
 * volte nello stesso termine. Ogni chiamata pubblica memorizza il risultato per coppia
 * (nodo, profondità) e visita ogni coppia una sola volta: il costo è lineare nel numero
 * di nodi distinti, non nella dimensione dell'albero espanso.
 */
public class DeBruijn {

    /**
     * Nodo visitato a una data profondità di legatori locali.
     */
    private static final class Visit {
        final Term term;
        final int depth;

        Visit(Term term, int depth) {
            this.term = term;
            this.depth = depth;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Visit)) return false;
            Visit other = (Visit) o;
            return term == other.term && depth == other.depth;
        }

        @Override
        public int hashCode() {
            return 31 * term.hashCode() + depth;
        }
    }

    /**
     * Memoria di una singola chiamata: calcola il risultato solo alla prima visita.
     */
    private static <R> R memo(Map<Visit, R> cache, Term t, int depth, Function<Visit, R> compute) {
        Visit key = new Visit(t, depth);
        R cached = cache.get(key);
        if (cached == null) {
            cached = compute.apply(key);
            cache.put(key, cached);
        }
        return cached;
    }

    private final TermFactory factory;

    public DeBruijn(TermFactory factory) {
        this.factory = factory;
    }

    public TermFactory getFactory() {
        return factory;
    }

    //region SPOSTAMENTO

    /**
     * Aumenta di {@code n} tutti gli indici liberi del termine.
     */
    public Term shift(Term t, int n) {
        if (n == 0 || t.isClosed()) {
            return t;
        }
        return shiftRec(t, n, 0, new HashMap<>());
    }

    private Term shiftRec(Term t, int n, int depth, Map<Visit, Term> cache) {
        if (t.getLooseBound() <= depth) {
            return t;
        }
        return memo(cache, t, depth, v -> switch (t.getKind()) {
            case VAR, CONST -> t;
            case DB -> factory.bvar(t.getIndex() + n, t.getTypeExn());
            case APP -> {
                Term head = shiftRec(t.getHead(), n, depth, cache);
                yield factory.app(t.getTypeExn(), head, shiftAll(t.getArgs(), n, depth, cache));
            }
            case BIND -> factory.bind(t.getBinder(), t.getTypeExn(), t.getVarType(),
                    shiftRec(t.getBody(), n, depth + 1, cache));
            case APP_BUILTIN -> factory.appBuiltin(t.getBuiltin(), t.getType(),
                    shiftAll(t.getArgs(), n, depth, cache));
        });
    }

    private List<Term> shiftAll(List<Term> ts, int n, int depth, Map<Visit, Term> cache) {
        List<Term> out = new ArrayList<>(ts.size());
        for (Term a : ts) out.add(shiftRec(a, n, depth, cache));
        return out;
    }

    /**
     * Diminuisce di {@code n} tutti gli indici liberi del termine.
     *
     * @throws IllegalStateException se un indice libero minore di n compare nel termine
     */
    public Term unshift(Term t, int n) {
        if (n == 0 || t.isClosed()) {
            return t;
        }
        return unshiftRec(t, n, 0, new HashMap<>());
    }

    private Term unshiftRec(Term t, int n, int depth, Map<Visit, Term> cache) {
        if (t.getLooseBound() <= depth) {
            return t;
        }
        return memo(cache, t, depth, v -> switch (t.getKind()) {
            case VAR, CONST -> t;
            case DB -> {
                int newIndex = t.getIndex() - n;
                if (newIndex < depth) {
                    throw new IllegalStateException("unshift di " + n + " cattura l'indice " + t.getIndex());
                }
                yield factory.bvar(newIndex, t.getTypeExn());
            }
            case APP -> {
                Term head = unshiftRec(t.getHead(), n, depth, cache);
                List<Term> args = new ArrayList<>(t.getArgs().size());
                for (Term a : t.getArgs()) args.add(unshiftRec(a, n, depth, cache));
                yield factory.app(t.getTypeExn(), head, args);
            }
            case BIND -> factory.bind(t.getBinder(), t.getTypeExn(), t.getVarType(),
                    unshiftRec(t.getBody(), n, depth + 1, cache));
            case APP_BUILTIN -> {
                List<Term> args = new ArrayList<>(t.getArgs().size());
                for (Term a : t.getArgs()) args.add(unshiftRec(a, n, depth, cache));
                yield factory.appBuiltin(t.getBuiltin(), t.getType(), args);
            }
        });
    }

    //endregion

    //region RICERCA

    /**
     * Verifica se l'indice libero {@code i} compare nel termine.
     */
    public boolean contains(Term t, int i) {
        return containsRec(t, i, 0, new HashMap<>());
    }

    private boolean containsRec(Term t, int i, int depth, Map<Visit, Boolean> cache) {
        if (t.getLooseBound() <= i + depth) {
            return false;
        }
        return memo(cache, t, depth, v -> switch (t.getKind()) {
            case VAR, CONST -> false;
            case DB -> t.getIndex() == i + depth;
            case APP -> containsRec(t.getHead(), i, depth, cache)
                    || t.getArgs().stream().anyMatch(a -> containsRec(a, i, depth, cache));
            case BIND -> containsRec(t.getBody(), i, depth + 1, cache);
            case APP_BUILTIN -> t.getArgs().stream().anyMatch(a -> containsRec(a, i, depth, cache));
        });
    }

    //endregion

    //region VALUTAZIONE IN AMBIENTE

    /**
     * Applica le sostituzioni pendenti dell'ambiente agli indici liberi del termine.
     *
     * Sotto k legatori locali, l'indice i >= k corrisponde alla voce i-k dell'ambiente:
     * se presente viene sostituita (spostata di k), altrimenti l'indice viene abbassato
     * della dimensione dell'ambiente, poiché quei legatori sono stati eliminati.
     */
    public Term eval(DBEnv env, Term t) {
        if (env.isEmpty() || t.isClosed()) {
            return t;
        }
        return evalRec(env, t, 0, new HashMap<>());
    }

    private Term evalRec(DBEnv env, Term t, int depth, Map<Visit, Term> cache) {
        if (t.getLooseBound() <= depth) {
            return t;
        }
        return memo(cache, t, depth, v -> switch (t.getKind()) {
            case VAR, CONST -> t;
            case DB -> {
                int j = t.getIndex() - depth;
                Term replacement = env.find(j);
                yield replacement != null
                        ? shift(replacement, depth)
                        : factory.bvar(t.getIndex() - env.size(), t.getTypeExn());
            }
            case APP -> {
                Term head = evalRec(env, t.getHead(), depth, cache);
                List<Term> args = new ArrayList<>(t.getArgs().size());
                for (Term a : t.getArgs()) args.add(evalRec(env, a, depth, cache));
                yield factory.app(t.getTypeExn(), head, args);
            }
            case BIND -> factory.bind(t.getBinder(), t.getTypeExn(), t.getVarType(),
                    evalRec(env, t.getBody(), depth + 1, cache));
            case APP_BUILTIN -> {
                List<Term> args = new ArrayList<>(t.getArgs().size());
                for (Term a : t.getArgs()) args.add(evalRec(env, a, depth, cache));
                yield factory.appBuiltin(t.getBuiltin(), t.getType(), args);
            }
        });
    }

    //endregion
}
