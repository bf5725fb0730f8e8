package org.prover.lambda;

import org.prover.term.Binder;
import org.prover.term.DBEnv;
import org.prover.term.DeBruijn;
import org.prover.term.Term;
import org.prover.term.TermFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * NORMALIZZATORE LAMBDA - Forme normali dei termini di ordine superiore
 *
 * Calcola le forme canoniche usate da tutti gli altri componenti per confrontare,
 * ordinare e indicizzare i termini:
 * • WHNF (forma normale di testa debole) tramite sostituzioni esplicite
 * • SNF (forma normale forte) applicando la WHNF a ogni nodo
 * • η-espansione e η-riduzione (completa e rapida)
 * • riconoscimento dei pattern di ordine superiore
 *
 * STRATEGIA WHNF:
 * La riduzione mantiene uno stato {testa, ambiente della testa, argomenti pendenti,
 * tipo}. Ogni argomento pendente è accompagnato dal proprio ambiente d'origine e viene
 * valutato solo quando viene effettivamente consumato da una β-riduzione. L'ambiente è
 * condiviso fra i passi e il ciclo è iterativo, così catene di riduzione profonde non
 * consumano stack e variabili ripetute non vengono copiate in modo esponenziale.
 *
 * Le visite ricorsive (SNF, η, pattern) memorizzano il risultato per ogni nodo nel
 * corso di una singola chiamata: un sottotermine condiviso viene elaborato una volta.
 *
 * I termini mal tipati (tipo del parametro diverso dal tipo dell'argomento) sono errori
 * di programmazione e producono IllegalStateException.
 */
public class Lambda {

    private static final Logger LOGGER = Logger.getLogger(Lambda.class.getName());

    private final TermFactory factory;
    private final DeBruijn db;

    public Lambda(TermFactory factory) {
        this.factory = factory;
        this.db = new DeBruijn(factory);
    }

    public TermFactory getFactory() {
        return factory;
    }

    public DeBruijn getDeBruijn() {
        return db;
    }

    //region STATO DI RIDUZIONE

    /**
     * Argomento pendente insieme all'ambiente in cui va valutato.
     */
    private static final class Closure {
        final Term term;
        final DBEnv env;

        Closure(Term term, DBEnv env) {
            this.term = term;
            this.env = env;
        }
    }

    /**
     * Stato della macchina di riduzione. La testa non è mai un'applicazione
     * dopo {@link #normalize(State)}.
     */
    private static final class State {
        Term head;
        DBEnv env;
        final Deque<Closure> args;
        final Term type;

        State(Term head, DBEnv env, Term type) {
            this.head = head;
            this.env = env;
            this.args = new ArrayDeque<>();
            this.type = type;
        }
    }

    /**
     * Se la testa è un'applicazione, sposta i suoi argomenti in testa alla lista
     * dei pendenti, etichettati con l'ambiente corrente.
     */
    private static void normalize(State st) {
        if (st.head.isApp()) {
            List<Term> headArgs = st.head.getArgs();
            for (int i = headArgs.size() - 1; i >= 0; i--) {
                st.args.addFirst(new Closure(headArgs.get(i), st.env));
            }
            st.head = st.head.getHead();
        }
    }

    private State stateOf(Term t, DBEnv env, Term type) {
        State st = new State(t, env, type);
        normalize(st);
        return st;
    }

    private Term termOf(State st) {
        Term f = db.eval(st.env, st.head);
        List<Term> args = new ArrayList<>(st.args.size());
        for (Closure c : st.args) {
            args.add(db.eval(c.env, c.term));
        }
        return factory.app(st.type, f, args);
    }

    //endregion

    //region WHNF

    /**
     * Ciclo di riduzione di testa (trampolino, nessuna ricorsione).
     */
    private void whnfLoop(State st) {
        while (true) {
            Term head = st.head;
            switch (head.getKind()) {
                case APP -> throw new IllegalStateException("Stato non normalizzato: testa applicazione " + head);
                case VAR, CONST, APP_BUILTIN -> {
                    return;
                }
                case DB -> {
                    Term evaluated = db.eval(st.env, head);
                    if (evaluated == head) {
                        return;
                    }
                    // Sostituisce l'indice con il valore dell'ambiente e riprende la riduzione
                    st.head = evaluated;
                    st.env = DBEnv.empty();
                    normalize(st);
                }
                case BIND -> {
                    if (head.getBinder() != Binder.LAMBDA || st.args.isEmpty()) {
                        return;
                    }
                    Closure first = st.args.removeFirst();
                    Term arg = db.eval(first.env, first.term);
                    if (!head.getVarType().equals(arg.getTypeExn())) {
                        throw new IllegalStateException("β-riduzione mal tipata: parametro di tipo "
                                + head.getVarType() + ", argomento " + arg + " di tipo " + arg.getType());
                    }
                    LOGGER.finest(() -> "β-riduzione di " + head + " con " + arg);
                    st.head = head.getBody();
                    st.env = st.env.push(arg);
                    normalize(st);
                }
            }
        }
    }

    private Term whnfTerm(Term t, DBEnv env) {
        Term type = t.getType();
        if (type == null) {
            return t;
        }
        State st = stateOf(t, env, type);
        whnfLoop(st);
        return termOf(st);
    }

    /**
     * Forma normale di testa debole. Solo le applicazioni con testa λ vengono ridotte;
     * ogni altro termine è già in WHNF e viene restituito identico.
     */
    public Term whnf(Term t) {
        if (t.isApp() && t.getHead().isLambda()) {
            return whnfTerm(t, DBEnv.empty());
        }
        return t;
    }

    /**
     * WHNF di {@code t} applicato agli argomenti dati, senza costruire il redesso intermedio.
     */
    public Term whnfList(Term t, List<Term> args) {
        Term type = factory.applyType(t.getTypeExn(), args.size());
        State st = stateOf(t, DBEnv.empty(), type);
        for (Term arg : args) {
            st.args.addLast(new Closure(arg, DBEnv.empty()));
        }
        whnfLoop(st);
        return termOf(st);
    }

    /**
     * Riduce la testa sotto il prefisso di λ: λx̄. whnf(corpo).
     */
    public Term betaReduceHead(Term t) {
        List<Term> prefix = new ArrayList<>();
        Term body = openLambdas(t, prefix);
        Term reduced = whnf(body);
        return reduced == body ? t : factory.funL(prefix, reduced);
    }

    //endregion

    //region SNF

    /**
     * Forma normale forte: WHNF applicata ricorsivamente a testa, argomenti e corpi.
     * I sottotermini che non cambiano restano condivisi.
     */
    public Term snf(Term t) {
        return snfRec(t, new HashMap<>());
    }

    private Term snfRec(Term t, Map<Term, Term> memo) {
        return visit(memo, t, x -> snfStep(x, memo));
    }

    private Term snfStep(Term t, Map<Term, Term> memo) {
        Term w = whnfTerm(t, DBEnv.empty());
        Term type = w.getType();
        if (type == null) {
            return w;
        }
        return switch (w.getKind()) {
            case VAR, CONST, DB -> w;
            case APP -> {
                Term f = w.getHead();
                Term f2 = snfRec(f, memo);
                if (f2 != f) {
                    // la testa è cambiata: potrebbe essere comparso un nuovo redesso
                    yield snfRec(factory.app(type, f2, w.getArgs()), memo);
                }
                List<Term> args2 = mapChanged(w.getArgs(), a -> snfRec(a, memo));
                yield args2 == null ? w : factory.app(type, f, args2);
            }
            case APP_BUILTIN -> {
                List<Term> args2 = mapChanged(w.getArgs(), a -> snfRec(a, memo));
                yield args2 == null ? w : factory.appBuiltin(w.getBuiltin(), type, args2);
            }
            case BIND -> {
                Term body = w.getBody();
                Term body2 = snfRec(body, memo);
                yield body2 == body ? w : factory.bind(w.getBinder(), type, w.getVarType(), body2);
            }
        };
    }

    //endregion

    //region ETA-ESPANSIONE

    /**
     * η-espansione: aggiunge le λ mancanti così che ogni sottotermine riceva
     * esattamente tanti argomenti quanti ne prescrive il suo tipo.
     */
    public Term etaExpand(Term t) {
        return etaExpandRec(t, new HashMap<>());
    }

    private Term etaExpandRec(Term t, Map<Term, Term> memo) {
        return visit(memo, t, x -> etaExpandStep(x, memo));
    }

    private Term etaExpandStep(Term t, Map<Term, Term> memo) {
        Term type = t.getType();
        if (type == null) {
            return t;
        }
        List<Term> tyArgs = type.arrowArgs();
        Term tyRet = type.arrowReturn();

        Term w = whnfTerm(t, DBEnv.empty());
        List<Term> prefix = new ArrayList<>();
        Term body = openLambdas(w, prefix);

        int nArgs = tyArgs.size();
        int nMissing = nArgs - prefix.size();
        if (nMissing > 0) {
            LOGGER.finest(() -> "η-espansione di " + w + ": mancano " + nMissing + " argomenti");
            List<Term> missing = tyArgs.subList(nArgs - nMissing, nArgs);
            // il corpo finisce sotto nMissing nuovi legatori
            Term shifted = db.shift(body, nMissing);
            List<Term> dbVars = new ArrayList<>(nMissing);
            for (int i = 0; i < nMissing; i++) {
                dbVars.add(factory.bvar(nMissing - i - 1, missing.get(i)));
            }
            return factory.funL(tyArgs, etaExpandRec(factory.app(tyRet, shifted, dbVars), memo));
        }

        Term bodyType = body.getTypeExn();
        Term newBody = switch (body.getKind()) {
            case VAR, CONST, DB -> body;
            case APP -> {
                List<Term> args2 = mapChanged(body.getArgs(), a -> etaExpandRec(a, memo));
                yield args2 == null ? body : factory.app(bodyType, body.getHead(), args2);
            }
            case APP_BUILTIN -> {
                List<Term> args2 = mapChanged(body.getArgs(), a -> etaExpandRec(a, memo));
                yield args2 == null ? body : factory.appBuiltin(body.getBuiltin(), bodyType, args2);
            }
            case BIND -> factory.bind(body.getBinder(), bodyType, body.getVarType(),
                    etaExpandRec(body.getBody(), memo));
        };
        return factory.funL(tyArgs, newBody);
    }

    //endregion

    //region ETA-RIDUZIONE

    /**
     * η-riduzione canonica: λx. f x diventa f quando x compare solo come ultimo argomento.
     */
    public Term etaReduce(Term t) {
        return etaReduceRec(t, new HashMap<>());
    }

    private Term etaReduceRec(Term t, Map<Term, Term> memo) {
        return visit(memo, t, x -> etaReduceStep(x, memo));
    }

    private Term etaReduceStep(Term t, Map<Term, Term> memo) {
        Term type = t.getType();
        if (type == null) {
            return t;
        }
        return switch (t.getKind()) {
            case VAR, DB, CONST -> t;
            case BIND -> {
                Term body = t.getBody();
                Term body2 = etaReduceRec(body, memo);
                if (t.getBinder() == Binder.LAMBDA && body2.isApp()) {
                    Term reduced = tryEtaContract(type, body2);
                    if (reduced != null) {
                        yield reduced;
                    }
                }
                yield body2 == body ? t : factory.bind(t.getBinder(), type, t.getVarType(), body2);
            }
            case APP -> {
                Term f = t.getHead();
                Term f2 = etaReduceRec(f, memo);
                List<Term> args2 = mapChanged(t.getArgs(), a -> etaReduceRec(a, memo));
                if (f2 == f && args2 == null) {
                    yield t;
                }
                yield factory.app(type, f2, args2 == null ? t.getArgs() : args2);
            }
            case APP_BUILTIN -> {
                List<Term> args2 = mapChanged(t.getArgs(), a -> etaReduceRec(a, memo));
                yield args2 == null ? t : factory.appBuiltin(t.getBuiltin(), type, args2);
            }
        };
    }

    /**
     * Contrae λ. f a₁…aₙ₋₁ #0 se #0 non compare in f né in a₁…aₙ₋₁.
     *
     * @param lambdaType tipo della λ, che coincide con il tipo del risultato
     * @return termine contratto oppure null se la forma non è η-riducibile
     */
    private Term tryEtaContract(Term lambdaType, Term body) {
        List<Term> args = body.getArgs();
        Term last = args.get(args.size() - 1);
        if (!last.isBVar(0)) {
            return null;
        }
        List<Term> butLast = args.subList(0, args.size() - 1);
        if (db.contains(body.getHead(), 0)) {
            return null;
        }
        for (Term a : butLast) {
            if (db.contains(a, 0)) {
                return null;
            }
        }
        return db.unshift(factory.app(lambdaType, body.getHead(), butLast), 1);
    }

    /**
     * η-riduzione parziale e rapida: rimuove dalla coda degli argomenti la sequenza finale
     * di variabili legate ridondanti (…, #1, #0) insieme alle λ corrispondenti, senza
     * ricostruire l'intero termine. Non scende nei corpi delle λ annidate.
     */
    public Term etaQuickReduce(Term t) {
        return etaQuickRec(t, new HashMap<>());
    }

    private Term etaQuickRec(Term t, Map<Term, Term> memo) {
        return visit(memo, t, x -> etaQuickStep(x, memo));
    }

    private Term etaQuickStep(Term t, Map<Term, Term> memo) {
        Term type = t.getType();
        if (type == null) {
            return t;
        }
        return switch (t.getKind()) {
            case VAR, DB, CONST -> t;
            case BIND -> t.getBinder() == Binder.LAMBDA ? quickReduceLambda(t) : t;
            case APP -> {
                Term f = t.getHead();
                Term f2 = etaQuickRec(f, memo);
                List<Term> args2 = mapChanged(t.getArgs(), a -> etaQuickRec(a, memo));
                if (f2 == f && args2 == null) {
                    yield t;
                }
                yield factory.app(type, f2, args2 == null ? t.getArgs() : args2);
            }
            case APP_BUILTIN -> {
                List<Term> args2 = mapChanged(t.getArgs(), a -> etaQuickRec(a, memo));
                yield args2 == null ? t : factory.appBuiltin(t.getBuiltin(), type, args2);
            }
        };
    }

    private Term quickReduceLambda(Term t) {
        List<Term> prefix = new ArrayList<>();
        Term body = openLambdas(t, prefix);
        if (!body.isApp()) {
            return t;
        }
        Term hd = body.getHead();
        List<Term> args = body.getArgs();
        int n = args.size();

        // lunghezza della coda #k … #1 #0, limitata dal numero di λ disponibili
        int redundant = 0;
        while (redundant < n && redundant < prefix.size() && args.get(n - 1 - redundant).isBVar(redundant)) {
            redundant++;
        }
        if (redundant == 0) {
            return t;
        }

        List<Term> nonRedundant = new ArrayList<>(n - redundant + 1);
        nonRedundant.add(hd);
        nonRedundant.addAll(args.subList(0, n - redundant));

        // a partire da #0, conta le variabili che non compaiono nella parte restante
        int removable = 0;
        while (removable < redundant && !occursIn(nonRedundant, removable)) {
            removable++;
        }
        if (removable == 0) {
            return t;
        }

        List<Term> kept = args.subList(0, n - removable);
        Term keptType = factory.applyType(hd.getTypeExn(), kept.size());
        Term reduced = db.unshift(factory.app(keptType, hd, kept), removable);
        return factory.funL(prefix.subList(0, prefix.size() - removable), reduced);
    }

    private boolean occursIn(List<Term> terms, int index) {
        for (Term t : terms) {
            if (db.contains(t, index)) {
                return true;
            }
        }
        return false;
    }

    //endregion

    //region PATTERN DI ORDINE SUPERIORE

    /**
     * Verifica la restrizione dei pattern: ogni applicazione con testa variabile libera
     * ha come argomenti variabili legate distinte (a meno di η).
     */
    public boolean isLambdaPattern(Term t) {
        return isPatternRec(t, new HashMap<>());
    }

    private boolean isPatternRec(Term t, Map<Term, Boolean> memo) {
        return visit(memo, t, x -> {
            Term w = whnf(x);
            return switch (w.getKind()) {
                case DB, VAR, CONST -> true;
                case APP_BUILTIN -> w.getArgs().stream().allMatch(a -> isPatternRec(a, memo));
                case APP -> w.getHead().isVar()
                        ? allDistinctBound(w.getArgs())
                        : w.getArgs().stream().allMatch(a -> isPatternRec(a, memo));
                case BIND -> isPatternRec(w.getBody(), memo);
            };
        });
    }

    private boolean allDistinctBound(List<Term> args) {
        Set<Integer> seen = new HashSet<>();
        for (Term arg : args) {
            Term reduced = etaReduce(arg);
            if (!reduced.isBVar() || !seen.add(reduced.getIndex())) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region UTILITÀ

    /**
     * Rimuove il prefisso di λ del termine raccogliendo i tipi delle variabili legate.
     */
    private static Term openLambdas(Term t, List<Term> prefixOut) {
        Term cur = t;
        while (cur.isLambda()) {
            prefixOut.add(cur.getVarType());
            cur = cur.getBody();
        }
        return cur;
    }

    /**
     * Calcola {@code step(t)} alla prima visita del nodo, poi riusa il risultato.
     */
    private static <R> R visit(Map<Term, R> memo, Term t, Function<Term, R> step) {
        R done = memo.get(t);
        if (done == null) {
            done = step.apply(t);
            memo.put(t, done);
        }
        return done;
    }

    /**
     * Applica f a ogni elemento; restituisce null se nessun elemento cambia.
     */
    private static List<Term> mapChanged(List<Term> ts, UnaryOperator<Term> f) {
        List<Term> out = null;
        for (int i = 0; i < ts.size(); i++) {
            Term a = ts.get(i);
            Term a2 = f.apply(a);
            if (a2 != a && out == null) {
                out = new ArrayList<>(ts.subList(0, i));
            }
            if (out != null) {
                out.add(a2);
            }
        }
        return out;
    }

    //endregion
}
