package org.prover.term;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * FABBRICA DEI TERMINI - Tabella di condivisione (hash-consing) esplicita
 *
 * Ogni termine costruito passa dalla tabella: se esiste già un termine strutturalmente
 * uguale viene restituita l'istanza condivisa. Di conseguenza, per termini costruiti
 * dalla stessa fabbrica, l'identità dei riferimenti coincide con l'uguaglianza semantica.
 *
 * La fabbrica è un oggetto esplicito, creato una volta e passato a chi costruisce termini;
 * non esiste alcuna tabella globale.
 *
 * NORMALIZZAZIONI APPLICATE IN COSTRUZIONE:
 * • app(f, []) = f
 * • app(app(f, a), b) = app(f, a b)
 * • arrow(a, arrow(b, r)) = arrow(a b, r) e arrow([], r) = r
 */
public class TermFactory {

    private static final Logger LOGGER = Logger.getLogger(TermFactory.class.getName());

    /** Nomi dei tipi atomici predefiniti */
    public static final String PROP_TYPE_NAME = "$o";
    public static final String INDIVIDUAL_TYPE_NAME = "$i";

    /** Tabella dei termini condivisi: termine -> istanza canonica */
    private final Map<Term, Term> table = new HashMap<>();

    private final Term propType;
    private final Term individualType;

    public TermFactory() {
        this.propType = tyConst(PROP_TYPE_NAME);
        this.individualType = tyConst(INDIVIDUAL_TYPE_NAME);
        LOGGER.fine("TermFactory inizializzata");
    }

    private Term intern(Term t) {
        Term existing = table.putIfAbsent(t, t);
        return existing != null ? existing : t;
    }

    /** Numero di termini distinti nella tabella */
    public int size() {
        return table.size();
    }

    //region TIPI

    public Term tyConst(String name) {
        validateName(name);
        return intern(Term.mkConst(name, null));
    }

    public Term tyProp() {
        return propType;
    }

    public Term tyIndividual() {
        return individualType;
    }

    /**
     * Costruisce il tipo funzionale args → ret, appiattito.
     *
     * @param args tipi dei parametri (anche vuota)
     * @param ret tipo di ritorno
     * @return ret se args è vuota, altrimenti il tipo ARROW appiattito
     */
    public Term arrow(List<Term> args, Term ret) {
        if (args.isEmpty()) {
            return ret;
        }
        List<Term> all = new ArrayList<>(args.size() + 1);
        for (Term arg : args) {
            requireType(arg);
            all.add(arg);
        }
        requireType(ret);
        if (ret.isArrow()) {
            all.addAll(ret.getArgs());
        } else {
            all.add(ret);
        }
        return intern(Term.mkBuiltin(Builtin.ARROW, null, all));
    }

    public Term arrow(Term arg, Term ret) {
        return arrow(List.of(arg), ret);
    }

    /**
     * Tipo risultante dall'applicazione di un termine di tipo {@code ty} a {@code n} argomenti.
     *
     * @throws IllegalStateException se il tipo non accetta abbastanza argomenti
     */
    public Term applyType(Term ty, int n) {
        if (n == 0) {
            return ty;
        }
        List<Term> params = ty.arrowArgs();
        if (params.size() < n) {
            throw new IllegalStateException("Il tipo " + ty + " non accetta " + n + " argomenti");
        }
        return arrow(params.subList(n, params.size()), ty.arrowReturn());
    }

    private void requireType(Term t) {
        if (t.hasType()) {
            throw new IllegalArgumentException("Atteso un tipo, trovato il termine " + t);
        }
    }

    //endregion

    //region TERMINI

    public Term var(int id, Term ty) {
        if (id < 0) {
            throw new IllegalArgumentException("Identificatore di variabile negativo: " + id);
        }
        requireType(ty);
        return intern(Term.mkVar(id, ty));
    }

    public Term constant(String symbol, Term ty) {
        validateName(symbol);
        requireType(ty);
        return intern(Term.mkConst(symbol, ty));
    }

    public Term bvar(int index, Term ty) {
        if (index < 0) {
            throw new IllegalArgumentException("Indice De Bruijn negativo: " + index);
        }
        requireType(ty);
        return intern(Term.mkBVar(index, ty));
    }

    /**
     * Applicazione con tipo calcolato dal tipo della testa.
     * Gli argomenti non vengono controllati uno per uno: il chiamante fornisce termini ben tipati.
     */
    public Term app(Term f, List<Term> args) {
        if (args.isEmpty()) {
            return f;
        }
        return app(applyType(f.getTypeExn(), args.size()), f, args);
    }

    public Term app(Term f, Term... args) {
        return app(f, List.of(args));
    }

    /**
     * Applicazione con tipo esplicito; appiattisce le applicazioni annidate.
     */
    public Term app(Term ty, Term f, List<Term> args) {
        if (args.isEmpty()) {
            return f;
        }
        if (f.isApp()) {
            List<Term> all = new ArrayList<>(f.getArgs().size() + args.size());
            all.addAll(f.getArgs());
            all.addAll(args);
            return intern(Term.mkApp(ty, f.getHead(), all));
        }
        return intern(Term.mkApp(ty, f, args));
    }

    public Term bind(Binder binder, Term ty, Term varType, Term body) {
        requireType(varType);
        return intern(Term.mkBind(binder, ty, varType, body));
    }

    /**
     * λ-astrazione: il tipo è varType → tipo del corpo.
     */
    public Term lambda(Term varType, Term body) {
        return bind(Binder.LAMBDA, arrow(varType, body.getTypeExn()), varType, body);
    }

    /**
     * Astrae il corpo su più variabili: funL([t1, t2], b) = λ:t1. λ:t2. b
     * (la variabile più interna, indice 0, ha tipo t2).
     */
    public Term funL(List<Term> varTypes, Term body) {
        Term result = body;
        for (int i = varTypes.size() - 1; i >= 0; i--) {
            result = lambda(varTypes.get(i), result);
        }
        return result;
    }

    public Term forall(Term varType, Term body) {
        return bind(Binder.FORALL, propType, varType, body);
    }

    public Term exists(Term varType, Term body) {
        return bind(Binder.EXISTS, propType, varType, body);
    }

    public Term appBuiltin(Builtin builtin, @Nullable Term ty, List<Term> args) {
        if (builtin == Builtin.ARROW) {
            throw new IllegalArgumentException("Usare arrow() per costruire tipi funzionali");
        }
        return intern(Term.mkBuiltin(builtin, ty, args));
    }

    public Term trueTerm() {
        return appBuiltin(Builtin.TRUE, propType, List.of());
    }

    public Term falseTerm() {
        return appBuiltin(Builtin.FALSE, propType, List.of());
    }

    public Term not(Term t) {
        return appBuiltin(Builtin.NOT, propType, List.of(t));
    }

    //endregion

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome di simbolo non può essere null o vuoto");
        }
    }
}
