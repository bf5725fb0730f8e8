package org.prover.optionalfeatures;

import org.jetbrains.annotations.Nullable;
import org.prover.lambda.Lambda;
import org.prover.support.Literal;
import org.prover.support.Substitution;
import org.prover.term.Term;
import org.prover.term.TermFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * UNIFICAZIONE SINTATTICA - Unificazione e matching del primo ordine
 *
 * I termini con testa variabile applicata (flex) unificano solo se identici dopo la
 * sostituzione; i termini che non rispettano la restrizione dei pattern vengono rifiutati
 * in partenza dalle regole tramite {@link #isSupported(Term)}.
 *
 * Le sostituzioni prodotte dall'unificazione sono triangolari (vanno applicate con
 * {@link Substitution#apply}); quelle del matching legano solo le variabili del pattern a
 * sottotermini del bersaglio e vanno consultate con {@link Substitution#lookup}.
 */
public class Unifier {

    private final Lambda lambda;

    public Unifier(Lambda lambda) {
        this.lambda = lambda;
    }

    public TermFactory getFactory() {
        return lambda.getFactory();
    }

    /**
     * Vero se il termine rispetta la restrizione dei pattern di ordine superiore.
     */
    public boolean isSupported(Term t) {
        return lambda.isLambdaPattern(t);
    }

    //region UNIFICAZIONE

    /**
     * @return l'unificatore più generale, null se i termini non sono unificabili
     */
    public @Nullable Substitution unify(Term a, Term b) {
        Substitution s = new Substitution();
        return unifyInto(a, b, s) ? s : null;
    }

    /**
     * Estende s con l'unificatore di a e b. In caso di fallimento s può risultare
     * parzialmente estesa: chi esplora alternative lavora su una copia.
     */
    public boolean unifyInto(Term a, Term b, Substitution s) {
        Term x = s.deref(a);
        Term y = s.deref(b);
        if (x == y) {
            return true;
        }
        if (x.isVar()) {
            return bindVar(x, y, s);
        }
        if (y.isVar()) {
            return bindVar(y, x, s);
        }
        if (x.getKind() != y.getKind()) {
            return false;
        }
        return switch (x.getKind()) {
            case VAR, CONST, DB -> false;
            case APP -> {
                if (x.getHead().isVar() || y.getHead().isVar()) {
                    yield s.apply(getFactory(), x) == s.apply(getFactory(), y);
                }
                yield x.getHead() == y.getHead() && unifyAll(x.getArgs(), y.getArgs(), s);
            }
            case BIND -> x.getBinder() == y.getBinder() && x.getVarType() == y.getVarType()
                    && unifyInto(x.getBody(), y.getBody(), s);
            case APP_BUILTIN -> x.getBuiltin() == y.getBuiltin() && unifyAll(x.getArgs(), y.getArgs(), s);
        };
    }

    private boolean unifyAll(List<Term> as, List<Term> bs, Substitution s) {
        if (as.size() != bs.size()) {
            return false;
        }
        for (int i = 0; i < as.size(); i++) {
            if (!unifyInto(as.get(i), bs.get(i), s)) return false;
        }
        return true;
    }

    private boolean bindVar(Term v, Term t, Substitution s) {
        if (v.getType() != t.getType() || !t.isClosed() || occurs(v.getVarId(), t, s)) {
            return false;
        }
        s.bind(v.getVarId(), t);
        return true;
    }

    private boolean occurs(int varId, Term t, Substitution s) {
        Term d = s.deref(t);
        if (d.isGround()) {
            return false;
        }
        return switch (d.getKind()) {
            case VAR -> d.getVarId() == varId;
            case CONST, DB -> false;
            case APP -> occurs(varId, d.getHead(), s) || occursAny(varId, d.getArgs(), s);
            case BIND -> occurs(varId, d.getBody(), s);
            case APP_BUILTIN -> occursAny(varId, d.getArgs(), s);
        };
    }

    private boolean occursAny(int varId, List<Term> ts, Substitution s) {
        for (Term t : ts) {
            if (occurs(varId, t, s)) return true;
        }
        return false;
    }

    //endregion

    //region MATCHING

    /**
     * Matching unidirezionale: cerca σ con pattern·σ = target, dove le variabili del
     * bersaglio sono trattate come costanti.
     */
    public @Nullable Substitution match(Term pattern, Term target) {
        Substitution s = new Substitution();
        return matchInto(pattern, target, s) ? s : null;
    }

    public boolean matchInto(Term pattern, Term target, Substitution s) {
        if (pattern.isVar()) {
            Term bound = s.lookup(pattern.getVarId());
            if (bound != null) {
                return bound == target;
            }
            if (pattern.getType() != target.getType() || !target.isClosed()) {
                return false;
            }
            s.bind(pattern.getVarId(), target);
            return true;
        }
        if (pattern.isGround()) {
            return pattern == target;
        }
        if (pattern.getKind() != target.getKind()) {
            return false;
        }
        return switch (pattern.getKind()) {
            case VAR, CONST, DB -> pattern == target;
            case APP -> {
                if (pattern.getArgs().size() != target.getArgs().size()) yield false;
                yield matchInto(pattern.getHead(), target.getHead(), s)
                        && matchAll(pattern.getArgs(), target.getArgs(), s);
            }
            case BIND -> pattern.getBinder() == target.getBinder() && pattern.getVarType() == target.getVarType()
                    && matchInto(pattern.getBody(), target.getBody(), s);
            case APP_BUILTIN -> pattern.getBuiltin() == target.getBuiltin()
                    && matchAll(pattern.getArgs(), target.getArgs(), s);
        };
    }

    private boolean matchAll(List<Term> ps, List<Term> ts, Substitution s) {
        if (ps.size() != ts.size()) {
            return false;
        }
        for (int i = 0; i < ps.size(); i++) {
            if (!matchInto(ps.get(i), ts.get(i), s)) return false;
        }
        return true;
    }

    /**
     * Matching di letterali dello stesso tipo e segno; le equazioni sono provate in
     * entrambe le orientazioni. In caso di successo s viene estesa.
     */
    public boolean matchLiteral(Literal pattern, Literal target, Substitution s) {
        if (pattern.getKind() != target.getKind() || pattern.isPositive() != target.isPositive()) {
            return false;
        }
        return switch (pattern.getKind()) {
            case TRUE, FALSE -> true;
            case PROP -> {
                Substitution attempt = s.copy();
                if (!matchInto(pattern.getAtom(), target.getAtom(), attempt)) yield false;
                commit(attempt, s);
                yield true;
            }
            case EQUATION -> {
                Substitution direct = s.copy();
                if (matchInto(pattern.getLhs(), target.getLhs(), direct)
                        && matchInto(pattern.getRhs(), target.getRhs(), direct)) {
                    commit(direct, s);
                    yield true;
                }
                Substitution swapped = s.copy();
                if (matchInto(pattern.getLhs(), target.getRhs(), swapped)
                        && matchInto(pattern.getRhs(), target.getLhs(), swapped)) {
                    commit(swapped, s);
                    yield true;
                }
                yield false;
            }
        };
    }

    private static void commit(Substitution from, Substitution into) {
        from.asMap().forEach((id, t) -> {
            if (!into.isBound(id)) into.bind(id, t);
        });
    }

    //endregion

    //region RINOMINA

    /**
     * Rinomina ogni variabile X_i in X_(i+offset), per separare le variabili di due clausole.
     */
    public Term shiftVars(Term t, int offset) {
        if (offset == 0 || t.isGround()) {
            return t;
        }
        TermFactory f = getFactory();
        return switch (t.getKind()) {
            case VAR -> f.var(t.getVarId() + offset, t.getTypeExn());
            case CONST, DB -> t;
            case APP -> f.app(t.getTypeExn(), shiftVars(t.getHead(), offset), shiftAll(t.getArgs(), offset));
            case BIND -> f.bind(t.getBinder(), t.getTypeExn(), t.getVarType(), shiftVars(t.getBody(), offset));
            case APP_BUILTIN -> f.appBuiltin(t.getBuiltin(), t.getType(), shiftAll(t.getArgs(), offset));
        };
    }

    private List<Term> shiftAll(List<Term> ts, int offset) {
        List<Term> out = new ArrayList<>(ts.size());
        for (Term t : ts) out.add(shiftVars(t, offset));
        return out;
    }

    public Literal shiftVars(Literal lit, int offset) {
        return lit.map(t -> shiftVars(t, offset));
    }

    //endregion
}
