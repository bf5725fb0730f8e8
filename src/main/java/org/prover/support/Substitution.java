package org.prover.support;

import org.jetbrains.annotations.Nullable;
import org.prover.term.Term;
import org.prover.term.TermFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sostituzione (triangolare) da identificatori di variabile a termini.
 *
 * L'applicazione segue le catene di legami fino a un termine stabile; l'occurs-check
 * del chiamante garantisce che le catene siano finite. I termini legati sono chiusi
 * rispetto agli indici De Bruijn, quindi possono essere inseriti sotto legatori senza spostamenti.
 */
public class Substitution {

    private final Map<Integer, Term> bindings;

    public Substitution() {
        this.bindings = new HashMap<>();
    }

    private Substitution(Map<Integer, Term> bindings) {
        this.bindings = bindings;
    }

    /** Copia indipendente, per l'esplorazione con backtracking */
    public Substitution copy() {
        return new Substitution(new HashMap<>(bindings));
    }

    public void bind(int varId, Term t) {
        if (bindings.containsKey(varId)) {
            throw new IllegalStateException("Variabile X" + varId + " già legata a " + bindings.get(varId));
        }
        bindings.put(varId, t);
    }

    public @Nullable Term lookup(int varId) {
        return bindings.get(varId);
    }

    public boolean isBound(int varId) {
        return bindings.containsKey(varId);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public Map<Integer, Term> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Segue i legami della variabile in testa al termine.
     */
    public Term deref(Term t) {
        Term cur = t;
        while (cur.isVar()) {
            Term next = bindings.get(cur.getVarId());
            if (next == null) {
                return cur;
            }
            cur = next;
        }
        return cur;
    }

    /**
     * Applica la sostituzione al termine ricostruendolo tramite la fabbrica.
     * Le applicazioni con testa variabile istanziata possono formare redessi:
     * il chiamante li normalizza con il normalizzatore lambda.
     */
    public Term apply(TermFactory factory, Term t) {
        if (bindings.isEmpty() || t.isGround()) {
            return t;
        }
        return switch (t.getKind()) {
            case VAR -> {
                Term bound = bindings.get(t.getVarId());
                yield bound == null ? t : apply(factory, bound);
            }
            case CONST, DB -> t;
            case APP -> {
                Term head = apply(factory, t.getHead());
                List<Term> args = applyAll(factory, t.getArgs());
                yield factory.app(t.getTypeExn(), head, args);
            }
            case BIND -> factory.bind(t.getBinder(), t.getTypeExn(), t.getVarType(), apply(factory, t.getBody()));
            case APP_BUILTIN -> factory.appBuiltin(t.getBuiltin(), t.getType(), applyAll(factory, t.getArgs()));
        };
    }

    private List<Term> applyAll(TermFactory factory, List<Term> ts) {
        List<Term> out = new ArrayList<>(ts.size());
        for (Term a : ts) out.add(apply(factory, a));
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        bindings.forEach((id, t) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append('X').append(id).append(" ↦ ").append(t);
        });
        return sb.append('}').toString();
    }
}
