package org.prover.optionalfeatures;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Comparison;
import org.prover.support.TermOrdering;
import org.prover.term.Term;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ORDINAMENTO DI KNUTH-BENDIX - Pesi unitari e precedenza sui simboli
 *
 * PRECEDENZA:
 * • i simboli elencati nel costruttore precedono gli altri, i primi sono i maggiori
 * • i simboli non elencati si confrontano per nome
 *
 * I termini con testa flessibile, le astrazioni e gli indici legati non hanno un simbolo
 * di testa: a parità di peso risultano incomparabili con termini diversi.
 */
public class KnuthBendixOrdering implements TermOrdering {

    private final Map<String, Integer> explicitRank = new HashMap<>();

    public KnuthBendixOrdering() {
        this(List.of());
    }

    /**
     * @param precedence simboli in ordine decrescente di precedenza
     */
    public KnuthBendixOrdering(List<String> precedence) {
        for (int i = 0; i < precedence.size(); i++) {
            explicitRank.putIfAbsent(precedence.get(i), i);
        }
    }

    @Override
    public Comparison compare(Term s, Term t) {
        if (s == t) {
            return Comparison.EQUAL;
        }
        if (t.isVar()) {
            return s.containsVar(t.getVarId()) ? Comparison.GREATER_THAN : Comparison.INCOMPARABLE;
        }
        if (s.isVar()) {
            return t.containsVar(s.getVarId()) ? Comparison.LESS_THAN : Comparison.INCOMPARABLE;
        }

        Map<Integer, Integer> balance = new HashMap<>();
        countVars(s, 1, balance);
        countVars(t, -1, balance);
        boolean sCoversT = balance.values().stream().allMatch(n -> n >= 0);
        boolean tCoversS = balance.values().stream().allMatch(n -> n <= 0);

        int ws = s.size();
        int wt = t.size();
        if (ws > wt) {
            return sCoversT ? Comparison.GREATER_THAN : Comparison.INCOMPARABLE;
        }
        if (ws < wt) {
            return tCoversS ? Comparison.LESS_THAN : Comparison.INCOMPARABLE;
        }

        Comparison byHead = compareHeads(s, t);
        if (byHead == Comparison.EQUAL) {
            byHead = compareArgs(argsOf(s), argsOf(t));
        }
        return switch (byHead) {
            case GREATER_THAN -> sCoversT ? Comparison.GREATER_THAN : Comparison.INCOMPARABLE;
            case LESS_THAN -> tCoversS ? Comparison.LESS_THAN : Comparison.INCOMPARABLE;
            case EQUAL, INCOMPARABLE -> Comparison.INCOMPARABLE;
        };
    }

    @Override
    public String name() {
        return "kbo";
    }

    //region CONFRONTO PER PRECEDENZA

    private Comparison compareHeads(Term s, Term t) {
        String hs = headSymbol(s);
        String ht = headSymbol(t);
        if (hs == null || ht == null) {
            return Comparison.INCOMPARABLE;
        }
        if (hs.equals(ht)) {
            int as = argsOf(s).size();
            int at = argsOf(t).size();
            if (as == at) return Comparison.EQUAL;
            return as > at ? Comparison.GREATER_THAN : Comparison.LESS_THAN;
        }
        return comparePrecedence(hs, ht);
    }

    /**
     * Confronto fra due simboli distinti.
     */
    Comparison comparePrecedence(String a, String b) {
        Integer ra = explicitRank.get(a);
        Integer rb = explicitRank.get(b);
        int cmp;
        if (ra != null && rb != null) {
            cmp = Integer.compare(rb, ra);
        } else if (ra != null) {
            cmp = 1;
        } else if (rb != null) {
            cmp = -1;
        } else {
            cmp = a.compareTo(b);
        }
        if (cmp == 0) return Comparison.EQUAL;
        return cmp > 0 ? Comparison.GREATER_THAN : Comparison.LESS_THAN;
    }

    private Comparison compareArgs(List<Term> as, List<Term> bs) {
        for (int i = 0; i < as.size(); i++) {
            Comparison c = compare(as.get(i), bs.get(i));
            if (c != Comparison.EQUAL) {
                return c;
            }
        }
        return Comparison.EQUAL;
    }

    private static @Nullable String headSymbol(Term t) {
        return switch (t.getKind()) {
            case CONST -> t.getSymbol();
            case APP -> t.getHead().isConst() ? t.getHead().getSymbol() : null;
            case APP_BUILTIN -> "$" + t.getBuiltin().name();
            case VAR, DB, BIND -> null;
        };
    }

    private static List<Term> argsOf(Term t) {
        return switch (t.getKind()) {
            case APP, APP_BUILTIN -> t.getArgs();
            default -> List.of();
        };
    }

    //endregion

    private static void countVars(Term t, int delta, Map<Integer, Integer> balance) {
        if (t.isGround()) return;
        switch (t.getKind()) {
            case VAR -> balance.merge(t.getVarId(), delta, Integer::sum);
            case CONST, DB -> { }
            case APP -> {
                countVars(t.getHead(), delta, balance);
                for (Term a : t.getArgs()) countVars(a, delta, balance);
            }
            case BIND -> countVars(t.getBody(), delta, balance);
            case APP_BUILTIN -> {
                for (Term a : t.getArgs()) countVars(a, delta, balance);
            }
        }
    }
}
