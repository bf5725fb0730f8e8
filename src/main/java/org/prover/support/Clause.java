package org.prover.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CLAUSOLA - Disgiunzione di letterali con metadati di saturazione
 *
 * La lista dei letterali è fissata alla costruzione. Gli unici campi mutabili sono
 * il flag di ridondanza, impostato quando la clausola viene sussunta o sostituita,
 * e il trail, che può solo essere esteso.
 *
 * METADATI:
 * • id univoco, assegnato in ordine di creazione
 * • trail dei rami di split da cui dipende
 * • passo di prova con le clausole genitrici
 * • penalità euristica usata dalle strategie di selezione
 */
public final class Clause {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    private final List<Literal> literals;
    private final ProofStep proof;
    private final int penalty;
    private Trail trail;
    private boolean redundant;

    /** Cache della chiave di variante, calcolata al primo uso */
    private String variantKey;

    private Clause(List<Literal> literals, ProofStep proof, Trail trail, int penalty) {
        this.id = NEXT_ID.getAndIncrement();
        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
        this.proof = proof;
        this.trail = trail;
        this.penalty = penalty;
    }

    //region COSTRUZIONE

    /**
     * @throws IllegalArgumentException se la penalità è negativa o un letterale è null
     */
    public static Clause create(List<Literal> literals, ProofStep proof, Trail trail, int penalty) {
        Objects.requireNonNull(literals, "literals");
        Objects.requireNonNull(proof, "proof");
        Objects.requireNonNull(trail, "trail");
        if (penalty < 0) {
            throw new IllegalArgumentException("Penalità negativa: " + penalty);
        }
        for (Literal lit : literals) {
            if (lit == null) {
                throw new IllegalArgumentException("Letterale null nella clausola");
            }
        }
        return new Clause(literals, proof, trail, penalty);
    }

    public static Clause create(List<Literal> literals, ProofStep proof) {
        return create(literals, proof, Trail.empty(), 1);
    }

    /**
     * Clausola derivata: trail unione dei trail dei genitori, penalità massima fra i genitori.
     */
    public static Clause derive(List<Literal> literals, ProofStep proof) {
        Trail trail = Trail.empty();
        int penalty = 1;
        for (Clause parent : proof.getParents()) {
            trail = trail.merge(parent.getTrail());
            penalty = Math.max(penalty, parent.getPenalty());
        }
        return create(literals, proof, trail, penalty);
    }

    //endregion

    //region ACCESSO

    public int getId() {
        return id;
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public ProofStep getProof() {
        return proof;
    }

    public List<Clause> getParents() {
        return proof.getParents();
    }

    public Trail getTrail() {
        return trail;
    }

    public int getPenalty() {
        return penalty;
    }

    /** Clausola vuota: nessun letterale e trail vuoto */
    public boolean isEmpty() {
        return literals.isEmpty() && trail.isEmpty();
    }

    /** Nessun letterale, indipendentemente dal trail */
    public boolean hasNoLiterals() {
        return literals.isEmpty();
    }

    public boolean isUnit() {
        return literals.size() == 1;
    }

    public boolean isGround() {
        for (Literal lit : literals) {
            if (!lit.isGround()) return false;
        }
        return true;
    }

    public int weight() {
        int w = 0;
        for (Literal lit : literals) w += lit.weight();
        return w;
    }

    public int maxVarId() {
        int max = -1;
        for (Literal lit : literals) max = Math.max(max, lit.maxVarId());
        return max;
    }

    //endregion

    //region STATO MUTABILE

    public boolean isRedundant() {
        return redundant;
    }

    public void markRedundant() {
        this.redundant = true;
    }

    /**
     * Aggiunge letterali al trail; la chiave di variante viene ricalcolata.
     */
    public void extendTrail(Trail extra) {
        this.trail = trail.merge(extra);
        this.variantKey = null;
    }

    //endregion

    //region VARIANTI

    /** Numero massimo di rami esplorati fra letterali indistinguibili */
    private static final int MAX_TIE_BRANCHES = 64;

    /**
     * Chiave canonica della clausola a meno di rinomina delle variabili e di permutazione dei letterali.
     *
     * I letterali vengono emessi uno alla volta: a ogni passo si sceglie quello con la stampa minima
     * sotto la rinomina accumulata (variabili nuove numerate in ordine di prima occorrenza). A parità
     * di stampa si esplorano tutte le scelte e si tiene la chiave minima, entro MAX_TIE_BRANCHES rami.
     *
     * La chiave è una stampa iniettiva, quindi clausole non varianti hanno sempre chiavi diverse.
     * Due varianti hanno la stessa chiave, tranne quando i pareggi superano il limite di rami
     * (molti letterali simmetrici): in quel caso la chiave può dipendere dall'ordine dei letterali.
     */
    public String variantKey() {
        if (variantKey == null) {
            variantKey = computeVariantKey();
        }
        return variantKey;
    }

    private String computeVariantKey() {
        List<Integer> remaining = new ArrayList<>(literals.size());
        for (int i = 0; i < literals.size(); i++) remaining.add(i);
        String key = canonicalSuffix(remaining, new HashMap<>(), new int[]{MAX_TIE_BRANCHES});
        if (!trail.isEmpty()) {
            key = key + " ← " + trail;
        }
        return key;
    }

    /**
     * Stampa minima dei letterali rimanenti, data la rinomina già fissata dai letterali emessi.
     */
    private String canonicalSuffix(List<Integer> remaining, Map<Integer, Integer> renaming, int[] budget) {
        if (remaining.isEmpty()) {
            return "";
        }
        String min = null;
        List<Integer> ties = new ArrayList<>();
        for (int i : remaining) {
            String printed = printLiteral(literals.get(i), new HashMap<>(renaming));
            int cmp = min == null ? -1 : printed.compareTo(min);
            if (cmp < 0) {
                min = printed;
                ties.clear();
            }
            if (cmp <= 0) {
                ties.add(i);
            }
        }

        String best = null;
        List<Literal> tried = new ArrayList<>();
        for (int i : ties) {
            Literal lit = literals.get(i);
            if (tried.contains(lit)) continue;
            if (best != null && budget[0] <= 0) break;
            if (best != null) budget[0]--;
            tried.add(lit);

            Map<Integer, Integer> extended = new HashMap<>(renaming);
            printLiteral(lit, extended);
            List<Integer> rest = new ArrayList<>(remaining);
            rest.remove(Integer.valueOf(i));
            String rendered = rest.isEmpty() ? min : min + " | " + canonicalSuffix(rest, extended, budget);
            if (best == null || rendered.compareTo(best) < 0) {
                best = rendered;
            }
        }
        return best;
    }

    /**
     * Stampa il letterale con le variabili canoniche, estendendo la rinomina con quelle nuove.
     */
    private static String printLiteral(Literal lit, Map<Integer, Integer> renaming) {
        StringBuilder sb = new StringBuilder();
        lit.appendTo(sb, v -> {
            Integer canonical = renaming.get(v);
            if (canonical == null) {
                canonical = renaming.size();
                renaming.put(v, canonical);
            }
            return "V" + canonical;
        });
        return sb.toString();
    }

    //endregion

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Clause && ((Clause) o).id == id);
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id).append(": [");
        if (literals.isEmpty()) {
            sb.append('⊥');
        }
        for (int i = 0; i < literals.size(); i++) {
            if (i > 0) sb.append(" ∨ ");
            literals.get(i).appendTo(sb, v -> "X" + v);
        }
        sb.append(']');
        if (!trail.isEmpty()) sb.append(" ← ").append(trail);
        return sb.toString();
    }
}
