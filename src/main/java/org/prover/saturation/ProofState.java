package org.prover.saturation;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Clause;
import org.prover.support.Trail;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * STATO DI PROVA - Insiemi active, passive e simpl con gli indici ausiliari
 *
 * INVARIANTI:
 * • nessuna clausola appartiene contemporaneamente ad active e passive
 * • l'indice delle varianti copre esattamente active ∪ passive
 * • l'indice dei discendenti associa a ogni genitore le conclusioni d'inferenza
 *   inserite in passive, per il criterio degli orfani
 *
 * Le clausole rimosse restano raggiungibili tramite i passi di prova delle loro
 * conclusioni; nessuna rimozione invalida una prova già costruita.
 */
public class ProofState {

    private static final Logger LOGGER = Logger.getLogger(ProofState.class.getName());

    private final ClauseSet active = new ClauseSet("active");
    private final ClauseSet simpl = new ClauseSet("simpl");
    private final PassiveSet passive;

    /** Chiave di variante -> numero di clausole vive in active ∪ passive con quella chiave */
    private final Map<String, Integer> variants = new HashMap<>();

    /** Id clausola -> chiave con cui è stata indicizzata */
    private final Map<Integer, String> variantKeys = new HashMap<>();

    /** Id genitore -> conclusioni d'inferenza inserite in passive */
    private final Map<Integer, List<Clause>> descendants = new HashMap<>();

    /** Clausole vuote mai inserite in passive, in ordine di arrivo */
    private final List<Clause> emptyClauses = new ArrayList<>();

    public ProofState(ClauseSelection selection) {
        this.passive = new PassiveSet(selection);
    }

    //region ACTIVE

    /**
     * @throws IllegalStateException se la clausola è in passive
     */
    public boolean addActive(Clause c) {
        if (passive.contains(c)) {
            throw new IllegalStateException("Clausola " + c + " già presente in passive");
        }
        if (!active.add(c)) {
            return false;
        }
        indexVariant(c);
        LOGGER.finest(() -> "active += " + c);
        return true;
    }

    public boolean removeActive(Clause c) {
        if (!active.remove(c)) {
            return false;
        }
        unindexVariant(c);
        LOGGER.finest(() -> "active -= " + c);
        return true;
    }

    public boolean isActive(Clause c) {
        return active.contains(c);
    }

    public ClauseSet getActive() {
        return active;
    }

    //endregion

    //region PASSIVE

    /**
     * @throws IllegalStateException se la clausola è in active
     */
    public boolean addPassive(Clause c) {
        if (active.contains(c)) {
            throw new IllegalStateException("Clausola " + c + " già presente in active");
        }
        if (!passive.add(c)) {
            return false;
        }
        indexVariant(c);
        if (c.getProof().isInference()) {
            for (Clause parent : c.getParents()) {
                descendants.computeIfAbsent(parent.getId(), k -> new ArrayList<>()).add(c);
            }
        }
        if (c.isEmpty()) {
            emptyClauses.add(c);
        }
        LOGGER.finest(() -> "passive += " + c);
        return true;
    }

    public boolean removePassive(Clause c) {
        if (!passive.remove(c)) {
            return false;
        }
        unindexVariant(c);
        LOGGER.finest(() -> "passive -= " + c);
        return true;
    }

    /**
     * Estrae e rimuove da passive la prossima clausola secondo la strategia di selezione.
     */
    public @Nullable Clause nextPassive() {
        Clause c = passive.next();
        if (c != null) {
            unindexVariant(c);
        }
        return c;
    }

    public boolean isPassive(Clause c) {
        return passive.contains(c);
    }

    public PassiveSet getPassive() {
        return passive;
    }

    //endregion

    //region SIMPL

    public boolean addSimpl(Clause c) {
        return simpl.add(c);
    }

    public boolean removeSimpl(Clause c) {
        return simpl.remove(c);
    }

    public ClauseSet getSimpl() {
        return simpl;
    }

    //endregion

    //region VARIANTI E CLAUSOLE VUOTE

    /**
     * Vero se una variante della clausola (stessi letterali a meno di rinomina e di ordine,
     * stesso trail) è già in active o in passive.
     */
    public boolean hasVariant(Clause c) {
        return variants.containsKey(c.variantKey());
    }

    public @Nullable Clause someEmptyClause() {
        return emptyClauses.isEmpty() ? null : emptyClauses.get(0);
    }

    /**
     * Estende il trail di una clausola mantenendo coerente l'indice delle varianti,
     * anche se la clausola è già in active o in passive.
     */
    public void extendTrail(Clause c, Trail extra) {
        boolean indexed = variantKeys.containsKey(c.getId());
        if (indexed) {
            unindexVariant(c);
        }
        c.extendTrail(extra);
        if (indexed) {
            indexVariant(c);
        }
    }

    private void indexVariant(Clause c) {
        if (variantKeys.containsKey(c.getId())) {
            return;
        }
        String key = c.variantKey();
        variants.merge(key, 1, Integer::sum);
        variantKeys.put(c.getId(), key);
    }

    /**
     * Rimuove la clausola dall'indice usando la chiave con cui era stata inserita.
     */
    private void unindexVariant(Clause c) {
        String key = variantKeys.remove(c.getId());
        if (key != null) {
            variants.computeIfPresent(key, (k, n) -> n == 1 ? null : n - 1);
        }
    }

    //endregion

    //region ORFANI E PULIZIA

    /**
     * Rimuove da passive le conclusioni d'inferenza delle clausole date, marcandole ridondanti.
     *
     * @return numero di orfani rimossi
     */
    public int removeOrphans(Collection<Clause> removed) {
        int count = 0;
        for (Clause parent : removed) {
            List<Clause> children = descendants.remove(parent.getId());
            if (children == null) continue;
            for (Clause child : children) {
                if (removePassive(child)) {
                    child.markRedundant();
                    count++;
                }
            }
        }
        if (count > 0) {
            LOGGER.fine("Rimossi " + count + " orfani da passive");
        }
        return count;
    }

    /**
     * Elimina da passive le clausole marcate ridondanti e compatta l'indice dei discendenti.
     *
     * @return numero di clausole eliminate
     */
    public int cleanPassive() {
        int count = 0;
        for (Clause c : passive.snapshot()) {
            if (c.isRedundant() && removePassive(c)) {
                count++;
            }
        }
        descendants.values().forEach(children -> children.removeIf(d -> !passive.contains(d)));
        descendants.values().removeIf(List::isEmpty);
        return count;
    }

    //endregion

    /**
     * Clausole presenti sia in active sia in passive; vuota se l'invariante regge.
     */
    public List<Clause> activePassiveIntersection() {
        List<Clause> both = new ArrayList<>();
        for (Clause c : active) {
            if (passive.contains(c)) both.add(c);
        }
        return both;
    }

    @Override
    public String toString() {
        return "ProofState[active=" + active.size() + ", passive=" + passive.size()
                + ", simpl=" + simpl.size() + "]";
    }
}
