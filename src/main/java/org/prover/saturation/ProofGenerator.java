package org.prover.saturation;

import org.prover.support.Clause;
import org.prover.support.ProofStep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * GENERATORE DI PROVE - Ricostruzione della refutazione a partire dalla clausola vuota
 *
 * Percorre il grafo delle giustificazioni seguendo i genitori dei passi di prova.
 * Una prova è ben fondata se il grafo è aciclico e ogni cammino termina in un passo
 * ASSERT, GOAL o TRIVIAL.
 *
 * FORMATO OUTPUT (genitori prima dei figli):
 * 3: [P(a)]    assert problema:ax1
 * 7: [Q(a)]    inf resolution da 3, 5
 * ...
 * 12: [⊥]      simp unit_simplify_reflect da 9, 3
 */
public class ProofGenerator {

    private static final Logger LOGGER = Logger.getLogger(ProofGenerator.class.getName());

    private final Clause root;

    /** Clausole raggiungibili dalla radice in ordine di visita in ampiezza, per id */
    private final Map<Integer, Clause> reachable;

    public ProofGenerator(Clause root) {
        this.root = Objects.requireNonNull(root, "root");
        this.reachable = collect(root);
        LOGGER.fine(() -> "Prova di " + root.getId() + ": " + reachable.size() + " clausole");
    }

    /**
     * Prova dello stato UNSAT.
     *
     * @throws IllegalStateException se lo stato non è UNSAT
     */
    public static ProofGenerator of(SZSStatus status) {
        return new ProofGenerator(status.getEmptyClause());
    }

    //region VISITA

    private static Map<Integer, Clause> collect(Clause root) {
        Map<Integer, Clause> seen = new LinkedHashMap<>();
        Deque<Clause> queue = new ArrayDeque<>();
        seen.put(root.getId(), root);
        queue.add(root);
        while (!queue.isEmpty()) {
            Clause c = queue.poll();
            for (Clause parent : c.getParents()) {
                if (seen.putIfAbsent(parent.getId(), parent) == null) {
                    queue.add(parent);
                }
            }
        }
        return seen;
    }

    /** Clausole della prova in ordine di visita in ampiezza dalla radice */
    public List<Clause> getClauses() {
        return Collections.unmodifiableList(new ArrayList<>(reachable.values()));
    }

    public int size() {
        return reachable.size();
    }

    /** Clausole in ingresso usate dalla prova */
    public List<Clause> getLeaves() {
        return reachable.values().stream()
                .filter(c -> c.getProof().isLeaf())
                .collect(Collectors.toList());
    }

    //endregion

    //region VERIFICHE STRUTTURALI

    /**
     * Ordinamento topologico (genitori prima dei figli), vuoto se il grafo contiene un ciclo.
     */
    private List<Clause> topologicalOrder() {
        Map<Integer, Integer> state = new HashMap<>(); // 1 = in visita, 2 = chiuso
        List<Clause> order = new ArrayList<>();
        Deque<Clause> stack = new ArrayDeque<>();
        Deque<Integer> nextParent = new ArrayDeque<>();
        stack.push(root);
        nextParent.push(0);
        state.put(root.getId(), 1);
        while (!stack.isEmpty()) {
            Clause c = stack.peek();
            int i = nextParent.pop();
            List<Clause> parents = c.getParents();
            if (i < parents.size()) {
                nextParent.push(i + 1);
                Clause p = parents.get(i);
                Integer s = state.get(p.getId());
                if (s == null) {
                    state.put(p.getId(), 1);
                    stack.push(p);
                    nextParent.push(0);
                } else if (s == 1) {
                    return List.of();
                }
            } else {
                stack.pop();
                state.put(c.getId(), 2);
                order.add(c);
            }
        }
        return order;
    }

    public boolean isAcyclic() {
        return !topologicalOrder().isEmpty();
    }

    /**
     * Aciclica, e ogni clausola senza genitori è giustificata da ASSERT, GOAL o TRIVIAL.
     */
    public boolean isWellFounded() {
        if (!isAcyclic()) {
            return false;
        }
        for (Clause c : reachable.values()) {
            if (c.getParents().isEmpty() && !c.getProof().isLeaf()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lunghezza del cammino più lungo dalla radice a una foglia (0 se la radice è una foglia).
     *
     * @throws IllegalStateException se il grafo contiene un ciclo
     */
    public int depth() {
        List<Clause> order = topologicalOrder();
        if (order.isEmpty()) {
            throw new IllegalStateException("Grafo della prova ciclico a partire da " + root);
        }
        Map<Integer, Integer> depths = new HashMap<>();
        for (Clause c : order) {
            int d = 0;
            for (Clause p : c.getParents()) {
                d = Math.max(d, depths.get(p.getId()) + 1);
            }
            depths.put(c.getId(), d);
        }
        return depths.get(root.getId());
    }

    //endregion

    //region OUTPUT

    /**
     * Elenco testuale della prova, genitori prima dei figli.
     *
     * @throws IllegalStateException se il grafo contiene un ciclo
     */
    public String generateProof() {
        List<Clause> order = topologicalOrder();
        if (order.isEmpty()) {
            throw new IllegalStateException("Impossibile stampare una prova ciclica a partire da " + root);
        }
        StringBuilder proof = new StringBuilder();
        for (Clause c : order) {
            proof.append(formatStep(c)).append('\n');
        }
        LOGGER.info("Prova generata: " + order.size() + " passi, profondità " + depth());
        return proof.toString();
    }

    private String formatStep(Clause c) {
        ProofStep step = c.getProof();
        StringBuilder line = new StringBuilder();
        line.append(c).append("    ").append(step);
        if (!c.getParents().isEmpty()) {
            line.append(" da ").append(c.getParents().stream()
                    .map(p -> Integer.toString(p.getId()))
                    .collect(Collectors.joining(", ")));
        }
        if (!step.getComments().isEmpty()) {
            line.append(" (").append(String.join("; ", step.getComments())).append(')');
        }
        return line.toString();
    }

    //endregion

    public Clause getRoot() {
        return root;
    }

    @Override
    public String toString() {
        return "ProofGenerator[radice=" + root.getId() + ", clausole=" + size() + "]";
    }
}
