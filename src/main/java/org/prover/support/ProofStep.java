package org.prover.support;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PASSO DI PROVA - Giustificazione di una clausola
 *
 * Registra la regola che ha prodotto la clausola e le clausole genitrici. Le foglie del
 * grafo delle giustificazioni sono i passi ASSERT, GOAL e TRIVIAL; tutti gli altri passi
 * hanno almeno un genitore.
 *
 * TIPI DI PASSO:
 * • INFERENCE: conclusione di una regola generativa
 * • SIMPLIFICATION: sostituto semplificato di un'altra clausola
 * • ESA: trasformazione che preserva la soddisfacibilità
 * • ASSERT / GOAL: clausole in ingresso, con la loro sorgente
 * • TRIVIAL: tautologie senza genitori
 */
public final class ProofStep {

    public enum Kind { INFERENCE, SIMPLIFICATION, ESA, ASSERT, GOAL, TRIVIAL }

    /**
     * Provenienza di un'asserzione: file e nome della formula nel problema originale.
     */
    public static final class Source {
        private final String file;
        private final @Nullable String name;

        public Source(String file, @Nullable String name) {
            this.file = Objects.requireNonNull(file, "file");
            this.name = name;
        }

        public String getFile() {
            return file;
        }

        public @Nullable String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Source)) return false;
            Source other = (Source) o;
            return file.equals(other.file) && Objects.equals(name, other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(file, name);
        }

        @Override
        public String toString() {
            return name == null ? file : file + ":" + name;
        }
    }

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    private final Kind kind;
    private final @Nullable String ruleName;
    private final List<String> comments;
    private final List<Clause> parents;
    private final @Nullable Source source;

    private ProofStep(Kind kind, @Nullable String ruleName, List<String> comments,
                      List<Clause> parents, @Nullable Source source) {
        this.id = NEXT_ID.getAndIncrement();
        this.kind = kind;
        this.ruleName = ruleName;
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.parents = Collections.unmodifiableList(new ArrayList<>(parents));
        this.source = source;
    }

    //region COSTRUZIONE

    public static ProofStep mkAssert(Source source) {
        return new ProofStep(Kind.ASSERT, null, List.of(), List.of(), source);
    }

    public static ProofStep mkGoal(Source source) {
        return new ProofStep(Kind.GOAL, null, List.of(), List.of(), source);
    }

    public static ProofStep mkTrivial() {
        return new ProofStep(Kind.TRIVIAL, null, List.of(), List.of(), null);
    }

    public static ProofStep mkInference(String rule, List<Clause> parents, String... comments) {
        return mkWithParents(Kind.INFERENCE, rule, parents, comments);
    }

    public static ProofStep mkSimplification(String rule, List<Clause> parents, String... comments) {
        return mkWithParents(Kind.SIMPLIFICATION, rule, parents, comments);
    }

    public static ProofStep mkEsa(String rule, List<Clause> parents, String... comments) {
        return mkWithParents(Kind.ESA, rule, parents, comments);
    }

    private static ProofStep mkWithParents(Kind kind, String rule, List<Clause> parents, String[] comments) {
        Objects.requireNonNull(rule, "rule");
        if (parents.isEmpty()) {
            throw new IllegalArgumentException("Il passo " + kind + " '" + rule + "' richiede almeno un genitore");
        }
        return new ProofStep(kind, rule, List.of(comments), parents, null);
    }

    //endregion

    public int getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    public @Nullable String getRuleName() {
        return ruleName;
    }

    public List<String> getComments() {
        return comments;
    }

    public List<Clause> getParents() {
        return parents;
    }

    public @Nullable Source getSource() {
        return source;
    }

    public boolean isLeaf() {
        return kind == Kind.ASSERT || kind == Kind.GOAL || kind == Kind.TRIVIAL;
    }

    public boolean isInference() {
        return kind == Kind.INFERENCE;
    }

    public boolean isSimplification() {
        return kind == Kind.SIMPLIFICATION;
    }

    /**
     * Descrizione breve: "inf resolution", "simp demod", "assert f.p:ax1", "trivial".
     */
    @Override
    public String toString() {
        return switch (kind) {
            case INFERENCE -> "inf " + ruleName;
            case SIMPLIFICATION -> "simp " + ruleName;
            case ESA -> "esa " + ruleName;
            case ASSERT -> "assert " + source;
            case GOAL -> "goal " + source;
            case TRIVIAL -> "trivial";
        };
    }
}
