package org.prover.saturation;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Clause;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * AMBIENTE DI SATURAZIONE - Registro delle regole e orchestrazione sullo stato di prova
 *
 * Le estensioni del calcolo registrano qui le proprie regole senza che l'ambiente ne conosca
 * l'identità; il ciclo given-clause usa soltanto le operazioni esposte.
 *
 * REGISTRI:
 * • inferenze binarie (given contro active) e unarie (solo given)
 * • regole generative senza given clause, per il controllo finale di saturazione
 * • semplificazioni unarie, multiple e all'indietro
 * • controlli di banalità, ridondanza e sussunzione
 * • regole di eliminazione periodiche con priorità, hook di inizio passo
 */
public class Env {

    private static final Logger LOGGER = Logger.getLogger(Env.class.getName());

    //region STATO

    private final Context context;
    private final ProofState proofState;
    private final SaturationConfiguration configuration;
    private final SaturationStatistics statistics = new SaturationStatistics();

    //endregion

    //region REGISTRI

    private final List<Named<BinaryInference>> binaryInferences = new ArrayList<>();
    private final List<Named<UnaryInference>> unaryInferences = new ArrayList<>();
    private final List<Named<GenerateRule>> generateRules = new ArrayList<>();
    private final List<SimplificationRule> simplifications = new ArrayList<>();
    private final List<MultiSimplificationRule> multiSimplifications = new ArrayList<>();
    private final List<BackwardSimplificationRule> backwardSimplifications = new ArrayList<>();
    private final List<TrivialityCheck> trivialityChecks = new ArrayList<>();
    private final List<RedundancyCheck> redundancyChecks = new ArrayList<>();
    private final List<SubsumptionCheck> subsumptionChecks = new ArrayList<>();
    private final List<PrioritizedElimination> clauseEliminationRules = new ArrayList<>();
    private final List<Runnable> stepInits = new ArrayList<>();

    //endregion

    public Env(Context context, ClauseSelection selection, SaturationConfiguration configuration) {
        this.context = Objects.requireNonNull(context, "context");
        this.proofState = new ProofState(Objects.requireNonNull(selection, "selection"));
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        LOGGER.fine(() -> "Env creato: selezione " + selection.name() + ", ordinamento "
                + context.getOrdering().name() + ", " + configuration);
    }

    //region REGISTRAZIONE

    public void addBinaryInference(String name, BinaryInference rule) {
        binaryInferences.add(new Named<>(name, rule));
        LOGGER.fine("Registrata inferenza binaria " + name);
    }

    public void addUnaryInference(String name, UnaryInference rule) {
        unaryInferences.add(new Named<>(name, rule));
        LOGGER.fine("Registrata inferenza unaria " + name);
    }

    public void addGenerate(String name, GenerateRule rule) {
        generateRules.add(new Named<>(name, rule));
        LOGGER.fine("Registrata regola generativa " + name);
    }

    public void addSimplification(SimplificationRule rule) {
        simplifications.add(Objects.requireNonNull(rule));
    }

    public void addMultiSimplification(MultiSimplificationRule rule) {
        multiSimplifications.add(Objects.requireNonNull(rule));
    }

    public void addBackwardSimplification(BackwardSimplificationRule rule) {
        backwardSimplifications.add(Objects.requireNonNull(rule));
    }

    public void addIsTrivial(TrivialityCheck check) {
        trivialityChecks.add(Objects.requireNonNull(check));
    }

    public void addRedundancy(RedundancyCheck check) {
        redundancyChecks.add(Objects.requireNonNull(check));
    }

    public void addSubsumption(SubsumptionCheck check) {
        subsumptionChecks.add(Objects.requireNonNull(check));
    }

    /**
     * Registra una regola di eliminazione periodica; a priorità maggiore corrisponde
     * un'esecuzione anticipata.
     */
    public void addClauseEliminationRule(int priority, String name, ClauseEliminationRule rule) {
        clauseEliminationRules.add(new PrioritizedElimination(priority, name, Objects.requireNonNull(rule)));
        clauseEliminationRules.sort(Comparator.comparingInt((PrioritizedElimination p) -> p.priority).reversed());
        LOGGER.fine("Registrata eliminazione " + name + " con priorità " + priority);
    }

    public void addStepInit(Runnable hook) {
        stepInits.add(Objects.requireNonNull(hook));
    }

    //endregion

    //region INSIEMI DI CLAUSOLE

    /**
     * Prossima clausola passiva; le clausole già marcate ridondanti vengono scartate.
     */
    public @Nullable Clause nextPassive() {
        while (true) {
            Clause c = proofState.nextPassive();
            if (c == null || !c.isRedundant()) {
                return c;
            }
            LOGGER.finest(() -> "Scartata clausola passiva ridondante " + c);
        }
    }

    /**
     * @return numero di clausole effettivamente inserite
     */
    public int addPassive(Collection<Clause> clauses) {
        int added = 0;
        for (Clause c : clauses) {
            if (proofState.addPassive(c)) added++;
        }
        return added;
    }

    public boolean addPassive(Clause c) {
        return proofState.addPassive(c);
    }

    public void addActive(Collection<Clause> clauses) {
        clauses.forEach(proofState::addActive);
    }

    public boolean addActive(Clause c) {
        return proofState.addActive(c);
    }

    public void removeActive(Collection<Clause> clauses) {
        clauses.forEach(proofState::removeActive);
    }

    public void removePassive(Collection<Clause> clauses) {
        clauses.forEach(proofState::removePassive);
    }

    public void addSimpl(Collection<Clause> clauses) {
        clauses.forEach(proofState::addSimpl);
    }

    public void addSimpl(Clause c) {
        proofState.addSimpl(c);
    }

    public void removeSimpl(Collection<Clause> clauses) {
        clauses.forEach(proofState::removeSimpl);
    }

    /**
     * Criterio degli orfani: rimuove da passive le conclusioni d'inferenza delle clausole
     * eliminate. Senza effetto se il criterio è disabilitato.
     */
    public int removeOrphans(Collection<Clause> removed) {
        if (!configuration.isOrphanCriterion() || removed.isEmpty()) {
            return 0;
        }
        int count = proofState.removeOrphans(removed);
        statistics.addOrphansRemoved(count);
        return count;
    }

    public boolean isActive(Clause c) {
        return proofState.isActive(c);
    }

    public boolean isPassive(Clause c) {
        return proofState.isPassive(c);
    }

    /**
     * Vero se la clausola, o una sua variante, è già in active o in passive.
     */
    public boolean isKnown(Clause c) {
        return isActive(c) || isPassive(c) || proofState.hasVariant(c);
    }

    public @Nullable Clause someEmptyClause() {
        return proofState.someEmptyClause();
    }

    public int cleanPassive() {
        int count = proofState.cleanPassive();
        statistics.addPassiveCleaned(count);
        LOGGER.fine(() -> "Pulizia di passive: " + count + " clausole eliminate, " + proofState);
        return count;
    }

    //endregion

    //region SEMPLIFICAZIONE

    /**
     * Clausole attive (diverse da c) sussunte da c.
     */
    public Set<Clause> subsumedBy(Clause c) {
        Set<Clause> result = new LinkedHashSet<>();
        if (subsumptionChecks.isEmpty()) {
            return result;
        }
        for (Clause d : proofState.getActive()) {
            if (d != c && subsumes(c, d)) {
                result.add(d);
            }
        }
        return result;
    }

    private boolean subsumes(Clause a, Clause b) {
        for (SubsumptionCheck check : subsumptionChecks) {
            if (check.subsumes(a, b)) return true;
        }
        return false;
    }

    /**
     * Punto fisso delle semplificazioni unarie, limitato a maxSimplificationRounds giri.
     * Ogni clausola sostituita viene marcata ridondante.
     */
    public Clause simplify(Clause c) {
        Clause current = c;
        for (int round = 0; round < configuration.getMaxSimplificationRounds(); round++) {
            Clause before = current;
            for (SimplificationRule rule : simplifications) {
                Clause next = rule.simplify(this, current);
                if (next != current) {
                    LOGGER.finest(() -> "Semplificazione: " + before + " → " + next);
                    current.markRedundant();
                    current = next;
                }
            }
            if (current == before) {
                return current;
            }
        }
        LOGGER.warning("Semplificazione di " + c + " interrotta dopo "
                + configuration.getMaxSimplificationRounds() + " giri");
        return current;
    }

    /**
     * Semplificazione in avanti di una clausola nuova rispetto all'insieme simpl.
     */
    public Clause forwardSimplify(Clause c) {
        Clause result = simplify(c);
        if (result != c) {
            statistics.incrementForwardSimplified();
        }
        return result;
    }

    /**
     * Prima semplificazione multipla applicabile, null se nessuna si applica.
     */
    public @Nullable List<Clause> multiSimplify(Clause c) {
        for (MultiSimplificationRule rule : multiSimplifications) {
            List<Clause> result = rule.simplify(this, c);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /**
     * Applica tutte le semplificazioni fino al punto fisso.
     *
     * @return le clausole risultanti; vuota se c è banale o ridondante, più elementi se una
     *         semplificazione multipla la divide. Il primo elemento discende direttamente da c.
     */
    public List<Clause> allSimplify(Clause c) {
        List<Clause> result = new ArrayList<>();
        Deque<Clause> todo = new ArrayDeque<>();
        todo.add(c);
        while (!todo.isEmpty()) {
            Clause current = simplify(todo.poll());
            if (isTrivial(current) || isRedundant(current)) {
                current.markRedundant();
                continue;
            }
            List<Clause> split = multiSimplify(current);
            if (split != null) {
                current.markRedundant();
                todo.addAll(split);
                continue;
            }
            result.add(current);
        }
        if (result.size() != 1 || result.get(0) != c) {
            statistics.incrementForwardSimplified();
        }
        return result;
    }

    /**
     * Semplifica all'indietro l'insieme active usando la given clause, che deve già trovarsi
     * nell'insieme simpl.
     *
     * @return le clausole attive semplificate (da rimuovere) e i loro sostituti non banali
     */
    public BackwardSimplification backwardSimplify(Clause given) {
        Set<Clause> candidates = new LinkedHashSet<>();
        for (BackwardSimplificationRule rule : backwardSimplifications) {
            for (Clause d : rule.candidates(this, given)) {
                if (d != given && isActive(d)) candidates.add(d);
            }
        }
        Set<Clause> simplified = new LinkedHashSet<>();
        List<Clause> replacements = new ArrayList<>();
        for (Clause d : candidates) {
            Clause s = simplify(d);
            if (s == d) continue;
            d.markRedundant();
            simplified.add(d);
            if (!isTrivial(s)) {
                replacements.add(s);
            }
        }
        statistics.addBackwardSimplified(simplified.size());
        if (!simplified.isEmpty()) {
            LOGGER.fine(() -> "Given " + given.getId() + " semplifica all'indietro " + simplified.size() + " clausole");
        }
        return new BackwardSimplification(simplified, replacements);
    }

    public boolean isTrivial(Clause c) {
        if (c.isRedundant() || c.getTrail().isTrivial()) {
            return true;
        }
        for (TrivialityCheck check : trivialityChecks) {
            if (check.isTrivial(c)) return true;
        }
        return false;
    }

    public boolean isRedundant(Clause c) {
        for (RedundancyCheck check : redundancyChecks) {
            if (check.isRedundant(this, c)) return true;
        }
        return false;
    }

    //endregion

    //region GENERAZIONE

    /**
     * Inferenze fra la given clause e active (given inclusa), più le inferenze unarie.
     */
    public List<Clause> generate(Clause given) {
        List<Clause> result = new ArrayList<>();
        for (Named<BinaryInference> inf : binaryInferences) {
            List<Clause> produced = inf.rule.infer(this, given);
            LOGGER.finest(() -> inf.name + " su " + given.getId() + ": " + produced.size() + " clausole");
            result.addAll(produced);
        }
        for (Named<UnaryInference> inf : unaryInferences) {
            result.addAll(inf.rule.infer(given));
        }
        statistics.addGeneratedClauses(result.size());
        return result;
    }

    /**
     * Passo generativo finale, senza given clause.
     */
    public List<Clause> doGenerate() {
        List<Clause> result = new ArrayList<>();
        for (Named<GenerateRule> gen : generateRules) {
            result.addAll(gen.rule.generate(this, true));
        }
        statistics.addGeneratedClauses(result.size());
        return result;
    }

    //endregion

    //region HOOK PERIODICI

    public void stepInit() {
        stepInits.forEach(Runnable::run);
    }

    /**
     * Esegue le regole di eliminazione in ordine di priorità decrescente.
     *
     * @return numero totale di clausole rimosse
     */
    public int doClauseEliminate() {
        int total = 0;
        for (PrioritizedElimination rule : clauseEliminationRules) {
            int removed = rule.rule.eliminate(this);
            if (removed > 0) {
                LOGGER.fine("Eliminazione " + rule.name + ": " + removed + " clausole");
            }
            total += removed;
        }
        statistics.addClausesEliminated(total);
        return total;
    }

    //endregion

    //region ACCESSORS

    public Context getContext() {
        return context;
    }

    public ProofState getProofState() {
        return proofState;
    }

    public SaturationConfiguration getConfiguration() {
        return configuration;
    }

    public SaturationStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region TIPI DI SUPPORTO

    /**
     * Esito della semplificazione all'indietro.
     */
    public static final class BackwardSimplification {
        private final Set<Clause> simplified;
        private final List<Clause> replacements;

        BackwardSimplification(Set<Clause> simplified, List<Clause> replacements) {
            this.simplified = simplified;
            this.replacements = replacements;
        }

        /** Clausole attive semplificate, da rimuovere da active, simpl e orfani */
        public Set<Clause> getSimplified() {
            return simplified;
        }

        /** Sostituti da inserire in passive */
        public List<Clause> getReplacements() {
            return replacements;
        }
    }

    private static final class Named<R> {
        private final String name;
        private final R rule;

        Named(String name, R rule) {
            this.name = Objects.requireNonNull(name, "name");
            this.rule = Objects.requireNonNull(rule, "rule");
        }
    }

    private static final class PrioritizedElimination {
        private final int priority;
        private final String name;
        private final ClauseEliminationRule rule;

        PrioritizedElimination(int priority, String name, ClauseEliminationRule rule) {
            this.priority = priority;
            this.name = name;
            this.rule = rule;
        }
    }

    //endregion
}
