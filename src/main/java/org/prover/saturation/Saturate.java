package org.prover.saturation;

import org.jetbrains.annotations.Nullable;
import org.prover.support.Clause;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SATURAZIONE - Algoritmo della given clause
 *
 * A ogni passo una clausola passiva viene semplificata, usata per ridurre l'insieme active
 * e infine combinata con active tramite le inferenze registrate. Le nuove clausole tornano
 * in passive. Il ciclo termina quando viene derivata la clausola vuota (UNSAT), quando
 * passive si esaurisce senza nuove conclusioni (SAT), oppure per limite di passi o di tempo.
 *
 * La scadenza è cooperativa: viene controllata solo fra un passo e il successivo.
 * Le eccezioni sollevate dalle regole terminano l'esecuzione: vengono registrate e rilanciate
 * senza alcun ripristino dello stato.
 */
public class Saturate {

    private static final Logger LOGGER = Logger.getLogger(Saturate.class.getName());

    private final Env env;
    private final SaturationConfiguration configuration;
    private final LongSupplier clock;

    public Saturate(Env env) {
        this(env, System::currentTimeMillis);
    }

    /**
     * @param clock orologio in millisecondi usato per il controllo della scadenza
     */
    public Saturate(Env env, LongSupplier clock) {
        this.env = Objects.requireNonNull(env, "env");
        this.configuration = env.getConfiguration();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    //region PASSO SINGOLO

    /**
     * Esegue un passo del ciclo given-clause.
     *
     * @param generating se false non vengono eseguite inferenze generative (interriduzione)
     * @param num indice del passo, per i log
     * @return UNKNOWN se il ciclo deve proseguire, altrimenti lo stato terminale
     */
    public SZSStatus givenClauseStep(boolean generating, int num) {
        SZSStatus status = doGivenClauseStep(generating, num);
        if (configuration.isCheckInvariants()) {
            String violation = checkInvariants();
            if (violation != null) {
                LOGGER.severe("Invariante violata al passo " + num + ": " + violation);
                return SZSStatus.error(violation);
            }
        }
        return status;
    }

    private SZSStatus doGivenClauseStep(boolean generating, int num) {
        SaturationStatistics stats = env.getStatistics();
        env.stepInit();

        Clause c = env.nextPassive();
        if (c == null) {
            return finalGeneratingPass();
        }

        List<Clause> simplified = env.allSimplify(c);
        if (simplified.isEmpty()) {
            stats.incrementRedundantGiven();
            LOGGER.fine(() -> "Given clause ridondante: " + c);
            return SZSStatus.unknown();
        }
        for (Clause s : simplified) {
            if (s.isEmpty()) {
                return SZSStatus.unsat(s);
            }
        }

        Clause given = simplified.get(0);
        env.addPassive(simplified.subList(1, simplified.size()));
        stats.incrementGivenClauses();
        LOGGER.fine(() -> String.format("============ passo %5d ============ given: %s", num, given));

        // clausole attive sussunte dalla given
        Set<Clause> subsumed = env.subsumedBy(given);
        subsumed.forEach(Clause::markRedundant);
        env.removeActive(subsumed);
        env.removeSimpl(subsumed);
        env.removeOrphans(subsumed);
        stats.addSubsumedActive(subsumed.size());

        // semplificazione all'indietro di active
        env.addSimpl(given);
        Env.BackwardSimplification backward = env.backwardSimplify(given);
        env.removeActive(backward.getSimplified());
        env.removeSimpl(backward.getSimplified());
        env.removeOrphans(backward.getSimplified());
        List<Clause> newClauses = new ArrayList<>(backward.getReplacements());

        env.addActive(given);

        if (generating) {
            Set<String> seen = new HashSet<>();
            for (Clause inferred : env.generate(given)) {
                Clause s = env.forwardSimplify(inferred);
                if (env.isTrivial(s) || env.isKnown(s) || !seen.add(s.variantKey())) {
                    LOGGER.finest(() -> "Scartata conclusione banale o già nota: " + s);
                    continue;
                }
                newClauses.add(s);
            }
        }
        if (!newClauses.isEmpty()) {
            LOGGER.finer(() -> "Nuove clausole: " + newClauses);
        }
        env.addPassive(newClauses);

        Clause empty = env.someEmptyClause();
        return empty == null ? SZSStatus.unknown() : SZSStatus.unsat(empty);
    }

    /**
     * Passive vuoto: ultimo tentativo generativo prima di dichiarare la saturazione.
     */
    private SZSStatus finalGeneratingPass() {
        List<Clause> fresh = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Clause generated : env.doGenerate()) {
            Clause s = env.simplify(generated);
            if (env.isTrivial(s) || env.isKnown(s) || !seen.add(s.variantKey())) {
                continue;
            }
            fresh.add(s);
        }
        if (fresh.isEmpty()) {
            return SZSStatus.sat();
        }
        LOGGER.fine(() -> "Passo generativo finale: " + fresh.size() + " nuove clausole");
        env.addPassive(fresh);
        return SZSStatus.unknown();
    }

    /**
     * @return descrizione della violazione, null se lo stato è coerente
     */
    private @Nullable String checkInvariants() {
        ProofState state = env.getProofState();
        List<Clause> both = state.activePassiveIntersection();
        if (!both.isEmpty()) {
            return "clausole sia in active sia in passive: " + both;
        }
        for (Clause c : state.getActive()) {
            if (c.isRedundant()) {
                return "clausola ridondante ancora in active: " + c;
            }
        }
        return null;
    }

    //endregion

    //region CICLO PRINCIPALE

    /**
     * Ripete il passo given-clause fino a uno stato terminale o a un limite.
     *
     * @param generating abilita le inferenze generative
     * @param steps limite di passi, null per nessun limite
     * @param deadline istante assoluto in millisecondi, null per nessuna scadenza
     */
    public SaturationResult givenClause(boolean generating, @Nullable Integer steps, @Nullable Long deadline) {
        SaturationStatistics stats = env.getStatistics();
        LOGGER.info("Inizio saturazione (" + (generating ? "generativa" : "interriduzione") + "), "
                + env.getProofState());

        int num = 0;
        SZSStatus status;
        try {
            while (true) {
                if (deadline != null && clock.getAsLong() >= deadline) {
                    status = SZSStatus.timeout();
                    break;
                }
                if (steps != null && num >= steps) {
                    status = SZSStatus.unknown();
                    break;
                }
                if (num % configuration.getCleanPassiveInterval() == 0) {
                    env.cleanPassive();
                }
                if (num > 0 && num % configuration.getClauseEliminationInterval() == 0) {
                    env.doClauseEliminate();
                }
                status = givenClauseStep(generating, num);
                if (status.isTerminal()) {
                    break;
                }
                num++;
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore fatale al passo " + num + " della saturazione", e);
            stats.stopTimer();
            throw e;
        }

        stats.stopTimer();
        LOGGER.info("Saturazione terminata: " + status + " dopo " + num + " passi. " + stats.toCompactString());
        return new SaturationResult(status, num, stats);
    }

    public SaturationResult givenClause() {
        return givenClause(true, null, null);
    }

    /**
     * Interriduzione senza inferenze generative, fino al punto fisso.
     */
    public SaturationResult presaturate() {
        return givenClause(false, null, null);
    }

    //endregion

    public Env getEnv() {
        return env;
    }
}
