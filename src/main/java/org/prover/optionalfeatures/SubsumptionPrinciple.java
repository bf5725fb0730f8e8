package org.prover.optionalfeatures;

import org.prover.saturation.ClauseEliminationRule;
import org.prover.saturation.Env;
import org.prover.saturation.ProofState;
import org.prover.saturation.RedundancyCheck;
import org.prover.saturation.SubsumptionCheck;
import org.prover.support.Clause;
import org.prover.support.Literal;
import org.prover.support.Substitution;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * IMPLEMENTAZIONE DEL PRINCIPIO DI SUSSUNZIONE per l'eliminazione di clausole ridondanti
 *
 * DEFINIZIONE:
 * Una clausola C1 sussume una clausola C2 se esiste una sostituzione σ tale che ogni
 * letterale di C1σ corrisponde a un letterale distinto di C2, e il trail di C1 è contenuto
 * nel trail di C2. In questo caso C2 può essere eliminata senza alterare la
 * soddisfacibilità dell'insieme.
 *
 * ESEMPIO:
 * (P(X)) sussume (P(a) ∨ Q(b)) con σ = {X ↦ a}
 * (P(X) ∨ P(Y)) non sussume (P(a)): servono due letterali distinti
 *
 * La ricerca dell'assegnamento dei letterali procede per backtracking; il fallimento di un
 * ramo è segnalato dal valore restituito, senza eccezioni.
 */
public class SubsumptionPrinciple implements SubsumptionCheck {

    private static final Logger LOGGER = Logger.getLogger(SubsumptionPrinciple.class.getName());

    private final Unifier unifier;

    //region STATISTICHE

    /** Confronti eseguiti */
    private int checks;

    /** Confronti conclusi con successo */
    private int successes;

    /** Clausole eliminate dalla regola periodica */
    private int eliminatedClauses;

    //endregion

    public SubsumptionPrinciple(Unifier unifier) {
        this.unifier = unifier;
        LOGGER.fine("SubsumptionPrinciple inizializzato");
    }

    //region ALGORITMO SUSSUNZIONE

    @Override
    public boolean subsumes(Clause subsumer, Clause subsumed) {
        checks++;
        if (subsumer.size() > subsumed.size() || !subsumer.getTrail().subsetOf(subsumed.getTrail())) {
            return false;
        }
        boolean result = matchFrom(0, subsumer.getLiterals(), subsumed.getLiterals(),
                new boolean[subsumed.size()], new Substitution());
        if (result) {
            successes++;
            LOGGER.finest(() -> "Clausola " + subsumer + " sussume " + subsumed);
        }
        return result;
    }

    /**
     * Assegna il letterale i-esimo di C1 a un letterale ancora libero di C2, poi prosegue;
     * in caso di fallimento prova l'assegnamento successivo.
     */
    private boolean matchFrom(int i, List<Literal> from, List<Literal> into, boolean[] used, Substitution subst) {
        if (i == from.size()) {
            return true;
        }
        Literal lit = from.get(i);
        for (int j = 0; j < into.size(); j++) {
            if (used[j]) continue;
            Substitution attempt = subst.copy();
            if (!unifier.matchLiteral(lit, into.get(j), attempt)) continue;
            used[j] = true;
            if (matchFrom(i + 1, from, into, used, attempt)) {
                return true;
            }
            used[j] = false;
        }
        return false;
    }

    //endregion

    //region SUSSUNZIONE IN AVANTI

    /**
     * Controllo di ridondanza: una clausola è ridondante se una clausola attiva la sussume.
     */
    public RedundancyCheck asRedundancyCheck() {
        return this::isSubsumedByActive;
    }

    private boolean isSubsumedByActive(Env env, Clause c) {
        for (Clause a : env.getProofState().getActive()) {
            if (a != c && !a.isRedundant() && subsumes(a, c)) {
                LOGGER.finer(() -> "Sussunzione in avanti di " + c + " da parte di " + a);
                return true;
            }
        }
        return false;
    }

    //endregion

    //region ELIMINAZIONE PERIODICA

    /**
     * Regola periodica: elimina da passive le clausole sussunte da una clausola attiva.
     */
    public ClauseEliminationRule asEliminationRule() {
        return this::eliminateSubsumedPassive;
    }

    private int eliminateSubsumedPassive(Env env) {
        ProofState state = env.getProofState();
        List<Clause> active = state.getActive().snapshot();
        List<Clause> toEliminate = new ArrayList<>();
        for (Clause candidate : state.getPassive().snapshot()) {
            for (Clause a : active) {
                if (subsumes(a, candidate)) {
                    toEliminate.add(candidate);
                    break;
                }
            }
        }
        for (Clause c : toEliminate) {
            c.markRedundant();
            state.removePassive(c);
        }
        eliminatedClauses += toEliminate.size();
        if (!toEliminate.isEmpty()) {
            LOGGER.fine("Sussunzione periodica: " + toEliminate.size() + " clausole passive eliminate");
        }
        return toEliminate.size();
    }

    //endregion

    //region INTERFACCIA PUBBLICA INFORMAZIONI

    public int getChecks() {
        return checks;
    }

    public int getSuccesses() {
        return successes;
    }

    public int getEliminatedClausesCount() {
        return eliminatedClauses;
    }

    /**
     * Riepilogo testuale dell'attività di sussunzione.
     */
    public String getOptimizationInfo() {
        StringBuilder info = new StringBuilder();
        info.append("=== SUBSUMPTION REPORT ===\n");
        info.append("Confronti eseguiti: ").append(checks).append("\n");
        info.append("Sussunzioni trovate: ").append(successes).append("\n");
        info.append("Clausole passive eliminate: ").append(eliminatedClauses).append("\n");
        if (checks > 0) {
            double rate = (double) successes / checks * 100;
            info.append("Tasso di successo: ").append(String.format("%.1f%%", rate)).append("\n");
        }
        info.append("==========================\n");
        return info.toString();
    }

    @Override
    public String toString() {
        return String.format("SubsumptionPrinciple[checks=%d, successes=%d, eliminated=%d]",
                checks, successes, eliminatedClauses);
    }

    //endregion
}
