package org.prover.optionalfeatures;

import org.prover.saturation.Env;

/**
 * Registra sull'ambiente il calcolo di risoluzione di default: risoluzione binaria,
 * fattorizzazione, eliminazione di tautologie e duplicati, semplificazione unitaria
 * in avanti e all'indietro, sussunzione in avanti, all'indietro e periodica su passive.
 */
public final class DefaultCalculus {

    private DefaultCalculus() {
    }

    public static void install(Env env) {
        Unifier unifier = new Unifier(env.getContext().getLambda());
        UnitSimplifyReflect unitSimplify = new UnitSimplifyReflect(unifier);
        SubsumptionPrinciple subsumption = new SubsumptionPrinciple(unifier);

        env.addBinaryInference(BinaryResolution.RULE_NAME, new BinaryResolution(unifier));
        env.addUnaryInference(Factoring.RULE_NAME, new Factoring(unifier, env.getContext()));
        env.addIsTrivial(new TautologyElimination());
        env.addSimplification(new DuplicateLiteralElimination());
        env.addSimplification(unitSimplify);
        env.addBackwardSimplification(unitSimplify);
        env.addSubsumption(subsumption);
        env.addRedundancy(subsumption.asRedundancyCheck());
        env.addClauseEliminationRule(0, "subsumption", subsumption.asEliminationRule());
    }
}
