package org.prover.saturation;

/**
 * Forma normale η applicata ai termini dei letterali quando una clausola viene costruita.
 */
public enum EtaMode {
    /** η-contrazione dopo la forma normale forte */
    REDUCE,
    /** η-espansione dopo la forma normale forte */
    EXPAND,
    /** solo forma normale forte */
    NONE
}
