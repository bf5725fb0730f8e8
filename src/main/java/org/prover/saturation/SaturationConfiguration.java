package org.prover.saturation;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CONFIGURAZIONE DELLA SATURAZIONE - Parametri validati del ciclo given-clause
 *
 * Valore immutabile costruito dai default, da un oggetto {@link Properties} oppure dalla
 * risorsa di classpath {@value #RESOURCE_NAME}. Le varianti si ottengono con i metodi with*.
 *
 * CHIAVI RICONOSCIUTE:
 * • saturation.cleanPassiveInterval: cadenza della pulizia di passive (passi)
 * • saturation.clauseEliminationInterval: cadenza delle regole di eliminazione periodiche (passi)
 * • saturation.maxSimplificationRounds: limite al punto fisso della semplificazione unaria
 * • saturation.orphanCriterion: abilita la rimozione degli orfani
 * • saturation.checkInvariants: verifica active ∩ passive = ∅ dopo ogni passo
 * • saturation.etaMode: REDUCE, EXPAND oppure NONE
 */
public final class SaturationConfiguration {

    private static final Logger LOGGER = Logger.getLogger(SaturationConfiguration.class.getName());

    public static final String RESOURCE_NAME = "saturation.properties";

    public static final String KEY_CLEAN_PASSIVE_INTERVAL = "saturation.cleanPassiveInterval";
    public static final String KEY_CLAUSE_ELIMINATION_INTERVAL = "saturation.clauseEliminationInterval";
    public static final String KEY_MAX_SIMPLIFICATION_ROUNDS = "saturation.maxSimplificationRounds";
    public static final String KEY_ORPHAN_CRITERION = "saturation.orphanCriterion";
    public static final String KEY_CHECK_INVARIANTS = "saturation.checkInvariants";
    public static final String KEY_ETA_MODE = "saturation.etaMode";

    private static final Set<String> KNOWN_KEYS = Set.of(
            KEY_CLEAN_PASSIVE_INTERVAL, KEY_CLAUSE_ELIMINATION_INTERVAL, KEY_MAX_SIMPLIFICATION_ROUNDS,
            KEY_ORPHAN_CRITERION, KEY_CHECK_INVARIANTS, KEY_ETA_MODE);

    //region DEFAULT

    public static final int DEFAULT_CLEAN_PASSIVE_INTERVAL = 1000;
    public static final int DEFAULT_CLAUSE_ELIMINATION_INTERVAL = 10;
    public static final int DEFAULT_MAX_SIMPLIFICATION_ROUNDS = 64;

    //endregion

    private final int cleanPassiveInterval;
    private final int clauseEliminationInterval;
    private final int maxSimplificationRounds;
    private final boolean orphanCriterion;
    private final boolean checkInvariants;
    private final EtaMode etaMode;

    private SaturationConfiguration(int cleanPassiveInterval, int clauseEliminationInterval,
                                    int maxSimplificationRounds, boolean orphanCriterion,
                                    boolean checkInvariants, EtaMode etaMode) {
        requirePositive(KEY_CLEAN_PASSIVE_INTERVAL, cleanPassiveInterval);
        requirePositive(KEY_CLAUSE_ELIMINATION_INTERVAL, clauseEliminationInterval);
        requirePositive(KEY_MAX_SIMPLIFICATION_ROUNDS, maxSimplificationRounds);
        if (etaMode == null) {
            throw new IllegalArgumentException(KEY_ETA_MODE + " non può essere null");
        }
        this.cleanPassiveInterval = cleanPassiveInterval;
        this.clauseEliminationInterval = clauseEliminationInterval;
        this.maxSimplificationRounds = maxSimplificationRounds;
        this.orphanCriterion = orphanCriterion;
        this.checkInvariants = checkInvariants;
        this.etaMode = etaMode;
    }

    //region COSTRUZIONE

    public static SaturationConfiguration defaults() {
        return new SaturationConfiguration(DEFAULT_CLEAN_PASSIVE_INTERVAL, DEFAULT_CLAUSE_ELIMINATION_INTERVAL,
                DEFAULT_MAX_SIMPLIFICATION_ROUNDS, true, false, EtaMode.REDUCE);
    }

    /**
     * Legge i parametri presenti; quelli assenti mantengono il default.
     * Le chiavi sconosciute con prefisso "saturation." vengono segnalate e ignorate.
     *
     * @throws IllegalArgumentException se un valore non è valido, con il nome della chiave
     */
    public static SaturationConfiguration fromProperties(Properties props) {
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith("saturation.") && !KNOWN_KEYS.contains(key)) {
                LOGGER.warning("Chiave di configurazione sconosciuta ignorata: " + key);
            }
        }
        SaturationConfiguration d = defaults();
        return new SaturationConfiguration(
                readInt(props, KEY_CLEAN_PASSIVE_INTERVAL, d.cleanPassiveInterval),
                readInt(props, KEY_CLAUSE_ELIMINATION_INTERVAL, d.clauseEliminationInterval),
                readInt(props, KEY_MAX_SIMPLIFICATION_ROUNDS, d.maxSimplificationRounds),
                readBoolean(props, KEY_ORPHAN_CRITERION, d.orphanCriterion),
                readBoolean(props, KEY_CHECK_INVARIANTS, d.checkInvariants),
                readEtaMode(props, d.etaMode));
    }

    /**
     * Carica {@value #RESOURCE_NAME} dal classpath; se la risorsa manca usa i default.
     *
     * @throws IllegalStateException se la risorsa esiste ma non è leggibile
     */
    public static SaturationConfiguration load() {
        ClassLoader loader = SaturationConfiguration.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                LOGGER.fine("Risorsa " + RESOURCE_NAME + " assente, uso i default");
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new IllegalStateException("Impossibile leggere " + RESOURCE_NAME, e);
        }
    }

    public SaturationConfiguration withCleanPassiveInterval(int value) {
        return new SaturationConfiguration(value, clauseEliminationInterval, maxSimplificationRounds,
                orphanCriterion, checkInvariants, etaMode);
    }

    public SaturationConfiguration withClauseEliminationInterval(int value) {
        return new SaturationConfiguration(cleanPassiveInterval, value, maxSimplificationRounds,
                orphanCriterion, checkInvariants, etaMode);
    }

    public SaturationConfiguration withMaxSimplificationRounds(int value) {
        return new SaturationConfiguration(cleanPassiveInterval, clauseEliminationInterval, value,
                orphanCriterion, checkInvariants, etaMode);
    }

    public SaturationConfiguration withOrphanCriterion(boolean value) {
        return new SaturationConfiguration(cleanPassiveInterval, clauseEliminationInterval, maxSimplificationRounds,
                value, checkInvariants, etaMode);
    }

    public SaturationConfiguration withCheckInvariants(boolean value) {
        return new SaturationConfiguration(cleanPassiveInterval, clauseEliminationInterval, maxSimplificationRounds,
                orphanCriterion, value, etaMode);
    }

    public SaturationConfiguration withEtaMode(EtaMode value) {
        return new SaturationConfiguration(cleanPassiveInterval, clauseEliminationInterval, maxSimplificationRounds,
                orphanCriterion, checkInvariants, value);
    }

    //endregion

    //region LETTURA VALORI

    private static int readInt(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valore non intero per " + key + ": '" + raw + "'", e);
        }
    }

    private static boolean readBoolean(Properties props, String key, boolean fallback) {
        String raw = props.getProperty(key);
        if (raw == null) return fallback;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true")) return true;
        if (v.equals("false")) return false;
        throw new IllegalArgumentException("Valore non booleano per " + key + ": '" + raw + "'");
    }

    private static EtaMode readEtaMode(Properties props, EtaMode fallback) {
        String raw = props.getProperty(KEY_ETA_MODE);
        if (raw == null) return fallback;
        try {
            return EtaMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Valore non valido per " + KEY_ETA_MODE + ": '" + raw + "'", e);
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " deve essere > 0, ricevuto: " + value);
        }
    }

    //endregion

    //region ACCESSORS

    public int getCleanPassiveInterval() {
        return cleanPassiveInterval;
    }

    public int getClauseEliminationInterval() {
        return clauseEliminationInterval;
    }

    public int getMaxSimplificationRounds() {
        return maxSimplificationRounds;
    }

    public boolean isOrphanCriterion() {
        return orphanCriterion;
    }

    public boolean isCheckInvariants() {
        return checkInvariants;
    }

    public EtaMode getEtaMode() {
        return etaMode;
    }

    //endregion

    @Override
    public String toString() {
        return "SaturationConfiguration[cleanPassive=" + cleanPassiveInterval
                + ", clauseElimination=" + clauseEliminationInterval
                + ", maxSimplRounds=" + maxSimplificationRounds
                + ", orphans=" + orphanCriterion
                + ", checkInvariants=" + checkInvariants
                + ", eta=" + etaMode + "]";
    }
}
