package org.prover.saturation;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SaturationConfigurationTest {

    @Test
    void defaultValues() {
        SaturationConfiguration config = SaturationConfiguration.defaults();
        assertEquals(1000, config.getCleanPassiveInterval());
        assertEquals(10, config.getClauseEliminationInterval());
        assertEquals(64, config.getMaxSimplificationRounds());
        assertTrue(config.isOrphanCriterion());
        assertFalse(config.isCheckInvariants());
        assertEquals(EtaMode.REDUCE, config.getEtaMode());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(SaturationConfiguration.KEY_CLEAN_PASSIVE_INTERVAL, " 50 ");
        props.setProperty(SaturationConfiguration.KEY_CHECK_INVARIANTS, "TRUE");
        props.setProperty(SaturationConfiguration.KEY_ETA_MODE, "expand");
        props.setProperty("saturation.unknownKey", "1");

        SaturationConfiguration config = SaturationConfiguration.fromProperties(props);
        assertEquals(50, config.getCleanPassiveInterval());
        assertTrue(config.isCheckInvariants());
        assertEquals(EtaMode.EXPAND, config.getEtaMode());
        assertEquals(10, config.getClauseEliminationInterval());
    }

    @Test
    void invalidValuesNameTheKey() {
        Properties props = new Properties();
        props.setProperty(SaturationConfiguration.KEY_MAX_SIMPLIFICATION_ROUNDS, "molti");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SaturationConfiguration.fromProperties(props));
        assertTrue(e.getMessage().contains(SaturationConfiguration.KEY_MAX_SIMPLIFICATION_ROUNDS));

        Properties bool = new Properties();
        bool.setProperty(SaturationConfiguration.KEY_ORPHAN_CRITERION, "forse");
        assertThrows(IllegalArgumentException.class, () -> SaturationConfiguration.fromProperties(bool));

        Properties eta = new Properties();
        eta.setProperty(SaturationConfiguration.KEY_ETA_MODE, "sideways");
        assertThrows(IllegalArgumentException.class, () -> SaturationConfiguration.fromProperties(eta));
    }

    @Test
    void intervalsMustBePositive() {
        SaturationConfiguration config = SaturationConfiguration.defaults();
        assertThrows(IllegalArgumentException.class, () -> config.withCleanPassiveInterval(0));
        assertThrows(IllegalArgumentException.class, () -> config.withClauseEliminationInterval(-3));
        assertThrows(IllegalArgumentException.class, () -> config.withEtaMode(null));
    }

    @Test
    void withersLeaveOriginalUntouched() {
        SaturationConfiguration config = SaturationConfiguration.defaults();
        SaturationConfiguration changed = config.withOrphanCriterion(false).withEtaMode(EtaMode.NONE);
        assertTrue(config.isOrphanCriterion());
        assertFalse(changed.isOrphanCriterion());
        assertEquals(EtaMode.NONE, changed.getEtaMode());
    }

    @Test
    void bundledResourceMatchesDefaults() {
        SaturationConfiguration loaded = SaturationConfiguration.load();
        SaturationConfiguration defaults = SaturationConfiguration.defaults();
        assertEquals(defaults.toString(), loaded.toString());
    }
}
