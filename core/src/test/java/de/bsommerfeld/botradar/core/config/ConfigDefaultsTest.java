package de.bsommerfeld.botradar.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void botRadarConfig_shouldInitializeWithDefaults() {
        var config = new BotRadarConfig();

        assertNotNull(config.getInterval());
        assertNotNull(config.getPhrases());
        assertNotNull(config.getNetwork());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void intervalConfig_shouldHaveDocumentedDefaults() {
        var config = new IntervalConfig();

        assertEquals(30.0, config.getIntervalThresholdSeconds(), 0.001);
        assertEquals(2.0, config.getOutlierThresholdStddev(), 0.001);
        assertEquals("UTC", config.getTimeZone());
    }

    @Test
    void phraseConfig_shouldHaveDocumentedDefaults() {
        var config = new PhraseConfig();

        assertEquals(5, config.getRepetitionThreshold());
        assertEquals("[^a-zA-Z0-9\\s]", config.getCleaningRegex());
        assertTrue(config.isCaseSensitive());
    }

    @Test
    void networkConfig_shouldHaveDocumentedDefaults() {
        var config = new NetworkConfig();

        assertEquals(20, config.getClusterThreshold());
        assertEquals(GraphBackend.UNION_FIND, config.getBackend());
    }

    @Test
    void botRadarConfig_shouldProvideIndependentSections() {
        var config = new BotRadarConfig();

        // Changing one section must not touch another
        config.getPhrases().setRepetitionThreshold(2);
        assertEquals(2, config.getPhrases().getRepetitionThreshold());
        assertEquals(20, config.getNetwork().getClusterThreshold());
        assertEquals(30.0, config.getInterval().getIntervalThresholdSeconds(), 0.001);
    }
}
