package de.bsommerfeld.botradar.core.config;

import de.bsommerfeld.botradar.core.ConfigurationException;

final class ConfigChecks {

    private ConfigChecks() {
    }

    static void requireNonNegative(String key, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new ConfigurationException(key + " must be a finite number, got " + value);
        if (value < 0)
            throw new ConfigurationException(key + " must not be negative, got " + value);
    }

    static void requirePositive(String key, int value) {
        if (value < 1)
            throw new ConfigurationException(key + " must be at least 1, got " + value);
    }

    static <T> T requireSection(String key, T section) {
        if (section == null)
            throw new ConfigurationException("Configuration section '" + key + "' must not be null");
        return section;
    }
}
