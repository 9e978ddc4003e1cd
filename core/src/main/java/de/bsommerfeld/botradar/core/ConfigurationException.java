package de.bsommerfeld.botradar.core;

/**
 * Thrown when a threshold or pattern is missing, non-numeric or out of range.
 * Raised while loading configuration or constructing an analyzer, never
 * replaced by a silent default.
 */
public class ConfigurationException extends BotRadarException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
