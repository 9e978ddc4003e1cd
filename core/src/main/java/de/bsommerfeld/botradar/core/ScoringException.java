package de.bsommerfeld.botradar.core;

/**
 * Thrown when a sentiment scorer fails or produces a polarity outside
 * {@code [-1.0, 1.0]}.
 */
public class ScoringException extends BotRadarException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
