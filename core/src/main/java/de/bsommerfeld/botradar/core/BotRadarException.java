package de.bsommerfeld.botradar.core;

/**
 * Base type of every failure raised by the detectors and their configuration.
 * Unchecked, so analyzers can be called from streams and lambdas without
 * wrapping.
 */
public class BotRadarException extends RuntimeException {

    public BotRadarException(String message) {
        super(message);
    }

    public BotRadarException(String message, Throwable cause) {
        super(message, cause);
    }
}
