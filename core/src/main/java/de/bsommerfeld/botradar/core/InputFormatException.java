package de.bsommerfeld.botradar.core;

/**
 * Thrown when caller-supplied data cannot be interpreted, e.g. an unparsable
 * timestamp. Carries the offending account and raw value when known so the
 * caller can fix the record instead of losing it silently.
 */
public class InputFormatException extends BotRadarException {

    private final String accountId;
    private final String value;

    public InputFormatException(String message) {
        this(message, null, null, null);
    }

    public InputFormatException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public InputFormatException(String message, String accountId, String value, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
        this.value = value;
    }

    /**
     * @return the account whose data was malformed, {@code null} if not
     *         account-specific
     */
    public String getAccountId() {
        return accountId;
    }

    /**
     * @return the raw value that failed to parse, {@code null} if not
     *         value-specific
     */
    public String getValue() {
        return value;
    }
}
