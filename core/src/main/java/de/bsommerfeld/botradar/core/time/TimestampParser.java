package de.bsommerfeld.botradar.core.time;

import de.bsommerfeld.botradar.core.InputFormatException;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts raw timestamp strings from activity logs into {@link Instant}s.
 *
 * <p>
 * Accepted forms, tried in order:
 * <ul>
 * <li>integral epoch seconds, e.g. {@code 1741521601}</li>
 * <li>ISO-8601 offset date-times, e.g. {@code 2025-03-09T12:00:01Z} or
 * {@code 2025-03-09T12:00:01+01:00}</li>
 * <li>zone-less local date-times: {@code 2025-03-09T12:00:01},
 * {@code 2025-03-09 12:00:01}, {@code 2025/03/09 12:00:01}</li>
 * </ul>
 * Zone-less values are interpreted in the zone passed at construction.
 * Anything else is rejected with an {@link InputFormatException}; values are
 * never skipped, because a dropped timestamp can hide an abnormal cadence.
 */
public final class TimestampParser {

    private static final Pattern EPOCH_SECONDS = Pattern.compile("-?\\d{1,12}");

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm[:ss][.SSS]"));

    private final ZoneId zone;

    public TimestampParser() {
        this(ZoneOffset.UTC);
    }

    public TimestampParser(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Parses a single timestamp belonging to {@code accountId}.
     *
     * @throws InputFormatException if the value is null, blank or matches no
     *                              supported form
     */
    public Instant parse(String accountId, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InputFormatException(
                    "Empty timestamp for account '" + accountId + "'", accountId, raw, null);
        }
        String value = raw.trim();

        if (EPOCH_SECONDS.matcher(value).matches())
            return Instant.ofEpochSecond(Long.parseLong(value));

        try {
            if (matchesFully(DateTimeFormatter.ISO_OFFSET_DATE_TIME, value))
                return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();

            for (DateTimeFormatter format : LOCAL_FORMATS) {
                if (matchesFully(format, value))
                    return LocalDateTime.parse(value, format).atZone(zone).toInstant();
            }
        } catch (DateTimeException e) {
            throw new InputFormatException(
                    "Invalid timestamp '" + raw + "' for account '" + accountId + "'", accountId, raw, e);
        }

        throw new InputFormatException(
                "Unparsable timestamp '" + raw + "' for account '" + accountId + "'", accountId, raw, null);
    }

    /**
     * Syntax check only; field values such as month 13 are rejected later when
     * the text is resolved.
     */
    private static boolean matchesFully(DateTimeFormatter format, String value) {
        ParsePosition position = new ParsePosition(0);
        return format.parseUnresolved(value, position) != null
                && position.getErrorIndex() < 0
                && position.getIndex() == value.length();
    }

    /**
     * Parses every timestamp of one account, preserving order.
     */
    public List<Instant> parseAll(String accountId, List<String> raw) {
        return raw.stream().map(ts -> parse(accountId, ts)).toList();
    }
}
