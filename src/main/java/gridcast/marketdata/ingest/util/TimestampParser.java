package gridcast.marketdata.ingest.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Converts raw timestamp cells into zoned timestamps in a reference zone.
 *
 * Accepted inputs:
 * - ZonedDateTime, OffsetDateTime, Instant: converted to the reference zone
 * - LocalDateTime, LocalDate: localized to the reference zone
 * - Strings in ISO-8601 form, with 'T' or a space between date and time,
 *   optional seconds/fraction, optional offset or [zone id]; or a bare date
 *
 * Examples:
 *   "2023-01-01 00:00:00" → 2023-01-01T00:00-06:00[America/Chicago]
 *   "2023-01-01T06:00:00Z" → 2023-01-01T00:00-06:00[America/Chicago]
 *   "2023-01-01" → 2023-01-01T00:00-06:00[America/Chicago]
 *
 * This class is stateless and can be safely used concurrently.
 */
public final class TimestampParser {

    private TimestampParser() {
    }

    /**
     * @param value the raw cell value
     * @param zone  the reference zone
     * @return the timestamp expressed in the reference zone
     * @throws IllegalArgumentException if the value is null or cannot be parsed
     */
    public static ZonedDateTime toZoned(Object value, ZoneId zone) {
        if (value == null) {
            throw new IllegalArgumentException("Timestamp value is missing");
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(zone);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).atZoneSameInstant(zone);
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(zone);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone);
        }
        if (value instanceof CharSequence) {
            return parse(value.toString(), zone);
        }
        throw new IllegalArgumentException(
                "Unsupported timestamp type " + value.getClass().getSimpleName() + ": " + value);
    }

    private static ZonedDateTime parse(String text, ZoneId zone) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Timestamp value is blank");
        }
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(zone);
            }
            // Accept "yyyy-MM-dd HH:mm:ss" as well as the ISO 'T' separator
            String iso = trimmed.length() > 10 && trimmed.charAt(10) == ' '
                    ? trimmed.substring(0, 10) + 'T' + trimmed.substring(11).trim()
                    : trimmed;
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    iso, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).withZoneSameInstant(zone);
            }
            return ((LocalDateTime) parsed).atZone(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unparseable timestamp: '" + text + "'", e);
        }
    }
}
