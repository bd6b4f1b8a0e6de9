package com.questrail.janus.codec.impl;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * RFC 3339 timestamp format used in Janus envelopes.
 *
 * <p>Writers always emit UTC with exactly three fractional digits
 * ({@code 2025-01-31T12:00:00.123Z}). Readers accept any RFC 3339 offset and any
 * number of fractional digits, as well as a bare number of epoch seconds.</p>
 */
public final class JanusTimestamps
{
    private static final DateTimeFormatter WRITE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private JanusTimestamps() {
    }

    public static String format(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        return WRITE_FORMAT.format(instant);
    }

    /**
     * @throws DateTimeParseException if the text is not an RFC 3339 date-time
     */
    public static Instant parse(String text) {
        Objects.requireNonNull(text, "text");
        return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    public static Instant fromEpochSeconds(double seconds) {
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1_000_000_000L);
        return Instant.ofEpochSecond(whole, nanos);
    }
}
