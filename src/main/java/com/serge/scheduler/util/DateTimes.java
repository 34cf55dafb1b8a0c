package com.serge.scheduler.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Lenient ISO-8601 parsing for client-supplied timestamps: a date, a local date-time, or a date-time
 * with offset. Values without an offset are read as UTC.
 */
public final class DateTimes {
    private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private DateTimes() {
    }

    public static Optional<Instant> parseInstant(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            TemporalAccessor parsed = FLEXIBLE.parseBest(value.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            if (parsed instanceof LocalDateTime) {
                return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static Optional<LocalDate> parseDate(String value) {
        return parseInstant(value).map(i -> i.atOffset(ZoneOffset.UTC).toLocalDate());
    }

    public static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    public static String iso(LocalDate date) {
        return date == null ? null : date.toString();
    }
}
