package com.catalog.reconciliation.core.marc;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Parsing and formatting of the 005 "date and time of latest transaction" value,
 * {@code yyyyMMddHHmmss.f}.
 */
public final class MarcDates {

    private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
            .appendPattern("uuuuMMddHHmmss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("uuuuMMddHHmmss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 1, true)
            .toFormatter();

    private MarcDates() {
    }

    /**
     * Parses a 005 value. Returns null for null or blank input.
     *
     * @throws IllegalArgumentException if the value is not a valid 005 timestamp
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), PARSER);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid 005 timestamp: '" + value + "'", e);
        }
    }

    public static String format(LocalDateTime value) {
        return value != null ? FORMATTER.format(value) : null;
    }
}
