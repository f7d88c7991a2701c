package com.flagship.credit_ledger.lifecycle;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parses the stored trial_expires_at text.
 *
 * Accepted forms:
 * <ul>
 *   <li>{@code 2026-01-31}: end of that day, 23:59:59 UTC</li>
 *   <li>{@code 2026-01-31T12:00:00Z} or with an offset such as {@code +02:00}</li>
 *   <li>{@code 2026-01-31T12:00:00}: no zone, taken as UTC</li>
 * </ul>
 */
public final class TrialExpiryParser {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private TrialExpiryParser() {
    }

    /**
     * @throws DateTimeParseException if the text matches none of the accepted forms
     */
    public static Instant parse(String text) {
        String value = text.trim();

        if (value.indexOf('T') < 0) {
            return LocalDate.parse(value).atTime(END_OF_DAY).toInstant(ZoneOffset.UTC);
        }

        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException noOffset) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
