package com.taskboard.servicebackend.task;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Parses ISO-8601 due dates: {@code 2025-03-01}, {@code 2025-03-01T14:30[:00]} or a timestamp
 * with offset, which is shifted into the service's zone.
 */
final class DueDates {

    private DueDates() {
    }

    static Optional<LocalDateTime> parse(String raw, ZoneId zone) {
        String text = raw.trim();
        try {
            if (text.indexOf('T') < 0) {
                return Optional.of(LocalDate.parse(text).atStartOfDay());
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.atZoneSameInstant(zone).toLocalDateTime());
            }
            return Optional.of((LocalDateTime) parsed);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
