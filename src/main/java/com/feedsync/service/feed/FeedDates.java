package com.feedsync.service.feed;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Upstream timestamps are stored as UTC {@link LocalDateTime} truncated to the database precision,
 * so that a re-fetched value compares equal to the stored one.
 */
@Slf4j
final class FeedDates {

    private FeedDates() {
    }

    static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed,
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return normalize(offset);
            }
            return ((LocalDateTime) parsed).truncatedTo(ChronoUnit.MICROS);
        } catch (DateTimeParseException e) {
            try {
                return normalize(OffsetDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME));
            } catch (DateTimeParseException rfcFailure) {
                log.warn("Unparseable published date '{}', storing none", trimmed);
                return null;
            }
        }
    }

    static LocalDateTime fromDate(Date date) {
        if (date == null) {
            return null;
        }
        return normalize(date.toInstant().atOffset(ZoneOffset.UTC));
    }

    private static LocalDateTime normalize(OffsetDateTime dateTime) {
        return dateTime.withOffsetSameInstant(ZoneOffset.UTC)
                .toLocalDateTime()
                .truncatedTo(ChronoUnit.MICROS);
    }
}
