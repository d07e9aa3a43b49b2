package com.marketpool.domain;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

/**
 * Parses the timestamp spellings the sources use. Never throws: anything it
 * cannot read comes back as {@code null}, which is a valid "unknown" value.
 */
public final class FlexibleTimestampParser {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // 2024-01-01T10:00:00+0000
    private static final DateTimeFormatter BASIC_OFFSET = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendPattern("xx")
            .toFormatter();

    private FlexibleTimestampParser() {
    }

    public static PublishedAt parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof PublishedAt) {
            return (PublishedAt) raw;
        }
        if (raw instanceof OffsetDateTime) {
            return PublishedAt.of((OffsetDateTime) raw);
        }
        if (raw instanceof ZonedDateTime) {
            return PublishedAt.of(((ZonedDateTime) raw).toOffsetDateTime());
        }
        if (raw instanceof Instant) {
            return PublishedAt.ofInstant((Instant) raw);
        }
        if (raw instanceof LocalDateTime) {
            return PublishedAt.naive((LocalDateTime) raw);
        }
        if (raw instanceof CharSequence) {
            return parseText(raw.toString().trim());
        }
        return null;
    }

    private static PublishedAt parseText(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            if (text.endsWith("Z")) {
                // 2023-10-26T00:00:00Z or 2023-07-15T20:38:13.044Z
                LocalDateTime local = LocalDateTime.parse(text.substring(0, text.length() - 1),
                        DateTimeFormatter.ISO_LOCAL_DATE_TIME);
                return PublishedAt.of(local.atOffset(ZoneOffset.UTC));
            }
            if (hasOffset(text)) {
                return parseOffset(withTSeparator(text));
            }
            if (text.length() == 10) {
                return PublishedAt.naive(LocalDate.parse(text).atStartOfDay());
            }
            return PublishedAt.naive(LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        } catch (DateTimeException e) {
            return parseSpaceSeparated(text);
        }
    }

    private static PublishedAt parseOffset(String text) {
        try {
            return PublishedAt.of(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeException e) {
            return PublishedAt.of(OffsetDateTime.parse(text, BASIC_OFFSET));
        }
    }

    private static PublishedAt parseSpaceSeparated(String text) {
        try {
            return PublishedAt.naive(LocalDateTime.parse(text, SPACE_SEPARATED));
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static String withTSeparator(String text) {
        if (text.charAt(10) == ' ') {
            return text.substring(0, 10) + 'T' + text.substring(11);
        }
        return text;
    }

    // Sign after the date part means an offset suffix
    private static boolean hasOffset(String text) {
        if (text.length() <= 10) {
            return false;
        }
        String timePart = text.substring(10);
        return timePart.indexOf('+') >= 0 || timePart.indexOf('-') >= 0;
    }
}
