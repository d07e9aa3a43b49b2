package com.marketpool.domain;

import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Publication time of a market. Either zoned (carries an offset) or naive (local
 * wall-clock time whose zone the source did not state).
 */
@EqualsAndHashCode
public final class PublishedAt implements Comparable<PublishedAt> {

    private final LocalDateTime dateTime;
    private final ZoneOffset offset; // null when naive

    private PublishedAt(LocalDateTime dateTime, ZoneOffset offset) {
        if (dateTime == null) {
            throw new IllegalArgumentException("dateTime must not be null");
        }
        this.dateTime = dateTime;
        this.offset = offset;
    }

    public static PublishedAt of(OffsetDateTime value) {
        return new PublishedAt(value.toLocalDateTime(), value.getOffset());
    }

    public static PublishedAt ofInstant(Instant instant) {
        return of(instant.atOffset(ZoneOffset.UTC));
    }

    public static PublishedAt ofEpochMillis(long epochMillis) {
        return ofInstant(Instant.ofEpochMilli(epochMillis));
    }

    public static PublishedAt naive(LocalDateTime value) {
        return new PublishedAt(value, null);
    }

    public boolean isZoned() {
        return offset != null;
    }

    public LocalDateTime getDateTime() {
        return dateTime;
    }

    public ZoneOffset getOffset() {
        return offset;
    }

    public OffsetDateTime toOffsetDateTime() {
        if (offset == null) {
            throw new IllegalStateException("Naive timestamp has no offset: " + dateTime);
        }
        return dateTime.atOffset(offset);
    }

    /**
     * Zoned values are shifted to UTC; naive values come back unchanged since
     * their zone is unknown.
     */
    public PublishedAt toUtc() {
        if (offset == null) {
            return this;
        }
        return of(toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC));
    }

    /**
     * Instant used for ordering. Naive values are read as UTC wall-clock time.
     */
    public Instant sortInstant() {
        return offset == null ? dateTime.toInstant(ZoneOffset.UTC) : toOffsetDateTime().toInstant();
    }

    @Override
    public int compareTo(PublishedAt other) {
        return sortInstant().compareTo(other.sortInstant());
    }

    @Override
    public String toString() {
        return offset == null ? dateTime.toString() : toOffsetDateTime().toString();
    }
}
