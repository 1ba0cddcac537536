package dev.vibeshowcase.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Timestamps are stored as UTC {@code TIMESTAMP} columns and serialized as instants.
 */
public final class DateTimes {

    private DateTimes() {
    }

    public static Instant toInstant(LocalDateTime value) {
        return value != null ? value.toInstant(ZoneOffset.UTC) : null;
    }
}
