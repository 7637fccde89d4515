package com.company.scheduler.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Converts between absolute instants and an owner's local wall-clock time
 * expressed as a fixed offset in minutes.
 * <p>
 * instant -> local subtracts the offset, local -> instant adds it back, so the
 * two directions round-trip exactly for any integer-minute offset.
 */
public final class LocalTimeConverter {

    private LocalTimeConverter() {
    }

    public static LocalDateTime toLocal(Instant instant, int offsetMinutes) {
        if (instant == null) return null;
        return LocalDateTime.ofInstant(instant.minusSeconds(offsetMinutes * 60L), ZoneOffset.UTC);
    }

    public static Instant toInstant(LocalDateTime local, int offsetMinutes) {
        if (local == null) return null;
        return local.toInstant(ZoneOffset.UTC).plusSeconds(offsetMinutes * 60L);
    }
}
