package com.phillippitts.vibedj.domain;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persistent play history for one normalized (title, artist) pair.
 *
 * <p>Rolling counters are reset lazily when a period boundary is crossed relative to
 * {@code lastCountReset}; the all-time counter never resets.
 */
public record HistoryRecord(
        long id,
        String title,
        String artist,
        String searchQuery,
        Instant firstPlayed,
        Instant lastPlayed,
        int playsToday,
        int playsWeek,
        int playsMonth,
        int playsYear,
        int playsAllTime,
        LocalDate lastCountReset,
        AudioTargets lastTargets
) {
}
