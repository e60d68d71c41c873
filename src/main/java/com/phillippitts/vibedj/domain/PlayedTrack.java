package com.phillippitts.vibedj.domain;

import java.time.Instant;

/**
 * Summary of a recently played track as handed to the recommender oracle.
 *
 * @param targets sliders active when the track was picked; {@code null} if never recorded
 */
public record PlayedTrack(
        String title,
        String artist,
        String searchQuery,
        Instant lastPlayed,
        int playsToday,
        int playsAllTime,
        AudioTargets targets
) {
}
