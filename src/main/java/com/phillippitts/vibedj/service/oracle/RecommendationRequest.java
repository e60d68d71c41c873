package com.phillippitts.vibedj.service.oracle;

import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.PlayedTrack;
import com.phillippitts.vibedj.domain.VibeTargets;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Objects;

/**
 * Input of the recommender oracle.
 *
 * @param recentlyPlayed oldest first, at most ten
 * @param lastPlayed     {@code null} when nothing was played yet
 * @param providedSongs  shortlist sample, at most ten
 */
public record RecommendationRequest(
        DayOfWeek dayOfWeek,
        VibeTargets vibeTargets,
        List<PlayedTrack> recentlyPlayed,
        PlayedTrack lastPlayed,
        List<CatalogTrack> providedSongs
) {

    public RecommendationRequest {
        Objects.requireNonNull(vibeTargets, "vibeTargets must not be null");
        recentlyPlayed = recentlyPlayed == null ? List.of() : List.copyOf(recentlyPlayed);
        providedSongs = providedSongs == null ? List.of() : List.copyOf(providedSongs);
    }
}
