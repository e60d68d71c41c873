package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.util.TextNormalizer;

import java.util.List;

/**
 * In-process evaluation of {@link MusicFilters} against a catalog track.
 *
 * <p>Matching is case-insensitive substring containment on ASCII-folded text. Keywords
 * match against the combined search string.
 */
public final class MusicFilterMatcher {

    private MusicFilterMatcher() {}

    public static boolean matches(MusicFilters filters, CatalogTrack track) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        String genre = TextNormalizer.asciiKey(track.genre());
        String artist = TextNormalizer.asciiKey(track.artist());
        String query = TextNormalizer.asciiKey(track.searchQuery());

        if (anyContained(filters.excludeGenres(), genre) || anyContained(filters.excludeArtists(), artist)) {
            return false;
        }
        if (!filters.includeGenres().isEmpty() && !anyContained(filters.includeGenres(), genre)) {
            return false;
        }
        if (!filters.includeArtists().isEmpty() && !anyContained(filters.includeArtists(), artist)) {
            return false;
        }
        return filters.includeKeywords().isEmpty() || anyContained(filters.includeKeywords(), query);
    }

    private static boolean anyContained(List<String> needles, String haystack) {
        for (String n : needles) {
            String k = TextNormalizer.asciiKey(n);
            if (!k.isEmpty() && haystack.contains(k)) {
                return true;
            }
        }
        return false;
    }
}
