package com.phillippitts.vibedj.domain;

import java.util.List;

/**
 * Optional user-requested constraints on the shortlist.
 *
 * <p>Exclusions win over inclusions. Within a category any entry may match (OR); across
 * categories every non-empty inclusion list must match (AND). Matching is case-insensitive
 * substring containment.
 */
public record MusicFilters(
        List<String> includeGenres,
        List<String> excludeGenres,
        List<String> includeArtists,
        List<String> excludeArtists,
        List<String> includeKeywords
) {

    public static final MusicFilters NONE = new MusicFilters(List.of(), List.of(), List.of(), List.of(), List.of());

    public MusicFilters {
        includeGenres = clean(includeGenres);
        excludeGenres = clean(excludeGenres);
        includeArtists = clean(includeArtists);
        excludeArtists = clean(excludeArtists);
        includeKeywords = clean(includeKeywords);
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::strip)
                .toList();
    }

    public boolean isEmpty() {
        return includeGenres.isEmpty() && excludeGenres.isEmpty() && includeArtists.isEmpty()
                && excludeArtists.isEmpty() && includeKeywords.isEmpty();
    }
}
