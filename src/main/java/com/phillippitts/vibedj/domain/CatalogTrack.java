package com.phillippitts.vibedj.domain;

import com.phillippitts.vibedj.util.SearchQuery;

import java.util.Objects;

/**
 * A catalog entry with its audio features already converted to slider space.
 *
 * @param trackId           catalog identity; may be empty for legacy rows
 * @param title             ASCII-folded track title
 * @param artist            ASCII-folded primary artist
 * @param genre             ASCII-folded genre label
 * @param sliders           audio features on the 0-100 slider scale
 * @param probabilityFactor sampling weight, default 1.0, never negative
 */
public record CatalogTrack(
        String trackId,
        String title,
        String artist,
        String genre,
        SliderVector sliders,
        double probabilityFactor
) {

    public CatalogTrack {
        trackId = trackId == null ? "" : trackId.strip();
        title = Objects.requireNonNull(title, "title must not be null");
        artist = artist == null || artist.isBlank() ? SearchQuery.UNKNOWN_ARTIST : artist;
        genre = genre == null ? "" : genre;
        Objects.requireNonNull(sliders, "sliders must not be null");
        probabilityFactor = Double.isNaN(probabilityFactor) ? 1.0 : Math.max(0.0, probabilityFactor);
    }

    public String searchQuery() {
        return SearchQuery.build(title, artist);
    }

    /**
     * Returns a copy carrying a different probability factor.
     */
    public CatalogTrack withProbabilityFactor(double factor) {
        return new CatalogTrack(trackId, title, artist, genre, sliders, factor);
    }
}
