package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.service.scaler.FeatureScaler;
import com.phillippitts.vibedj.util.SearchQuery;
import com.phillippitts.vibedj.util.TextNormalizer;

/**
 * Converts raw catalog rows into slider-space {@link CatalogTrack}s.
 */
final class CatalogTracks {

    private CatalogTracks() {}

    /**
     * @return the track, or {@code null} for a row without a title
     */
    static CatalogTrack fromRow(CatalogRow row, FeatureScaler scaler, double probabilityFactor) {
        String title = row.trackName() == null ? "" : row.trackName().strip();
        if (title.isEmpty()) {
            return null;
        }
        return new CatalogTrack(
                row.trackId(),
                TextNormalizer.asciiSafe(title),
                TextNormalizer.asciiSafe(primaryArtist(row.artistName())),
                TextNormalizer.asciiSafe(row.genre() == null ? "" : row.genre().strip()),
                scaler.toSliderVector(row.nativeFeatures()),
                probabilityFactor);
    }

    static double storedFactor(CatalogRow row) {
        Double pf = row.probabilityFactor();
        return pf == null || pf.isNaN() ? 1.0 : Math.max(0.0, pf);
    }

    /**
     * First entry of a {@code ;}-separated artist list, {@code "Unknown"} when blank.
     */
    static String primaryArtist(String artists) {
        if (artists == null || artists.isBlank()) {
            return SearchQuery.UNKNOWN_ARTIST;
        }
        String first = artists.split(";", -1)[0].strip();
        return first.isEmpty() ? SearchQuery.UNKNOWN_ARTIST : first;
    }
}
