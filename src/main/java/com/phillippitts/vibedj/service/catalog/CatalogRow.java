package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.AudioFeature;

import java.util.Map;

/**
 * A raw catalog row: text as stored, features in native units (absent ones omitted).
 *
 * @param probabilityFactor stored factor, {@code null} when the column is empty
 */
public record CatalogRow(
        String trackId,
        String trackName,
        String artistName,
        String genre,
        Double probabilityFactor,
        Map<AudioFeature, Double> nativeFeatures
) {

    public CatalogRow {
        nativeFeatures = Map.copyOf(nativeFeatures);
    }
}
