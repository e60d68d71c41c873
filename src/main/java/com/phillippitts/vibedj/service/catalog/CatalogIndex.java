package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.SliderVector;
import com.phillippitts.vibedj.exception.CatalogUnavailableException;

import java.util.List;

/**
 * Nearest-neighbor lookup over the track catalog in slider space.
 *
 * <p>Implementations return tracks ordered by ascending {@link TrackDistance#between}
 * distance, at most {@code n} of them (at least one is requested even for {@code n < 1}).
 */
public interface CatalogIndex {

    /**
     * @param target  target sliders
     * @param n       maximum number of tracks to return
     * @param filters optional filters; {@link MusicFilters#NONE} for none
     * @throws CatalogUnavailableException if the backing store cannot be read
     */
    List<CatalogTrack> nearestMatches(SliderVector target, int n, MusicFilters filters);

    /** Short backend name for logs and status. */
    String backendName();
}
