package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.CatalogTrack;

import java.util.List;

/**
 * Result of shortlist sampling: the filtered match pool and the weighted sample drawn
 * from it for the recommender.
 */
public record Shortlist(List<CatalogTrack> pool, List<CatalogTrack> sample) {

    public static final Shortlist EMPTY = new Shortlist(List.of(), List.of());

    public Shortlist {
        pool = List.copyOf(pool);
        sample = List.copyOf(sample);
    }

    public boolean isEmpty() {
        return sample.isEmpty();
    }
}
