package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.SliderVector;

/**
 * Weighted L1 distance in slider space, using {@link AudioFeature#distanceWeight()}.
 */
public final class TrackDistance {

    private TrackDistance() {}

    public static double between(SliderVector target, SliderVector track) {
        double d = 0.0;
        for (AudioFeature f : AudioFeature.values()) {
            d += f.distanceWeight() * Math.abs(target.get(f) - track.get(f));
        }
        return d;
    }

    /**
     * The cheap two-feature distance used to order a prefiltered candidate set.
     */
    public static double coarse(SliderVector target, SliderVector track) {
        return AudioFeature.ENERGY.distanceWeight()
                * Math.abs(target.get(AudioFeature.ENERGY) - track.get(AudioFeature.ENERGY))
                + AudioFeature.VALENCE.distanceWeight()
                * Math.abs(target.get(AudioFeature.VALENCE) - track.get(AudioFeature.VALENCE));
    }
}
