package com.phillippitts.vibedj.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * The eight audio features a vibe is expressed in, with their weight in the slider-space
 * L1 distance used to rank catalog tracks.
 *
 * <p>Six features are native 0.0-1.0 ratios; loudness (dB) and tempo (BPM) use an
 * anchored scale, see {@link com.phillippitts.vibedj.service.scaler.FeatureScaler}.
 */
public enum AudioFeature {
    ENERGY(2.0, true),
    VALENCE(2.0, true),
    LOUDNESS(1.0, false),
    SPEECHINESS(1.2, true),
    ACOUSTICNESS(1.2, true),
    INSTRUMENTALNESS(1.5, true),
    LIVENESS(0.7, true),
    TEMPO(1.0, false);

    private final double distanceWeight;
    private final boolean unitInterval;

    AudioFeature(double distanceWeight, boolean unitInterval) {
        this.distanceWeight = distanceWeight;
        this.unitInterval = unitInterval;
    }

    public double distanceWeight() {
        return distanceWeight;
    }

    /** True when the native unit is a 0.0-1.0 ratio. */
    public boolean isUnitInterval() {
        return unitInterval;
    }

    /** Lowercase wire name, e.g. {@code "instrumentalness"}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AudioFeature> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (AudioFeature f : values()) {
            if (f.key().equalsIgnoreCase(key.strip())) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
