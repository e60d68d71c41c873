package com.phillippitts.vibedj.domain;

import java.util.Objects;

/**
 * Multiplicative sampling factor for a genre, artist or single track.
 *
 * @param scope  what the key identifies
 * @param key    normalized key; for {@link WeightScope#TRACK} it is {@code "<title>|||<artist>"}
 * @param factor multiplier, never negative; 0 bans the key from sampling
 */
public record WeightOverride(WeightScope scope, String key, double factor) {

    public WeightOverride {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (Double.isNaN(factor) || factor < 0.0) {
            throw new IllegalArgumentException("factor must be >= 0, got: " + factor);
        }
    }
}
