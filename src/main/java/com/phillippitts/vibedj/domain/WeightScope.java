package com.phillippitts.vibedj.domain;

import java.util.Locale;
import java.util.Optional;

/** Scope a {@link WeightOverride} applies to. */
public enum WeightScope {
    GENRE,
    ARTIST,
    TRACK;

    public static Optional<WeightScope> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
