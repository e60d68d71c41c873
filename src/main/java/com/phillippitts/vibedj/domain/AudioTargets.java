package com.phillippitts.vibedj.domain;

import java.util.EnumMap;
import java.util.Map;

/**
 * Eight integer sliders describing a desired sound, each clamped to [0, 100].
 *
 * <p>Values outside the range are clamped on construction, so an instance can never
 * hold an out-of-range slider.
 */
public record AudioTargets(
        int energy,
        int valence,
        int loudness,
        int speechiness,
        int acousticness,
        int instrumentalness,
        int liveness,
        int tempo
) {

    /** Neutral "focus-ish" targets used when no plan is active. */
    public static final AudioTargets DEFAULTS = new AudioTargets(55, 50, 55, 10, 40, 70, 15, 45);

    public AudioTargets {
        energy = clamp(energy);
        valence = clamp(valence);
        loudness = clamp(loudness);
        speechiness = clamp(speechiness);
        acousticness = clamp(acousticness);
        instrumentalness = clamp(instrumentalness);
        liveness = clamp(liveness);
        tempo = clamp(tempo);
    }

    /**
     * Clamps to [0, 100].
     */
    public static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }

    /**
     * Clamps to [0, 100] and rounds half-to-even; NaN maps to the fallback.
     */
    public static int clampRound(double v, int fallback) {
        if (Double.isNaN(v)) {
            return fallback;
        }
        return (int) Math.rint(Math.max(0.0, Math.min(100.0, v)));
    }

    public int get(AudioFeature feature) {
        return switch (feature) {
            case ENERGY -> energy;
            case VALENCE -> valence;
            case LOUDNESS -> loudness;
            case SPEECHINESS -> speechiness;
            case ACOUSTICNESS -> acousticness;
            case INSTRUMENTALNESS -> instrumentalness;
            case LIVENESS -> liveness;
            case TEMPO -> tempo;
        };
    }

    /**
     * Builds targets from per-feature values; features absent from the map take the
     * corresponding value from {@code fallback}.
     */
    public static AudioTargets fromMap(Map<AudioFeature, Integer> values, AudioTargets fallback) {
        Map<AudioFeature, Integer> v = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            Integer given = values == null ? null : values.get(f);
            v.put(f, given != null ? given : fallback.get(f));
        }
        return new AudioTargets(
                v.get(AudioFeature.ENERGY),
                v.get(AudioFeature.VALENCE),
                v.get(AudioFeature.LOUDNESS),
                v.get(AudioFeature.SPEECHINESS),
                v.get(AudioFeature.ACOUSTICNESS),
                v.get(AudioFeature.INSTRUMENTALNESS),
                v.get(AudioFeature.LIVENESS),
                v.get(AudioFeature.TEMPO));
    }

    public Map<AudioFeature, Integer> asMap() {
        Map<AudioFeature, Integer> out = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            out.put(f, get(f));
        }
        return out;
    }

    public SliderVector toSliderVector() {
        Map<AudioFeature, Double> m = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            m.put(f, (double) get(f));
        }
        return SliderVector.of(m);
    }
}
