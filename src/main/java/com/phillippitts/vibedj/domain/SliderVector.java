package com.phillippitts.vibedj.domain;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable vector of slider values (0-100 scale, fractional) indexed by {@link AudioFeature}.
 *
 * <p>Catalog tracks carry their features in this form so every distance computation happens
 * in one comparable space.
 */
public final class SliderVector {

    /** Value used for a feature the source did not provide. */
    public static final double MIDPOINT = 50.0;

    private final double[] values;

    private SliderVector(double[] values) {
        this.values = values;
    }

    /**
     * Creates a vector from a partial map; missing features take {@link #MIDPOINT}.
     */
    public static SliderVector of(Map<AudioFeature, Double> sliders) {
        double[] v = new double[AudioFeature.values().length];
        Arrays.fill(v, MIDPOINT);
        if (sliders != null) {
            sliders.forEach((feature, value) -> {
                if (feature != null && value != null && !value.isNaN()) {
                    v[feature.ordinal()] = value;
                }
            });
        }
        return new SliderVector(v);
    }

    /**
     * Creates a vector with every feature at the given value.
     */
    public static SliderVector uniform(double value) {
        double[] v = new double[AudioFeature.values().length];
        Arrays.fill(v, value);
        return new SliderVector(v);
    }

    public double get(AudioFeature feature) {
        return values[feature.ordinal()];
    }

    /**
     * Returns a copy with one feature replaced.
     */
    public SliderVector with(AudioFeature feature, double value) {
        double[] copy = values.clone();
        copy[feature.ordinal()] = value;
        return new SliderVector(copy);
    }

    public Map<AudioFeature, Double> asMap() {
        Map<AudioFeature, Double> out = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            out.put(f, values[f.ordinal()]);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SliderVector other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (AudioFeature f : AudioFeature.values()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(f.key()).append('=').append(values[f.ordinal()]);
        }
        return sb.append('}').toString();
    }
}
