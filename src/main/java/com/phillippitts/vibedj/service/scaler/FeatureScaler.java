package com.phillippitts.vibedj.service.scaler;

import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.SliderVector;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stateless, bidirectional conversion between 0-100 sliders and native feature units.
 *
 * <p>Ratio features (energy, valence, speechiness, acousticness, instrumentalness,
 * liveness) map linearly to 0.0-1.0. Loudness and tempo use an anchored
 * {@link FeatureScale} so outliers do not compress the usable range.
 *
 * <p>{@link #nativeToSliders(Map)} rounds to one decimal, which is how catalog rows are
 * stored in slider space; the single-value methods do not round.
 */
public final class FeatureScaler {

    private final FeatureScale loudnessScale;
    private final FeatureScale tempoScale;

    public FeatureScaler() {
        this(FeatureScale.LOUDNESS_DB, FeatureScale.TEMPO_BPM);
    }

    public FeatureScaler(FeatureScale loudnessScale, FeatureScale tempoScale) {
        this.loudnessScale = Objects.requireNonNull(loudnessScale, "loudnessScale must not be null");
        this.tempoScale = Objects.requireNonNull(tempoScale, "tempoScale must not be null");
    }

    public FeatureScale scaleFor(AudioFeature feature) {
        return switch (feature) {
            case LOUDNESS -> loudnessScale;
            case TEMPO -> tempoScale;
            default -> FeatureScale.UNIT;
        };
    }

    public double sliderToNative(AudioFeature feature, double slider) {
        return scaleFor(feature).sliderToNative(slider);
    }

    public double nativeToSlider(AudioFeature feature, double nativeValue) {
        return scaleFor(feature).nativeToSlider(nativeValue);
    }

    /**
     * Converts slider values to native units. Null values are skipped.
     */
    public Map<AudioFeature, Double> slidersToNative(Map<AudioFeature, ? extends Number> sliders) {
        Map<AudioFeature, Double> out = new EnumMap<>(AudioFeature.class);
        sliders.forEach((feature, value) -> {
            if (value != null && !Double.isNaN(value.doubleValue())) {
                out.put(feature, sliderToNative(feature, value.doubleValue()));
            }
        });
        return out;
    }

    /**
     * Converts native values to sliders rounded to one decimal. Null values are skipped.
     */
    public Map<AudioFeature, Double> nativeToSliders(Map<AudioFeature, ? extends Number> nativeValues) {
        Map<AudioFeature, Double> out = new EnumMap<>(AudioFeature.class);
        nativeValues.forEach((feature, value) -> {
            if (value != null && !Double.isNaN(value.doubleValue())) {
                out.put(feature, round1(nativeToSlider(feature, value.doubleValue())));
            }
        });
        return out;
    }

    /**
     * Native values to a full slider vector; absent features sit at the midpoint.
     */
    public SliderVector toSliderVector(Map<AudioFeature, ? extends Number> nativeValues) {
        return SliderVector.of(nativeToSliders(nativeValues));
    }

    /**
     * Signed valence: slider 0 is -1.0, 50 is 0.0, 100 is +1.0.
     */
    public static double valenceSliderToSigned(double valenceSlider) {
        return FeatureScale.clamp(valenceSlider, 0.0, 100.0) / 100.0 * 2.0 - 1.0;
    }

    public static double signedValenceToSlider(double signedValence) {
        return (FeatureScale.clamp(signedValence, -1.0, 1.0) + 1.0) / 2.0 * 100.0;
    }

    private static double round1(double v) {
        return new BigDecimal(v).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }
}
