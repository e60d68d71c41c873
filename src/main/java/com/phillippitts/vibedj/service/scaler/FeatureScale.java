package com.phillippitts.vibedj.service.scaler;

/**
 * Linear mapping between a 0-100 slider and a native range anchored at {@code lo..hi}.
 *
 * <p>Native values outside the anchors clamp to 0 or 100. A degenerate scale
 * ({@code lo == hi}) maps every native value to 0.
 *
 * @param lo native value at slider 0
 * @param hi native value at slider 100
 */
public record FeatureScale(double lo, double hi) {

    /** Loudness in dB, anchored at the reference corpus p5..p95. */
    public static final FeatureScale LOUDNESS_DB = new FeatureScale(-19.464, -3.433);

    /** Tempo in BPM, anchored at the reference corpus p5..p95. */
    public static final FeatureScale TEMPO_BPM = new FeatureScale(76.783, 175.797);

    /** Plain ratio features. */
    public static final FeatureScale UNIT = new FeatureScale(0.0, 1.0);

    public double sliderToNative(double slider) {
        double t = clamp(slider, 0.0, 100.0) / 100.0;
        return lo + (hi - lo) * t;
    }

    public double nativeToSlider(double nativeValue) {
        if (hi == lo) {
            return 0.0;
        }
        return clamp((nativeValue - lo) / (hi - lo), 0.0, 1.0) * 100.0;
    }

    static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
