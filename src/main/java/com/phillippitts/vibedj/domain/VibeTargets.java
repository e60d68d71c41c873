package com.phillippitts.vibedj.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Interpolated targets for "now", decorated with plan context and the legacy scalar fields
 * older consumers still read.
 *
 * <p>The legacy fields are pure functions of the sliders:
 * <ul>
 *   <li>{@code energyTarget} (1-10) = round(1 + energy/100 * 9)</li>
 *   <li>{@code valenceTarget} (-1..+1) = round2(valence/100 * 2 - 1)</li>
 *   <li>{@code vocalTolerance} (1-10) = clamp(round(1 + (100 - instrumentalness)/100 * 9))</li>
 * </ul>
 * Rounding is half-to-even.
 */
public record VibeTargets(
        AudioTargets audioTargets,
        int energyTarget,
        double valenceTarget,
        int vocalTolerance,
        String contextBlock,
        String verbalPlan,
        String phaseNote,
        double phaseProgress,
        String currentMood,
        String currentEnergy,
        String anxietyLevel,
        MusicFilters musicFilters
) {

    public VibeTargets {
        Objects.requireNonNull(audioTargets, "audioTargets must not be null");
        musicFilters = musicFilters == null ? MusicFilters.NONE : musicFilters;
    }

    /**
     * Decorates sliders with the legacy fields and the given plan context.
     *
     * @param plan active plan, or {@code null} for the no-plan defaults
     */
    public static VibeTargets decorate(AudioTargets audio, VibePlan plan, String phaseNote, double phaseProgress) {
        return new VibeTargets(
                audio,
                legacyEnergy(audio.energy()),
                legacyValence(audio.valence()),
                vocalTolerance(audio.instrumentalness()),
                plan != null ? plan.contextBlock() : "unknown",
                plan != null ? plan.verbalPlan() : "",
                phaseNote == null ? "" : phaseNote,
                round(phaseProgress, 2),
                plan != null ? plan.currentMood() : "unknown",
                plan != null ? plan.currentEnergy() : "unknown",
                plan != null ? plan.anxietyLevel() : "calm",
                plan != null ? plan.musicFilters() : MusicFilters.NONE);
    }

    static int legacyEnergy(int energySlider) {
        double e = Math.max(0.0, Math.min(100.0, energySlider));
        return (int) Math.rint(1 + (e / 100.0) * 9);
    }

    static double legacyValence(int valenceSlider) {
        double v = Math.max(0.0, Math.min(100.0, valenceSlider));
        return round((v / 100.0) * 2.0 - 1.0, 2);
    }

    static int vocalTolerance(int instrumentalnessSlider) {
        double i = Math.max(0.0, Math.min(100.0, instrumentalnessSlider));
        int tol = (int) Math.rint(1 + ((100.0 - i) / 100.0) * 9);
        return Math.max(1, Math.min(10, tol));
    }

    private static double round(double v, int places) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return 0.0;
        }
        return new BigDecimal(v).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
