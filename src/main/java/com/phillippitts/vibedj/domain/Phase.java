package com.phillippitts.vibedj.domain;

import java.util.Objects;

/**
 * One segment of a {@link VibePlan}: either a hold (constant targets) or a gradient
 * (linear ramp from {@code start} to {@code end} over the phase).
 *
 * @param durationMinutes phase length, 5-60 minutes per the oracle contract
 * @param start           hold targets, or the gradient's starting targets
 * @param end             gradient end targets; {@code null} for a hold phase
 * @param note            free-text note from the planner
 */
public record Phase(int durationMinutes, AudioTargets start, AudioTargets end, String note) {

    public Phase {
        Objects.requireNonNull(start, "start targets must not be null");
        note = note == null ? "" : note;
    }

    public static Phase hold(int durationMinutes, AudioTargets targets, String note) {
        return new Phase(durationMinutes, targets, null, note);
    }

    public static Phase gradient(int durationMinutes, AudioTargets start, AudioTargets end, String note) {
        return new Phase(durationMinutes, start, Objects.requireNonNull(end, "end targets must not be null"), note);
    }

    public boolean isGradient() {
        return end != null;
    }

    /**
     * Targets at fractional progress through this phase. Holds ignore progress; gradients
     * interpolate every slider linearly, rounding and clamping to [0, 100].
     *
     * @param progress fraction in [0, 1]; values outside are clamped
     */
    public AudioTargets targetsAt(double progress) {
        if (!isGradient()) {
            return start;
        }
        double p = Double.isNaN(progress) ? 0.0 : Math.max(0.0, Math.min(1.0, progress));
        return new AudioTargets(
                lerp(start.energy(), end.energy(), p),
                lerp(start.valence(), end.valence(), p),
                lerp(start.loudness(), end.loudness(), p),
                lerp(start.speechiness(), end.speechiness(), p),
                lerp(start.acousticness(), end.acousticness(), p),
                lerp(start.instrumentalness(), end.instrumentalness(), p),
                lerp(start.liveness(), end.liveness(), p),
                lerp(start.tempo(), end.tempo(), p));
    }

    private static int lerp(int a, int b, double p) {
        return AudioTargets.clampRound(a + (b - a) * p, a);
    }
}
