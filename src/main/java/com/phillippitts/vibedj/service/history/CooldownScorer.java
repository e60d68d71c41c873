package com.phillippitts.vibedj.service.history;

import com.phillippitts.vibedj.config.properties.CooldownProperties;
import com.phillippitts.vibedj.domain.PlayStats;

import java.util.Objects;

/**
 * Decay-recovered weight penalizing recently played tracks and artists.
 *
 * <p>track = clamp01(trackRate * days since this track), artist = clamp01(artistRate * days
 * since any track by the artist); each factor is floored, and the product is kept in
 * [floor, 1.0]. Unknown elapsed time counts as 9999 days. Never-played tracks score 1.0.
 */
public final class CooldownScorer {

    static final double UNKNOWN_DAYS = 9999.0;

    private final CooldownProperties props;

    public CooldownScorer(CooldownProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    public double score(PlayStats stats, Double artistHoursSinceLast) {
        if (stats == null || !stats.found()) {
            return 1.0;
        }
        double floor = props.getFloor();
        double trackW = Math.max(floor, clamp01(props.getTrackRecoveryPerDay() * days(stats.hoursSinceLast())));
        double artistW = Math.max(floor, clamp01(props.getArtistRecoveryPerDay() * days(artistHoursSinceLast)));
        return Math.max(floor, Math.min(1.0, trackW * artistW));
    }

    public double floor() {
        return props.getFloor();
    }

    static double days(Double hours) {
        if (hours == null || hours.isNaN()) {
            return UNKNOWN_DAYS;
        }
        return Math.max(0.0, hours) / 24.0;
    }

    private static double clamp01(double x) {
        if (Double.isNaN(x)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, x));
    }
}
