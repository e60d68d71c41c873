package com.phillippitts.vibedj.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Recovery rates for the history-based cooldown score.
 *
 * <p>A track's weight climbs linearly from 0 at {@code trackRecoveryPerDay} per day since
 * it was last played; the artist component uses {@code artistRecoveryPerDay}. Both are
 * floored at {@code floor} and capped at 1.0.
 */
@Validated
@ConfigurationProperties(prefix = "dj.cooldown")
public class CooldownProperties {

    public static final double DEFAULT_TRACK_RECOVERY_PER_DAY = 0.05;
    public static final double DEFAULT_ARTIST_RECOVERY_PER_DAY = 0.10;
    public static final double DEFAULT_FLOOR = 0.01;

    @Positive
    private final double trackRecoveryPerDay;

    @Positive
    private final double artistRecoveryPerDay;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double floor;

    @ConstructorBinding
    public CooldownProperties(Double trackRecoveryPerDay, Double artistRecoveryPerDay, Double floor) {
        this.trackRecoveryPerDay = trackRecoveryPerDay == null ? DEFAULT_TRACK_RECOVERY_PER_DAY : trackRecoveryPerDay;
        this.artistRecoveryPerDay = artistRecoveryPerDay == null ? DEFAULT_ARTIST_RECOVERY_PER_DAY : artistRecoveryPerDay;
        this.floor = floor == null ? DEFAULT_FLOOR : floor;
    }

    public static CooldownProperties defaults() {
        return new CooldownProperties(null, null, null);
    }

    public double getTrackRecoveryPerDay() {
        return trackRecoveryPerDay;
    }

    public double getArtistRecoveryPerDay() {
        return artistRecoveryPerDay;
    }

    public double getFloor() {
        return floor;
    }
}
