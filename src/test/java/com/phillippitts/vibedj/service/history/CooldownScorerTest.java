package com.phillippitts.vibedj.service.history;

import com.phillippitts.vibedj.config.properties.CooldownProperties;
import com.phillippitts.vibedj.domain.PlayStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CooldownScorerTest {

    private final CooldownScorer scorer = new CooldownScorer(CooldownProperties.defaults());

    @Test
    void shouldScoreNeverPlayedAsOne() {
        assertThat(scorer.score(PlayStats.NEVER_PLAYED, null)).isEqualTo(1.0);
        assertThat(scorer.score(null, 5.0)).isEqualTo(1.0);
    }

    @Test
    void shouldSitAtFloorRightAfterPlay() {
        PlayStats justPlayed = new PlayStats(true, 1, 1, 1, 0.0);

        assertThat(scorer.score(justPlayed, 0.0)).isEqualTo(CooldownProperties.DEFAULT_FLOOR);
    }

    @Test
    void shouldRecoverMonotonicallyAndNeverExceedOne() {
        double previous = 0.0;
        for (int days = 0; days <= 60; days++) {
            double hours = days * 24.0;
            double s = scorer.score(new PlayStats(true, 0, 0, 1, hours), hours);
            assertThat(s).isGreaterThanOrEqualTo(previous).isBetween(CooldownProperties.DEFAULT_FLOOR, 1.0);
            previous = s;
        }
        assertThat(previous).isEqualTo(1.0);
    }

    @Test
    void shouldMultiplyTrackAndArtistRecovery() {
        // 10 days: track 0.5, artist 1.0; then artist at 2 days: 0.2
        PlayStats tenDays = new PlayStats(true, 0, 0, 1, 240.0);

        assertThat(scorer.score(tenDays, 240.0)).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.score(tenDays, 48.0)).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void shouldTreatUnknownArtistTimeAsFullyRecovered() {
        PlayStats tenDays = new PlayStats(true, 0, 0, 1, 240.0);

        assertThat(scorer.score(tenDays, null)).isCloseTo(0.5, within(1e-9));
    }
}
