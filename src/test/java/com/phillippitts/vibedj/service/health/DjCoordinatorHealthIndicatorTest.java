package com.phillippitts.vibedj.service.health;

import com.phillippitts.vibedj.service.coordinator.DjCoordinator;
import com.phillippitts.vibedj.service.coordinator.DjStatus;
import com.phillippitts.vibedj.service.playback.PlaybackChannel;
import com.phillippitts.vibedj.service.vibe.PlanDebug;
import com.phillippitts.vibedj.domain.MusicFilters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DjCoordinatorHealthIndicatorTest {

    private static final Instant T = Instant.parse("2024-05-15T09:00:00Z");

    private DjCoordinator coordinator;
    private PlaybackChannel playback;
    private DjCoordinatorHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        coordinator = mock(DjCoordinator.class);
        playback = mock(PlaybackChannel.class);
        indicator = new DjCoordinatorHealthIndicator(coordinator, playback);
    }

    @Test
    void shouldReportDownWhenLoopIsNotRunning() {
        when(coordinator.getStatus()).thenReturn(status(false, null, null));
        when(playback.isConnected()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Coordinator loop not running");
    }

    @Test
    void shouldReportDegradedWithoutPlayer() {
        when(coordinator.getStatus()).thenReturn(status(true, null, null));
        when(playback.isConnected()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("playerConnected", false);
    }

    @Test
    void shouldReportUpWithDetails() {
        PlanDebug plan = new PlanDebug("Calm focus", "Deep work", 60, 12.5, 1, T, MusicFilters.NONE);
        when(coordinator.getStatus()).thenReturn(status(true, "queue_next(manual)", plan));
        when(playback.isConnected()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("enabled", true)
                .containsEntry("backupCandidates", 3)
                .containsEntry("lastAction", "queue_next(manual)")
                .containsEntry("contextBlock", "Deep work");
    }

    @Test
    void shouldOmitActionDetailsWhenNothingHappenedYet() {
        when(coordinator.getStatus()).thenReturn(status(true, null, null));
        when(playback.isConnected()).thenReturn(true);

        assertThat(indicator.health().getDetails()).doesNotContainKeys("lastAction", "contextBlock");
    }

    private static DjStatus status(boolean alive, String lastAction, PlanDebug plan) {
        return new DjStatus(true, alive, alive, true, false, false, 3, null, null, plan, T,
                lastAction, lastAction == null ? null : T);
    }
}
