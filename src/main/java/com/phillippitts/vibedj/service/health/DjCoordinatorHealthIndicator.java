package com.phillippitts.vibedj.service.health;

import com.phillippitts.vibedj.service.coordinator.DjCoordinator;
import com.phillippitts.vibedj.service.coordinator.DjStatus;
import com.phillippitts.vibedj.service.playback.PlaybackChannel;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the DJ coordinator.
 *
 * <ul>
 *   <li>UP: consumer thread alive and a player connected</li>
 *   <li>DEGRADED: consumer thread alive but no player connected</li>
 *   <li>DOWN: consumer thread not running</li>
 * </ul>
 *
 * <p>Details come from the approximate status snapshot.
 */
public class DjCoordinatorHealthIndicator implements HealthIndicator {

    private final DjCoordinator coordinator;
    private final PlaybackChannel playback;

    public DjCoordinatorHealthIndicator(DjCoordinator coordinator, PlaybackChannel playback) {
        this.coordinator = coordinator;
        this.playback = playback;
    }

    @Override
    public Health health() {
        DjStatus s = coordinator.getStatus();
        boolean playerConnected = playback.isConnected();

        Health.Builder builder = new Health.Builder();
        if (!s.threadAlive()) {
            builder.down().withDetail("status", "Coordinator loop not running");
        } else if (!playerConnected) {
            builder.status("DEGRADED").withDetail("status", "No player connected");
        } else {
            builder.up().withDetail("status", "Coordinator running");
        }
        builder.withDetail("enabled", s.enabled())
                .withDetail("continuousMode", s.continuousMode())
                .withDetail("nextSongQueued", s.nextSongQueued())
                .withDetail("pickInProgress", s.pickInProgress())
                .withDetail("backupCandidates", s.backupCandidates())
                .withDetail("playerConnected", playerConnected);
        if (s.lastAction() != null) {
            builder.withDetail("lastAction", s.lastAction())
                    .withDetail("lastActionTime", String.valueOf(s.lastActionTime()));
        }
        if (s.vibePlan() != null) {
            builder.withDetail("contextBlock", s.vibePlan().contextBlock());
        }
        return builder.build();
    }
}
