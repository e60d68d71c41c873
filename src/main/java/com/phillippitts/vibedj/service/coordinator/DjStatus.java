package com.phillippitts.vibedj.service.coordinator;

import com.phillippitts.vibedj.service.vibe.PlanDebug;

import java.time.Instant;

/**
 * Snapshot of coordinator state.
 *
 * <p>Snapshots from {@link DjCoordinator#getStatus()} are assembled from independently read
 * fields and may mix values from before and after a concurrent event; use
 * {@link DjCoordinator#getStatusStrict} for a consistent view.
 *
 * @param vibePlan        active plan, or {@code null}
 * @param currentTrackId  {@code "title-artist"} of the playing track, or {@code null}
 * @param queueRetryAfter end of the queue retry cooldown, or {@code null}
 * @param lastAction      e.g. {@code queue_next(music_chat)}, or {@code null}
 */
public record DjStatus(
        boolean enabled,
        boolean running,
        boolean threadAlive,
        boolean continuousMode,
        boolean nextSongQueued,
        boolean pickInProgress,
        int backupCandidates,
        String currentTrackId,
        Instant queueRetryAfter,
        PlanDebug vibePlan,
        Instant startedAt,
        String lastAction,
        Instant lastActionTime
) {
}
