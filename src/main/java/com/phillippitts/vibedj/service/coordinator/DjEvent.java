package com.phillippitts.vibedj.service.coordinator;

import com.phillippitts.vibedj.domain.PickResult;
import com.phillippitts.vibedj.domain.ScoredCandidate;
import com.phillippitts.vibedj.service.playback.PlayerTrack;

import java.util.concurrent.CompletableFuture;

/**
 * Events consumed by the {@link DjCoordinator} loop. Every state mutation is one of these.
 *
 * <p>Request/reply events carry a future completed exactly once by the loop; callers wait
 * on it with a timeout.
 */
sealed interface DjEvent {

    /** Short event name for logs and the {@code djEvent} thread-context key. */
    String name();

    record Enable(boolean continuous) implements DjEvent {
        @Override
        public String name() {
            return "enable";
        }
    }

    record Disable() implements DjEvent {
        @Override
        public String name() {
            return "disable";
        }
    }

    record SetContinuousMode(boolean enabled) implements DjEvent {
        @Override
        public String name() {
            return "set_continuous_mode";
        }
    }

    /** @param track {@code null} when playback stopped */
    record TrackChanged(PlayerTrack track) implements DjEvent {
        @Override
        public String name() {
            return "track_changed";
        }
    }

    record RequestPickAndQueue(String reason) implements DjEvent {
        @Override
        public String name() {
            return "pick_and_queue";
        }
    }

    /** @param reply completed with the result, or {@code null} for "no result" */
    record PickSong(String reason, boolean allowWhenDisabled, CompletableFuture<PickResult> reply) implements DjEvent {
        @Override
        public String name() {
            return "pick_song";
        }
    }

    record FrontendQueued(PlayerTrack track) implements DjEvent {
        @Override
        public String name() {
            return "frontend_queued";
        }
    }

    /**
     * @param queue whether to also queue the backup on the player
     * @param reply completed with the consumed backup or {@code null}; may itself be {@code null}
     */
    record UseBackup(boolean queue, CompletableFuture<ScoredCandidate> reply) implements DjEvent {
        @Override
        public String name() {
            return "use_backup";
        }
    }

    record StatusRequest(CompletableFuture<DjStatus> reply) implements DjEvent {
        @Override
        public String name() {
            return "status";
        }
    }

    record Stop() implements DjEvent {
        @Override
        public String name() {
            return "stop";
        }
    }
}
