package com.phillippitts.vibedj.service.coordinator;

import com.phillippitts.vibedj.config.properties.CoordinatorProperties;
import com.phillippitts.vibedj.domain.ChatExcerpt;
import com.phillippitts.vibedj.domain.PickResult;
import com.phillippitts.vibedj.domain.ScoredCandidate;
import com.phillippitts.vibedj.service.chat.ChatFeed;
import com.phillippitts.vibedj.service.history.PlayHistoryService;
import com.phillippitts.vibedj.service.metrics.DjMetrics;
import com.phillippitts.vibedj.service.playback.PlayMode;
import com.phillippitts.vibedj.service.playback.PlaybackChannel;
import com.phillippitts.vibedj.service.playback.PlaybackCommand;
import com.phillippitts.vibedj.service.playback.PlayerEventListener;
import com.phillippitts.vibedj.service.playback.PlayerTrack;
import com.phillippitts.vibedj.service.selector.CandidateSelector;
import com.phillippitts.vibedj.service.vibe.VibePlanner;
import com.phillippitts.vibedj.util.LogSanitizer;
import com.phillippitts.vibedj.util.SearchQuery;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-writer state machine that decides when to pick and queue the next track.
 *
 * <p>All session state is mutated by one consumer thread ({@code dj-coordinator}) that
 * handles {@link DjEvent}s in order. Public methods only enqueue events, or enqueue and
 * wait on a reply with a timeout. Because picks run on that thread, at most one pick is
 * ever in progress.
 *
 * <p>Between queue reads the loop polls the music chat; new messages while enabled in
 * continuous mode enqueue a pick-and-queue without touching the already queued track.
 *
 * <p>State fields are volatile only so {@link #getStatus()} can read them from other
 * threads. That snapshot is approximate.
 */
public class DjCoordinator implements PlayerEventListener {

    private static final Logger LOG = LogManager.getLogger(DjCoordinator.class);

    static final String THREAD_NAME = "dj-coordinator";
    static final String MDC_EVENT = "djEvent";
    static final String MDC_REASON = "pickReason";
    private static final int CHAT_PREVIEW_CHARS = 120;

    private final PickPipeline pipeline;
    private final VibePlanner planner;
    private final CandidateSelector selector;
    private final PlayHistoryService history;
    private final PlaybackChannel playback;
    private final ChatFeed chatFeed;
    private final CoordinatorProperties props;
    private final DjMetrics metrics;
    private final Clock clock;

    private final BlockingQueue<DjEvent> queue = new LinkedBlockingQueue<>();
    private final Object lifecycleLock = new Object();
    private Thread worker;

    private volatile boolean running;
    private volatile boolean enabled;
    private volatile boolean continuousMode;
    private volatile boolean nextSongQueued;
    private volatile boolean pickInProgress;
    private volatile Instant lastPickTime;
    private volatile Instant queueRetryAfter;
    private volatile String currentTrackId;
    private volatile Instant lastChatSeen;
    private volatile Instant lastChatTrigger;
    private volatile Instant lastChatPoll;
    private volatile Instant startedAt;
    private volatile String lastAction;
    private volatile Instant lastActionTime;

    public DjCoordinator(PickPipeline pipeline,
                         VibePlanner planner,
                         CandidateSelector selector,
                         PlayHistoryService history,
                         PlaybackChannel playback,
                         ChatFeed chatFeed,
                         CoordinatorProperties props,
                         DjMetrics metrics,
                         Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.playback = Objects.requireNonNull(playback, "playback must not be null");
        this.chatFeed = Objects.requireNonNull(chatFeed, "chatFeed must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---- lifecycle ----

    /** Starts the consumer thread. Idempotent. */
    public void start() {
        synchronized (lifecycleLock) {
            if (worker != null && worker.isAlive()) {
                return;
            }
            running = true;
            startedAt = clock.instant();
            worker = new Thread(this::runLoop, THREAD_NAME);
            worker.setDaemon(true);
            worker.start();
            LOG.info("DJ coordinator started");
        }
    }

    /** Enqueues a stop and joins the consumer thread for at most the configured timeout. */
    public void stop() {
        Thread t;
        synchronized (lifecycleLock) {
            t = worker;
            if (t == null) {
                return;
            }
            queue.offer(new DjEvent.Stop());
        }
        try {
            t.join(props.getJoinTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.warn("DJ coordinator thread did not stop within {} ms", props.getJoinTimeoutMs());
        }
        synchronized (lifecycleLock) {
            running = false;
            worker = null;
        }
        LOG.info("DJ coordinator stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isThreadAlive() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    // ---- inbound control ----

    public void enable(boolean continuous) {
        enqueue(new DjEvent.Enable(continuous));
    }

    public void disable() {
        enqueue(new DjEvent.Disable());
    }

    public void setContinuousMode(boolean on) {
        enqueue(new DjEvent.SetContinuousMode(on));
    }

    public void requestPickAndQueue(String reason) {
        enqueue(new DjEvent.RequestPickAndQueue(reason == null ? "manual" : reason));
    }

    /**
     * Picks a track without queueing it. Blocks until the loop answers or the timeout ends.
     *
     * @return empty when the loop is stopped, disabled, busy, timed out or when nothing
     *         could be picked
     */
    public Optional<PickResult> pickSong(String reason, Duration timeout) {
        return pick(reason, false, timeout);
    }

    /** Like {@link #pickSong} but allowed while the DJ is disabled. */
    public Optional<PickResult> pickSongOnce(String reason, Duration timeout) {
        return pick(reason, true, timeout);
    }

    /**
     * Consumes the best backup from the last selection round and records it to history.
     *
     * @param queue also queue it on the player
     */
    public Optional<ScoredCandidate> useBackup(boolean queue, Duration timeout) {
        if (!running) {
            LOG.warn("Coordinator not running, cannot serve use_backup");
            return Optional.empty();
        }
        CompletableFuture<ScoredCandidate> reply = new CompletableFuture<>();
        enqueue(new DjEvent.UseBackup(queue, reply));
        return await(reply, timeout, "use_backup");
    }

    @Override
    public void onTrackChanged(PlayerTrack track) {
        enqueue(new DjEvent.TrackChanged(track));
    }

    @Override
    public void onFrontendQueued(PlayerTrack track) {
        enqueue(new DjEvent.FrontendQueued(track));
    }

    @Override
    public void onPickRequested(String reason) {
        requestPickAndQueue(reason);
    }

    @Override
    public void onNeedBackup() {
        enqueue(new DjEvent.UseBackup(true, null));
    }

    // ---- status ----

    /**
     * Approximate snapshot read without synchronizing with the consumer thread.
     */
    public DjStatus getStatus() {
        return new DjStatus(
                enabled,
                running,
                isThreadAlive(),
                continuousMode,
                nextSongQueued,
                pickInProgress,
                selector.backupCount(),
                currentTrackId,
                queueRetryAfter,
                planner.planDebug().orElse(null),
                startedAt,
                lastAction,
                lastActionTime);
    }

    /**
     * Snapshot taken on the consumer thread between events.
     *
     * @return empty if the loop did not answer within the timeout
     */
    public Optional<DjStatus> getStatusStrict(Duration timeout) {
        if (!running) {
            LOG.warn("Coordinator not running, cannot serve status");
            return Optional.empty();
        }
        CompletableFuture<DjStatus> reply = new CompletableFuture<>();
        enqueue(new DjEvent.StatusRequest(reply));
        return await(reply, timeout, "status");
    }

    // ---- playback passthroughs ----

    public boolean play() {
        return playback.send(PlaybackCommand.PLAY, Map.of());
    }

    public boolean pause() {
        return playback.send(PlaybackCommand.PAUSE, Map.of());
    }

    public boolean next() {
        return playback.send(PlaybackCommand.NEXT, Map.of());
    }

    public boolean previous() {
        return playback.send(PlaybackCommand.PREVIOUS, Map.of());
    }

    public boolean searchAndPlay(String query) {
        return playSong(query, PlayMode.SEARCH_AND_PLAY);
    }

    public boolean queueNext(String query) {
        return playSong(query, PlayMode.QUEUE_NEXT);
    }

    /**
     * @param volume clamped to [0, 1]
     */
    public boolean setVolume(double volume) {
        double v = Double.isNaN(volume) ? 0.0 : Math.max(0.0, Math.min(1.0, volume));
        return playback.send(PlaybackCommand.SET_VOLUME, Map.of("volume", v));
    }

    /**
     * @return {@code false} for a blank query or when no player received the command
     */
    public boolean playSong(String query, PlayMode mode) {
        if (query == null || query.isBlank()) {
            return false;
        }
        return playback.send(mode.command(), Map.of("query", query.strip()));
    }

    // ---- loop ----

    private void enqueue(DjEvent event) {
        if (!running) {
            LOG.debug("Coordinator not running, event {} will wait for start", event.name());
        }
        queue.offer(event);
    }

    private void runLoop() {
        LOG.info("DJ coordinator loop running");
        while (true) {
            pollChatIfDue();
            DjEvent event;
            try {
                event = queue.poll(props.getQueuePollTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("DJ coordinator loop interrupted");
                break;
            }
            if (event == null) {
                continue;
            }
            if (event instanceof DjEvent.Stop) {
                break;
            }
            ThreadContext.put(MDC_EVENT, event.name());
            try {
                handle(event);
            } catch (RuntimeException e) {
                LOG.error("Error handling DJ event {}", event.name(), e);
            } finally {
                ThreadContext.remove(MDC_EVENT);
                ThreadContext.remove(MDC_REASON);
            }
        }
        running = false;
        LOG.info("DJ coordinator loop exited");
    }

    void handle(DjEvent event) {
        if (event instanceof DjEvent.Enable e) {
            enabled = true;
            continuousMode = e.continuous();
            nextSongQueued = false;
            selector.clearBackups();
            LOG.info("DJ enabled (continuous={})", e.continuous());
        } else if (event instanceof DjEvent.Disable) {
            enabled = false;
            continuousMode = false;
            nextSongQueued = false;
            pickInProgress = false;
            planner.clear();
            selector.clearBackups();
            LOG.info("DJ disabled");
        } else if (event instanceof DjEvent.SetContinuousMode e) {
            continuousMode = e.enabled();
            if (!e.enabled()) {
                nextSongQueued = false;
            }
            LOG.info("Continuous mode set to {}", e.enabled());
        } else if (event instanceof DjEvent.TrackChanged e) {
            onTrackChangedInLoop(e.track());
        } else if (event instanceof DjEvent.RequestPickAndQueue e) {
            ThreadContext.put(MDC_REASON, e.reason());
            pickAndQueue(e.reason());
        } else if (event instanceof DjEvent.PickSong e) {
            ThreadContext.put(MDC_REASON, e.reason());
            PickResult result = pickSafely(e.reason(), false, e.allowWhenDisabled());
            e.reply().complete(result);
        } else if (event instanceof DjEvent.FrontendQueued e) {
            PlayerTrack t = e.track();
            LOG.debug("Player confirmed queue: '{}' by '{}'",
                    t == null ? "" : t.title(), t == null ? "" : t.artist());
        } else if (event instanceof DjEvent.UseBackup e) {
            ScoredCandidate backup = consumeBackup(e.queue());
            if (e.reply() != null) {
                e.reply().complete(backup);
            }
        } else if (event instanceof DjEvent.StatusRequest e) {
            e.reply().complete(getStatus());
        }
    }

    private void onTrackChangedInLoop(PlayerTrack track) {
        if (track != null) {
            String id = track.identity();
            if (!id.equals(currentTrackId)) {
                String old = currentTrackId;
                currentTrackId = id;
                nextSongQueued = false;
                LOG.info("Track changed: '{}' to '{}', queue flag reset", old, id);
            }
        } else if (currentTrackId != null) {
            LOG.info("Track ended (was: {})", currentTrackId);
            currentTrackId = null;
            nextSongQueued = false;
        }
    }

    private void pickAndQueue(String reason) {
        Instant retry = queueRetryAfter;
        if (retry != null && clock.instant().isBefore(retry)) {
            LOG.debug("Queue retry cooldown active until {}, ignoring pick request ({})", retry, reason);
            return;
        }
        try {
            // allowed while disabled
            PickResult picked = pickSafely(reason, true, true);
            if (picked == null) {
                scheduleQueueRetry("no_pick_result");
                return;
            }
            if (picked.skipMusic()) {
                scheduleQueueRetry("skip_music");
                return;
            }
            SearchQuery q = SearchQuery.resolve(picked.title(), picked.artist(), picked.searchQuery());
            if (!q.hasTitle()) {
                scheduleQueueRetry("empty_query");
                return;
            }
            SearchQuery recorded = q.withDefaultArtist();
            history.recordPlay(recorded.title(), recorded.artist(), q.asQuery(), picked.targets().audioTargets());

            if (playSong(q.asQuery(), PlayMode.QUEUE_NEXT)) {
                nextSongQueued = true;
                queueRetryAfter = null;
                lastAction = "queue_next(" + reason + ")";
                lastActionTime = clock.instant();
                metrics.incrementQueued(reason);
                LOG.info("Queued '{}' ({})", q.asQuery(), reason);
            } else {
                scheduleQueueRetry("socket_failed");
            }
        } catch (RuntimeException e) {
            LOG.error("Pick-and-queue failed ({})", reason, e);
            scheduleQueueRetry("exception");
        } finally {
            pickInProgress = false;
        }
    }

    /**
     * Runs one guarded pick. Returns {@code null} for every "no result" case, including
     * failures inside the pipeline.
     */
    private PickResult pickSafely(String reason, boolean debounce, boolean allowWhenDisabled) {
        if (!enabled && !allowWhenDisabled) {
            LOG.debug("Pick rejected: DJ disabled ({})", reason);
            return null;
        }
        if (pickInProgress) {
            LOG.debug("Pick rejected: another pick in progress ({})", reason);
            return null;
        }
        Instant now = clock.instant();
        Instant last = lastPickTime;
        if (debounce && last != null && Duration.between(last, now).toMillis() < props.getPickDebounceMs()) {
            LOG.debug("Pick debounced ({})", reason);
            return null;
        }

        pickInProgress = true;
        lastPickTime = now;
        long t0 = System.nanoTime();
        String outcome = "none";
        try {
            Optional<PickResult> result = pipeline.pick(reason);
            if (result.isPresent()) {
                outcome = result.get().skipMusic() ? "skip" : "chosen";
            }
            return result.orElse(null);
        } catch (RuntimeException e) {
            outcome = "error";
            LOG.warn("Pick failed ({}): {}", reason, e.getMessage());
            return null;
        } finally {
            pickInProgress = false;
            metrics.recordPick(outcome, System.nanoTime() - t0);
        }
    }

    private ScoredCandidate consumeBackup(boolean queueIt) {
        Optional<ScoredCandidate> popped = selector.popBackup();
        if (popped.isEmpty()) {
            LOG.info("No backup candidates left");
            return null;
        }
        ScoredCandidate b = popped.get();
        history.recordPlay(b.title(), b.artist(), b.searchQuery(), planner.currentTargets().audioTargets());
        LOG.info("Using backup '{}' ({} left)", b.searchQuery(), selector.backupCount());
        if (queueIt) {
            if (playSong(b.searchQuery(), PlayMode.QUEUE_NEXT)) {
                nextSongQueued = true;
                lastAction = "queue_next(backup)";
                lastActionTime = clock.instant();
                metrics.incrementQueued("backup");
            } else {
                scheduleQueueRetry("socket_failed");
            }
        }
        return b;
    }

    private void scheduleQueueRetry(String reason) {
        nextSongQueued = false;
        queueRetryAfter = clock.instant().plusMillis(props.getQueueRetryCooldownMs());
        metrics.incrementQueueRetry(reason);
        LOG.info("Queue retry scheduled in {} ms ({})", props.getQueueRetryCooldownMs(), reason);
    }

    private void pollChatIfDue() {
        if (!enabled || !continuousMode) {
            return;
        }
        Instant now = clock.instant();
        Instant lastPoll = lastChatPoll;
        if (lastPoll != null && Duration.between(lastPoll, now).toMillis() < props.getChatPollIntervalMs()) {
            return;
        }
        lastChatPoll = now;
        try {
            Instant seen = lastChatSeen;
            Instant cutoff = (seen != null ? seen : now.minus(Duration.ofHours(props.getChatLookbackHours())))
                    .minusSeconds(1);
            List<ChatExcerpt> messages = chatFeed.since(cutoff, 0);
            if (messages.isEmpty()) {
                return;
            }
            ChatExcerpt newest = messages.get(messages.size() - 1);
            for (ChatExcerpt m : messages) {
                if (m.timestamp().isAfter(newest.timestamp())) {
                    newest = m;
                }
            }
            if (seen != null && !newest.timestamp().isAfter(seen)) {
                return;
            }
            lastChatSeen = newest.timestamp();
            Instant trig = lastChatTrigger;
            if (trig != null && Duration.between(trig, now).toMillis() < props.getChatTriggerDebounceMs()) {
                return;
            }
            lastChatTrigger = now;
            LOG.info("New music chat, requesting pick: {}", LogSanitizer.preview(newest.content(), CHAT_PREVIEW_CHARS));
            queue.offer(new DjEvent.RequestPickAndQueue("music_chat"));
        } catch (RuntimeException e) {
            LOG.warn("Music chat poll failed: {}", e.getMessage());
        }
    }

    private Optional<PickResult> pick(String reason, boolean allowWhenDisabled, Duration timeout) {
        if (!running) {
            LOG.warn("Coordinator not running, cannot serve pick_song");
            return Optional.empty();
        }
        CompletableFuture<PickResult> reply = new CompletableFuture<>();
        enqueue(new DjEvent.PickSong(reason == null ? "manual" : reason, allowWhenDisabled, reply));
        return await(reply, timeout == null ? Duration.ofMillis(props.getPickTimeoutMs()) : timeout, "pick_song");
    }

    private static <T> Optional<T> await(CompletableFuture<T> reply, Duration timeout, String what) {
        try {
            return Optional.ofNullable(reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            LOG.warn("Timed out after {} ms waiting for {}", timeout.toMillis(), what);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            LOG.warn("{} failed: {}", what, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return Optional.empty();
        }
    }
}
