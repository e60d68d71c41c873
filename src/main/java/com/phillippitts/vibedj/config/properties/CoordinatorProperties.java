package com.phillippitts.vibedj.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Timing and sizing for the DJ coordinator's consumer loop.
 */
@Validated
@ConfigurationProperties(prefix = "dj.coordinator")
public class CoordinatorProperties {

    /** A pick started within this window after the previous one returns no result. */
    @Min(0)
    private final long pickDebounceMs;

    /** After a failed pick-and-queue, further attempts are suppressed for this long. */
    @Min(0)
    private final long queueRetryCooldownMs;

    @Positive
    private final long chatPollIntervalMs;

    @Positive
    private final int chatLookbackHours;

    @Min(0)
    private final long chatTriggerDebounceMs;

    /** Upper bound on how long the loop blocks waiting for an event. */
    @Positive
    private final long queuePollTimeoutMs;

    @Positive
    private final long pickTimeoutMs;

    @Positive
    private final long joinTimeoutMs;

    /** Candidates the recommender must take from the provided shortlist. */
    @Min(0)
    @Max(10)
    private final int providedCount;

    @Positive
    @Max(20)
    private final int totalCandidates;

    @Positive
    private final int recentlyPlayedLimit;

    @ConstructorBinding
    public CoordinatorProperties(Long pickDebounceMs,
                                 Long queueRetryCooldownMs,
                                 Long chatPollIntervalMs,
                                 Integer chatLookbackHours,
                                 Long chatTriggerDebounceMs,
                                 Long queuePollTimeoutMs,
                                 Long pickTimeoutMs,
                                 Long joinTimeoutMs,
                                 Integer providedCount,
                                 Integer totalCandidates,
                                 Integer recentlyPlayedLimit) {
        this.pickDebounceMs = pickDebounceMs == null ? 5_000L : pickDebounceMs;
        this.queueRetryCooldownMs = queueRetryCooldownMs == null ? 20_000L : queueRetryCooldownMs;
        this.chatPollIntervalMs = chatPollIntervalMs == null ? 2_500L : chatPollIntervalMs;
        this.chatLookbackHours = chatLookbackHours == null ? 6 : chatLookbackHours;
        this.chatTriggerDebounceMs = chatTriggerDebounceMs == null ? 2_000L : chatTriggerDebounceMs;
        this.queuePollTimeoutMs = queuePollTimeoutMs == null ? 250L : queuePollTimeoutMs;
        this.pickTimeoutMs = pickTimeoutMs == null ? 90_000L : pickTimeoutMs;
        this.joinTimeoutMs = joinTimeoutMs == null ? 2_000L : joinTimeoutMs;
        this.providedCount = providedCount == null ? 5 : providedCount;
        this.totalCandidates = totalCandidates == null ? 10 : totalCandidates;
        this.recentlyPlayedLimit = recentlyPlayedLimit == null ? 10 : recentlyPlayedLimit;
    }

    /**
     * All defaults. Used by tests and by non-Spring wiring.
     */
    public static CoordinatorProperties defaults() {
        return new CoordinatorProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public long getPickDebounceMs() {
        return pickDebounceMs;
    }

    public long getQueueRetryCooldownMs() {
        return queueRetryCooldownMs;
    }

    public long getChatPollIntervalMs() {
        return chatPollIntervalMs;
    }

    public int getChatLookbackHours() {
        return chatLookbackHours;
    }

    public long getChatTriggerDebounceMs() {
        return chatTriggerDebounceMs;
    }

    public long getQueuePollTimeoutMs() {
        return queuePollTimeoutMs;
    }

    public long getPickTimeoutMs() {
        return pickTimeoutMs;
    }

    public long getJoinTimeoutMs() {
        return joinTimeoutMs;
    }

    public int getProvidedCount() {
        return providedCount;
    }

    public int getTotalCandidates() {
        return totalCandidates;
    }

    public int getRecentlyPlayedLimit() {
        return recentlyPlayedLimit;
    }
}
