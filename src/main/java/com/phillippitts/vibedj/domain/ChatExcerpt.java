package com.phillippitts.vibedj.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A music-scoped chat message as seen by the planner.
 *
 * @param timestamp when the message was sent
 * @param sender    sender label (e.g. "user")
 * @param content   message text, already truncated by the feed
 */
public record ChatExcerpt(Instant timestamp, String sender, String content) {

    public ChatExcerpt {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        sender = sender == null ? "" : sender;
        content = content == null ? "" : content;
    }
}
