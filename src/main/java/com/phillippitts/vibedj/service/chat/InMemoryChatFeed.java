package com.phillippitts.vibedj.service.chat;

import com.phillippitts.vibedj.domain.ChatExcerpt;
import com.phillippitts.vibedj.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded in-memory chat buffer fed by the player connection.
 */
public class InMemoryChatFeed implements ChatFeed {

    private static final Logger LOG = LogManager.getLogger(InMemoryChatFeed.class);

    static final int DEFAULT_CAPACITY = 500;
    static final int MAX_CONTENT_CHARS = 2_000;

    private final Clock clock;
    private final int capacity;
    private final Deque<ChatExcerpt> messages = new ArrayDeque<>();

    public InMemoryChatFeed(Clock clock) {
        this(clock, DEFAULT_CAPACITY);
    }

    public InMemoryChatFeed(Clock clock, int capacity) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    /** Appends a message stamped with the current time. Blank content is ignored. */
    public void append(String sender, String content) {
        if (content == null || content.isBlank()) {
            return;
        }
        ChatExcerpt m = new ChatExcerpt(clock.instant(), sender, LogSanitizer.truncate(content.strip(), MAX_CONTENT_CHARS));
        synchronized (messages) {
            messages.addLast(m);
            while (messages.size() > capacity) {
                messages.removeFirst();
            }
        }
        LOG.debug("Music chat from '{}': {}", m.sender(), LogSanitizer.preview(m.content(), 120));
    }

    @Override
    public List<ChatExcerpt> since(Instant cutoff, int limit) {
        List<ChatExcerpt> out = new ArrayList<>();
        synchronized (messages) {
            for (ChatExcerpt m : messages) {
                if (cutoff == null || m.timestamp().isAfter(cutoff)) {
                    out.add(m);
                }
            }
        }
        if (limit > 0 && out.size() > limit) {
            return new ArrayList<>(out.subList(out.size() - limit, out.size()));
        }
        return out;
    }
}
