package com.phillippitts.vibedj.service.chat;

import com.phillippitts.vibedj.domain.ChatExcerpt;

import java.time.Instant;
import java.util.List;

/**
 * Source of music-related chat messages.
 */
public interface ChatFeed {

    /**
     * Messages strictly newer than {@code cutoff}, oldest first.
     *
     * @param limit maximum number of messages; the newest are kept
     */
    List<ChatExcerpt> since(Instant cutoff, int limit);
}
