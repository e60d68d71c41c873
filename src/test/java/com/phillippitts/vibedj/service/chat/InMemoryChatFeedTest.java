package com.phillippitts.vibedj.service.chat;

import com.phillippitts.vibedj.domain.ChatExcerpt;
import com.phillippitts.vibedj.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryChatFeedTest {

    private static final Instant T0 = Instant.parse("2024-05-15T09:00:00Z");

    private final MutableClock clock = new MutableClock(T0);

    @Test
    void shouldReturnMessagesStrictlyAfterCutoff() {
        InMemoryChatFeed feed = new InMemoryChatFeed(clock);
        feed.append("user", "first");
        clock.advance(Duration.ofMinutes(1));
        feed.append("user", "second");

        List<ChatExcerpt> out = feed.since(T0, 0);

        assertThat(out).extracting(ChatExcerpt::content).containsExactly("second");
        assertThat(feed.since(null, 0)).hasSize(2);
    }

    @Test
    void shouldKeepNewestWhenLimited() {
        InMemoryChatFeed feed = new InMemoryChatFeed(clock);
        for (int i = 0; i < 5; i++) {
            feed.append("user", "m" + i);
        }

        assertThat(feed.since(T0.minusSeconds(1), 2)).extracting(ChatExcerpt::content).containsExactly("m3", "m4");
    }

    @Test
    void shouldIgnoreBlankAndTruncateLongContent() {
        InMemoryChatFeed feed = new InMemoryChatFeed(clock);
        feed.append("user", "   ");
        feed.append("user", null);
        feed.append("user", "x".repeat(InMemoryChatFeed.MAX_CONTENT_CHARS + 50));

        List<ChatExcerpt> out = feed.since(null, 0);

        assertThat(out).singleElement()
                .satisfies(m -> assertThat(m.content()).hasSizeLessThanOrEqualTo(InMemoryChatFeed.MAX_CONTENT_CHARS));
    }

    @Test
    void shouldEvictOldestBeyondCapacity() {
        InMemoryChatFeed feed = new InMemoryChatFeed(clock, 3);
        for (int i = 0; i < 5; i++) {
            feed.append("user", "m" + i);
        }

        assertThat(feed.since(null, 0)).extracting(ChatExcerpt::content).containsExactly("m2", "m3", "m4");
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new InMemoryChatFeed(clock, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
