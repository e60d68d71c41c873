package com.phillippitts.vibedj.service.vibe;

import com.phillippitts.vibedj.domain.ChatExcerpt;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatSignatureTest {

    private static final Instant T = Instant.parse("2024-05-15T09:00:00Z");

    @Test
    void shouldBeNullWithoutMessages() {
        assertThat(ChatSignature.of(List.of(), 5, 200)).isNull();
        assertThat(ChatSignature.of(null, 5, 200)).isNull();
    }

    @Test
    void shouldOnlyConsiderTrailingMessages() {
        ChatExcerpt old = new ChatExcerpt(T, "user", "old");
        ChatExcerpt recent = new ChatExcerpt(T.plusSeconds(60), "user", "recent");

        assertThat(ChatSignature.of(List.of(old, recent), 1, 200))
                .isEqualTo(ChatSignature.of(List.of(recent), 1, 200))
                .hasSize(40);
    }

    @Test
    void shouldIgnoreContentBeyondLimit() {
        String base = "a".repeat(10);

        assertThat(ChatSignature.of(List.of(new ChatExcerpt(T, "u", base + "xyz")), 5, 10))
                .isEqualTo(ChatSignature.of(List.of(new ChatExcerpt(T, "u", base + "zzz")), 5, 10));
    }

    @Test
    void shouldChangeWithSender() {
        assertThat(ChatSignature.of(List.of(new ChatExcerpt(T, "a", "hi")), 5, 200))
                .isNotEqualTo(ChatSignature.of(List.of(new ChatExcerpt(T, "b", "hi")), 5, 200));
    }
}
