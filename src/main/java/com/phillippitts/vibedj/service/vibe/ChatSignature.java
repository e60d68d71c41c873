package com.phillippitts.vibedj.service.vibe;

import com.phillippitts.vibedj.domain.ChatExcerpt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Fingerprint of the most recent music-chat messages. A change in signature means the
 * user said something new and the plan should be rechecked.
 */
final class ChatSignature {

    private ChatSignature() {}

    /**
     * SHA-1 hex over the last {@code messages} excerpts, each rendered as
     * {@code time|sender|content} with content cut to {@code maxChars}.
     *
     * @return the signature, or {@code null} when there are no messages
     */
    static String of(List<ChatExcerpt> chat, int messages, int maxChars) {
        if (chat == null || chat.isEmpty()) {
            return null;
        }
        List<ChatExcerpt> tail = chat.subList(Math.max(0, chat.size() - messages), chat.size());
        StringBuilder sb = new StringBuilder();
        for (ChatExcerpt m : tail) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            String content = m.content();
            if (content.length() > maxChars) {
                content = content.substring(0, maxChars);
            }
            sb.append(m.timestamp()).append('|').append(m.sender()).append('|').append(content);
        }
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(sha1.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
