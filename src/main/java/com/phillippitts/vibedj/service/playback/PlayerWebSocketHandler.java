package com.phillippitts.vibedj.service.playback;

import com.phillippitts.vibedj.service.chat.InMemoryChatFeed;
import com.phillippitts.vibedj.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint the remote player connects to. Doubles as the {@link PlaybackChannel}:
 * commands are broadcast to every open player session.
 *
 * <p>Inbound message types: {@code track_changed}, {@code queued}, {@code music_chat},
 * {@code request_pick} and {@code need_backup}. Unknown or malformed messages are logged and ignored.
 */
public class PlayerWebSocketHandler extends TextWebSocketHandler implements PlaybackChannel {

    private static final Logger LOG = LogManager.getLogger(PlayerWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_BYTES = 64 * 1024;
    private static final int LOG_PREVIEW_CHARS = 120;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final InMemoryChatFeed chatFeed;
    private volatile PlayerEventListener listener;

    public PlayerWebSocketHandler(InMemoryChatFeed chatFeed) {
        this.chatFeed = Objects.requireNonNull(chatFeed, "chatFeed must not be null");
    }

    public void setListener(PlayerEventListener listener) {
        this.listener = listener;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_BYTES));
        LOG.info("Player connected: session={} (connected={})", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        LOG.info("Player disconnected: session={} status={} (connected={})",
                session.getId(), status.getCode(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JSONObject obj;
        try {
            obj = new JSONObject(message.getPayload());
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed player message: {}", LogSanitizer.preview(message.getPayload(), LOG_PREVIEW_CHARS));
            return;
        }
        String type = obj.optString("type", "");
        PlayerEventListener l = listener;
        switch (type) {
            case "track_changed" -> {
                JSONObject t = obj.optJSONObject("track");
                if (l != null) {
                    l.onTrackChanged(t == null ? null : new PlayerTrack(t.optString("title", ""), t.optString("artist", "")));
                }
            }
            case "queued" -> {
                if (l != null) {
                    l.onFrontendQueued(new PlayerTrack(obj.optString("title", ""), obj.optString("artist", "")));
                }
            }
            case "music_chat" -> chatFeed.append(obj.optString("sender", "user"), obj.optString("content", ""));
            case "request_pick" -> {
                if (l != null) {
                    l.onPickRequested(obj.optString("reason", "frontend"));
                }
            }
            case "need_backup" -> {
                if (l != null) {
                    l.onNeedBackup();
                }
            }
            default -> LOG.debug("Ignoring player message of type '{}'", type);
        }
    }

    @Override
    public boolean send(PlaybackCommand command, Map<String, Object> payload) {
        if (sessions.isEmpty()) {
            LOG.warn("No player connected, dropping command {}", command.wireName());
            return false;
        }
        String json = new JSONObject()
                .put("command", command.wireName())
                .put("payload", payload == null ? new JSONObject() : new JSONObject(payload))
                .toString();
        TextMessage tm = new TextMessage(json);
        int delivered = 0;
        for (WebSocketSession s : sessions.values()) {
            if (!s.isOpen()) {
                continue;
            }
            try {
                s.sendMessage(tm);
                delivered++;
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to send {} to session {}: {}", command.wireName(), s.getId(), e.getMessage());
            }
        }
        LOG.debug("Sent {} to {} player session(s)", command.wireName(), delivered);
        return delivered > 0;
    }

    @Override
    public boolean isConnected() {
        return sessions.values().stream().anyMatch(WebSocketSession::isOpen);
    }
}
