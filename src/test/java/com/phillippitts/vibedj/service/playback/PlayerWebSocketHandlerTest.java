package com.phillippitts.vibedj.service.playback;

import com.phillippitts.vibedj.domain.ChatExcerpt;
import com.phillippitts.vibedj.service.chat.InMemoryChatFeed;
import com.phillippitts.vibedj.testutil.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PlayerWebSocketHandlerTest {

    private InMemoryChatFeed chat;
    private PlayerEventListener listener;
    private PlayerWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        chat = new InMemoryChatFeed(new MutableClock(Instant.parse("2024-05-15T09:00:00Z")));
        listener = mock(PlayerEventListener.class);
        handler = new PlayerWebSocketHandler(chat);
        handler.setListener(listener);
    }

    @Test
    void shouldReportFailureWhenNoPlayerIsConnected() {
        assertThat(handler.send(PlaybackCommand.PLAY, Map.of())).isFalse();
        assertThat(handler.isConnected()).isFalse();
    }

    @Test
    void shouldBroadcastCommandEnvelope() throws Exception {
        WebSocketSession session = openSession("s1");
        handler.afterConnectionEstablished(session);

        boolean sent = handler.send(PlaybackCommand.QUEUE_NEXT, Map.of("query", "Naima by John Coltrane"));

        assertThat(sent).isTrue();
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        JSONObject json = new JSONObject(captor.getValue().getPayload());
        assertThat(json.getString("command")).isEqualTo("queue_next");
        assertThat(json.getJSONObject("payload").getString("query")).isEqualTo("Naima by John Coltrane");
    }

    @Test
    void shouldSucceedIfAnySessionReceives() throws Exception {
        WebSocketSession broken = openSession("s1");
        doThrow(new IOException("pipe closed")).when(broken).sendMessage(any());
        WebSocketSession healthy = openSession("s2");
        handler.afterConnectionEstablished(broken);
        handler.afterConnectionEstablished(healthy);

        assertThat(handler.send(PlaybackCommand.NEXT, Map.of())).isTrue();
    }

    @Test
    void shouldForgetClosedSessions() {
        WebSocketSession session = openSession("s1");
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(handler.send(PlaybackCommand.PAUSE, Map.of())).isFalse();
    }

    @Test
    void shouldRouteTrackChanges() {
        WebSocketSession session = openSession("s1");

        handler.handleTextMessage(session, new TextMessage(
                "{\"type\": \"track_changed\", \"track\": {\"title\": \"So What\", \"artist\": \"Miles Davis\"}}"));
        handler.handleTextMessage(session, new TextMessage("{\"type\": \"track_changed\"}"));

        verify(listener).onTrackChanged(new PlayerTrack("So What", "Miles Davis"));
        verify(listener).onTrackChanged(null);
    }

    @Test
    void shouldRoutePickAndBackupRequests() {
        WebSocketSession session = openSession("s1");

        handler.handleTextMessage(session, new TextMessage("{\"type\": \"request_pick\"}"));
        handler.handleTextMessage(session, new TextMessage("{\"type\": \"need_backup\"}"));
        handler.handleTextMessage(session, new TextMessage("{\"type\": \"queued\", \"title\": \"Naima\", \"artist\": \"JC\"}"));

        verify(listener).onPickRequested("frontend");
        verify(listener).onNeedBackup();
        verify(listener).onFrontendQueued(new PlayerTrack("Naima", "JC"));
    }

    @Test
    void shouldAppendMusicChatToFeed() {
        handler.handleTextMessage(openSession("s1"), new TextMessage(
                "{\"type\": \"music_chat\", \"content\": \"more horns please\"}"));

        List<ChatExcerpt> messages = chat.since(null, 0);
        assertThat(messages).singleElement().satisfies(m -> {
            assertThat(m.sender()).isEqualTo("user");
            assertThat(m.content()).isEqualTo("more horns please");
        });
    }

    @Test
    void shouldIgnoreMalformedAndUnknownMessages() {
        WebSocketSession session = openSession("s1");

        handler.handleTextMessage(session, new TextMessage("not json"));
        handler.handleTextMessage(session, new TextMessage("{\"type\": \"dance\"}"));

        verifyNoInteractions(listener);
        assertThat(chat.since(null, 0)).isEmpty();
    }

    private static WebSocketSession openSession(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }
}
