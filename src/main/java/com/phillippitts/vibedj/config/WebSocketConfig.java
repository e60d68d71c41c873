package com.phillippitts.vibedj.config;

import com.phillippitts.vibedj.service.playback.PlayerWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the player endpoint at {@code /ws/player}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String PLAYER_PATH = "/ws/player";

    private final PlayerWebSocketHandler playerHandler;

    public WebSocketConfig(PlayerWebSocketHandler playerHandler) {
        this.playerHandler = playerHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(playerHandler, PLAYER_PATH).setAllowedOrigins("*");
    }
}
