package com.gridrealm.config;

import com.gridrealm.websocket.GameWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the raw (non-STOMP) game endpoint.
 * <p>
 * Clients open a plain WebSocket to {@code game.network.path} and exchange JSON envelopes
 * of the form {@code {"type": ..., "playerId": ..., ...}}. Inbound frames above
 * {@code game.network.max-text-message-bytes} are refused by the container.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final GameWebSocketHandler gameWebSocketHandler;
    private final NetworkProperties networkProperties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(gameWebSocketHandler, networkProperties.path())
                .setAllowedOriginPatterns(networkProperties.allowedOrigins().toArray(String[]::new));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(networkProperties.maxTextMessageBytes());
        return container;
    }
}
