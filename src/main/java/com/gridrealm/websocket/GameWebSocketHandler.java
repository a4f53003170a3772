package com.gridrealm.websocket;

import com.gridrealm.config.NetworkProperties;
import com.gridrealm.config.OutboundExecutorConfig;
import com.gridrealm.exception.ServerFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Servlet WebSocket callbacks, adapted onto the {@link MessageDispatcher}.
 */
@Component
@Slf4j
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final CloseStatus SERVER_FULL = CloseStatus.POLICY_VIOLATION.withReason("Server full");

    private final MessageDispatcher dispatcher;
    private final NetworkProperties networkProperties;
    private final Executor sendExecutor;

    private final Map<String, PlayerConnection> openConnections = new ConcurrentHashMap<>();

    public GameWebSocketHandler(MessageDispatcher dispatcher,
                                NetworkProperties networkProperties,
                                @Qualifier(OutboundExecutorConfig.OUTBOUND_EXECUTOR) Executor sendExecutor) {
        this.dispatcher = dispatcher;
        this.networkProperties = networkProperties;
        this.sendExecutor = sendExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        PlayerConnection connection = new WebSocketPlayerConnection(session, networkProperties, sendExecutor);
        openConnections.put(session.getId(), connection);
        try {
            dispatcher.onJoin(connection);
        } catch (ServerFullException e) {
            log.warn("Refusing connection {} from {}: {}", session.getId(), session.getRemoteAddress(), e.getMessage());
            connection.close(SERVER_FULL);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PlayerConnection connection = openConnections.get(session.getId());
        if (connection == null) {
            log.debug("Frame on unknown session {}", session.getId());
            return;
        }
        dispatcher.dispatch(connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        openConnections.remove(session.getId());
        log.debug("Session {} closed: {}", session.getId(), status);
        dispatcher.onLeave(session.getId());
    }
}
