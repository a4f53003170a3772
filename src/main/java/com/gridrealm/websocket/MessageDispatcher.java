package com.gridrealm.websocket;

import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.exception.GameProtocolException;
import com.gridrealm.exception.IdentityException;
import com.gridrealm.model.ChatMessage;
import com.gridrealm.service.SessionRegistry;
import com.gridrealm.service.WorldStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Protocol boundary: joins, leaves and inbound envelopes.
 * <p>
 * Frames are decoded outside the world lock; identity checks, the mutation and any
 * broadcast it triggers then run as one locked step. Moves are applied silently and
 * only become visible with the next tick's {@code STATE_UPDATE}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageDispatcher {

    private final WorldStateStore store;
    private final SessionRegistry sessionRegistry;
    private final GameBroadcaster broadcaster;
    private final MessageCodec codec;

    /**
     * Admit a connection: {@code INIT} to it, {@code PLAYER_JOINED} to everyone else.
     * The INIT snapshot is the world as it stood just before this player was added.
     *
     * @return the assigned player id
     */
    public String onJoin(PlayerConnection connection) {
        return store.callLocked(() -> {
            GameStateDTO before = store.snapshot();
            String playerId = sessionRegistry.onConnect(connection);
            broadcaster.sendTo(connection, GameMessage.init(playerId, before));
            store.findPlayer(playerId).ifPresent(player ->
                    broadcaster.broadcastExcept(connection.getId(), GameMessage.playerJoined(player)));
            return playerId;
        });
    }

    /**
     * Drop a connection. Announces {@code PLAYER_LEFT} only the first time.
     */
    public void onLeave(String connectionId) {
        store.runLocked(() -> sessionRegistry.onDisconnect(connectionId).ifPresent(playerId ->
                broadcaster.broadcast(GameMessage.playerLeft(playerId))));
    }

    /**
     * Handle one inbound frame. Problems are answered with {@code ERROR} to the sender;
     * the connection always stays open.
     */
    public void dispatch(PlayerConnection connection, String payload) {
        ClientMessage message = decode(connection, payload);
        if (message == null) {
            return;
        }

        store.runLocked(() -> {
            try {
                PlayerDTO player = authenticate(connection, message);
                log.debug("{} from {}", message.getType(), player.getId());
                switch (message.getType()) {
                    case MOVE -> store.applyMove(player.getId(), message.getPosition());
                    case CHAT -> handleChat(player, message.getContent());
                    case INTERACT -> handleInteract(player, message.getTargetId());
                    case RUN -> store.setRunning(player.getId(), message.getRunning());
                }
            } catch (GameProtocolException e) {
                log.warn("Rejected {} from connection {}: {}",
                        message.getType(), connection.getId(), e.getMessage());
                sendError(connection, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Error processing {} from connection {}", message.getType(), connection.getId(), e);
                sendError(connection, "Internal server error");
            }
        });
    }

    private ClientMessage decode(PlayerConnection connection, String payload) {
        try {
            return codec.decodeClientMessage(payload);
        } catch (GameProtocolException e) {
            log.warn("Undecodable frame from connection {}: {}", connection.getId(), e.getMessage());
            sendError(connection, e.getMessage());
            return null;
        }
    }

    private PlayerDTO authenticate(PlayerConnection connection, ClientMessage message) {
        String sessionPlayerId = sessionRegistry.findPlayerId(connection.getId()).orElse(null);
        if (sessionPlayerId == null || !sessionPlayerId.equals(message.getPlayerId())) {
            throw new IdentityException("Invalid player ID");
        }
        return store.findPlayer(sessionPlayerId)
                .orElseThrow(() -> new IdentityException("Player not found"));
    }

    private void handleChat(PlayerDTO player, String content) {
        ChatMessage chat = store.appendChat(player.getName(), content);
        broadcaster.broadcast(GameMessage.chatMessage(chat));
    }

    private void handleInteract(PlayerDTO player, String targetId) {
        // Reserved: identity is checked, nothing in the world changes yet.
        log.debug("{} interacted with {}", player.getName(), targetId);
    }

    private void sendError(PlayerConnection connection, String error) {
        broadcaster.sendTo(connection, GameMessage.error(error));
    }
}
