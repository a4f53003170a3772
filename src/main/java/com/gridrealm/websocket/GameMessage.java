package com.gridrealm.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.model.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server to client envelope. Only the fields belonging to {@link #type} are written.
 * <p>
 * {@code message} is a {@link ChatMessage} for {@code CHAT_MESSAGE} and a plain string
 * for {@code ERROR}; after decoding on the client it is a map or a string respectively.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameMessage {

    private ServerMessageType type;
    private String playerId;
    private GameStateDTO gameState;
    private PlayerDTO player;
    private Object message;
    private long timestamp;

    public static GameMessage init(String playerId, GameStateDTO state) {
        return GameMessage.builder()
                .type(ServerMessageType.INIT)
                .playerId(playerId)
                .gameState(state)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static GameMessage stateUpdate(GameStateDTO state) {
        return GameMessage.builder()
                .type(ServerMessageType.STATE_UPDATE)
                .gameState(state)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static GameMessage playerJoined(PlayerDTO player) {
        return GameMessage.builder()
                .type(ServerMessageType.PLAYER_JOINED)
                .player(player)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static GameMessage playerLeft(String playerId) {
        return GameMessage.builder()
                .type(ServerMessageType.PLAYER_LEFT)
                .playerId(playerId)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static GameMessage chatMessage(ChatMessage chat) {
        return GameMessage.builder()
                .type(ServerMessageType.CHAT_MESSAGE)
                .message(chat)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static GameMessage error(String error) {
        return GameMessage.builder()
                .type(ServerMessageType.ERROR)
                .message(error)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
