package com.gridrealm.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gridrealm.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client to server envelope. Which payload field is set depends on {@link #type}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClientMessage {

    private ClientMessageType type;
    private String playerId;
    private Position position;
    private String content;
    private String targetId;
    private Boolean running;

    public static ClientMessage move(String playerId, Position position) {
        return ClientMessage.builder()
                .type(ClientMessageType.MOVE)
                .playerId(playerId)
                .position(position)
                .build();
    }

    public static ClientMessage chat(String playerId, String content) {
        return ClientMessage.builder()
                .type(ClientMessageType.CHAT)
                .playerId(playerId)
                .content(content)
                .build();
    }

    public static ClientMessage interact(String playerId, String targetId) {
        return ClientMessage.builder()
                .type(ClientMessageType.INTERACT)
                .playerId(playerId)
                .targetId(targetId)
                .build();
    }

    public static ClientMessage run(String playerId, boolean running) {
        return ClientMessage.builder()
                .type(ClientMessageType.RUN)
                .playerId(playerId)
                .running(running)
                .build();
    }
}
