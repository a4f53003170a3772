package com.gridrealm.client;

import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.model.ChatMessage;

/**
 * Callbacks for server events. Invoked on the WebSocket client's receive thread,
 * after the mirror has been updated.
 */
public interface ClientListener {

    default void onInit(String playerId, GameStateDTO state) {
    }

    default void onStateUpdate(GameStateDTO state) {
    }

    default void onPlayerJoined(PlayerDTO player) {
    }

    default void onPlayerLeft(String playerId) {
    }

    default void onChatMessage(ChatMessage message) {
    }

    default void onError(String error) {
    }

    default void onDisconnected() {
    }
}
