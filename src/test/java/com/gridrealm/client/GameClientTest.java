package com.gridrealm.client;

import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.model.ChatMessage;
import com.gridrealm.model.Player;
import com.gridrealm.websocket.GameMessage;
import com.gridrealm.websocket.MessageCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import tools.jackson.databind.json.JsonMapper;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GameClient's handling of server frames.
 */
@ExtendWith(MockitoExtension.class)
class GameClientTest {

    @Mock private ClientListener listener;
    @Mock private WebSocketSession session;

    private MessageCodec codec;
    private GameClient client;

    @BeforeEach
    void setUp() {
        codec = new MessageCodec(JsonMapper.builder().build());
        client = new GameClient(URI.create("ws://localhost:8080/game"), codec, listener);
    }

    private void receive(GameMessage message) {
        client.handleTextMessage(session, new TextMessage(codec.encode(message)));
    }

    private static GameStateDTO state(long tick, String... playerIds) {
        GameStateDTO state = GameStateDTO.builder().tick(tick).build();
        for (String id : playerIds) {
            state.getPlayers().put(id, PlayerDTO.fromPlayer(Player.newcomer(id, "Name-" + id)));
        }
        return state;
    }

    @Test
    @DisplayName("INIT should record the player id and seed the mirror")
    void shouldHandleInit() {
        receive(GameMessage.init("me", state(7, "other")));

        assertEquals("me", client.getPlayerId());
        assertEquals(7, client.getMirror().tick());
        assertTrue(client.getMirror().player("other").isPresent());
        verify(listener).onInit(eq("me"), any(GameStateDTO.class));
    }

    @Test
    @DisplayName("STATE_UPDATE should replace the mirror wholesale")
    void shouldReplaceOnStateUpdate() {
        receive(GameMessage.init("me", state(1, "other")));
        receive(GameMessage.stateUpdate(state(2, "me")));

        assertEquals(2, client.getMirror().tick());
        assertTrue(client.getMirror().player("other").isEmpty());
        assertTrue(client.getMirror().player("me").isPresent());
        verify(listener).onStateUpdate(any(GameStateDTO.class));
    }

    @Test
    @DisplayName("events should be forwarded to the listener")
    void shouldForwardEvents() {
        PlayerDTO joined = PlayerDTO.fromPlayer(Player.newcomer("p2", "Player2"));
        ChatMessage chat = new ChatMessage("Player2", "hello", 99L);

        receive(GameMessage.playerJoined(joined));
        receive(GameMessage.playerLeft("p2"));
        receive(GameMessage.chatMessage(chat));
        receive(GameMessage.error("Invalid player ID"));

        verify(listener).onPlayerJoined(joined);
        verify(listener).onPlayerLeft("p2");
        verify(listener).onChatMessage(chat);
        verify(listener).onError("Invalid player ID");
    }

    @Test
    @DisplayName("undecodable frames should be ignored")
    void shouldIgnoreGarbage() {
        assertDoesNotThrow(() -> client.handleTextMessage(session, new TextMessage("nonsense")));

        verifyNoInteractions(listener);
        assertNull(client.getPlayerId());
    }

    @Test
    @DisplayName("sending before joining should fail")
    void shouldRefuseSendBeforeInit() {
        assertThrows(IllegalStateException.class, () -> client.move(1, 1));
        assertFalse(client.isConnected());
    }
}
