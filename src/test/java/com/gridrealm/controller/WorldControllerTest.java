package com.gridrealm.controller;

import com.gridrealm.config.WorldProperties;
import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.dto.ServerStatusDTO;
import com.gridrealm.exception.PlayerNotFoundException;
import com.gridrealm.model.Position;
import com.gridrealm.model.WorldObject;
import com.gridrealm.service.ActionValidator;
import com.gridrealm.service.SessionRegistry;
import com.gridrealm.service.WorldStateStore;
import com.gridrealm.websocket.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorldController.
 */
class WorldControllerTest {

    private WorldStateStore store;
    private SessionRegistry registry;
    private WorldController controller;

    @BeforeEach
    void setUp() {
        WorldProperties properties = WorldProperties.defaults();
        store = new WorldStateStore(properties, new ActionValidator(properties));
        registry = new SessionRegistry(store, properties);
        controller = new WorldController(store, registry, properties);
    }

    @Test
    @DisplayName("GET /api/world should report counts and settings")
    void shouldReportStatus() {
        registry.onConnect(new RecordingConnection("c1"));
        registry.onConnect(new RecordingConnection("c2"));
        store.placeWorldObject(new WorldObject("tree-1", "tree", Position.of(1, 1)));
        store.appendChat("Player1", "hello");
        store.advanceTick();

        ResponseEntity<ServerStatusDTO> response = controller.getStatus();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        ServerStatusDTO status = response.getBody();
        assertNotNull(status);
        assertEquals(1, status.getTick());
        assertEquals(2, status.getPlayerCount());
        assertEquals(2, status.getConnectionCount());
        assertEquals(1, status.getChatMessageCount());
        assertEquals(1, status.getWorldObjectCount());
        assertEquals(600, status.getTickIntervalMs());
        assertEquals(100, status.getWorldWidth());
        assertEquals(100, status.getWorldHeight());
    }

    @Test
    @DisplayName("GET /api/world/snapshot should return the current world")
    void shouldReturnSnapshot() {
        String playerId = registry.onConnect(new RecordingConnection("c1"));

        GameStateDTO snapshot = controller.getSnapshot().getBody();

        assertNotNull(snapshot);
        assertTrue(snapshot.getPlayers().containsKey(playerId));
    }

    @Test
    @DisplayName("GET /api/world/players/{id} should return a known player")
    void shouldReturnPlayer() {
        String playerId = registry.onConnect(new RecordingConnection("c1"));

        ResponseEntity<PlayerDTO> response = controller.getPlayer(playerId);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(playerId, response.getBody().getId());
    }

    @Test
    @DisplayName("GET /api/world/players/{id} should throw for an unknown player")
    void shouldThrowForUnknownPlayer() {
        PlayerNotFoundException ex = assertThrows(PlayerNotFoundException.class,
                () -> controller.getPlayer("nobody"));

        assertEquals("Player not found: nobody", ex.getMessage());
    }
}
