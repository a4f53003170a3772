package com.gridrealm.client;

import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.model.Player;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClientWorldMirror.
 */
class ClientWorldMirrorTest {

    private final ClientWorldMirror mirror = new ClientWorldMirror();

    @Test
    @DisplayName("should start empty at tick 0")
    void shouldStartEmpty() {
        assertEquals(0, mirror.tick());
        assertEquals(0, mirror.playerCount());
        assertTrue(mirror.player("p1").isEmpty());
    }

    @Test
    @DisplayName("replace() should swap the whole state, dropping players missing from the new snapshot")
    void shouldReplaceWholesale() {
        mirror.replace(state(3, "p1", "p2"));
        mirror.replace(state(4, "p2"));

        assertEquals(4, mirror.tick());
        assertEquals(1, mirror.playerCount());
        assertTrue(mirror.player("p1").isEmpty());
        assertEquals("p2", mirror.player("p2").orElseThrow().getId());
    }

    @Test
    @DisplayName("replace(null) should fall back to an empty world")
    void shouldHandleNull() {
        mirror.replace(state(3, "p1"));
        mirror.replace(null);

        assertEquals(0, mirror.playerCount());
    }

    private static GameStateDTO state(long tick, String... playerIds) {
        GameStateDTO state = GameStateDTO.builder().tick(tick).build();
        for (String id : playerIds) {
            state.getPlayers().put(id, PlayerDTO.fromPlayer(Player.newcomer(id, "Name-" + id)));
        }
        return state;
    }

    @Test
    @DisplayName("current() should expose the snapshot last handed in")
    void shouldExposeCurrent() {
        GameStateDTO snapshot = GameStateDTO.builder()
                .tick(9)
                .players(Map.of())
                .build();

        mirror.replace(snapshot);

        assertSame(snapshot, mirror.current());
    }
}
