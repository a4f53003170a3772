package com.gridrealm.config;

import com.gridrealm.model.Position;
import com.gridrealm.model.WorldObject;
import com.gridrealm.service.ActionValidator;
import com.gridrealm.service.WorldStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorldObjectLoader.
 */
class WorldObjectLoaderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private WorldStateStore store;

    @BeforeEach
    void setUp() {
        WorldProperties properties = WorldProperties.defaults();
        store = new WorldStateStore(properties, new ActionValidator(properties));
    }

    private WorldObjectLoader loaderFor(String location) {
        return new WorldObjectLoader(objectMapper, store, location);
    }

    @Test
    @DisplayName("should place the bundled scenery inside the world")
    void shouldLoadBundledObjects() {
        loaderFor("classpath:world/objects.json").loadObjects();

        assertEquals(8, store.worldObjectCount());
        WorldObject bank = store.snapshot().getWorldObjects().get("bank-1");
        assertNotNull(bank);
        assertEquals("bank_booth", bank.type());
        assertEquals(Position.of(50, 50), bank.position());
    }

    @Test
    @DisplayName("should skip out-of-bounds, duplicate and incomplete entries")
    void shouldSkipInvalidEntries() throws IOException {
        Path file = tempDir.resolve("objects.json");
        Files.writeString(file, """
                {"objects": [
                  {"id": "tree-1", "type": "tree", "position": {"x": 1, "y": 2}},
                  {"id": "tree-1", "type": "tree", "position": {"x": 3, "y": 4}},
                  {"id": "rock-1", "type": "rock", "position": {"x": 100, "y": 4}},
                  {"id": "rock-2", "type": "rock"},
                  {"type": "rock", "position": {"x": 5, "y": 5}}
                ]}
                """);

        loaderFor(file.toUri().toString()).loadObjects();

        assertEquals(1, store.worldObjectCount());
        assertEquals(Position.of(1, 2), store.snapshot().getWorldObjects().get("tree-1").position());
    }

    @Test
    @DisplayName("a missing file should leave the world empty")
    void shouldTolerateMissingFile() {
        WorldObjectLoader loader = loaderFor(tempDir.resolve("absent.json").toUri().toString());

        assertDoesNotThrow(loader::loadObjects);
        assertEquals(0, store.worldObjectCount());
    }

    @Test
    @DisplayName("a malformed file should leave the world empty")
    void shouldTolerateMalformedFile() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"objects\": [ {\"id\": ");

        WorldObjectLoader loader = loaderFor(file.toUri().toString());

        assertDoesNotThrow(loader::loadObjects);
        assertEquals(0, store.worldObjectCount());
    }
}
