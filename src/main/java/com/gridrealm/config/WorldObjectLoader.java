package com.gridrealm.config;

import com.gridrealm.model.WorldObject;
import com.gridrealm.service.WorldStateStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Places the static scenery into the world at startup.
 * <p>
 * Objects come from {@code game.world.objects-location} (by default
 * {@code classpath:world/objects.json}). Entries outside the world bounds or with an
 * id that is already taken are skipped; a missing or unreadable file leaves the world
 * without scenery.
 */
@Component
@Slf4j
public class WorldObjectLoader {

    private final ObjectMapper objectMapper;
    private final WorldStateStore store;
    private final String location;

    public WorldObjectLoader(ObjectMapper objectMapper,
                             WorldStateStore store,
                             @Value("${game.world.objects-location:classpath:world/objects.json}") String location) {
        this.objectMapper = objectMapper;
        this.store = store;
        this.location = location;
    }

    @PostConstruct
    public void loadObjects() {
        Resource resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) {
            log.warn("No world objects found at '{}', starting with an empty world", location);
            return;
        }

        List<WorldObject> objects;
        try (InputStream is = resource.getInputStream()) {
            WorldObjectManifest manifest = objectMapper.readValue(is, WorldObjectManifest.class);
            objects = manifest.objects() != null ? manifest.objects() : List.of();
        } catch (IOException | JacksonException e) {
            log.error("Failed to load world objects from '{}'", location, e);
            return;
        }

        int placed = 0;
        for (WorldObject object : objects) {
            if (object.id() == null || object.position() == null) {
                log.warn("Skipping incomplete world object {}", object);
            } else if (store.placeWorldObject(object)) {
                placed++;
            } else {
                log.warn("Skipping world object '{}' at {}: out of bounds or duplicate id",
                        object.id(), object.position());
            }
        }
        log.info("Placed {} of {} world object(s) from '{}'", placed, objects.size(), location);
    }

    /**
     * File layout: {@code {"objects": [{"id": ..., "type": ..., "position": {"x": .., "y": ..}}]}}.
     */
    public record WorldObjectManifest(List<WorldObject> objects) {
    }
}
