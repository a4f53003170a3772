package com.gridrealm.controller;

import com.gridrealm.config.WorldProperties;
import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.dto.ServerStatusDTO;
import com.gridrealm.exception.PlayerNotFoundException;
import com.gridrealm.service.SessionRegistry;
import com.gridrealm.service.WorldStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only HTTP view of the world, for dashboards and health checks.
 */
@RestController
@RequestMapping("/api/world")
@RequiredArgsConstructor
public class WorldController {

    private final WorldStateStore store;
    private final SessionRegistry sessionRegistry;
    private final WorldProperties properties;

    @GetMapping
    public ResponseEntity<ServerStatusDTO> getStatus() {
        ServerStatusDTO status = store.callLocked(() -> ServerStatusDTO.builder()
                .tick(store.currentTick())
                .playerCount(store.playerCount())
                .connectionCount(sessionRegistry.size())
                .chatMessageCount(store.chatMessageCount())
                .worldObjectCount(store.worldObjectCount())
                .tickIntervalMs(properties.tickIntervalMs())
                .worldWidth(properties.width())
                .worldHeight(properties.height())
                .build());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/snapshot")
    public ResponseEntity<GameStateDTO> getSnapshot() {
        return ResponseEntity.ok(store.snapshot());
    }

    @GetMapping("/players/{playerId}")
    public ResponseEntity<PlayerDTO> getPlayer(@PathVariable String playerId) {
        return store.findPlayer(playerId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PlayerNotFoundException(playerId));
    }
}
