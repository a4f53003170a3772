package com.gridrealm.service;

import com.gridrealm.config.WorldProperties;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.exception.ServerFullException;
import com.gridrealm.model.Player;
import com.gridrealm.websocket.PlayerConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps each live connection to the player identity minted for it.
 * <p>
 * The registry only keeps connection to id; the {@link Player} itself lives in the
 * {@link WorldStateStore}. Ids are random UUIDs and are never handed out twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionRegistry {

    private final WorldStateStore store;
    private final WorldProperties properties;

    private final Map<String, PlayerConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, String> playerIdsByConnection = new ConcurrentHashMap<>();
    private final AtomicLong joinSequence = new AtomicLong();

    /**
     * Register a new connection and seed its default player in the world.
     *
     * @return the freshly minted player id
     * @throws ServerFullException   if {@code maxPlayers} connections are already registered
     * @throws IllegalStateException if the connection is already registered
     */
    public String onConnect(PlayerConnection connection) {
        return store.callLocked(() -> {
            if (playerIdsByConnection.containsKey(connection.getId())) {
                throw new IllegalStateException("Connection already registered: " + connection.getId());
            }
            if (playerIdsByConnection.size() >= properties.maxPlayers()) {
                throw new ServerFullException(properties.maxPlayers());
            }

            String playerId = UUID.randomUUID().toString();
            Player player = Player.newcomer(playerId, "Player" + joinSequence.incrementAndGet());
            store.upsertPlayer(player);
            connections.put(connection.getId(), connection);
            playerIdsByConnection.put(connection.getId(), playerId);

            log.info("{} joined as {} ({} online)", player.getName(), playerId, playerIdsByConnection.size());
            return playerId;
        });
    }

    /**
     * Forget a connection and remove its player. Safe to call any number of times.
     *
     * @return the removed player's id on the first call for a registered connection,
     *         empty otherwise
     */
    public Optional<String> onDisconnect(String connectionId) {
        return store.callLocked(() -> {
            String playerId = playerIdsByConnection.remove(connectionId);
            connections.remove(connectionId);
            if (playerId == null) {
                return Optional.<String>empty();
            }
            Optional<PlayerDTO> removed = store.removePlayer(playerId);
            log.info("{} left ({} online)",
                    removed.map(PlayerDTO::getName).orElse(playerId), playerIdsByConnection.size());
            return Optional.of(playerId);
        });
    }

    public Optional<String> findPlayerId(String connectionId) {
        return Optional.ofNullable(playerIdsByConnection.get(connectionId));
    }

    /**
     * Snapshot of the registered connections.
     */
    public List<PlayerConnection> connections() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return playerIdsByConnection.size();
    }
}
