package com.gridrealm.service;

import com.gridrealm.config.WorldProperties;
import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.exception.ActionRejectedException;
import com.gridrealm.exception.PlayerNotFoundException;
import com.gridrealm.model.ChatMessage;
import com.gridrealm.model.Player;
import com.gridrealm.model.Position;
import com.gridrealm.model.WorldObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Sole owner of the mutable world: players, chat history, scenery and the tick counter.
 * <p>
 * Every read and write goes through one {@link ReentrantLock}. Callers that need a
 * mutation and the broadcasts it causes to form a single step of the global order
 * wrap both in {@link #runLocked(Runnable)} or {@link #callLocked(Supplier)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorldStateStore {

    private final WorldProperties properties;
    private final ActionValidator validator;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final Deque<ChatMessage> chatMessages = new ArrayDeque<>();
    private final Map<String, WorldObject> worldObjects = new LinkedHashMap<>();
    private long tick;

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public <T> T callLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advance the clock by one tick and apply per-tick player upkeep.
     *
     * @return the new tick value
     */
    public long advanceTick() {
        return callLocked(() -> {
            tick++;
            players.values().forEach(p ->
                    p.updateRunEnergy(properties.runEnergyDrain(), properties.runEnergyRegen()));
            return tick;
        });
    }

    public long currentTick() {
        return callLocked(() -> tick);
    }

    /**
     * Move a player. Out-of-bounds targets are refused and leave the player where it was.
     *
     * @return true if the move was committed
     * @throws PlayerNotFoundException if no player has this id
     */
    public boolean applyMove(String playerId, Position position) {
        return callLocked(() -> {
            Player player = requirePlayer(playerId);
            if (!validator.isWithinBounds(position)) {
                log.debug("Rejected move of {} to {}", playerId, position);
                return false;
            }
            player.setPosition(position);
            return true;
        });
    }

    /**
     * Sanitize and append a chat line, evicting the oldest lines beyond the history limit.
     *
     * @throws ActionRejectedException if nothing is left after sanitizing
     */
    public ChatMessage appendChat(String playerName, String rawContent) {
        String content = validator.sanitizeChat(rawContent);
        if (content.isBlank()) {
            throw new ActionRejectedException("Chat message is empty");
        }
        return callLocked(() -> {
            ChatMessage message = new ChatMessage(playerName, content, System.currentTimeMillis());
            while (chatMessages.size() >= properties.chatHistoryLimit()) {
                chatMessages.removeFirst();
            }
            chatMessages.addLast(message);
            return message;
        });
    }

    /**
     * Toggle running. Switching it on needs some run energy left; otherwise nothing changes.
     *
     * @return true if the flag now has the requested value
     */
    public boolean setRunning(String playerId, boolean running) {
        return callLocked(() -> {
            Player player = requirePlayer(playerId);
            if (running && player.getRunEnergy() <= 0) {
                return false;
            }
            player.setRunning(running);
            return true;
        });
    }

    public void upsertPlayer(Player player) {
        runLocked(() -> players.put(player.getId(), player));
    }

    public Optional<PlayerDTO> removePlayer(String playerId) {
        return callLocked(() -> Optional.ofNullable(players.remove(playerId)).map(PlayerDTO::fromPlayer));
    }

    public Optional<PlayerDTO> findPlayer(String playerId) {
        return callLocked(() -> Optional.ofNullable(players.get(playerId)).map(PlayerDTO::fromPlayer));
    }

    public boolean containsPlayer(String playerId) {
        return callLocked(() -> players.containsKey(playerId));
    }

    public int playerCount() {
        return callLocked(players::size);
    }

    public int chatMessageCount() {
        return callLocked(chatMessages::size);
    }

    public int worldObjectCount() {
        return callLocked(worldObjects::size);
    }

    /**
     * Add scenery. Objects outside the world bounds or with a taken id are refused.
     *
     * @return true if the object was placed
     */
    public boolean placeWorldObject(WorldObject object) {
        return callLocked(() -> {
            if (!validator.isWithinBounds(object.position())) {
                return false;
            }
            return worldObjects.putIfAbsent(object.id(), object) == null;
        });
    }

    /**
     * Detached copy of the whole world; later mutations never show through it.
     */
    public GameStateDTO snapshot() {
        return callLocked(() -> {
            Map<String, PlayerDTO> playerViews = new LinkedHashMap<>();
            players.forEach((id, player) -> playerViews.put(id, PlayerDTO.fromPlayer(player)));
            return GameStateDTO.builder()
                    .tick(tick)
                    .players(playerViews)
                    .chatMessages(List.copyOf(chatMessages))
                    .worldObjects(new LinkedHashMap<>(worldObjects))
                    .build();
        });
    }

    private Player requirePlayer(String playerId) {
        Player player = players.get(playerId);
        if (player == null) {
            throw new PlayerNotFoundException(playerId);
        }
        return player;
    }
}
