package com.gridrealm.client;

import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client-side copy of the world. Replaced wholesale on every snapshot, never merged.
 */
public class ClientWorldMirror {

    private final AtomicReference<GameStateDTO> state = new AtomicReference<>(GameStateDTO.empty());

    public void replace(GameStateDTO snapshot) {
        state.set(snapshot != null ? snapshot : GameStateDTO.empty());
    }

    public GameStateDTO current() {
        return state.get();
    }

    public long tick() {
        return state.get().getTick();
    }

    public Optional<PlayerDTO> player(String playerId) {
        return Optional.ofNullable(state.get().getPlayers().get(playerId));
    }

    public int playerCount() {
        return state.get().getPlayers().size();
    }
}
