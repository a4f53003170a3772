package com.gridrealm.dto;

import com.gridrealm.model.ChatMessage;
import com.gridrealm.model.WorldObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full snapshot of the world at one tick, as sent in INIT and STATE_UPDATE.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameStateDTO {

    private long tick;

    @Builder.Default
    private Map<String, PlayerDTO> players = new LinkedHashMap<>();

    @Builder.Default
    private List<ChatMessage> chatMessages = List.of();

    @Builder.Default
    private Map<String, WorldObject> worldObjects = new LinkedHashMap<>();

    public static GameStateDTO empty() {
        return GameStateDTO.builder().build();
    }
}
