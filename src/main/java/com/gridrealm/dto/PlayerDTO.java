package com.gridrealm.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gridrealm.model.Item;
import com.gridrealm.model.Player;
import com.gridrealm.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DTO for player representation. Always a detached copy of the store's player.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerDTO {

    private String id;
    private String name;
    private Position position;
    @JsonProperty("isRunning")
    private boolean running;
    private double runEnergy;
    private List<Item> inventory;
    private Map<String, Integer> skills;

    public static PlayerDTO fromPlayer(Player player) {
        return PlayerDTO.builder()
                .id(player.getId())
                .name(player.getName())
                .position(player.getPosition())
                .running(player.isRunning())
                .runEnergy(player.getRunEnergy())
                .inventory(List.copyOf(player.getInventory()))
                .skills(new LinkedHashMap<>(player.getSkills()))
                .build();
    }
}
