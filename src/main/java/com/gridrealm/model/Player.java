package com.gridrealm.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.LinkedHashMap;

/**
 * A connected player. Instances are owned by the world store and never leave it;
 * everything outside the store sees {@code PlayerDTO} copies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Player {

    public static final double MAX_RUN_ENERGY = 100.0;

    private String id;

    private String name;

    @Builder.Default
    private Position position = Position.ORIGIN;

    private boolean running;

    @Builder.Default
    private double runEnergy = MAX_RUN_ENERGY;

    @Builder.Default
    private List<Item> inventory = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> skills = new LinkedHashMap<>();

    /**
     * Default player for a new connection: spawn at the origin, full run energy,
     * empty inventory, starting skill levels.
     */
    public static Player newcomer(String id, String name) {
        return Player.builder()
                .id(id)
                .name(name)
                .position(Position.ORIGIN)
                .skills(Skill.startingLevels())
                .build();
    }

    /**
     * Apply one tick of run energy: running drains (and stops at zero), then anyone not
     * running regenerates. A player who runs out stops and recovers on the same tick.
     */
    public void updateRunEnergy(double drain, double regen) {
        if (running) {
            runEnergy = Math.max(0, runEnergy - drain);
            if (runEnergy == 0) {
                running = false;
            }
        }
        if (!running && runEnergy < MAX_RUN_ENERGY) {
            runEnergy = Math.min(MAX_RUN_ENERGY, runEnergy + regen);
        }
    }
}
