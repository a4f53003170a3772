package com.gridrealm.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Skills tracked per player. Levels are opaque to the server core.
 */
public enum Skill {
    ATTACK,
    STRENGTH,
    DEFENCE,
    HITPOINTS,
    PRAYER,
    MAGIC,
    RANGED,
    MINING,
    WOODCUTTING,
    FISHING;

    public static final int STARTING_HITPOINTS = 10;

    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Levels for a freshly joined player: everything at 0 except hitpoints.
     */
    public static Map<String, Integer> startingLevels() {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (Skill skill : values()) {
            levels.put(skill.getKey(), skill == HITPOINTS ? STARTING_HITPOINTS : 0);
        }
        return levels;
    }
}
