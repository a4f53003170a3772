package com.gridrealm.model;

/**
 * Static scenery placed at startup (trees, rocks, booths...).
 */
public record WorldObject(String id, String type, Position position) {
}
