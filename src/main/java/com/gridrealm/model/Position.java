package com.gridrealm.model;

/**
 * A grid cell. Bounds are not enforced here, see {@code ActionValidator}.
 */
public record Position(int x, int y) {

    public static final Position ORIGIN = new Position(0, 0);

    public static Position of(int x, int y) {
        return new Position(x, y);
    }
}
