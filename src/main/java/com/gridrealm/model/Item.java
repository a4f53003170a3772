package com.gridrealm.model;

/**
 * Inventory entry. Carried as opaque data; no rule in the server core reads it.
 */
public record Item(String id, String name, boolean stackable, int quantity) {
}
