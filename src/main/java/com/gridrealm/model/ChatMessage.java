package com.gridrealm.model;

/**
 * An accepted, already sanitized chat line.
 */
public record ChatMessage(String playerName, String content, long timestamp) {
}
