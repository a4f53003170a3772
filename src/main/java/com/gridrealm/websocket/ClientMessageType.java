package com.gridrealm.websocket;

/**
 * Envelope types a client may send.
 */
public enum ClientMessageType {
    MOVE,
    CHAT,
    INTERACT,
    RUN
}
