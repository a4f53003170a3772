package com.gridrealm.websocket;

/**
 * Envelope types the server sends.
 */
public enum ServerMessageType {
    /** Once per connection, right after joining: assigned id and a snapshot. */
    INIT,
    /** Every tick, to every session. */
    STATE_UPDATE,
    /** Once per join, to every other session. */
    PLAYER_JOINED,
    /** Once per disconnect, to the remaining sessions. */
    PLAYER_LEFT,
    /** Once per accepted chat line, to every session. */
    CHAT_MESSAGE,
    /** To the offending session only. */
    ERROR
}
