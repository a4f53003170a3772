package com.gridrealm.websocket;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * One live client connection as seen by the game core.
 */
public interface PlayerConnection {

    /** Stable id of the underlying transport session. */
    String getId();

    boolean isOpen();

    void send(String payload) throws IOException;

    void close(CloseStatus status) throws IOException;
}
