package com.gridrealm.exception;

/**
 * Thrown when a connection arrives while the player cap is reached.
 */
public class ServerFullException extends RuntimeException {

    public ServerFullException(int maxPlayers) {
        super("Server full (" + maxPlayers + " players)");
    }
}
