package com.gridrealm.exception;

/**
 * The claimed player id does not belong to the sending session, or the player is gone.
 */
public class IdentityException extends GameProtocolException {

    public IdentityException(String message) {
        super(message);
    }
}
