package com.gridrealm.exception;

/**
 * A well-formed, authenticated action that the world refuses to apply.
 */
public class ActionRejectedException extends GameProtocolException {

    public ActionRejectedException(String message) {
        super(message);
    }
}
