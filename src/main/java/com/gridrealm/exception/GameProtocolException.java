package com.gridrealm.exception;

/**
 * Base class for errors that are reported back to the offending client as an
 * {@code ERROR} envelope. The message is sent verbatim, so keep it client-safe.
 */
public abstract class GameProtocolException extends RuntimeException {

    protected GameProtocolException(String message) {
        super(message);
    }

    protected GameProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
