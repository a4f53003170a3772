package com.gridrealm.exception;

/**
 * The inbound frame is not a well-formed client envelope.
 */
public class MessageDecodeException extends GameProtocolException {

    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
