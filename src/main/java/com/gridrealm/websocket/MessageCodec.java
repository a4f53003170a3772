package com.gridrealm.websocket;

import com.gridrealm.exception.MessageDecodeException;
import com.gridrealm.model.ChatMessage;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectReader;

/**
 * JSON encoding of the wire envelopes, for both directions of the protocol.
 * <p>
 * The server decodes {@link ClientMessage} and encodes {@link GameMessage};
 * {@code GameClient} does the reverse with the same instance type.
 */
@Component
public class MessageCodec {

    private final ObjectMapper objectMapper;

    /** Coordinates must be JSON integers; {@code 99.9} is refused rather than truncated. */
    private final ObjectReader clientMessageReader;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.clientMessageReader = objectMapper.readerFor(ClientMessage.class)
                .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    /**
     * Parse and shape-check a client envelope.
     *
     * @throws MessageDecodeException if the frame is not JSON, the type is unknown or
     *                                missing, a coordinate is not an integer, or the
     *                                payload field for the type is absent
     */
    public ClientMessage decodeClientMessage(String payload) {
        ClientMessage message;
        try {
            message = clientMessageReader.readValue(payload);
        } catch (JacksonException e) {
            throw new MessageDecodeException("Invalid message format", e);
        }
        if (message == null || message.getType() == null) {
            throw new MessageDecodeException("Missing message type");
        }
        switch (message.getType()) {
            case MOVE -> require(message.getPosition() != null, "MOVE requires a position");
            case CHAT -> require(message.getContent() != null, "CHAT requires content");
            case INTERACT -> require(message.getTargetId() != null, "INTERACT requires a targetId");
            case RUN -> require(message.getRunning() != null, "RUN requires a running flag");
        }
        return message;
    }

    public String encodeClientMessage(ClientMessage message) {
        return objectMapper.writeValueAsString(message);
    }

    public String encode(GameMessage message) {
        return objectMapper.writeValueAsString(message);
    }

    /**
     * @throws MessageDecodeException if the frame is not a server envelope
     */
    public GameMessage decodeServerMessage(String payload) {
        try {
            GameMessage message = objectMapper.readValue(payload, GameMessage.class);
            if (message == null || message.getType() == null) {
                throw new MessageDecodeException("Missing message type");
            }
            return message;
        } catch (JacksonException e) {
            throw new MessageDecodeException("Invalid message format", e);
        }
    }

    /**
     * Typed view of the {@code message} field of a decoded {@code CHAT_MESSAGE}.
     */
    public ChatMessage chatPayload(GameMessage message) {
        if (message.getMessage() instanceof ChatMessage chat) {
            return chat;
        }
        return objectMapper.convertValue(message.getMessage(), ChatMessage.class);
    }

    private static void require(boolean condition, String error) {
        if (!condition) {
            throw new MessageDecodeException(error);
        }
    }
}
