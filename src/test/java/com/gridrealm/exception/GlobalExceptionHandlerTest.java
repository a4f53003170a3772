package com.gridrealm.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should return 404 NOT_FOUND for PlayerNotFoundException")
    void shouldHandle404ForMissingPlayer() {
        ResponseEntity<Map<String, String>> response =
                handler.handlePlayerNotFound(new PlayerNotFoundException("p-1"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Player not found: p-1", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 404 NOT_FOUND for unknown resources")
    void shouldHandle404ForNoResource() {
        var ex = new NoResourceFoundException(HttpMethod.GET, "api/world/nope", null);

        ResponseEntity<Map<String, String>> response = handler.handleNoResource(ex);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Not found", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 500 INTERNAL_SERVER_ERROR for generic Exception")
    void shouldHandle500ForGenericException() {
        ResponseEntity<Map<String, String>> response =
                handler.handleGeneral(new RuntimeException("Something went wrong"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().get("error"));
    }

    @Test
    @DisplayName("protocol exceptions should carry their wire message")
    void protocolExceptionsCarryMessage() {
        assertEquals("Invalid player ID", new IdentityException("Invalid player ID").getMessage());
        assertEquals("Chat message is empty", new ActionRejectedException("Chat message is empty").getMessage());
        assertInstanceOf(GameProtocolException.class, new MessageDecodeException("Invalid message format"));
        assertTrue(new ServerFullException(2000).getMessage().startsWith("Server full"));
    }
}
