package com.gridrealm.websocket;

import com.gridrealm.service.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Fan-out of server envelopes to registered connections.
 * <p>
 * Each envelope is encoded once. Socket connections only queue the frame here, so a
 * broadcast issued under the world lock does not wait on any peer. A connection that
 * refuses the frame (closed, or dropped for lagging) is logged and skipped; the
 * remaining recipients still get the message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameBroadcaster {

    private final SessionRegistry sessionRegistry;
    private final MessageCodec codec;

    /**
     * Send to a single connection, registered or not.
     */
    public void sendTo(PlayerConnection connection, GameMessage message) {
        deliver(List.of(connection), message);
    }

    /**
     * Send to every registered connection.
     *
     * @return number of connections that accepted the frame
     */
    public int broadcast(GameMessage message) {
        return deliver(sessionRegistry.connections(), message);
    }

    /**
     * Send to every registered connection except the one with the given id.
     */
    public int broadcastExcept(String excludedConnectionId, GameMessage message) {
        List<PlayerConnection> recipients = sessionRegistry.connections().stream()
                .filter(c -> !c.getId().equals(excludedConnectionId))
                .toList();
        return deliver(recipients, message);
    }

    private int deliver(Collection<PlayerConnection> recipients, GameMessage message) {
        if (recipients.isEmpty()) {
            return 0;
        }
        String frame;
        try {
            frame = codec.encode(message);
        } catch (RuntimeException e) {
            log.error("Could not encode {} message", message.getType(), e);
            return 0;
        }

        int delivered = 0;
        for (PlayerConnection connection : recipients) {
            if (!connection.isOpen()) {
                log.debug("Skipping {} for closed connection {}", message.getType(), connection.getId());
                continue;
            }
            try {
                connection.send(frame);
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to deliver {} to connection {}: {}",
                        message.getType(), connection.getId(), e.getMessage());
            }
        }
        return delivered;
    }
}
