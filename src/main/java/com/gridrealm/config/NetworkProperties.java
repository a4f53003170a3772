package com.gridrealm.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * WebSocket endpoint settings ({@code game.network.*}). The listen address and port
 * are Spring's own {@code server.address} and {@code server.port}.
 *
 * @param path                URL path of the game endpoint
 * @param allowedOrigins      origin patterns accepted on the handshake
 * @param sendTimeLimitMs     longest a single outbound write may block before the peer is dropped
 * @param sendBufferSizeLimit characters that may wait in a peer's outbound queue
 * @param maxTextMessageBytes largest inbound frame the container accepts
 * @param senderThreads       threads writing queued frames to sockets
 */
@Validated
@ConfigurationProperties(prefix = "game.network")
public record NetworkProperties(
        @DefaultValue("/game") @NotBlank String path,
        @DefaultValue("*") List<String> allowedOrigins,
        @DefaultValue("5000") @Min(1) int sendTimeLimitMs,
        @DefaultValue("524288") @Min(1024) int sendBufferSizeLimit,
        @DefaultValue("16384") @Min(256) int maxTextMessageBytes,
        @DefaultValue("8") @Min(1) int senderThreads) {

    public static NetworkProperties defaults() {
        return new NetworkProperties("/game", List.of("*"), 5000, 524288, 16384, 8);
    }
}
