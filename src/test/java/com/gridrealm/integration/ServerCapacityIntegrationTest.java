package com.gridrealm.integration;

import com.gridrealm.client.ClientListener;
import com.gridrealm.client.GameClient;
import com.gridrealm.websocket.MessageCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import tools.jackson.databind.json.JsonMapper;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection limit enforcement against a running server.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "game.world.max-players=1")
class ServerCapacityIntegrationTest {

    @Value("${local.server.port}")
    private int port;

    private final MessageCodec codec = new MessageCodec(JsonMapper.builder().build());

    @Test
    @DisplayName("a connection beyond the limit should be closed without INIT")
    void refusesConnectionWhenFull() throws Exception {
        URI uri = URI.create("ws://localhost:" + port + "/game");
        CountDownLatch refused = new CountDownLatch(1);

        try (GameClient first = new GameClient(uri, codec, null);
             GameClient second = new GameClient(uri, codec, new ClientListener() {
                 @Override
                 public void onDisconnected() {
                     refused.countDown();
                 }
             })) {
            assertNotNull(first.connect(Duration.ofSeconds(10)));

            assertThrows(TimeoutException.class, () -> second.connect(Duration.ofSeconds(2)));
            assertTrue(refused.await(5, TimeUnit.SECONDS));
            assertNull(second.getPlayerId());
            assertTrue(first.isConnected());
        }
    }
}
