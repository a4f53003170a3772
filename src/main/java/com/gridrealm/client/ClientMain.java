package com.gridrealm.client;

import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.model.ChatMessage;
import com.gridrealm.websocket.MessageCodec;
import tools.jackson.databind.json.JsonMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Console client. Usage: {@code ClientMain [ws://host:port/game]}.
 * <p>
 * Commands: {@code /move x y}, {@code /run on|off}, {@code /interact id}, {@code /quit};
 * any other line is sent as chat.
 */
public final class ClientMain {

    private static final String DEFAULT_URI = "ws://localhost:8080/game";

    private ClientMain() {
    }

    public static void main(String[] args) throws Exception {
        URI uri = URI.create(args.length > 0 ? args[0] : DEFAULT_URI);
        MessageCodec codec = new MessageCodec(JsonMapper.builder().build());

        ClientListener printer = new ClientListener() {
            @Override
            public void onPlayerJoined(PlayerDTO player) {
                System.out.println("* " + player.getName() + " joined");
            }

            @Override
            public void onPlayerLeft(String playerId) {
                System.out.println("* " + playerId + " left");
            }

            @Override
            public void onChatMessage(ChatMessage message) {
                System.out.println("<" + message.playerName() + "> " + message.content());
            }

            @Override
            public void onError(String error) {
                System.out.println("! " + error);
            }
        };

        try (GameClient client = new GameClient(uri, codec, printer)) {
            String playerId = client.connect(Duration.ofSeconds(10));
            try (ConsoleRenderer renderer = new ConsoleRenderer(client.getMirror(), System.out, playerId)) {
                renderer.start(Duration.ofSeconds(1));
                readCommands(client);
            }
        }
    }

    private static void readCommands(GameClient client) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = in.readLine()) != null && client.isConnected()) {
            String[] parts = line.trim().split("\\s+");
            try {
                switch (parts[0]) {
                    case "/quit" -> {
                        return;
                    }
                    case "/move" -> client.move(Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
                    case "/run" -> client.setRunning("on".equalsIgnoreCase(parts[1]));
                    case "/interact" -> client.interact(parts[1]);
                    default -> client.chat(line);
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                System.out.println("! bad command: " + line);
            }
        }
    }
}
