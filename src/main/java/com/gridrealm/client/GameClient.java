package com.gridrealm.client;

import com.gridrealm.exception.MessageDecodeException;
import com.gridrealm.model.Position;
import com.gridrealm.websocket.ClientMessage;
import com.gridrealm.websocket.GameMessage;
import com.gridrealm.websocket.MessageCodec;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Peer side of the game protocol.
 * <p>
 * Keeps a {@link ClientWorldMirror} that is swapped for every {@code INIT} and
 * {@code STATE_UPDATE}, and forwards local input as envelopes tagged with the id the
 * server assigned on join.
 */
@Slf4j
public class GameClient extends TextWebSocketHandler implements AutoCloseable {

    /** Snapshots with a full chat history easily exceed the container's 8 KiB default. */
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 1024 * 1024;

    private final URI serverUri;
    private final MessageCodec codec;
    private final ClientListener listener;
    private final ClientWorldMirror mirror = new ClientWorldMirror();
    private final CountDownLatch initialized = new CountDownLatch(1);

    private volatile WebSocketSession session;
    private volatile String playerId;

    public GameClient(URI serverUri, MessageCodec codec, ClientListener listener) {
        this.serverUri = serverUri;
        this.codec = codec;
        this.listener = listener != null ? listener : new ClientListener() { };
    }

    /**
     * Open the connection and wait for the server's {@code INIT}.
     *
     * @return the player id assigned by the server
     * @throws IOException      if the handshake fails
     * @throws TimeoutException if the handshake or INIT does not arrive in time
     */
    public String connect(Duration timeout) throws IOException, InterruptedException, TimeoutException {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(DEFAULT_MAX_MESSAGE_BYTES);
        StandardWebSocketClient client = new StandardWebSocketClient(container);

        try {
            session = client.execute(this, new WebSocketHttpHeaders(), serverUri)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Could not connect to " + serverUri, e.getCause());
        }

        if (!initialized.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("No INIT from " + serverUri + " within " + timeout);
        }
        log.info("Connected to {} as {}", serverUri, playerId);
        return playerId;
    }

    public void move(int x, int y) throws IOException {
        send(ClientMessage.move(requirePlayerId(), Position.of(x, y)));
    }

    public void chat(String content) throws IOException {
        send(ClientMessage.chat(requirePlayerId(), content));
    }

    public void interact(String targetId) throws IOException {
        send(ClientMessage.interact(requirePlayerId(), targetId));
    }

    public void setRunning(boolean running) throws IOException {
        send(ClientMessage.run(requirePlayerId(), running));
    }

    /**
     * Send an arbitrary envelope as-is. The caller is responsible for the player id.
     */
    public void send(ClientMessage message) throws IOException {
        sendRaw(codec.encodeClientMessage(message));
    }

    /**
     * Send a raw text frame.
     */
    public synchronized void sendRaw(String frame) throws IOException {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new IllegalStateException("Not connected");
        }
        current.sendMessage(new TextMessage(frame));
    }

    public String getPlayerId() {
        return playerId;
    }

    public ClientWorldMirror getMirror() {
        return mirror;
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public void close() throws IOException {
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            current.close(CloseStatus.NORMAL);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        GameMessage envelope;
        try {
            envelope = codec.decodeServerMessage(message.getPayload());
        } catch (MessageDecodeException e) {
            log.warn("Ignoring undecodable server frame: {}", e.getMessage());
            return;
        }

        switch (envelope.getType()) {
            case INIT -> {
                playerId = envelope.getPlayerId();
                mirror.replace(envelope.getGameState());
                listener.onInit(playerId, mirror.current());
                initialized.countDown();
            }
            case STATE_UPDATE -> {
                mirror.replace(envelope.getGameState());
                listener.onStateUpdate(mirror.current());
            }
            case PLAYER_JOINED -> listener.onPlayerJoined(envelope.getPlayer());
            case PLAYER_LEFT -> listener.onPlayerLeft(envelope.getPlayerId());
            case CHAT_MESSAGE -> listener.onChatMessage(codec.chatPayload(envelope));
            case ERROR -> {
                String error = String.valueOf(envelope.getMessage());
                log.debug("Server reported error: {}", error);
                listener.onError(error);
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Disconnected from {}: {}", serverUri, status);
        listener.onDisconnected();
    }

    private String requirePlayerId() {
        String id = playerId;
        if (id == null) {
            throw new IllegalStateException("Not joined yet");
        }
        return id;
    }
}
