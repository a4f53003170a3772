package com.gridrealm.websocket;

import com.gridrealm.config.NetworkProperties;
import jakarta.websocket.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link PlayerConnection} over a servlet WebSocket session.
 * <p>
 * {@link #send(String)} only queues the frame; a task on the shared sender executor
 * writes queued frames to the socket one at a time, in queue order. Callers holding the
 * world lock therefore never block on a peer's TCP window. A peer that lets more than
 * {@code sendBufferSizeLimit} characters pile up, or whose current write has been stuck
 * for longer than {@code sendTimeLimitMs}, is closed with {@code SESSION_NOT_RELIABLE}.
 * <p>
 * Writes go through a {@link ConcurrentWebSocketSessionDecorator} so the sender task and
 * closes issued from container threads never touch the raw session at the same time.
 */
@Slf4j
public class WebSocketPlayerConnection implements PlayerConnection {

    /** Tomcat's per-session bound on one blocking write, as a {@code Long} in milliseconds. */
    static final String BLOCKING_SEND_TIMEOUT_PROPERTY = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final WebSocketSession session;
    private final Executor sendExecutor;
    private final long sendTimeLimitMs;
    private final long bufferSizeLimit;

    private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicLong pendingChars = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile long sendStartedAt;
    private volatile boolean abandoned;

    public WebSocketPlayerConnection(WebSocketSession session, NetworkProperties properties, Executor sendExecutor) {
        this.session = new ConcurrentWebSocketSessionDecorator(session,
                properties.sendTimeLimitMs(), properties.sendBufferSizeLimit());
        this.sendExecutor = sendExecutor;
        this.sendTimeLimitMs = properties.sendTimeLimitMs();
        this.bufferSizeLimit = properties.sendBufferSizeLimit();
        limitBlockingWrites(session, properties.sendTimeLimitMs());
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return !abandoned && session.isOpen();
    }

    /**
     * Queue a frame for the sender task. Never writes to the socket itself.
     *
     * @throws IOException if the connection was already dropped, or is dropped now for
     *                     falling too far behind
     */
    @Override
    public void send(String payload) throws IOException {
        if (abandoned) {
            throw new IOException("Connection " + getId() + " was dropped");
        }
        long started = sendStartedAt;
        if (started != 0 && System.currentTimeMillis() - started > sendTimeLimitMs) {
            abandon("write blocked for more than " + sendTimeLimitMs + " ms");
        }
        if (pendingChars.addAndGet(payload.length()) > bufferSizeLimit) {
            abandon("more than " + bufferSizeLimit + " characters queued");
        }
        outbound.add(payload);
        scheduleDrain();
    }

    @Override
    public void close(CloseStatus status) throws IOException {
        session.close(status);
    }

    /** Number of characters queued and not yet handed to the socket. */
    long pendingChars() {
        return pendingChars.get();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            sendExecutor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            String frame;
            while (!abandoned && (frame = outbound.poll()) != null) {
                pendingChars.addAndGet(-frame.length());
                sendStartedAt = System.currentTimeMillis();
                session.sendMessage(new TextMessage(frame));
                sendStartedAt = 0;
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Write to connection {} failed: {}", getId(), e.getMessage());
            markAbandoned();
            closeUnreliable();
        } finally {
            sendStartedAt = 0;
            draining.set(false);
        }
        // a frame queued after the last poll but before the flag was cleared
        if (!abandoned && !outbound.isEmpty()) {
            scheduleDrain();
        }
    }

    private void abandon(String reason) throws IOException {
        log.warn("Dropping slow connection {}: {}", getId(), reason);
        markAbandoned();
        // closing may wait on the stuck write, so it runs on the sender executor
        sendExecutor.execute(this::closeUnreliable);
        throw new IOException("Connection " + getId() + " dropped: " + reason);
    }

    private void markAbandoned() {
        abandoned = true;
        outbound.clear();
        pendingChars.set(0);
    }

    private void closeUnreliable() {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException | RuntimeException e) {
            log.debug("Close of dropped connection {} failed: {}", getId(), e.getMessage());
        }
    }

    private static void limitBlockingWrites(WebSocketSession session, long timeoutMs) {
        if (session instanceof NativeWebSocketSession nativeSession
                && nativeSession.getNativeSession() instanceof Session wsSession) {
            wsSession.getUserProperties().put(BLOCKING_SEND_TIMEOUT_PROPERTY, timeoutMs);
        }
    }

    @Override
    public String toString() {
        return "WebSocketPlayerConnection[" + session.getId() + "]";
    }
}
