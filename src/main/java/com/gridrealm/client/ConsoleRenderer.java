package com.gridrealm.client;

import com.gridrealm.dto.GameStateDTO;
import com.gridrealm.dto.PlayerDTO;
import com.gridrealm.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Text view of a {@link ClientWorldMirror}, redrawn on its own schedule regardless of
 * how often snapshots arrive.
 */
@Slf4j
public class ConsoleRenderer implements AutoCloseable {

    private static final int CHAT_LINES = 5;

    private final ClientWorldMirror mirror;
    private final PrintStream out;
    private final String ownPlayerId;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "console-renderer");
        t.setDaemon(true);
        return t;
    });

    private long lastRenderedTick = -1;

    public ConsoleRenderer(ClientWorldMirror mirror, PrintStream out, String ownPlayerId) {
        this.mirror = mirror;
        this.out = out;
        this.ownPlayerId = ownPlayerId;
    }

    public void start(Duration frameInterval) {
        long period = frameInterval.toMillis();
        executor.scheduleAtFixedRate(this::redraw, 0, period, TimeUnit.MILLISECONDS);
    }

    /**
     * Print a frame if the mirror moved to a new tick since the last one.
     */
    void redraw() {
        try {
            GameStateDTO state = mirror.current();
            if (state.getTick() == lastRenderedTick) {
                return;
            }
            lastRenderedTick = state.getTick();
            out.println(renderFrame(state));
        } catch (RuntimeException e) {
            log.error("Render failed", e);
        }
    }

    public String renderFrame(GameStateDTO state) {
        StringBuilder frame = new StringBuilder();
        frame.append("== tick ").append(state.getTick())
                .append(" | ").append(state.getPlayers().size()).append(" player(s) ==\n");
        for (PlayerDTO player : state.getPlayers().values()) {
            frame.append(player.getId().equals(ownPlayerId) ? " * " : "   ")
                    .append(player.getName())
                    .append(" @ (").append(player.getPosition().x())
                    .append(',').append(player.getPosition().y()).append(')')
                    .append(player.isRunning() ? " running" : "")
                    .append(String.format(" energy %.0f%%", player.getRunEnergy()))
                    .append('\n');
        }
        List<ChatMessage> chat = state.getChatMessages();
        for (ChatMessage line : chat.subList(Math.max(0, chat.size() - CHAT_LINES), chat.size())) {
            frame.append(" <").append(line.playerName()).append("> ").append(line.content()).append('\n');
        }
        return frame.toString();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
