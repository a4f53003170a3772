package com.gridrealm.service;

import com.gridrealm.websocket.GameBroadcaster;
import com.gridrealm.websocket.GameMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-rate world clock. Each tick advances the counter by one and sends the full
 * snapshot to every session; it is the only producer of {@code STATE_UPDATE}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TickScheduler {

    private final WorldStateStore store;
    private final GameBroadcaster broadcaster;

    @Scheduled(fixedRateString = "${game.world.tick-interval-ms:600}",
            initialDelayString = "${game.world.tick-interval-ms:600}")
    public void onTick() {
        try {
            store.runLocked(() -> {
                long tick = store.advanceTick();
                int delivered = broadcaster.broadcast(GameMessage.stateUpdate(store.snapshot()));
                log.trace("Tick {} sent to {} session(s)", tick, delivered);
            });
        } catch (RuntimeException e) {
            log.error("Tick failed", e);
        }
    }
}
