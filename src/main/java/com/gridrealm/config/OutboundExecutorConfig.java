package com.gridrealm.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool that performs the actual socket writes for every connection.
 * <p>
 * Broadcasts only queue frames while the world lock is held; these threads drain the
 * per-connection queues, so a peer with a full TCP window ties up one sender thread
 * for at most {@code game.network.send-time-limit-ms}.
 */
@Configuration
@RequiredArgsConstructor
public class OutboundExecutorConfig {

    public static final String OUTBOUND_EXECUTOR = "outboundSendExecutor";

    private final NetworkProperties networkProperties;

    @Bean(OUTBOUND_EXECUTOR)
    public ThreadPoolTaskExecutor outboundSendExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(networkProperties.senderThreads());
        executor.setMaxPoolSize(networkProperties.senderThreads());
        executor.setThreadNamePrefix("ws-send-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
