package com.nosota.roundup.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for connection syncs requested by webhooks, so the webhook response does not wait for them.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SYNC_EXECUTOR = "syncTaskExecutor";

    @Bean(name = SYNC_EXECUTOR)
    public Executor syncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("roundup-sync-");
        executor.initialize();
        return executor;
    }
}
