package com.alpharadar.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. liquidity-executor runs the per-token oracle lookups of one detection cycle in parallel;
 * its queue is bounded so a stuck upstream cannot pile up work across cycles.
 */
@Configuration
public class AsyncConfig {

    public static final String LIQUIDITY_EXECUTOR = "liquidity-executor";

    private static final int LIQUIDITY_QUEUE_CAPACITY = 256;

    @Bean(name = LIQUIDITY_EXECUTOR)
    public Executor liquidityExecutor(@Value("${alpharadar.liquidity.max-concurrent-checks:4}") int maxConcurrentChecks) {
        int size = Math.max(1, maxConcurrentChecks);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setQueueCapacity(LIQUIDITY_QUEUE_CAPACITY);
        e.setThreadNamePrefix("liquidity-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
