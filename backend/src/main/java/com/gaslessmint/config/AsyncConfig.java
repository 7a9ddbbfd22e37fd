package com.gaslessmint.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools. mint-executor runs whole mint workflows submitted via MintOrchestrator.submitMint;
 * each workflow blocks on provider calls and polling, so the pool is sized for I/O wait, not CPU.
 */
@Configuration
public class AsyncConfig {

    public static final String MINT_EXECUTOR = "mint-executor";

    @Bean(name = MINT_EXECUTOR)
    public AsyncTaskExecutor mintExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("mint-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
