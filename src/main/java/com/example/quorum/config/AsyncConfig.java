package com.example.quorum.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Async configuration for agent runs, embedding work, and reasoning processes.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentExecutor")
    public Executor agentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(5);
        executor.setMaxPoolSize(20);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("agent-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "embeddingExecutor")
    public Executor embeddingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("embed-");
        executor.initialize();
        return executor;
    }

    /**
     * Each reasoning process occupies two threads (stdout reader, stderr drain)
     * for its whole lifetime, so the queue is kept at zero and the pool sized
     * from {@code quorum.reasoning.max-concurrent-sessions}.
     */
    @Bean(name = "orchestratorExecutor")
    public ThreadPoolTaskExecutor orchestratorExecutor(QuorumProperties properties) {
        int sessions = Math.max(1, properties.getReasoning().getMaxConcurrentSessions());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(8, sessions * 2));
        executor.setMaxPoolSize(sessions * 2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("reasoning-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "orchestratorScheduler")
    public ThreadPoolTaskScheduler orchestratorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("reasoning-timeout-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "agentTriggerScheduler")
    public ThreadPoolTaskScheduler agentTriggerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("agent-trigger-");
        scheduler.initialize();
        return scheduler;
    }
}
