package com.deepansh.gameagent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread for the agent's receive loop.
 *
 * The loop blocks for the whole session, so it gets its own single-thread
 * pool instead of borrowing one from the web container.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentLoopExecutor")
    public Executor agentLoopExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("game-agent-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
