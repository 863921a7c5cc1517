package com.deepansh.foundry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Dedicated thread pools for resolving the tool calls of a requires-action batch
 * and for running streaming chat turns.
 *
 * Isolated from the web thread pool so a burst of slow MCP gateway calls
 * never starves HTTP request handling.
 *
 * Tool pool sizing:
 * - Tool calls are I/O bound (one gateway round-trip each)
 * - A batch rarely holds more than a handful of calls
 * - No queue: when the pool is saturated the submitting request thread
 *   resolves the call itself (CallerRunsPolicy)
 * - Tasks go through submit(), so cancelling a turn interrupts the worker
 *   threads still running its tool calls
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "toolTaskExecutor")
    public AsyncTaskExecutor toolTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(0);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("mcp-tool-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /** Runs streaming chat turns off the request thread; one task per open SSE stream. */
    @Bean(name = "chatStreamExecutor")
    public AsyncTaskExecutor chatStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("chat-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
