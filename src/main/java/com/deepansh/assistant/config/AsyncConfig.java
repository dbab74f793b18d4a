package com.deepansh.assistant.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;

/**
 * Thread pool for memory capture after each turn, kept apart from the web
 * request threads. Capture is best-effort: when the queue is full the task
 * is dropped with a warning instead of blocking the turn.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "memoryTaskExecutor")
    public Executor memoryTaskExecutor(AgentProperties agentProperties) {
        AgentProperties.Capture capture = agentProperties.getMemory().getCapture();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(capture.getThreads());
        executor.setMaxPoolSize(capture.getThreads());
        executor.setQueueCapacity(capture.getQueueCapacity());
        executor.setThreadNamePrefix("memory-capture-");
        executor.setRejectedExecutionHandler(dropWithWarning());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(capture.getShutdownWaitSeconds());
        executor.initialize();
        return executor;
    }

    static RejectedExecutionHandler dropWithWarning() {
        return (task, pool) -> log.warn("Memory capture queue full ({} pending), dropping capture task",
                pool.getQueue().size());
    }
}
