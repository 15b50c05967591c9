package com.example.importservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executor for the concurrent epic/issue fetches of an import.
 *
 * Each import submits at most two fetch tasks, so the pool is small.
 * Rejection: AbortPolicy. A rejected fetch fails the import instead of blocking the
 * scheduler thread that holds the ShedLock.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    @Bean(name = "importTaskExecutor")
    public Executor importTaskExecutor(
            @Value("${importer.async.core-pool-size:2}") int corePoolSize,
            @Value("${importer.async.max-pool-size:4}") int maxPoolSize,
            @Value("${importer.async.queue-capacity:50}") int queueCapacity,
            @Value("${importer.async.thread-name-prefix:import-}") String threadNamePrefix) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // Graceful shutdown: let in-flight fetches finish
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        // Correlation IDs follow the fetch onto the worker thread
        executor.setTaskDecorator(new MdcTaskDecorator());

        executor.initialize();

        log.info("✅ Initialized importTaskExecutor - core={}, max={}, queue={}, prefix='{}'",
                corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);

        return executor;
    }
}
