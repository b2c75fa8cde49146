package com.example.connectionmonitor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Configuration for async processing.
 * <p>
 * Two pools:
 * - probeExecutor: fixed pool for fanning out connection probes within a schedule run
 * - taskExecutor: Spring's @Async executor, used for alert delivery
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Fixed pool for parallel probing. Sized by connection-monitor.probe-parallelism.
     */
    @Bean(name = "probeExecutor", destroyMethod = "shutdown")
    public ExecutorService probeExecutor(ConnectionMonitorProperties properties) {
        var size = properties.getProbeParallelism();
        log.info("Creating probe executor with {} threads", size);

        var factory = new CustomizableThreadFactory("probe-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(size, factory);
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring Spring TaskExecutor for async alerting");

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
