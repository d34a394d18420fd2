package uk.gegc.coursesync.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.coursesync.features.sync.config.SyncProperties;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for the per-item render/upload stage of a sync run.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor(SyncProperties properties) {
        int parallelism = properties.getParallelism();
        int queueCapacity = properties.getQueueCapacity();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sync-");
        // Caller runs when the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Sync Task Executor configured - Threads: {}, Queue: {}", parallelism, queueCapacity);
        return executor;
    }
}
