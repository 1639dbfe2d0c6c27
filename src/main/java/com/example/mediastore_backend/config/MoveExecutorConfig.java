package com.example.mediastore_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the executor used by {@link com.example.mediastore_backend.service.MoveJobWorker}.
 * It has exactly one thread: relocations for the same entity and path type must never run
 * concurrently.
 */
@Configuration
public class MoveExecutorConfig {

    @Bean(name = "storageMoveExecutor")
    public ThreadPoolTaskExecutor storageMoveExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("storage-move-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
