package com.purchasingpower.codelod.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for description generation. Sized by {@code codelod.max-parallelism}.
 */
@Slf4j
@Configuration
public class PipelineExecutorConfig {

    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(CodeLodProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(properties.getMaxParallelism());
        executor.setMaxPoolSize(properties.getMaxParallelism());

        // Unbounded: a run queues every entity up front
        executor.setQueueCapacity(Integer.MAX_VALUE);

        executor.setThreadNamePrefix("lod-generate-");

        // Committed results must not be cut off on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Generation executor configured: workers={}", executor.getMaxPoolSize());
        return executor;
    }
}
