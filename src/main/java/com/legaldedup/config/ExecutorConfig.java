package com.legaldedup.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools. Collaborator calls made while fingerprinting run on {@code signalExecutor}
 * so they can be time-boxed; pairwise sweeps run on {@code comparisonExecutor}.
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final DedupConfig dedupConfig;

    @Bean("signalExecutor")
    public ThreadPoolTaskExecutor signalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("fp-signal-");
        // Rejected collaborator calls leave their signal absent; never run them on the caller
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean("comparisonExecutor")
    public ThreadPoolTaskExecutor comparisonExecutor() {
        int parallelism = Math.max(1, dedupConfig.getBatchParallelism());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("dedup-compare-");
        // Rejected rows are swept by the caller under the batch deadline
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
