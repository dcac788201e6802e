package com.example.faceclusters.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated worker pool for clustering runs, kept apart from request threads.
 */
@Configuration
public class ClusterRunExecutorConfig {

    @Bean(name = "clusterRunExecutor")
    public ThreadPoolTaskExecutor clusterRunExecutor(FaceClusteringProperties properties) {
        FaceClusteringProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getPoolSize());
        executor.setMaxPoolSize(config.getPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("face-cluster-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
