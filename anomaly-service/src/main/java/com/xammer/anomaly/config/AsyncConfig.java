package com.xammer.anomaly.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /**
     * Bounds concurrent usage queries so the Cost Explorer rate limit is respected.
     */
    @Bean(name = "anomalyFetchExecutor")
    public Executor anomalyFetchExecutor(@Value("${anomaly.report.fetch-parallelism:1}") int parallelism) {
        int poolSize = Math.max(1, parallelism);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("CostUsage-");
        executor.initialize();
        return executor;
    }
}
