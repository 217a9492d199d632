package com.nevis.ingest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "bulkIngestionExecutor")
    public Executor bulkIngestionExecutor(
        @Value("${app.ingest.bulk.max-concurrent-jobs:4}") int maxConcurrentJobs
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentJobs);
        executor.setMaxPoolSize(maxConcurrentJobs);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("bulk-ingest-");
        executor.initialize();
        return executor;
    }
}
