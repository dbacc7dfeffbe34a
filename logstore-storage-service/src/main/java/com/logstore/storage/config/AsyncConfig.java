package com.logstore.storage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Async configuration for storage service.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "registryExecutor")
    public ThreadPoolTaskExecutor registryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("registry-");
        executor.initialize();
        return executor;
    }
}
