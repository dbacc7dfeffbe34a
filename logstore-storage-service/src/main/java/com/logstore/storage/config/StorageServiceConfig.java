package com.logstore.storage.config;

import com.logstore.storage.registry.RestRegistryClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Configuration for storage service components
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class StorageServiceConfig {

    private final StorageConfig storageConfig;

    @Bean
    public RestTemplate restTemplate() {
        return new RestTemplate();
    }

    @Bean
    public RestRegistryClient registryClient(RestTemplate restTemplate,
                                             @Qualifier("registryExecutor") ThreadPoolTaskExecutor registryExecutor) {
        String registryUrl = storageConfig.getRegistry().getUrl();
        log.info("Registry client configured for {}", registryUrl);
        return new RestRegistryClient(registryUrl, restTemplate, registryExecutor,
                storageConfig.getRegistry().getRequestTimeoutMs());
    }
}
