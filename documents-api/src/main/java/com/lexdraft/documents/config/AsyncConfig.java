package com.lexdraft.documents.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for work that must not run on the request path: whole processing jobs, and the remote
 * OCR calls that are bounded by a timeout.
 */
@Configuration
@EnableConfigurationProperties(ProcessingProperties.class)
public class AsyncConfig {

    @Bean(name = "documentProcessingExecutor")
    public ThreadPoolTaskExecutor documentProcessingExecutor(ProcessingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("document-processing-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "ocrExecutor")
    public ThreadPoolTaskExecutor ocrExecutor(ProcessingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getOcrPoolSize());
        executor.setMaxPoolSize(properties.getOcrPoolSize());
        executor.setQueueCapacity(properties.getOcrQueueCapacity());
        executor.setThreadNamePrefix("ocr-");
        executor.initialize();
        return executor;
    }
}
