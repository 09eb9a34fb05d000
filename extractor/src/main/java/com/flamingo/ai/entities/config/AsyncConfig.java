package com.flamingo.ai.entities.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the per-document worker pool. */
@Configuration
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public ThreadPoolTaskExecutor documentProcessingExecutor(ExtractorConfig extractorConfig) {
    ExtractorConfig.Workers workers = extractorConfig.getWorkers();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers.getCorePoolSize());
    executor.setMaxPoolSize(workers.getMaxPoolSize());
    executor.setQueueCapacity(workers.getQueueCapacity());
    executor.setThreadNamePrefix("doc-proc-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
