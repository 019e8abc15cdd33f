package com.scholary.transcriber.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async job execution.
 *
 * <p>Accepted jobs run on a bounded thread pool so the HTTP thread returns immediately. Pool size
 * and queue capacity come from {@link TranscriptionProperties}.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("transcription-");
    executor.initialize();
    return executor;
  }
}
