package com.flamingo.ai.searchablepdf.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for building page layers.
 *
 * <p>When every worker is busy and the queue is full, the submitting thread builds the layer
 * itself, so documents of any length complete.
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "pageLayerExecutor")
  public Executor pageLayerExecutor(TextLayerConfig textLayerConfig) {
    TextLayerConfig.Concurrency concurrency = textLayerConfig.getConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency.getPoolSize());
    executor.setMaxPoolSize(concurrency.getPoolSize());
    executor.setQueueCapacity(concurrency.getQueueCapacity());
    executor.setThreadNamePrefix("layer-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
