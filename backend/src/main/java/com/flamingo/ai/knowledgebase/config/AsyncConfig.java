package com.flamingo.ai.knowledgebase.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-proc-");
    executor.initialize();
    return executor;
  }

  /** Per-chunk dense embedding calls; sized for external API rate limits. */
  @Bean(name = "embeddingExecutor")
  public ThreadPoolTaskExecutor embeddingExecutor(RagConfig ragConfig) {
    int concurrency = Math.max(1, ragConfig.getEmbedding().getConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(10_000);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }

  /** Recall paths of hybrid search. */
  @Bean(name = "retrievalExecutor")
  public ThreadPoolTaskExecutor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(6);
    executor.setMaxPoolSize(24);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("recall-");
    executor.initialize();
    return executor;
  }
}
