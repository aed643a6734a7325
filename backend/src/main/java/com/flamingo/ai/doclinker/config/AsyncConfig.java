package com.flamingo.ai.doclinker.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the page-parallel linking stage. */
@Configuration
public class AsyncConfig {

  @Bean(name = "pageLinkingExecutor")
  public Executor pageLinkingExecutor(LinkerConfig linkerConfig) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(linkerConfig.getExecution().getCorePoolSize());
    executor.setMaxPoolSize(linkerConfig.getExecution().getMaxPoolSize());
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("page-link-");
    // Long documents overflow the queue; the submitting thread then runs the page itself.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
