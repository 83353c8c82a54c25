package org.kartograph.mutations.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for background parsing.
 * Provides the worker pool large inputs are parsed on, and the scheduler that debounces
 * parse requests.
 */
@Configuration
@EnableConfigurationProperties(AsyncConfig.ParseExecutorProperties.class)
public class AsyncConfig {

  private final ParseExecutorProperties properties;

  /**
   * Constructor for AsyncConfig.
   *
   * @param properties parse executor properties
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ParseExecutorProperties is a Spring-managed configuration bean")
  public AsyncConfig(ParseExecutorProperties properties) {
    this.properties = properties;
  }

  /**
   * Thread pool the background parse path runs on.
   * Parsing is CPU-bound, so the pool stays small; excess requests queue.
   *
   * @return ThreadPoolTaskExecutor for parse work
   */
  @Bean(name = "parseExecutor")
  public ThreadPoolTaskExecutor parseExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.corePoolSize);
    executor.setMaxPoolSize(properties.maxPoolSize);
    executor.setQueueCapacity(properties.queueCapacity);
    executor.setThreadNamePrefix("parse-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  /**
   * Scheduler that delays background parse requests until the author pauses.
   *
   * @return ThreadPoolTaskScheduler for debouncing
   */
  @Bean(name = "parseScheduler")
  public ThreadPoolTaskScheduler parseScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("parse-debounce-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }

  /**
   * Configuration properties for the parse executor thread pool.
   */
  @ConfigurationProperties(prefix = "async.parse-executor")
  public static class ParseExecutorProperties {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 50;

    public int getCorePoolSize() {
      return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
      this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }
  }
}
