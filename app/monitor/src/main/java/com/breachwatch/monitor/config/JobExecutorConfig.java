/*
 * Where: Monitor configuration
 * What: Provides the bounded worker pool that runs claimed jobs
 * Why: Scans, dispatches and digests run concurrently and must drain on shutdown
 */
package com.breachwatch.monitor.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobExecutorConfig {

  @Bean
  ThreadPoolTaskExecutor jobExecutor(JobQueueProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("monitor-job-");
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerThreads());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.awaitTermination().toMillis());
    executor.initialize();
    return executor;
  }
}
