/*
 * Where: Monitor configuration binding
 * What: Polling, concurrency, retry and lease settings of the job queue
 * Why: Operational parameters are tuned per environment
 */
package com.breachwatch.monitor.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monitor.jobs")
public record JobQueueProperties(
    boolean enabled,
    Duration pollInterval,
    int workerThreads,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    Duration lease,
    Duration awaitTermination) {}
