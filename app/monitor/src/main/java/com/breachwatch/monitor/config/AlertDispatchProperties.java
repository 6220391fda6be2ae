/*
 * Where: Monitor configuration binding
 * What: Per-channel retry budget for alert dispatch
 * Why: Transient provider errors are retried inside one dispatch without blocking other channels
 */
package com.breachwatch.monitor.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monitor.alerts")
public record AlertDispatchProperties(
    int channelMaxAttempts, Duration channelRetryDelay, int errorMessageMaxLength) {}
