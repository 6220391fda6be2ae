/*
 * Where: Monitor configuration binding
 * What: Retention settings for finished job rows
 * Why: Keeps the queue table bounded without touching breach history
 */
package com.breachwatch.monitor.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monitor.retention")
public record JobRetentionProperties(boolean enabled, int retentionDays, Duration cleanupInterval) {}
