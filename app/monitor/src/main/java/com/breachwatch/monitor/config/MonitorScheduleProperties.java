/*
 * Where: Monitor configuration binding
 * What: Cron expressions for the full sweep and the weekly digest
 * Why: Schedules differ between production and local runs
 */
package com.breachwatch.monitor.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitor.schedule")
@Validated
public record MonitorScheduleProperties(
    boolean enabled,
    @NotBlank String sweepCron,
    @NotBlank String digestCron,
    @NotBlank String zone,
    @NotNull Duration digestWindow) {}
