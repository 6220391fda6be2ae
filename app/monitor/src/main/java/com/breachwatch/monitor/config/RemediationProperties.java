/*
 * Where: Monitor configuration binding
 * What: Text generation endpoint, model and fallback advisory text
 * Why: Model and token budget change per environment; the fallback must always be present
 */
package com.breachwatch.monitor.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitor.remediation")
@Validated
public record RemediationProperties(
    @NotBlank String apiKey,
    @NotBlank String baseUrl,
    @NotBlank String model,
    @Positive int maxTokens,
    @NotBlank String apiVersion,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @NotBlank String fallbackText) {}
