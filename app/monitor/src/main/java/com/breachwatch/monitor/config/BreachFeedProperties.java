/*
 * Where: Monitor configuration binding
 * What: Breach feed endpoint, credentials, pacing and timeouts
 * Why: A missing API key must stop startup rather than fail every scan later
 */
package com.breachwatch.monitor.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitor.breach-feed")
@Validated
public record BreachFeedProperties(
    @NotBlank String apiKey,
    @NotBlank String baseUrl,
    @NotBlank String pwnedPasswordsUrl,
    @NotBlank String userAgent,
    @NotNull Duration minInterval,
    @NotNull Duration rateLimitCooldown,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @NotNull Duration catalogTtl) {

  @AssertTrue(message = "monitor.breach-feed timeouts must be positive")
  public boolean isTimeoutsPositive() {
    return isPositive(connectTimeout) && isPositive(readTimeout);
  }

  @AssertTrue(message = "monitor.breach-feed.min-interval must not be negative")
  public boolean isMinIntervalValid() {
    return minInterval != null && !minInterval.isNegative();
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
