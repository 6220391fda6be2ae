/*
 * Where: Monitor configuration
 * What: Provides the breach feed RestClients and the shared feed rate limiter
 * Why: Keeps base URLs, timeouts and pacing for the feed in one place
 */
package com.breachwatch.monitor.config;

import com.breachwatch.monitor.client.BreachFeedRateLimiter;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(BreachFeedProperties.class)
public class BreachFeedClientConfig {

  @Bean
  RestClient breachFeedRestClient(RestClient.Builder builder, BreachFeedProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient pwnedPasswordsRestClient(
      RestClient.Builder builder, BreachFeedProperties properties) {
    return builder
        .baseUrl(properties.pwnedPasswordsUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  BreachFeedRateLimiter breachFeedRateLimiter(BreachFeedProperties properties, Clock clock) {
    return new BreachFeedRateLimiter(properties.minInterval(), clock);
  }

  static SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
