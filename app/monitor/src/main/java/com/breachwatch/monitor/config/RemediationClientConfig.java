/*
 * Where: Monitor configuration
 * What: Provides the RestClient used for remediation text generation
 * Why: Generation calls need their own base URL and a longer read timeout than the feed
 */
package com.breachwatch.monitor.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(RemediationProperties.class)
public class RemediationClientConfig {

  @Bean
  RestClient remediationRestClient(RestClient.Builder builder, RemediationProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(
            BreachFeedClientConfig.requestFactory(
                properties.connectTimeout(), properties.readTimeout()))
        .build();
  }
}
