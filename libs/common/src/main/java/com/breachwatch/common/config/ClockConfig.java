/*
 * Where: Shared configuration
 * What: Exposes a UTC clock that ticks in whole milliseconds
 * Why: Timestamps read back from Postgres and JSON compare equal to the values that were written
 */
package com.breachwatch.common.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  public Clock clock() {
    return Clock.tickMillis(ZoneOffset.UTC);
  }
}
