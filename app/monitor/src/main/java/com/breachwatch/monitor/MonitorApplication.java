/*
 * Where: Monitor application entry point
 * What: Boots Spring, scans configuration properties and enables scheduling
 * Why: Workers, schedulers and the admin API share one process
 */
package com.breachwatch.monitor;

import com.breachwatch.common.config.ClockConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(ClockConfig.class)
public class MonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(MonitorApplication.class, args);
  }
}
