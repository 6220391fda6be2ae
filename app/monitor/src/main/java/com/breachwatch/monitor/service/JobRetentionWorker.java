/*
 * Where: Monitor cleanup worker
 * What: Triggers job retention cleanup on a schedule
 */
package com.breachwatch.monitor.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitor.retention.enabled", havingValue = "true")
public class JobRetentionWorker {

  private final JobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${monitor.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
