/*
 * Where: Monitor scheduled worker
 * What: Triggers the periodic full sweep and the weekly digest fan-out
 * Why: Cron timing stays here while fan-out logic stays testable in SweepService
 */
package com.breachwatch.monitor.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "monitor.schedule.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MonitorScheduleWorker {

  private final SweepService sweepService;

  @Scheduled(cron = "${monitor.schedule.sweep-cron}", zone = "${monitor.schedule.zone}")
  public void fullSweep() {
    sweepService.enqueueFullSweep();
  }

  @Scheduled(cron = "${monitor.schedule.digest-cron}", zone = "${monitor.schedule.zone}")
  public void weeklyDigest() {
    sweepService.enqueueWeeklyDigests();
  }
}
