/*
 * Where: Monitor service layer
 * What: Fans out identity scans and weekly digests as individual jobs
 * Why: One job per identity or subscriber avoids head-of-line blocking behind slow scans
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.config.MonitorScheduleProperties;
import com.breachwatch.monitor.model.JobType;
import com.breachwatch.monitor.repository.MonitoredIdentityRepository;
import com.breachwatch.monitor.repository.SubscriberRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SweepService {

  private static final Logger logger = LoggerFactory.getLogger(SweepService.class);

  private final MonitoredIdentityRepository identityRepository;
  private final SubscriberRepository subscriberRepository;
  private final JobQueue jobQueue;
  private final MonitorScheduleProperties scheduleProperties;
  private final Clock clock;

  public FanOutResult enqueueFullSweep() {
    final List<UUID> identityIds = identityRepository.findActiveIdentityIds();
    int created = 0;
    for (UUID identityId : identityIds) {
      if (jobQueue.enqueue(JobType.IDENTITY_SCAN, identityId).created()) {
        created++;
      }
    }
    logger.info("full sweep enqueued identities={} newJobs={}", identityIds.size(), created);
    return new FanOutResult(identityIds.size(), created);
  }

  public FanOutResult enqueueWeeklyDigests() {
    final List<UUID> subscriberIds = subscriberRepository.findActiveSubscriberIds();
    final String week = isoWeek();
    int created = 0;
    for (UUID subscriberId : subscriberIds) {
      final String dedupKey = JobType.WEEKLY_DIGEST.dedupKey(subscriberId + ":" + week);
      if (jobQueue.enqueue(JobType.WEEKLY_DIGEST, subscriberId, dedupKey).created()) {
        created++;
      }
    }
    logger.info(
        "weekly digests enqueued week={} subscribers={} newJobs={}",
        week,
        subscriberIds.size(),
        created);
    return new FanOutResult(subscriberIds.size(), created);
  }

  String isoWeek() {
    final LocalDate today = LocalDate.now(clock.withZone(ZoneId.of(scheduleProperties.zone())));
    return String.format(
        "%d-W%02d",
        today.get(IsoFields.WEEK_BASED_YEAR),
        today.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
  }

  /** {@code subjects} found, of which {@code enqueued} got a new job; the rest were coalesced. */
  public record FanOutResult(int subjects, int enqueued) {}
}
