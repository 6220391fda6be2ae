package com.breachwatch.monitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.breachwatch.monitor.config.MonitorScheduleProperties;
import com.breachwatch.monitor.model.JobType;
import com.breachwatch.monitor.repository.MonitoredIdentityRepository;
import com.breachwatch.monitor.repository.SubscriberRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SweepServiceTest {

  // Sunday 23:30 UTC is already Monday of ISO week 2 in Tokyo
  private static final Instant FIXED_NOW = Instant.parse("2026-01-04T23:30:00Z");

  @Mock private MonitoredIdentityRepository identityRepository;
  @Mock private SubscriberRepository subscriberRepository;
  @Mock private JobQueue jobQueue;

  private SweepService service;

  @BeforeEach
  void setUp() {
    service =
        new SweepService(
            identityRepository,
            subscriberRepository,
            jobQueue,
            new MonitorScheduleProperties(
                true, "0 0 */6 * * *", "0 0 8 * * MON", "Asia/Tokyo", Duration.ofDays(7)),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void fullSweepEnqueuesOneScanPerActiveIdentity() {
    final UUID first = UUID.randomUUID();
    final UUID second = UUID.randomUUID();
    when(identityRepository.findActiveIdentityIds()).thenReturn(List.of(first, second));
    when(jobQueue.enqueue(JobType.IDENTITY_SCAN, first))
        .thenReturn(new JobQueue.EnqueueResult(UUID.randomUUID(), "scan:" + first, true));
    when(jobQueue.enqueue(JobType.IDENTITY_SCAN, second))
        .thenReturn(new JobQueue.EnqueueResult(UUID.randomUUID(), "scan:" + second, false));

    final SweepService.FanOutResult result = service.enqueueFullSweep();

    assertThat(result).isEqualTo(new SweepService.FanOutResult(2, 1));
  }

  @Test
  void weeklyDigestsAreKeyedBySubscriberAndIsoWeek() {
    final UUID subscriber = UUID.randomUUID();
    final String dedupKey = "digest:" + subscriber + ":2026-W02";
    when(subscriberRepository.findActiveSubscriberIds()).thenReturn(List.of(subscriber));
    when(jobQueue.enqueue(JobType.WEEKLY_DIGEST, subscriber, dedupKey))
        .thenReturn(new JobQueue.EnqueueResult(UUID.randomUUID(), dedupKey, true));

    final SweepService.FanOutResult result = service.enqueueWeeklyDigests();

    assertThat(result).isEqualTo(new SweepService.FanOutResult(1, 1));
    verify(jobQueue).enqueue(JobType.WEEKLY_DIGEST, subscriber, dedupKey);
  }

  @Test
  void isoWeekUsesScheduleZone() {
    assertThat(service.isoWeek()).isEqualTo("2026-W02");
  }
}
