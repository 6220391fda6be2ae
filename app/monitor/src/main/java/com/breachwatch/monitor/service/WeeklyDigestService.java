/*
 * Where: Monitor service layer
 * What: Builds and emails the weekly security digest of one subscriber
 * Why: Subscribers get a periodic summary even when no new breach arrived
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.client.ChannelSendResult;
import com.breachwatch.monitor.client.EmailChannelProvider;
import com.breachwatch.monitor.config.MonitorScheduleProperties;
import com.breachwatch.monitor.model.DigestSummary;
import com.breachwatch.monitor.model.SubscriberRecord;
import com.breachwatch.monitor.repository.BreachEventRepository;
import com.breachwatch.monitor.repository.SubscriberRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WeeklyDigestService {

  private static final Logger logger = LoggerFactory.getLogger(WeeklyDigestService.class);

  private final SubscriberRepository subscriberRepository;
  private final BreachEventRepository breachEventRepository;
  private final EmailChannelProvider emailProvider;
  private final AlertContentBuilder contentBuilder;
  private final MonitorScheduleProperties scheduleProperties;
  private final MonitorMetrics metrics;
  private final Clock clock;

  /**
   * @return outcome detail of a digest that was sent or deliberately skipped
   * @throws DigestDeliveryException when the email provider did not accept the digest
   */
  public String sendDigest(UUID subscriberId) {
    final Optional<SubscriberRecord> subscriber = subscriberRepository.findById(subscriberId);
    if (subscriber.isEmpty() || !subscriber.get().active()) {
      logger.info("digest skipped subscriberId={} reason=subscriber_inactive", subscriberId);
      return "subscriber_inactive";
    }
    final Instant since = Instant.now(clock).minus(scheduleProperties.digestWindow());
    final DigestSummary summary = breachEventRepository.summarizeForSubscriber(subscriberId, since);
    if (summary.monitoredIdentities() == 0) {
      logger.info("digest skipped subscriberId={} reason=no_monitored_identities", subscriberId);
      return "no_monitored_identities";
    }
    final ChannelSendResult result =
        emailProvider.sendEmail(
            subscriber.get().email(),
            contentBuilder.digestSubject(),
            contentBuilder.digestBody(summary));
    if (!result.sent()) {
      metrics.recordAlertDelivery("digest", "failed");
      throw new DigestDeliveryException(result.error(), result.transientFailure());
    }
    metrics.recordAlertDelivery("digest", "sent");
    logger.info(
        "digest sent subscriberId={} monitored={} total={} new={} risk={}",
        subscriberId,
        summary.monitoredIdentities(),
        summary.totalBreaches(),
        summary.newThisWeek(),
        summary.maxSeverityScore());
    return "digest_sent total_breaches="
        + summary.totalBreaches()
        + " new_this_week="
        + summary.newThisWeek();
  }

  public static class DigestDeliveryException extends RuntimeException {

    private final boolean transientFailure;

    public DigestDeliveryException(String message, boolean transientFailure) {
      super(message);
      this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
      return transientFailure;
    }
  }
}
