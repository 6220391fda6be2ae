/*
 * Where: Monitor service layer
 * What: Sends the alert for one breach event over email and SMS and logs every channel attempt
 * Why: The notified flag and the delivery log commit together, and only once per event
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.client.ChannelSendResult;
import com.breachwatch.monitor.client.EmailChannelProvider;
import com.breachwatch.monitor.client.SmsChannelProvider;
import com.breachwatch.monitor.config.AlertDispatchProperties;
import com.breachwatch.monitor.model.AlertChannel;
import com.breachwatch.monitor.model.AlertDeliveryRecord;
import com.breachwatch.monitor.model.BreachEventRecord;
import com.breachwatch.monitor.model.DeliveryStatus;
import com.breachwatch.monitor.model.MonitoredIdentityRecord;
import com.breachwatch.monitor.model.SubscriberRecord;
import com.breachwatch.monitor.repository.AlertDeliveryRepository;
import com.breachwatch.monitor.repository.BreachEventRepository;
import com.breachwatch.monitor.repository.MonitoredIdentityRepository;
import com.breachwatch.monitor.repository.SubscriberRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class AlertDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(AlertDispatchService.class);
  private static final Pattern E164 = Pattern.compile("\\+\\d{1,15}");

  static final String SKIP_SEVERITY_BELOW_THRESHOLD = "severity_below_threshold";
  static final String ERROR_INVALID_PHONE_NUMBER = "invalid_phone_number";

  private final BreachEventRepository breachEventRepository;
  private final MonitoredIdentityRepository identityRepository;
  private final SubscriberRepository subscriberRepository;
  private final AlertDeliveryRepository deliveryRepository;
  private final EmailChannelProvider emailProvider;
  private final SmsChannelProvider smsProvider;
  private final AlertContentBuilder contentBuilder;
  private final AlertDispatchProperties properties;
  private final MonitorMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public DispatchResult dispatch(UUID breachEventId) {
    final Optional<BreachEventRecord> found = breachEventRepository.findById(breachEventId);
    if (found.isEmpty()) {
      logger.info("dispatch skipped breachEventId={} reason=event_not_found", breachEventId);
      return DispatchResult.noop(breachEventId, "event_not_found");
    }
    final BreachEventRecord event = found.get();
    if (event.notified()) {
      logger.info("dispatch skipped breachEventId={} reason=already_notified", breachEventId);
      return DispatchResult.noop(breachEventId, "already_notified");
    }
    final Optional<SubscriberRecord> subscriber =
        subscriberRepository.findByIdentityId(event.identityId());
    if (subscriber.isEmpty()) {
      logger.warn("dispatch skipped breachEventId={} reason=subscriber_not_found", breachEventId);
      return DispatchResult.noop(breachEventId, "subscriber_not_found");
    }
    final String preview =
        identityRepository
            .findById(event.identityId())
            .map(MonitoredIdentityRecord::identityPreview)
            .orElse("your account");

    final List<AlertDeliveryRecord> deliveries = new ArrayList<>();
    deliveries.add(sendEmail(event, subscriber.get(), preview));
    if (subscriber.get().hasPhoneNumber()) {
      deliveries.add(sendSms(event, subscriber.get(), preview));
    }

    final Boolean committed =
        transactionTemplate()
            .execute(
                status -> {
                  final int updated =
                      breachEventRepository.markNotified(breachEventId, Instant.now(clock));
                  if (updated == 0) {
                    status.setRollbackOnly();
                    return false;
                  }
                  deliveries.forEach(deliveryRepository::insert);
                  return true;
                });
    if (!Boolean.TRUE.equals(committed)) {
      logger.warn(
          "dispatch discarded because another dispatch notified first breachEventId={}",
          breachEventId);
      return DispatchResult.noop(breachEventId, "already_notified");
    }
    for (AlertDeliveryRecord delivery : deliveries) {
      metrics.recordAlertDelivery(
          delivery.channel().name().toLowerCase(Locale.ROOT),
          delivery.status().name().toLowerCase(Locale.ROOT));
    }
    final DispatchResult result = new DispatchResult(breachEventId, true, null, deliveries);
    logger.info("dispatch completed breachEventId={} {}", breachEventId, result.summary());
    return result;
  }

  private AlertDeliveryRecord sendEmail(
      BreachEventRecord event, SubscriberRecord subscriber, String preview) {
    final String subject = contentBuilder.emailSubject(event);
    final String body = contentBuilder.emailBody(event, preview);
    return sendWithRetry(
        event,
        AlertChannel.EMAIL,
        subscriber.email(),
        () -> emailProvider.sendEmail(subscriber.email(), subject, body));
  }

  private AlertDeliveryRecord sendSms(
      BreachEventRecord event, SubscriberRecord subscriber, String preview) {
    final String phone = subscriber.phoneNumber().trim();
    if (!event.severity().isUrgent()) {
      logger.info(
          "sms skipped breachEventId={} severity={} reason={}",
          event.breachEventId(),
          event.severity(),
          SKIP_SEVERITY_BELOW_THRESHOLD);
      return record(event, AlertChannel.SMS, phone, DeliveryStatus.SKIPPED, 0,
          SKIP_SEVERITY_BELOW_THRESHOLD, null);
    }
    if (!E164.matcher(phone).matches()) {
      logger.warn("sms not sent breachEventId={} reason={}", event.breachEventId(),
          ERROR_INVALID_PHONE_NUMBER);
      return record(event, AlertChannel.SMS, phone, DeliveryStatus.FAILED, 0,
          ERROR_INVALID_PHONE_NUMBER, null);
    }
    final String body;
    try {
      body = contentBuilder.smsBody(event, preview);
    } catch (AlertContentBuilder.SmsBodyTooLongException ex) {
      logger.warn("sms not sent breachEventId={} reason={}", event.breachEventId(), ex.getMessage());
      return record(event, AlertChannel.SMS, phone, DeliveryStatus.FAILED, 0,
          "sms_body_too_long", null);
    }
    return sendWithRetry(event, AlertChannel.SMS, phone, () -> smsProvider.sendSms(phone, body));
  }

  private AlertDeliveryRecord sendWithRetry(
      BreachEventRecord event,
      AlertChannel channel,
      String recipient,
      Supplier<ChannelSendResult> send) {
    final int maxAttempts = Math.max(1, properties.channelMaxAttempts());
    ChannelSendResult result = null;
    int attempt = 0;
    while (attempt < maxAttempts) {
      attempt++;
      try {
        result = send.get();
      } catch (RuntimeException ex) {
        result = ChannelSendResult.transientFailure(
            ex.getClass().getSimpleName() + ": " + ex.getMessage());
      }
      if (result.sent() || !result.transientFailure()) {
        break;
      }
      logger.warn(
          "{} send attempt failed breachEventId={} attempt={} error={}",
          channel,
          event.breachEventId(),
          attempt,
          result.error());
      if (attempt < maxAttempts) {
        pause(properties.channelRetryDelay());
      }
    }
    if (result.sent()) {
      return record(event, channel, recipient, DeliveryStatus.SENT, attempt, null,
          result.providerMessageId());
    }
    logger.warn(
        "{} delivery failed breachEventId={} attempts={} error={}",
        channel,
        event.breachEventId(),
        attempt,
        result.error());
    return record(event, channel, recipient, DeliveryStatus.FAILED, attempt,
        truncateError(result.error()), null);
  }

  private AlertDeliveryRecord record(
      BreachEventRecord event,
      AlertChannel channel,
      String recipient,
      DeliveryStatus status,
      int attempts,
      String error,
      String providerMessageId) {
    return new AlertDeliveryRecord(
        UUID.randomUUID(),
        event.breachEventId(),
        channel,
        recipient,
        status,
        attempts,
        error,
        providerMessageId,
        Instant.now(clock));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  void pause(Duration delay) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted between channel attempts", ex);
    }
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
