/*
 * Where: Monitor dispatch tests
 * What: Verifies channel selection, SMS gating, retries and the notify-once commit of dispatch
 * Why: Subscribers must get one alert per breach and every channel attempt must be logged
 */
package com.breachwatch.monitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.breachwatch.monitor.client.ChannelSendResult;
import com.breachwatch.monitor.client.EmailChannelProvider;
import com.breachwatch.monitor.client.SmsChannelProvider;
import com.breachwatch.monitor.config.AlertDispatchProperties;
import com.breachwatch.monitor.model.AlertChannel;
import com.breachwatch.monitor.model.AlertDeliveryRecord;
import com.breachwatch.monitor.model.BreachEventRecord;
import com.breachwatch.monitor.model.DeliveryStatus;
import com.breachwatch.monitor.model.IdentityStatus;
import com.breachwatch.monitor.model.MonitoredIdentityRecord;
import com.breachwatch.monitor.model.SeverityLabel;
import com.breachwatch.monitor.model.SeverityResult;
import com.breachwatch.monitor.model.SubscriberRecord;
import com.breachwatch.monitor.repository.AlertDeliveryRepository;
import com.breachwatch.monitor.repository.BreachEventRepository;
import com.breachwatch.monitor.repository.MonitoredIdentityRepository;
import com.breachwatch.monitor.repository.SubscriberRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AlertDispatchServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T10:00:00Z");
  private static final UUID EVENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000e1");
  private static final UUID IDENTITY_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
  private static final AlertDispatchProperties PROPERTIES =
      new AlertDispatchProperties(2, Duration.ZERO, 20);

  @Mock private BreachEventRepository breachEventRepository;
  @Mock private MonitoredIdentityRepository identityRepository;
  @Mock private SubscriberRepository subscriberRepository;
  @Mock private AlertDeliveryRepository deliveryRepository;
  @Mock private EmailChannelProvider emailProvider;
  @Mock private SmsChannelProvider smsProvider;
  @Mock private MonitorMetrics metrics;

  private AlertDispatchService service;

  @BeforeEach
  void setUp() {
    service =
        new AlertDispatchService(
            breachEventRepository,
            identityRepository,
            subscriberRepository,
            deliveryRepository,
            emailProvider,
            smsProvider,
            new AlertContentBuilder(),
            PROPERTIES,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
  }

  @Test
  void missingEventIsNoop() {
    when(breachEventRepository.findById(EVENT_ID)).thenReturn(Optional.empty());

    final DispatchResult result = service.dispatch(EVENT_ID);

    assertThat(result.notified()).isFalse();
    assertThat(result.detail()).isEqualTo("event_not_found");
    verifyNoInteractions(emailProvider, smsProvider, deliveryRepository);
  }

  @Test
  void alreadyNotifiedEventIsNoop() {
    when(breachEventRepository.findById(EVENT_ID))
        .thenReturn(Optional.of(event(SeverityLabel.CRITICAL, true)));

    final DispatchResult result = service.dispatch(EVENT_ID);

    assertThat(result.summary()).isEqualTo("already_notified");
    verifyNoInteractions(emailProvider, smsProvider);
    verify(breachEventRepository, never()).markNotified(any(), any());
  }

  @Test
  void criticalEventGoesToEmailAndSms() {
    givenPending(SeverityLabel.CRITICAL, "+15551234567");
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("mail-1"));
    when(smsProvider.sendSms(anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("sms-1"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    final DispatchResult result = service.dispatch(EVENT_ID);

    assertThat(result.notified()).isTrue();
    final List<AlertDeliveryRecord> deliveries = insertedDeliveries(2);
    assertThat(deliveries).extracting(AlertDeliveryRecord::channel)
        .containsExactly(AlertChannel.EMAIL, AlertChannel.SMS);
    assertThat(deliveries).extracting(AlertDeliveryRecord::status)
        .containsOnly(DeliveryStatus.SENT);
    assertThat(deliveries.get(0).providerMessageId()).isEqualTo("mail-1");
    assertThat(deliveries.get(1).recipient()).isEqualTo("+15551234567");
    verify(emailProvider)
        .sendEmail(
            anyString(),
            eq("URGENT: Your credentials found in the Adobe breach"),
            anyString());
    verify(metrics).recordAlertDelivery("email", "sent");
    verify(metrics).recordAlertDelivery("sms", "sent");
  }

  @Test
  void mediumEventSkipsSms() {
    givenPending(SeverityLabel.MEDIUM, "+15551234567");
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("mail-1"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    service.dispatch(EVENT_ID);

    final List<AlertDeliveryRecord> deliveries = insertedDeliveries(2);
    assertThat(deliveries.get(1).status()).isEqualTo(DeliveryStatus.SKIPPED);
    assertThat(deliveries.get(1).errorMessage()).isEqualTo("severity_below_threshold");
    assertThat(deliveries.get(1).attemptCount()).isZero();
    verifyNoInteractions(smsProvider);
  }

  @Test
  void scoredPasswordBreachSendsSms() {
    givenPending(scoredEvent(List.of("Passwords", "Email addresses")), "+15551234567");
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("mail-1"));
    when(smsProvider.sendSms(anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("sms-1"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    service.dispatch(EVENT_ID);

    final List<AlertDeliveryRecord> deliveries = insertedDeliveries(2);
    assertThat(deliveries.get(1).channel()).isEqualTo(AlertChannel.SMS);
    assertThat(deliveries.get(1).status()).isEqualTo(DeliveryStatus.SENT);
    verify(smsProvider)
        .sendSms(
            eq("+15551234567"),
            eq(
                "[BreachWatch] CRITICAL ALERT: joh***@example.com found in Adobe breach."
                    + " Change your password NOW. Reply STOP to unsubscribe."));
  }

  @Test
  void scoredLowBreachSkipsSmsEvenWithPhone() {
    givenPending(scoredEvent(List.of("Names", "Device information")), "+15551234567");
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("mail-1"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    final DispatchResult result = service.dispatch(EVENT_ID);

    assertThat(result.notified()).isTrue();
    final List<AlertDeliveryRecord> deliveries = insertedDeliveries(2);
    assertThat(deliveries.get(0).status()).isEqualTo(DeliveryStatus.SENT);
    assertThat(deliveries.get(1).channel()).isEqualTo(AlertChannel.SMS);
    assertThat(deliveries.get(1).status()).isEqualTo(DeliveryStatus.SKIPPED);
    assertThat(deliveries.get(1).errorMessage()).isEqualTo("severity_below_threshold");
    verifyNoInteractions(smsProvider);
    verify(metrics).recordAlertDelivery("sms", "skipped");
  }

  @Test
  void invalidPhoneIsLoggedAsFailedWithoutSending() {
    givenPending(SeverityLabel.HIGH, "555-1234");
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("mail-1"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    service.dispatch(EVENT_ID);

    final AlertDeliveryRecord sms = insertedDeliveries(2).get(1);
    assertThat(sms.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(sms.errorMessage()).isEqualTo("invalid_phone_number");
    verifyNoInteractions(smsProvider);
  }

  @Test
  void subscriberWithoutPhoneOnlyGetsEmail() {
    givenPending(SeverityLabel.CRITICAL, null);
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("mail-1"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    service.dispatch(EVENT_ID);

    assertThat(insertedDeliveries(1).get(0).channel()).isEqualTo(AlertChannel.EMAIL);
    verifyNoInteractions(smsProvider);
  }

  @Test
  void transientFailureIsRetriedWithinDispatch() {
    givenPending(SeverityLabel.LOW, null);
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.transientFailure("503"))
        .thenReturn(ChannelSendResult.sent("mail-2"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    service.dispatch(EVENT_ID);

    final AlertDeliveryRecord email = insertedDeliveries(1).get(0);
    assertThat(email.status()).isEqualTo(DeliveryStatus.SENT);
    assertThat(email.attemptCount()).isEqualTo(2);
  }

  @Test
  void permanentFailureIsNotRetriedAndErrorIsTruncated() {
    givenPending(SeverityLabel.LOW, null);
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.permanentFailure("400 bad recipient address given"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(1);

    final DispatchResult result = service.dispatch(EVENT_ID);

    final AlertDeliveryRecord email = insertedDeliveries(1).get(0);
    assertThat(email.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(email.attemptCount()).isEqualTo(1);
    assertThat(email.errorMessage()).hasSize(PROPERTIES.errorMessageMaxLength());
    assertThat(result.notified()).isTrue();
    verify(emailProvider, times(1)).sendEmail(anyString(), anyString(), anyString());
  }

  @Test
  void losingTheNotifyRaceDiscardsDeliveries() {
    givenPending(SeverityLabel.LOW, null);
    when(emailProvider.sendEmail(anyString(), anyString(), anyString()))
        .thenReturn(ChannelSendResult.sent("mail-1"));
    when(breachEventRepository.markNotified(EVENT_ID, FIXED_NOW)).thenReturn(0);

    final DispatchResult result = service.dispatch(EVENT_ID);

    assertThat(result.notified()).isFalse();
    assertThat(result.detail()).isEqualTo("already_notified");
    verifyNoInteractions(deliveryRepository, metrics);
  }

  private void givenPending(SeverityLabel severity, String phone) {
    givenPending(event(severity, false), phone);
  }

  private void givenPending(BreachEventRecord pending, String phone) {
    when(breachEventRepository.findById(EVENT_ID)).thenReturn(Optional.of(pending));
    when(subscriberRepository.findByIdentityId(IDENTITY_ID))
        .thenReturn(
            Optional.of(new SubscriberRecord(UUID.randomUUID(), "john@example.com", phone, true)));
    when(identityRepository.findById(IDENTITY_ID))
        .thenReturn(
            Optional.of(
                new MonitoredIdentityRecord(
                    IDENTITY_ID,
                    UUID.randomUUID(),
                    "cipher",
                    "hash",
                    "joh***@example.com",
                    IdentityStatus.ACTIVE,
                    1,
                    FIXED_NOW,
                    FIXED_NOW)));
  }

  private List<AlertDeliveryRecord> insertedDeliveries(int expected) {
    final ArgumentCaptor<AlertDeliveryRecord> captor =
        ArgumentCaptor.forClass(AlertDeliveryRecord.class);
    verify(deliveryRepository, times(expected)).insert(captor.capture());
    return captor.getAllValues();
  }

  private BreachEventRecord event(SeverityLabel severity, boolean notified) {
    return event(List.of("Passwords"), severity, severity.threshold(), notified);
  }

  private BreachEventRecord scoredEvent(List<String> dataClasses) {
    final SeverityResult severity = new SeverityScoringEngine().score(dataClasses);
    return event(dataClasses, severity.label(), severity.score(), false);
  }

  private BreachEventRecord event(
      List<String> dataClasses, SeverityLabel severity, int score, boolean notified) {
    return new BreachEventRecord(
        EVENT_ID,
        IDENTITY_ID,
        "Adobe",
        "adobe.com",
        LocalDate.of(2013, 10, 4),
        FIXED_NOW,
        dataClasses,
        100L,
        severity,
        score,
        true,
        false,
        false,
        notified,
        notified ? FIXED_NOW : null,
        "Change your password");
  }
}
