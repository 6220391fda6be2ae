/*
 * Where: Monitor service layer
 * What: Scans one monitored identity against the breach feed and records new breach events
 * Why: New events, their dispatch jobs and the scan counter must commit together
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.client.BreachFeedClient;
import com.breachwatch.monitor.client.RawBreach;
import com.breachwatch.monitor.model.BreachEventRecord;
import com.breachwatch.monitor.model.JobType;
import com.breachwatch.monitor.model.MonitoredIdentityRecord;
import com.breachwatch.monitor.model.NormalizedBreach;
import com.breachwatch.monitor.model.SeverityResult;
import com.breachwatch.monitor.repository.BreachEventRepository;
import com.breachwatch.monitor.repository.MonitoredIdentityRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class BreachIngestionService {

  private static final Logger logger = LoggerFactory.getLogger(BreachIngestionService.class);

  private final MonitoredIdentityRepository identityRepository;
  private final BreachEventRepository breachEventRepository;
  private final BreachFeedClient breachFeedClient;
  private final BreachNormalizer normalizer;
  private final SeverityScoringEngine severityEngine;
  private final RemediationAdvisor remediationAdvisor;
  private final IdentityProtector identityProtector;
  private final JobQueue jobQueue;
  private final MonitorMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Feed, generator and cache calls happen before the write transaction; any exception from them
   * aborts the scan with nothing written.
   */
  public ScanResult scanIdentity(UUID identityId) {
    final Optional<MonitoredIdentityRecord> found = identityRepository.findById(identityId);
    if (found.isEmpty()) {
      metrics.recordScan("skipped");
      logger.info("scan skipped identityId={} reason=identity_not_found", identityId);
      return ScanResult.skipped(identityId, "identity_not_found");
    }
    final MonitoredIdentityRecord identity = found.get();
    if (!identity.isActive()) {
      metrics.recordScan("skipped");
      logger.info("scan skipped identityId={} reason=identity_inactive", identityId);
      return ScanResult.skipped(identityId, "identity_inactive");
    }

    final String plainIdentity = identityProtector.decrypt(identity.identityEncrypted());
    final List<RawBreach> rawBreaches = breachFeedClient.lookup(plainIdentity);
    final List<BreachEventRecord> staged = stage(identity, rawBreaches);

    final List<UUID> inserted = transactionTemplate().execute(status -> commit(identity, staged));
    final List<UUID> newEventIds = inserted == null ? List.of() : inserted;

    metrics.recordScan("completed");
    metrics.recordNewBreaches(newEventIds.size());
    logger.info(
        "scan completed identityId={} preview={} breachesFound={} newEvents={}",
        identityId,
        identity.identityPreview(),
        rawBreaches.size(),
        newEventIds.size());
    return new ScanResult(identityId, false, rawBreaches.size(), newEventIds, null);
  }

  private List<BreachEventRecord> stage(
      MonitoredIdentityRecord identity, List<RawBreach> rawBreaches) {
    if (rawBreaches.isEmpty()) {
      return List.of();
    }
    final Set<String> known =
        new HashSet<>(breachEventRepository.findBreachNamesByIdentity(identity.identityId()));
    final List<BreachEventRecord> staged = new ArrayList<>();
    final Instant detectedAt = Instant.now(clock);
    for (RawBreach raw : rawBreaches) {
      final NormalizedBreach breach = normalizer.normalize(raw);
      if (breach == null) {
        logger.warn("breach without name ignored identityId={}", identity.identityId());
        continue;
      }
      // add() is false for names already stored or already staged in this scan
      if (!known.add(breach.name())) {
        continue;
      }
      final SeverityResult severity = severityEngine.score(breach.dataClasses());
      final String remediation = remediationAdvisor.advise(breach.name(), breach.dataClasses());
      staged.add(
          new BreachEventRecord(
              UUID.randomUUID(),
              identity.identityId(),
              breach.name(),
              breach.domain(),
              breach.breachDate(),
              detectedAt,
              breach.dataClasses(),
              breach.pwnCount(),
              severity.label(),
              severity.score(),
              breach.verified(),
              breach.fabricated(),
              breach.sensitive(),
              false,
              null,
              remediation));
    }
    return staged;
  }

  private List<UUID> commit(MonitoredIdentityRecord identity, List<BreachEventRecord> staged) {
    final List<UUID> inserted = new ArrayList<>();
    for (BreachEventRecord event : staged) {
      // a concurrent scan of the same identity may have inserted it since staging
      if (!breachEventRepository.insertIfAbsent(event)) {
        logger.debug(
            "breach event already recorded identityId={} breach={}",
            identity.identityId(),
            event.breachName());
        continue;
      }
      jobQueue.enqueue(JobType.ALERT_DISPATCH, event.breachEventId());
      inserted.add(event.breachEventId());
    }
    identityRepository.recordScan(identity.identityId(), Instant.now(clock));
    return inserted;
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
