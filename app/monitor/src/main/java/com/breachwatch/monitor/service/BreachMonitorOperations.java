/*
 * Where: Monitor service layer
 * What: Entry points of the pipeline for administrative callers
 * Why: The admin API stays thin and every manual action goes through the same queue as scheduled work
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.api.MonitorResourceNotFoundException;
import com.breachwatch.monitor.client.BreachFeedClient;
import com.breachwatch.monitor.client.RawBreach;
import com.breachwatch.monitor.model.BreachEventRecord;
import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobType;
import com.breachwatch.monitor.repository.BreachEventRepository;
import com.breachwatch.monitor.repository.MonitoredIdentityRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BreachMonitorOperations {

  private static final Logger logger = LoggerFactory.getLogger(BreachMonitorOperations.class);

  private final MonitoredIdentityRepository identityRepository;
  private final BreachEventRepository breachEventRepository;
  private final JobQueue jobQueue;
  private final SweepService sweepService;
  private final RemediationAdvisor remediationAdvisor;
  private final BreachFeedClient breachFeedClient;

  public JobQueue.EnqueueResult triggerScan(UUID identityId) {
    if (identityRepository.findById(identityId).isEmpty()) {
      throw new MonitorResourceNotFoundException("identity", identityId);
    }
    final JobQueue.EnqueueResult result = jobQueue.enqueue(JobType.IDENTITY_SCAN, identityId);
    logger.info(
        "manual scan requested identityId={} jobId={} created={}",
        identityId,
        result.jobId(),
        result.created());
    return result;
  }

  public SweepService.FanOutResult triggerFullSweep() {
    return sweepService.enqueueFullSweep();
  }

  public SweepService.FanOutResult triggerWeeklyDigest() {
    return sweepService.enqueueWeeklyDigests();
  }

  /** Enqueues a dispatch; it is a no-op when the event was already notified. */
  public JobQueue.EnqueueResult resendAlert(UUID breachEventId) {
    if (breachEventRepository.findById(breachEventId).isEmpty()) {
      throw new MonitorResourceNotFoundException("breach event", breachEventId);
    }
    final JobQueue.EnqueueResult result = jobQueue.enqueue(JobType.ALERT_DISPATCH, breachEventId);
    logger.info(
        "manual alert resend requested breachEventId={} jobId={} created={}",
        breachEventId,
        result.jobId(),
        result.created());
    return result;
  }

  /**
   * Drops the cached text for the event's breach shape, regenerates it and stores it on the event.
   * When generation fails the stored text is kept and returned.
   */
  public String regenerateRemediation(UUID breachEventId) {
    final BreachEventRecord event =
        breachEventRepository
            .findById(breachEventId)
            .orElseThrow(() -> new MonitorResourceNotFoundException("breach event", breachEventId));
    remediationAdvisor.invalidate(event.breachName(), event.dataClasses());
    final Optional<String> generated =
        remediationAdvisor.tryAdvise(event.breachName(), event.dataClasses());
    if (generated.isEmpty()) {
      logger.warn(
          "remediation regeneration failed breachEventId={} breach={}; keeping stored text",
          breachEventId,
          event.breachName());
      return event.remediationText();
    }
    final String text = generated.get();
    breachEventRepository.updateRemediation(breachEventId, text);
    logger.info(
        "remediation regenerated breachEventId={} breach={}", breachEventId, event.breachName());
    return text;
  }

  public long checkLeakedSecret(String secret) {
    return breachFeedClient.checkLeakedSecret(secret);
  }

  public List<RawBreach> breachCatalog() {
    return breachFeedClient.lookupAll();
  }

  public JobRecord jobStatus(UUID jobId) {
    return jobQueue
        .find(jobId)
        .orElseThrow(() -> new MonitorResourceNotFoundException("job", jobId));
  }
}
