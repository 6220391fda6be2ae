/*
 * Where: Monitor job handlers
 * What: Runs an identity scan for an IDENTITY_SCAN job
 * Why: Maps feed failures onto retryable or terminal job outcomes
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.client.BreachFeedException;
import com.breachwatch.monitor.model.JobOutcome;
import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IdentityScanJobHandler implements JobHandler {

  private final BreachIngestionService ingestionService;
  private final MonitorMetrics metrics;

  @Override
  public JobType type() {
    return JobType.IDENTITY_SCAN;
  }

  @Override
  public JobOutcome handle(JobRecord job) {
    try {
      return JobOutcome.succeeded(ingestionService.scanIdentity(job.subjectId()).summary());
    } catch (BreachFeedException ex) {
      metrics.recordScan("failed");
      final String reason = "breach feed " + ex.reason() + ": " + ex.getMessage();
      return ex.isTransient()
          ? JobOutcome.transientFailure(reason)
          : JobOutcome.permanentFailure(reason);
    } catch (IdentityProtector.IdentityDecryptionException ex) {
      metrics.recordScan("failed");
      return JobOutcome.permanentFailure("identity decryption failed: " + ex.getMessage());
    } catch (RuntimeException ex) {
      metrics.recordScan("failed");
      throw ex;
    }
  }
}
