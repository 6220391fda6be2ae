/*
 * Where: Monitor job handlers
 * What: Sends one subscriber's digest for a WEEKLY_DIGEST job
 * Why: One job per subscriber keeps one failing digest from affecting the others
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.model.JobOutcome;
import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WeeklyDigestJobHandler implements JobHandler {

  private final WeeklyDigestService digestService;

  @Override
  public JobType type() {
    return JobType.WEEKLY_DIGEST;
  }

  @Override
  public JobOutcome handle(JobRecord job) {
    try {
      return JobOutcome.succeeded(digestService.sendDigest(job.subjectId()));
    } catch (WeeklyDigestService.DigestDeliveryException ex) {
      final String reason = "digest delivery failed: " + ex.getMessage();
      return ex.isTransient()
          ? JobOutcome.transientFailure(reason)
          : JobOutcome.permanentFailure(reason);
    }
  }
}
