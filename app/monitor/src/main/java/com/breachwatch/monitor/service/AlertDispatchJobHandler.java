/*
 * Where: Monitor job handlers
 * What: Runs alert dispatch for an ALERT_DISPATCH job
 * Why: Dispatch runs on the worker pool, decoupled from the scan that found the breach
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.model.JobOutcome;
import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AlertDispatchJobHandler implements JobHandler {

  private final AlertDispatchService dispatchService;

  @Override
  public JobType type() {
    return JobType.ALERT_DISPATCH;
  }

  @Override
  public JobOutcome handle(JobRecord job) {
    return JobOutcome.succeeded(dispatchService.dispatch(job.subjectId()).summary());
  }
}
