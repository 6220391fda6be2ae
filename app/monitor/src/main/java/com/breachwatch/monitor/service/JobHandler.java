package com.breachwatch.monitor.service;

import com.breachwatch.monitor.model.JobOutcome;
import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobType;

/** Runs one claimed job. Exceptions escaping {@link #handle} count as transient failures. */
public interface JobHandler {

  JobType type();

  JobOutcome handle(JobRecord job);
}
