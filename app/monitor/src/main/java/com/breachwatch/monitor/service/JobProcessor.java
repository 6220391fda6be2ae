/*
 * Where: Monitor service layer
 * What: Runs a claimed job through its handler and records the outcome on the job row
 * Why: Retry counting and backoff live in one place instead of in every handler
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.config.JobQueueProperties;
import com.breachwatch.monitor.model.JobOutcome;
import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobType;
import com.breachwatch.monitor.repository.JobRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class JobProcessor {

  private static final Logger logger = LoggerFactory.getLogger(JobProcessor.class);

  private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);
  private final JobRepository jobRepository;
  private final JobQueueProperties properties;
  private final MonitorMetrics metrics;
  private final Clock clock;

  public JobProcessor(
      List<JobHandler> handlers,
      JobRepository jobRepository,
      JobQueueProperties properties,
      MonitorMetrics metrics,
      Clock clock) {
    for (JobHandler handler : handlers) {
      final JobHandler previous = this.handlers.put(handler.type(), handler);
      if (previous != null) {
        throw new IllegalStateException("duplicate job handler for type " + handler.type());
      }
    }
    this.jobRepository = jobRepository;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public JobOutcome process(JobRecord job, String lockedBy) {
    final JobHandler handler = handlers.get(job.jobType());
    JobOutcome outcome;
    if (handler == null) {
      outcome = JobOutcome.permanentFailure("no handler for job type " + job.jobType());
    } else {
      try {
        outcome = handler.handle(job);
      } catch (RuntimeException ex) {
        logger.warn(
            "job handler threw jobId={} type={} attempt={}",
            job.jobId(),
            job.jobType(),
            job.attemptCount(),
            ex);
        outcome = JobOutcome.transientFailure(describe(ex));
      }
    }
    return settle(job, outcome, lockedBy);
  }

  private JobOutcome settle(JobRecord job, JobOutcome outcome, String lockedBy) {
    final Instant now = Instant.now(clock);
    if (outcome instanceof JobOutcome.Succeeded succeeded) {
      warnIfLockLost(
          jobRepository.markSucceeded(job.jobId(), lockedBy, succeeded.detail(), now), job);
      record(job, "succeeded");
      logger.info(
          "job succeeded jobId={} type={} detail={}", job.jobId(), job.jobType(), succeeded.detail());
      return succeeded;
    }
    final String reason = truncateError(reasonOf(outcome));
    final boolean retryable =
        outcome instanceof JobOutcome.Retrying
            || (outcome instanceof JobOutcome.Failed failed && failed.retryable());
    if (retryable && job.attemptCount() < properties.maxAttempts()) {
      final Instant nextRetryAt = now.plus(computeBackoffDuration(job.attemptCount()));
      warnIfLockLost(jobRepository.markRetry(job.jobId(), lockedBy, nextRetryAt, reason), job);
      record(job, "retrying");
      logger.warn(
          "job retry scheduled jobId={} type={} attempt={} nextRetryAt={} reason={}",
          job.jobId(),
          job.jobType(),
          job.attemptCount(),
          nextRetryAt,
          reason);
      return new JobOutcome.Retrying(job.attemptCount(), nextRetryAt, reason);
    }
    final String finalReason =
        retryable ? truncateError("attempts exhausted (" + job.attemptCount() + "): " + reason)
            : reason;
    warnIfLockLost(jobRepository.markFailed(job.jobId(), lockedBy, finalReason, now), job);
    record(job, "failed");
    logger.error(
        "job failed jobId={} type={} attempt={} reason={}",
        job.jobId(),
        job.jobType(),
        job.attemptCount(),
        finalReason);
    return new JobOutcome.Failed(finalReason, false);
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    double baseMillis = properties.backoffBase().toMillis();
    double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    double capped = Math.min(exp, properties.backoffMax().toMillis());
    double jitterMin = properties.backoffJitterMin();
    double jitterMax = properties.backoffJitterMax();
    double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    long backoffMillis = (long) Math.ceil(capped * jitter);
    long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String reasonOf(JobOutcome outcome) {
    if (outcome instanceof JobOutcome.Failed failed) {
      return failed.reason();
    }
    if (outcome instanceof JobOutcome.Retrying retrying) {
      return retrying.reason();
    }
    return null;
  }

  private String describe(RuntimeException ex) {
    return ex.getClass().getSimpleName() + ": " + ex.getMessage();
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

  private void record(JobRecord job, String outcome) {
    metrics.recordJob(job.jobType().name().toLowerCase(Locale.ROOT), outcome);
  }

  private void warnIfLockLost(int updated, JobRecord job) {
    if (updated == 0) {
      logger.warn(
          "job outcome not recorded because lease was lost jobId={} type={}",
          job.jobId(),
          job.jobType());
    }
  }
}
