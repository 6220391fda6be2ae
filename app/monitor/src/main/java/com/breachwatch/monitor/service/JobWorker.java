/*
 * Where: Monitor job worker
 * What: Polls the job queue and runs claimed jobs on the worker pool
 * Why: Claims only as many jobs as there are free threads so leases are not wasted
 */
package com.breachwatch.monitor.service;

import com.breachwatch.common.TraceIds;
import com.breachwatch.monitor.config.JobQueueProperties;
import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.repository.JobRepository;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "monitor.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class JobWorker {

  private static final Logger logger = LoggerFactory.getLogger(JobWorker.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final JobRepository jobRepository;
  private final JobProcessor jobProcessor;
  private final ThreadPoolTaskExecutor jobExecutor;
  private final JobQueueProperties properties;
  private final MonitorMetrics metrics;
  private final Clock clock;
  private final String lockedBy;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "the executor is a shared Spring-managed component")
  public JobWorker(
      JobRepository jobRepository,
      JobProcessor jobProcessor,
      @Qualifier("jobExecutor") ThreadPoolTaskExecutor jobExecutor,
      JobQueueProperties properties,
      MonitorMetrics metrics,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.jobProcessor = jobProcessor;
    this.jobExecutor = jobExecutor;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    // one owner per process so two instances on the same host never share leases
    this.lockedBy = resolveHostname() + "-" + UUID.randomUUID().toString().substring(0, 8);
  }

  @Scheduled(fixedDelayString = "${monitor.jobs.poll-interval}")
  public void poll() {
    final Instant now = Instant.now(clock);
    metrics.updateBacklogCurrent(jobRepository.countBacklog(now));
    final int free = freeCapacity();
    if (free <= 0) {
      return;
    }
    // claim in a single statement; handler I/O never runs inside the claim transaction
    final List<JobRecord> claimed =
        jobRepository.claim(free, now, now.plus(properties.lease()), lockedBy);
    for (JobRecord job : claimed) {
      try {
        jobExecutor.execute(() -> run(job));
      } catch (TaskRejectedException ex) {
        logger.warn(
            "job submission rejected jobId={} type={}; it is requeued when its lease expires",
            job.jobId(),
            job.jobType());
      }
    }
  }

  @VisibleForTesting
  void run(JobRecord job) {
    MDC.put("job_id", job.jobId().toString());
    MDC.put("job_type", job.jobType().name());
    MDC.put("trace_id", TraceIds.newTraceId());
    try {
      jobProcessor.process(job, lockedBy);
    } catch (RuntimeException ex) {
      logger.error(
          "job outcome could not be recorded jobId={}; it is requeued when its lease expires",
          job.jobId(),
          ex);
    } finally {
      MDC.remove("job_id");
      MDC.remove("job_type");
      MDC.remove("trace_id");
    }
  }

  @VisibleForTesting
  int freeCapacity() {
    return jobExecutor.getMaxPoolSize()
        - jobExecutor.getActiveCount()
        - jobExecutor.getThreadPoolExecutor().getQueue().size();
  }

  @VisibleForTesting
  String lockedBy() {
    return lockedBy;
  }

  private static String resolveHostname() {
    String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
