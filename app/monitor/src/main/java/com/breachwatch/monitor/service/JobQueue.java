/*
 * Where: Monitor service layer
 * What: Typed enqueue API over the durable jobs table
 * Why: Callers enqueue work by subject and let the dedup key coalesce duplicates
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobType;
import com.breachwatch.monitor.repository.JobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobQueue {

  private static final Logger logger = LoggerFactory.getLogger(JobQueue.class);

  private final JobRepository jobRepository;
  private final Clock clock;

  /**
   * Enqueues a job keyed by its subject. Joins the caller's transaction when one is active, so a
   * rollback also discards the job.
   */
  public EnqueueResult enqueue(JobType jobType, UUID subjectId) {
    return enqueue(jobType, subjectId, jobType.dedupKey(subjectId));
  }

  public EnqueueResult enqueue(JobType jobType, UUID subjectId, String dedupKey) {
    final Optional<UUID> created =
        jobRepository.enqueue(jobType, subjectId, dedupKey, Instant.now(clock));
    if (created.isPresent()) {
      logger.debug("job enqueued jobId={} type={} dedupKey={}", created.get(), jobType, dedupKey);
      return new EnqueueResult(created.get(), dedupKey, true);
    }
    final UUID existing =
        jobRepository.findActiveByDedupKey(dedupKey).map(JobRecord::jobId).orElse(null);
    logger.debug("job enqueue coalesced type={} dedupKey={} existing={}", jobType, dedupKey, existing);
    return new EnqueueResult(existing, dedupKey, false);
  }

  public Optional<JobRecord> find(UUID jobId) {
    return jobRepository.findById(jobId);
  }

  /**
   * @param jobId the new job, or the already active one when coalesced (null if it finished in
   *     between)
   */
  public record EnqueueResult(UUID jobId, String dedupKey, boolean created) {}
}
