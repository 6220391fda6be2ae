/*
 * Where: Monitor service layer
 * What: Applies the retention policy to finished jobs
 * Why: Keeps the queue table bounded while surfacing jobs stuck in an active state
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.config.JobRetentionProperties;
import com.breachwatch.monitor.repository.JobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(JobRetentionService.class);

  private final JobRepository jobRepository;
  private final JobRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = jobRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "job retention found stale active jobs count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deleted = jobRepository.deleteCompletedOlderThan(threshold);
    logger.info("job retention cleanup deleted jobs={} threshold={}", deleted, threshold);
    return deleted;
  }
}
