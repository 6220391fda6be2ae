package com.breachwatch.monitor.api.response;

import com.breachwatch.monitor.model.JobRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobStatusResponse(
    UUID jobId,
    String jobType,
    UUID subjectId,
    String status,
    int attemptCount,
    Instant nextRetryAt,
    String lastError,
    String outcomeDetail,
    Instant createdAt,
    Instant completedAt) {

  public static JobStatusResponse from(JobRecord job) {
    return new JobStatusResponse(
        job.jobId(),
        job.jobType().name(),
        job.subjectId(),
        job.status().name(),
        job.attemptCount(),
        job.nextRetryAt(),
        job.lastError(),
        job.outcomeDetail(),
        job.createdAt(),
        job.completedAt());
  }
}
