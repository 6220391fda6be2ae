/*
 * Where: Monitor work queue model
 * What: Snapshot of a jobs row
 * Why: The processor needs attempt state and the subject; the admin API exposes the outcome
 */
package com.breachwatch.monitor.model;

import java.time.Instant;
import java.util.UUID;

public record JobRecord(
    UUID jobId,
    JobType jobType,
    UUID subjectId,
    String dedupKey,
    JobStatus status,
    int attemptCount,
    Instant nextRetryAt,
    String lockedBy,
    Instant leaseUntil,
    String lastError,
    String outcomeDetail,
    Instant createdAt,
    Instant completedAt) {}
