/*
 * Where: Monitor data access
 * What: Durable job queue with dedup on enqueue and lease-based claiming
 * Why: Background work must survive restarts and be delivered at least once
 */
package com.breachwatch.monitor.repository;

import static com.breachwatch.common.JdbcTimestampUtils.toInstant;
import static com.breachwatch.common.JdbcTimestampUtils.toTimestamp;

import com.breachwatch.monitor.model.JobRecord;
import com.breachwatch.monitor.model.JobStatus;
import com.breachwatch.monitor.model.JobType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobRepository {

  private static final String COLUMNS =
      """
      job_id, job_type, subject_id, dedup_key, status, attempt_count, next_retry_at,
      locked_by, lease_until, last_error, outcome_detail, created_at, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts a PENDING job unless a PENDING or IN_FLIGHT job with the same dedup key exists.
   *
   * @return the new job id, or empty when the enqueue was coalesced
   */
  public Optional<UUID> enqueue(JobType jobType, UUID subjectId, String dedupKey, Instant now) {
    final String sql =
        """
        INSERT INTO jobs (
          job_id,
          job_type,
          subject_id,
          dedup_key,
          status,
          attempt_count,
          next_retry_at,
          created_at
        ) VALUES (
          :jobId,
          :jobType,
          :subjectId,
          :dedupKey,
          'PENDING',
          0,
          :now,
          :now
        )
        ON CONFLICT (dedup_key) WHERE status IN ('PENDING', 'IN_FLIGHT') DO NOTHING
        RETURNING job_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", UUID.randomUUID())
            .addValue("jobType", jobType.name())
            .addValue("subjectId", subjectId)
            .addValue("dedupKey", dedupKey)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getObject("job_id", UUID.class))
        .stream()
        .findFirst();
  }

  public Optional<JobRecord> findActiveByDedupKey(String dedupKey) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM jobs WHERE dedup_key = :dedupKey AND status IN ('PENDING', 'IN_FLIGHT')";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dedupKey", dedupKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<JobRecord> findById(UUID jobId) {
    final String sql = "SELECT " + COLUMNS + " FROM jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Claims due PENDING jobs and IN_FLIGHT jobs whose lease expired. Each claim counts as one
   * attempt, so a job that keeps crashing its worker still exhausts its budget.
   */
  public List<JobRecord> claim(int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM jobs
          WHERE (
            status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'IN_FLIGHT'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE jobs j
        SET status = 'IN_FLIGHT',
            attempt_count = j.attempt_count + 1,
            locked_by = :lockedBy,
            lease_until = :leaseUntil
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.job_type, j.subject_id, j.dedup_key, j.status, j.attempt_count,
                  j.next_retry_at, j.locked_by, j.lease_until, j.last_error, j.outcome_detail,
                  j.created_at, j.completed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSucceeded(UUID jobId, String lockedBy, String detail, Instant completedAt) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'SUCCEEDED',
            outcome_detail = :detail,
            completed_at = :completedAt,
            next_retry_at = NULL,
            locked_by = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy)
            .addValue("detail", detail)
            .addValue("completedAt", toTimestamp(completedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(UUID jobId, String lockedBy, Instant nextRetryAt, String error) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'PENDING',
            next_retry_at = :nextRetryAt,
            last_error = :error,
            locked_by = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("error", error);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID jobId, String lockedBy, String error, Instant completedAt) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'FAILED',
            last_error = :error,
            outcome_detail = :error,
            completed_at = :completedAt,
            next_retry_at = NULL,
            locked_by = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'IN_FLIGHT'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy)
            .addValue("error", error)
            .addValue("completedAt", toTimestamp(completedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int countBacklog(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM jobs
        WHERE status = 'PENDING'
          AND (next_retry_at IS NULL OR next_retry_at <= :now)
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteCompletedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM jobs
        WHERE completed_at < :threshold
          AND status IN ('SUCCEEDED', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM jobs
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'IN_FLIGHT')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobRecord(
        rs.getObject("job_id", UUID.class),
        JobType.valueOf(rs.getString("job_type")),
        rs.getObject("subject_id", UUID.class),
        rs.getString("dedup_key"),
        JobStatus.valueOf(rs.getString("status")),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("next_retry_at")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getString("last_error"),
        rs.getString("outcome_detail"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("completed_at")));
  }
}
