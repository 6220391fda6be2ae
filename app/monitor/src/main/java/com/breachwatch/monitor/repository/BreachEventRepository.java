/*
 * Where: Monitor data access
 * What: Stores breach events and their notification and remediation state
 * Why: The (identity, breach name) uniqueness is the idempotency boundary of ingestion
 */
package com.breachwatch.monitor.repository;

import static com.breachwatch.common.JdbcTimestampUtils.toInstant;
import static com.breachwatch.common.JdbcTimestampUtils.toTimestamp;

import com.breachwatch.monitor.model.BreachEventRecord;
import com.breachwatch.monitor.model.DigestSummary;
import com.breachwatch.monitor.model.SeverityLabel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class BreachEventRepository {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  public BreachEventRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public Set<String> findBreachNamesByIdentity(UUID identityId) {
    final String sql =
        """
        SELECT breach_name
        FROM breach_events
        WHERE identity_id = :identityId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("identityId", identityId);
    return new HashSet<>(
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("breach_name")));
  }

  /** Returns false when an event for the same identity and breach name already exists. */
  public boolean insertIfAbsent(BreachEventRecord record) {
    final String sql =
        """
        INSERT INTO breach_events (
          breach_event_id,
          identity_id,
          breach_name,
          breach_domain,
          breach_date,
          detected_at,
          data_classes,
          pwn_count,
          severity,
          severity_score,
          verified,
          fabricated,
          sensitive,
          notified,
          notified_at,
          remediation_text
        ) VALUES (
          :breachEventId,
          :identityId,
          :breachName,
          :breachDomain,
          :breachDate,
          :detectedAt,
          :dataClasses::jsonb,
          :pwnCount,
          :severity,
          :severityScore,
          :verified,
          :fabricated,
          :sensitive,
          :notified,
          :notifiedAt,
          :remediationText
        )
        ON CONFLICT (identity_id, breach_name) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("breachEventId", record.breachEventId())
            .addValue("identityId", record.identityId())
            .addValue("breachName", record.breachName())
            .addValue("breachDomain", record.breachDomain())
            .addValue(
                "breachDate", record.breachDate() == null ? null : Date.valueOf(record.breachDate()))
            .addValue("detectedAt", toTimestamp(record.detectedAt()))
            .addValue("dataClasses", writeDataClasses(record.dataClasses()))
            .addValue("pwnCount", record.pwnCount())
            .addValue("severity", record.severity().name())
            .addValue("severityScore", record.severityScore())
            .addValue("verified", record.verified())
            .addValue("fabricated", record.fabricated())
            .addValue("sensitive", record.sensitive())
            .addValue("notified", record.notified())
            .addValue("notifiedAt", toTimestamp(record.notifiedAt()))
            .addValue("remediationText", record.remediationText());
    return jdbcTemplate.update(sql, params) == 1;
  }

  public Optional<BreachEventRecord> findById(UUID breachEventId) {
    final String sql =
        """
        SELECT breach_event_id, identity_id, breach_name, breach_domain, breach_date, detected_at,
               data_classes::text AS data_classes_text, pwn_count, severity, severity_score,
               verified, fabricated, sensitive, notified, notified_at, remediation_text
        FROM breach_events
        WHERE breach_event_id = :breachEventId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("breachEventId", breachEventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<BreachEventRecord> findByIdentity(UUID identityId) {
    final String sql =
        """
        SELECT breach_event_id, identity_id, breach_name, breach_domain, breach_date, detected_at,
               data_classes::text AS data_classes_text, pwn_count, severity, severity_score,
               verified, fabricated, sensitive, notified, notified_at, remediation_text
        FROM breach_events
        WHERE identity_id = :identityId
        ORDER BY detected_at, breach_name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("identityId", identityId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Flips the notified flag only if it is still unset; returns 0 when another dispatch won. */
  public int markNotified(UUID breachEventId, Instant notifiedAt) {
    final String sql =
        """
        UPDATE breach_events
        SET notified = TRUE,
            notified_at = :notifiedAt
        WHERE breach_event_id = :breachEventId
          AND notified = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("breachEventId", breachEventId)
            .addValue("notifiedAt", toTimestamp(notifiedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int updateRemediation(UUID breachEventId, String remediationText) {
    final String sql =
        """
        UPDATE breach_events
        SET remediation_text = :remediationText
        WHERE breach_event_id = :breachEventId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("breachEventId", breachEventId)
            .addValue("remediationText", remediationText);
    return jdbcTemplate.update(sql, params);
  }

  /** Counts only ACTIVE identities and the breaches recorded against them. */
  public DigestSummary summarizeForSubscriber(UUID subscriberId, Instant newSince) {
    final String sql =
        """
        SELECT
          (SELECT COUNT(*)
           FROM monitored_identities
           WHERE subscriber_id = :subscriberId
             AND status = 'ACTIVE') AS monitored_identities,
          COUNT(e.breach_event_id) AS total_breaches,
          COUNT(e.breach_event_id) FILTER (WHERE e.detected_at >= :newSince) AS new_breaches,
          COALESCE(MAX(e.severity_score), 0) AS max_severity_score
        FROM breach_events e
        JOIN monitored_identities i ON i.identity_id = e.identity_id
        WHERE i.subscriber_id = :subscriberId
          AND i.status = 'ACTIVE'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("newSince", toTimestamp(newSince));
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) ->
            new DigestSummary(
                rs.getInt("monitored_identities"),
                rs.getInt("total_breaches"),
                rs.getInt("new_breaches"),
                rs.getInt("max_severity_score")));
  }

  private String writeDataClasses(List<String> dataClasses) {
    try {
      return objectMapper.writeValueAsString(dataClasses);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize data classes", ex);
    }
  }

  private List<String> readDataClasses(String json) throws SQLException {
    if (json == null) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, STRING_LIST);
    } catch (JsonProcessingException ex) {
      throw new SQLException("breach_events.data_classes is not a JSON array", ex);
    }
  }

  private BreachEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Date breachDate = rs.getDate("breach_date");
    return new BreachEventRecord(
        rs.getObject("breach_event_id", UUID.class),
        rs.getObject("identity_id", UUID.class),
        rs.getString("breach_name"),
        rs.getString("breach_domain"),
        breachDate == null ? null : breachDate.toLocalDate(),
        toInstant(rs.getTimestamp("detected_at")),
        readDataClasses(rs.getString("data_classes_text")),
        rs.getLong("pwn_count"),
        SeverityLabel.valueOf(rs.getString("severity")),
        rs.getInt("severity_score"),
        rs.getBoolean("verified"),
        rs.getBoolean("fabricated"),
        rs.getBoolean("sensitive"),
        rs.getBoolean("notified"),
        toInstant(rs.getTimestamp("notified_at")),
        rs.getString("remediation_text"));
  }
}
