/*
 * Where: Monitor data access
 * What: Append-only log of per-channel alert attempts
 * Why: Every dispatch outcome stays auditable and is never rewritten
 */
package com.breachwatch.monitor.repository;

import static com.breachwatch.common.JdbcTimestampUtils.toInstant;
import static com.breachwatch.common.JdbcTimestampUtils.toTimestamp;

import com.breachwatch.monitor.model.AlertChannel;
import com.breachwatch.monitor.model.AlertDeliveryRecord;
import com.breachwatch.monitor.model.DeliveryStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AlertDeliveryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AlertDeliveryRecord record) {
    final String sql =
        """
        INSERT INTO alert_deliveries (
          delivery_id,
          breach_event_id,
          channel,
          recipient,
          status,
          attempt_count,
          error_message,
          provider_message_id,
          attempted_at
        ) VALUES (
          :deliveryId,
          :breachEventId,
          :channel,
          :recipient,
          :status,
          :attemptCount,
          :errorMessage,
          :providerMessageId,
          :attemptedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", record.deliveryId())
            .addValue("breachEventId", record.breachEventId())
            .addValue("channel", record.channel().name())
            .addValue("recipient", record.recipient())
            .addValue("status", record.status().name())
            .addValue("attemptCount", record.attemptCount())
            .addValue("errorMessage", record.errorMessage())
            .addValue("providerMessageId", record.providerMessageId())
            .addValue("attemptedAt", toTimestamp(record.attemptedAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<AlertDeliveryRecord> findByBreachEventId(UUID breachEventId) {
    final String sql =
        """
        SELECT delivery_id, breach_event_id, channel, recipient, status, attempt_count,
               error_message, provider_message_id, attempted_at
        FROM alert_deliveries
        WHERE breach_event_id = :breachEventId
        ORDER BY attempted_at, channel
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("breachEventId", breachEventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private AlertDeliveryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AlertDeliveryRecord(
        rs.getObject("delivery_id", UUID.class),
        rs.getObject("breach_event_id", UUID.class),
        AlertChannel.valueOf(rs.getString("channel")),
        rs.getString("recipient"),
        DeliveryStatus.valueOf(rs.getString("status")),
        rs.getInt("attempt_count"),
        rs.getString("error_message"),
        rs.getString("provider_message_id"),
        toInstant(rs.getTimestamp("attempted_at")));
  }
}
