/*
 * Where: Monitor data access
 * What: Reads subscriber contact data for alerts and digests
 * Why: Subscribers are owned by the account layer and are read-only here
 */
package com.breachwatch.monitor.repository;

import com.breachwatch.monitor.model.SubscriberRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SubscriberRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<SubscriberRecord> findById(UUID subscriberId) {
    final String sql =
        """
        SELECT subscriber_id, email, phone_number, active
        FROM subscribers
        WHERE subscriber_id = :subscriberId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriberId", subscriberId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<SubscriberRecord> findByIdentityId(UUID identityId) {
    final String sql =
        """
        SELECT s.subscriber_id, s.email, s.phone_number, s.active
        FROM subscribers s
        JOIN monitored_identities i ON i.subscriber_id = s.subscriber_id
        WHERE i.identity_id = :identityId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("identityId", identityId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UUID> findActiveSubscriberIds() {
    final String sql =
        """
        SELECT subscriber_id
        FROM subscribers
        WHERE active = TRUE
        ORDER BY created_at
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource(), (rs, rowNum) -> rs.getObject("subscriber_id", UUID.class));
  }

  private SubscriberRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SubscriberRecord(
        rs.getObject("subscriber_id", UUID.class),
        rs.getString("email"),
        rs.getString("phone_number"),
        rs.getBoolean("active"));
  }
}
