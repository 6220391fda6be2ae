/*
 * Where: Monitor data access
 * What: Reads monitored identities and records completed scans
 * Why: Scans need the encrypted value and the sweep needs the active set
 */
package com.breachwatch.monitor.repository;

import static com.breachwatch.common.JdbcTimestampUtils.toInstant;
import static com.breachwatch.common.JdbcTimestampUtils.toTimestamp;

import com.breachwatch.monitor.model.IdentityStatus;
import com.breachwatch.monitor.model.MonitoredIdentityRecord;
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
public class MonitoredIdentityRepository {

  private static final String COLUMNS =
      """
      identity_id, subscriber_id, identity_encrypted, identity_hash, identity_preview,
      status, scan_count, last_scanned_at, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(MonitoredIdentityRecord record) {
    final String sql =
        """
        INSERT INTO monitored_identities (
          identity_id,
          subscriber_id,
          identity_encrypted,
          identity_hash,
          identity_preview,
          status,
          scan_count,
          last_scanned_at,
          created_at
        ) VALUES (
          :identityId,
          :subscriberId,
          :identityEncrypted,
          :identityHash,
          :identityPreview,
          :status,
          :scanCount,
          :lastScannedAt,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("identityId", record.identityId())
            .addValue("subscriberId", record.subscriberId())
            .addValue("identityEncrypted", record.identityEncrypted())
            .addValue("identityHash", record.identityHash())
            .addValue("identityPreview", record.identityPreview())
            .addValue("status", record.status().name())
            .addValue("scanCount", record.scanCount())
            .addValue("lastScannedAt", toTimestamp(record.lastScannedAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<MonitoredIdentityRecord> findById(UUID identityId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM monitored_identities WHERE identity_id = :identityId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("identityId", identityId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UUID> findActiveIdentityIds() {
    final String sql =
        """
        SELECT identity_id
        FROM monitored_identities
        WHERE status = 'ACTIVE'
        ORDER BY created_at
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource(), (rs, rowNum) -> rs.getObject("identity_id", UUID.class));
  }

  public int recordScan(UUID identityId, Instant scannedAt) {
    final String sql =
        """
        UPDATE monitored_identities
        SET scan_count = scan_count + 1,
            last_scanned_at = :scannedAt
        WHERE identity_id = :identityId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("identityId", identityId)
            .addValue("scannedAt", toTimestamp(scannedAt));
    return jdbcTemplate.update(sql, params);
  }

  private MonitoredIdentityRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MonitoredIdentityRecord(
        rs.getObject("identity_id", UUID.class),
        rs.getObject("subscriber_id", UUID.class),
        rs.getString("identity_encrypted"),
        rs.getString("identity_hash"),
        rs.getString("identity_preview"),
        IdentityStatus.valueOf(rs.getString("status")),
        rs.getInt("scan_count"),
        toInstant(rs.getTimestamp("last_scanned_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
