/*
 * Where: Monitor data access
 * What: Content-addressed store of generated remediation text
 * Why: Identical breach shapes share one generated advisory across all identities
 */
package com.breachwatch.monitor.repository;

import static com.breachwatch.common.JdbcTimestampUtils.toInstant;
import static com.breachwatch.common.JdbcTimestampUtils.toTimestamp;

import com.breachwatch.monitor.model.RemediationCacheEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RemediationCacheRepository {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  public RemediationCacheRepository(
      NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public Optional<RemediationCacheEntry> findByKey(String cacheKey) {
    final String sql =
        """
        SELECT cache_key, breach_name, data_classes::text AS data_classes_text, remediation_text,
               hit_count, created_at, updated_at
        FROM remediation_cache
        WHERE cache_key = :cacheKey
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cacheKey", cacheKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // Concurrent generation for one key converges on the last writer; the hit count is kept.
  public void upsert(String cacheKey, String breachName, List<String> dataClasses, String text,
      Instant now) {
    final String sql =
        """
        INSERT INTO remediation_cache (
          cache_key,
          breach_name,
          data_classes,
          remediation_text,
          hit_count,
          created_at,
          updated_at
        ) VALUES (
          :cacheKey,
          :breachName,
          :dataClasses::jsonb,
          :remediationText,
          0,
          :now,
          :now
        )
        ON CONFLICT (cache_key) DO UPDATE
        SET remediation_text = EXCLUDED.remediation_text,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cacheKey", cacheKey)
            .addValue("breachName", breachName)
            .addValue("dataClasses", writeDataClasses(dataClasses))
            .addValue("remediationText", text)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public int incrementHit(String cacheKey) {
    final String sql =
        """
        UPDATE remediation_cache
        SET hit_count = hit_count + 1
        WHERE cache_key = :cacheKey
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("cacheKey", cacheKey));
  }

  public int delete(String cacheKey) {
    final String sql = "DELETE FROM remediation_cache WHERE cache_key = :cacheKey";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("cacheKey", cacheKey));
  }

  private String writeDataClasses(List<String> dataClasses) {
    try {
      return objectMapper.writeValueAsString(dataClasses);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize data classes", ex);
    }
  }

  private RemediationCacheEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    final List<String> dataClasses;
    try {
      dataClasses = objectMapper.readValue(rs.getString("data_classes_text"), STRING_LIST);
    } catch (JsonProcessingException ex) {
      throw new SQLException("remediation_cache.data_classes is not a JSON array", ex);
    }
    return new RemediationCacheEntry(
        rs.getString("cache_key"),
        rs.getString("breach_name"),
        dataClasses,
        rs.getString("remediation_text"),
        rs.getInt("hit_count"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
