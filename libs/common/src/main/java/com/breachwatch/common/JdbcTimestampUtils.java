/*
 * Where: Shared utilities
 * What: Converts Instant values into JDBC Timestamps explicitly
 * Why: The PostgreSQL driver cannot always infer a SQL type for Instant parameters
 */
package com.breachwatch.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; all timestamp columns are stored as UTC regardless of the session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
