/*
 * Where: Shared utilities
 * What: Creates and sanitizes correlation ids for logs
 * Why: Caller supplied ids end up in every MDC-tagged log line and must stay short and printable
 */
package com.breachwatch.common;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

public final class TraceIds {

  private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._-]{1,64}");

  private TraceIds() {}

  /** 32 lowercase hex characters, the W3C trace-id shape. */
  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "").toLowerCase(Locale.ROOT);
  }

  /** Returns {@code candidate} when it is safe to log, otherwise a fresh id. */
  public static String resolve(String candidate) {
    if (candidate == null) {
      return newTraceId();
    }
    final String trimmed = candidate.trim();
    return ACCEPTED.matcher(trimmed).matches() ? trimmed : newTraceId();
  }
}
