/*
 * Where: Monitor domain model
 * What: Cached advisory text for one breach shape
 * Why: Identical breach name and category set share one generated text
 */
package com.breachwatch.monitor.model;

import java.time.Instant;
import java.util.List;

public record RemediationCacheEntry(
    String cacheKey,
    String breachName,
    List<String> dataClasses,
    String remediationText,
    int hitCount,
    Instant createdAt,
    Instant updatedAt) {

  public RemediationCacheEntry {
    dataClasses = dataClasses == null ? List.of() : List.copyOf(dataClasses);
  }
}
