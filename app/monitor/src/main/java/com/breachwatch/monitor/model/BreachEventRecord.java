/*
 * Where: Monitor domain model
 * What: Snapshot of a breach_events row
 * Why: Shared by ingestion, dispatch and remediation regeneration
 */
package com.breachwatch.monitor.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record BreachEventRecord(
    UUID breachEventId,
    UUID identityId,
    String breachName,
    String breachDomain,
    LocalDate breachDate,
    Instant detectedAt,
    List<String> dataClasses,
    long pwnCount,
    SeverityLabel severity,
    int severityScore,
    boolean verified,
    boolean fabricated,
    boolean sensitive,
    boolean notified,
    Instant notifiedAt,
    String remediationText) {

  public BreachEventRecord {
    dataClasses = dataClasses == null ? List.of() : List.copyOf(dataClasses);
  }
}
