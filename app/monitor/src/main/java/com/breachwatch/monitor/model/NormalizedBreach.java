/*
 * Where: Monitor domain model
 * What: Breach feed entry reduced to the fields the pipeline stores
 * Why: Keeps raw feed payload quirks out of ingestion logic
 */
package com.breachwatch.monitor.model;

import java.time.LocalDate;
import java.util.List;

public record NormalizedBreach(
    String name,
    String domain,
    LocalDate breachDate,
    long pwnCount,
    List<String> dataClasses,
    boolean verified,
    boolean fabricated,
    boolean sensitive) {

  public NormalizedBreach {
    dataClasses = dataClasses == null ? List.of() : List.copyOf(dataClasses);
  }
}
