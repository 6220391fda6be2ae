/*
 * Where: Monitor domain model
 * What: Output of the severity scoring engine
 * Why: Ingestion persists label and score while the description feeds alert content
 */
package com.breachwatch.monitor.model;

import java.util.List;

public record SeverityResult(
    SeverityLabel label,
    int score,
    List<String> matchedCategories,
    String topRisk,
    String description) {

  public SeverityResult {
    matchedCategories = matchedCategories == null ? List.of() : List.copyOf(matchedCategories);
  }
}
