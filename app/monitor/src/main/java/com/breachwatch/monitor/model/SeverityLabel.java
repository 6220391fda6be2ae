/*
 * Where: Monitor domain model
 * What: Coarse risk tiers and their score thresholds
 * Why: Scoring, SMS gating and email styling share one definition
 */
package com.breachwatch.monitor.model;

public enum SeverityLabel {
  LOW(0),
  MEDIUM(6),
  HIGH(12),
  CRITICAL(25);

  private final int threshold;

  SeverityLabel(int threshold) {
    this.threshold = threshold;
  }

  public int threshold() {
    return threshold;
  }

  public boolean isUrgent() {
    return this == CRITICAL || this == HIGH;
  }

  public static SeverityLabel forScore(int score) {
    if (score >= CRITICAL.threshold) {
      return CRITICAL;
    }
    if (score >= HIGH.threshold) {
      return HIGH;
    }
    if (score >= MEDIUM.threshold) {
      return MEDIUM;
    }
    return LOW;
  }
}
