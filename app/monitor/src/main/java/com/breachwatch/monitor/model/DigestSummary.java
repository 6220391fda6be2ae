/*
 * Where: Monitor domain model
 * What: Weekly digest statistics for one subscriber
 * Why: Aggregated in SQL and rendered into the digest email
 */
package com.breachwatch.monitor.model;

public record DigestSummary(
    int monitoredIdentities, int totalBreaches, int newThisWeek, int maxSeverityScore) {}
