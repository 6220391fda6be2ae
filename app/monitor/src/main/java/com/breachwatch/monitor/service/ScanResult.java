package com.breachwatch.monitor.service;

import java.util.List;
import java.util.UUID;

/** Result of one identity scan. A skipped scan touched nothing. */
public record ScanResult(
    UUID identityId, boolean skipped, int breachesFound, List<UUID> newBreachEventIds,
    String detail) {

  public ScanResult {
    newBreachEventIds = newBreachEventIds == null ? List.of() : List.copyOf(newBreachEventIds);
  }

  static ScanResult skipped(UUID identityId, String detail) {
    return new ScanResult(identityId, true, 0, List.of(), detail);
  }

  public String summary() {
    if (skipped) {
      return detail;
    }
    return "breaches_found=" + breachesFound + " new_events=" + newBreachEventIds.size();
  }
}
