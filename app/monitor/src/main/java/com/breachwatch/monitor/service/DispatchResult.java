package com.breachwatch.monitor.service;

import com.breachwatch.monitor.model.AlertDeliveryRecord;
import java.util.List;
import java.util.UUID;

/** Result of one dispatch; {@code deliveries} is empty unless this call marked the event. */
public record DispatchResult(
    UUID breachEventId, boolean notified, String detail, List<AlertDeliveryRecord> deliveries) {

  public DispatchResult {
    deliveries = deliveries == null ? List.of() : List.copyOf(deliveries);
  }

  static DispatchResult noop(UUID breachEventId, String detail) {
    return new DispatchResult(breachEventId, false, detail, List.of());
  }

  public String summary() {
    if (!notified) {
      return detail;
    }
    return "notified deliveries="
        + deliveries.stream().map(d -> d.channel() + ":" + d.status()).toList();
  }
}
