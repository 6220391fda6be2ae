/*
 * Where: Monitor domain model
 * What: Final state of one channel attempt for one breach event
 * Why: Alert_deliveries is append-only so the status is written once
 */
package com.breachwatch.monitor.model;

public enum DeliveryStatus {
  SENT,
  FAILED,
  SKIPPED
}
