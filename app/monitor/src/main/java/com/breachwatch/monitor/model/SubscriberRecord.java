/*
 * Where: Monitor domain model
 * What: Owner of monitored identities and recipient of alerts
 * Why: Dispatch resolves email and phone from the owner, not from the breached identity
 */
package com.breachwatch.monitor.model;

import java.util.UUID;

public record SubscriberRecord(UUID subscriberId, String email, String phoneNumber, boolean active) {

  public boolean hasPhoneNumber() {
    return phoneNumber != null && !phoneNumber.isBlank();
  }
}
