/*
 * Where: Monitor domain model
 * What: Snapshot of a monitored_identities row
 * Why: The scan worker needs the encrypted value, the owner and the status in one read
 */
package com.breachwatch.monitor.model;

import java.time.Instant;
import java.util.UUID;

public record MonitoredIdentityRecord(
    UUID identityId,
    UUID subscriberId,
    String identityEncrypted,
    String identityHash,
    String identityPreview,
    IdentityStatus status,
    int scanCount,
    Instant lastScannedAt,
    Instant createdAt) {

  public boolean isActive() {
    return status == IdentityStatus.ACTIVE;
  }
}
