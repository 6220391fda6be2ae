/*
 * Where: Monitor domain model
 * What: One row of the append-only alert delivery log
 * Why: Records what each channel did for an event, including skips and failures
 */
package com.breachwatch.monitor.model;

import java.time.Instant;
import java.util.UUID;

public record AlertDeliveryRecord(
    UUID deliveryId,
    UUID breachEventId,
    AlertChannel channel,
    String recipient,
    DeliveryStatus status,
    int attemptCount,
    String errorMessage,
    String providerMessageId,
    Instant attemptedAt) {}
