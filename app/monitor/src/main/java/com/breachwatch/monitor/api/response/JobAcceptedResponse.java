package com.breachwatch.monitor.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

/** {@code created} is false when an equivalent job was already queued or running. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobAcceptedResponse(UUID jobId, String dedupKey, boolean created) {}
