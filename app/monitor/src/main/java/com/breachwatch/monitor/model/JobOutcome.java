/*
 * Where: Monitor work queue model
 * What: Typed result of one job invocation
 * Why: Workers report success, scheduled retry or terminal failure instead of throwing past their boundary
 */
package com.breachwatch.monitor.model;

import java.time.Instant;

public sealed interface JobOutcome
    permits JobOutcome.Succeeded, JobOutcome.Retrying, JobOutcome.Failed {

  static Succeeded succeeded(String detail) {
    return new Succeeded(detail);
  }

  /** Failure that another attempt may fix; the processor decides whether attempts remain. */
  static Failed transientFailure(String reason) {
    return new Failed(reason, true);
  }

  static Failed permanentFailure(String reason) {
    return new Failed(reason, false);
  }

  record Succeeded(String detail) implements JobOutcome {}

  record Retrying(int attempt, Instant nextRetryAt, String reason) implements JobOutcome {}

  record Failed(String reason, boolean retryable) implements JobOutcome {}
}
