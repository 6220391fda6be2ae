/*
 * Where: Remediation client
 * What: Typed failure of remediation text generation
 * Why: Logs and metrics record why the fallback text was used
 */
package com.breachwatch.monitor.client;

public class RemediationGenerationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    RATE_LIMITED,
    TIMEOUT,
    BAD_GATEWAY,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public RemediationGenerationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RemediationGenerationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
