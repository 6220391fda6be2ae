/*
 * Where: Breach feed client
 * What: Typed failure of a breach feed call
 * Why: The job processor needs to tell configuration errors from transient ones
 */
package com.breachwatch.monitor.client;

public class BreachFeedException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    RATE_LIMITED,
    TIMEOUT,
    BAD_GATEWAY,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public BreachFeedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public BreachFeedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /** A rejected API key will not fix itself on retry. */
  public boolean isTransient() {
    return reason != Reason.UNAUTHORIZED;
  }
}
