/*
 * Where: Monitor API
 * What: Signals that an admin operation referenced an unknown identity, event or job
 * Why: Mapped to a 404 response
 */
package com.breachwatch.monitor.api;

import java.util.UUID;

public class MonitorResourceNotFoundException extends RuntimeException {
  public MonitorResourceNotFoundException(String resource, UUID id) {
    super(resource + " not found: " + id);
  }
}
