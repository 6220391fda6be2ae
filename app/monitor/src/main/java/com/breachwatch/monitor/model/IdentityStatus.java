/*
 * Where: Monitor domain model
 * What: Lifecycle status of a monitored identity
 * Why: Deactivation keeps the row, its unique hash and scan history instead of deleting it
 */
package com.breachwatch.monitor.model;

public enum IdentityStatus {
  ACTIVE,
  INACTIVE
}
