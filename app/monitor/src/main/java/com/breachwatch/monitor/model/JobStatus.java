/*
 * Where: Monitor work queue model
 * What: Valid values of jobs.status
 * Why: Must match the CHECK constraint in the migration
 */
package com.breachwatch.monitor.model;

public enum JobStatus {
  PENDING,
  IN_FLIGHT,
  SUCCEEDED,
  FAILED
}
