/*
 * Where: Monitor work queue model
 * What: Kinds of background work carried by the jobs table
 * Why: Each type maps to exactly one handler and one subject id kind
 */
package com.breachwatch.monitor.model;

public enum JobType {
  IDENTITY_SCAN("scan"),
  ALERT_DISPATCH("dispatch"),
  WEEKLY_DIGEST("digest");

  private final String dedupPrefix;

  JobType(String dedupPrefix) {
    this.dedupPrefix = dedupPrefix;
  }

  public String dedupKey(Object subject) {
    return dedupPrefix + ":" + subject;
  }
}
