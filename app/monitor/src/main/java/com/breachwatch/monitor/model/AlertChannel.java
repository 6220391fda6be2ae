package com.breachwatch.monitor.model;

public enum AlertChannel {
  EMAIL,
  SMS
}
