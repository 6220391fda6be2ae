package com.breachwatch.monitor.api.request;

import jakarta.validation.constraints.NotBlank;

public record SecretCheckRequest(@NotBlank String secret) {

  @Override
  public String toString() {
    return "SecretCheckRequest[secret=***]";
  }
}
