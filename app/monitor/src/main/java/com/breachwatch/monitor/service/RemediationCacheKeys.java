package com.breachwatch.monitor.service;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Deterministic cache key of a breach shape: the category order does not matter. */
public final class RemediationCacheKeys {
  private RemediationCacheKeys() {}

  public static String of(String breachName, List<String> dataClasses) {
    final String joined = String.join(",", dataClasses.stream().sorted().toList());
    return Hashing.sha256()
        .hashString(breachName + "|" + joined, StandardCharsets.UTF_8)
        .toString();
  }
}
