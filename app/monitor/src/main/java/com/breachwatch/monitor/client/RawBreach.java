/*
 * Where: Breach feed DTO
 * What: One breach entry as returned by the HIBP v3 API
 * Why: The feed uses PascalCase field names and may omit flags
 */
package com.breachwatch.monitor.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RawBreach(
    @JsonProperty("Name") String name,
    @JsonProperty("Title") String title,
    @JsonProperty("Domain") String domain,
    @JsonProperty("BreachDate") String breachDate,
    @JsonProperty("PwnCount") Long pwnCount,
    @JsonProperty("DataClasses") List<String> dataClasses,
    @JsonProperty("IsVerified") Boolean verified,
    @JsonProperty("IsFabricated") Boolean fabricated,
    @JsonProperty("IsSensitive") Boolean sensitive) {

  public RawBreach {
    dataClasses = dataClasses == null ? List.of() : List.copyOf(dataClasses);
  }
}
