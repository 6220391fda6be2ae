package com.breachwatch.monitor.api.response;

import com.breachwatch.monitor.client.RawBreach;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CatalogEntryResponse(
    String name, String domain, String breachDate, Long pwnCount, List<String> dataClasses) {

  public CatalogEntryResponse {
    dataClasses = dataClasses == null ? List.of() : List.copyOf(dataClasses);
  }

  public static CatalogEntryResponse from(RawBreach breach) {
    return new CatalogEntryResponse(
        breach.name(), breach.domain(), breach.breachDate(), breach.pwnCount(),
        breach.dataClasses());
  }
}
