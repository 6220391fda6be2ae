/*
 * Where: Monitor service layer
 * What: Converts raw feed breaches into normalized breaches
 * Why: Feed fields are optional and loosely formatted
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.client.RawBreach;
import com.breachwatch.monitor.model.NormalizedBreach;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BreachNormalizer {

  private static final Logger logger = LoggerFactory.getLogger(BreachNormalizer.class);

  /** Returns null when the breach carries no name, since the name is its identity. */
  public NormalizedBreach normalize(RawBreach raw) {
    if (raw.name() == null || raw.name().isBlank()) {
      return null;
    }
    return new NormalizedBreach(
        raw.name().trim(),
        blankToNull(raw.domain()),
        parseDate(raw.name(), raw.breachDate()),
        raw.pwnCount() == null ? 0L : raw.pwnCount(),
        raw.dataClasses(),
        raw.verified() == null || raw.verified(),
        Boolean.TRUE.equals(raw.fabricated()),
        Boolean.TRUE.equals(raw.sensitive()));
  }

  private LocalDate parseDate(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException ex) {
      logger.debug("unparseable breach date breach={} value={}", name, value);
      return null;
    }
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
