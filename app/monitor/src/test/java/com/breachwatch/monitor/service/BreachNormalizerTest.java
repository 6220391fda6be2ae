package com.breachwatch.monitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.breachwatch.monitor.client.RawBreach;
import com.breachwatch.monitor.model.NormalizedBreach;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class BreachNormalizerTest {

  private final BreachNormalizer normalizer = new BreachNormalizer();

  @Test
  void normalizeFillsDefaultsForMissingFields() {
    final NormalizedBreach breach =
        normalizer.normalize(
            new RawBreach(" Adobe ", null, " ", "not-a-date", null, null, null, null, null));

    assertThat(breach.name()).isEqualTo("Adobe");
    assertThat(breach.domain()).isNull();
    assertThat(breach.breachDate()).isNull();
    assertThat(breach.pwnCount()).isZero();
    assertThat(breach.dataClasses()).isEmpty();
    assertThat(breach.verified()).isTrue();
    assertThat(breach.fabricated()).isFalse();
    assertThat(breach.sensitive()).isFalse();
  }

  @Test
  void normalizeKeepsFeedValues() {
    final NormalizedBreach breach =
        normalizer.normalize(
            new RawBreach(
                "LinkedIn",
                "LinkedIn",
                "linkedin.com",
                "2012-05-05",
                164611595L,
                List.of("Email addresses", "Passwords"),
                false,
                true,
                true));

    assertThat(breach.domain()).isEqualTo("linkedin.com");
    assertThat(breach.breachDate()).isEqualTo(LocalDate.of(2012, 5, 5));
    assertThat(breach.pwnCount()).isEqualTo(164611595L);
    assertThat(breach.verified()).isFalse();
    assertThat(breach.fabricated()).isTrue();
    assertThat(breach.sensitive()).isTrue();
  }

  @Test
  void normalizeDropsNamelessBreach() {
    assertThat(normalizer.normalize(new RawBreach(" ", null, null, null, 1L, null, null, null, null)))
        .isNull();
  }
}
