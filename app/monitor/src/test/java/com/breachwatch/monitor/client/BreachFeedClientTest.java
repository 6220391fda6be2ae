/*
 * Where: Breach feed client tests
 * What: Verifies request shape, caching and failure mapping of the breach feed client
 * Why: Feed failures decide whether a scan job is retried or failed for good
 */
package com.breachwatch.monitor.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.breachwatch.monitor.config.BreachFeedProperties;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class BreachFeedClientTest {

  private static final String ADOBE =
      """
      [{"Name":"Adobe","Title":"Adobe","Domain":"adobe.com","BreachDate":"2013-10-04",
      "PwnCount":152445165,"DataClasses":["Email addresses","Password hints","Passwords"],
      "IsVerified":true,"IsFabricated":false,"IsSensitive":false}]
      """;

  @Test
  void lookupSendsKeyAndParsesBreaches() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andExpect(method(GET))
        .andExpect(header("hibp-api-key", "test-key"))
        .andExpect(header("user-agent", "BreachWatch-Test"))
        .andRespond(withSuccess(ADOBE, MediaType.APPLICATION_JSON));

    final List<RawBreach> breaches = fixture.client.lookup("john@example.com");

    assertThat(breaches).hasSize(1);
    assertThat(breaches.get(0).name()).isEqualTo("Adobe");
    assertThat(breaches.get(0).pwnCount()).isEqualTo(152445165L);
    assertThat(breaches.get(0).dataClasses()).contains("Passwords");
    fixture.feed.verify();
  }

  @Test
  void lookupTreatsNotFoundAsClean() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThat(fixture.client.lookup("clean@example.com")).isEmpty();
  }

  @Test
  void lookupCoolsDownOnceOnRateLimitThenRetries() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withSuccess(ADOBE, MediaType.APPLICATION_JSON));

    assertThat(fixture.client.lookup("john@example.com")).hasSize(1);
    assertThat(fixture.sleeps).containsExactly(Duration.ofSeconds(5));
  }

  @Test
  void lookupMapsPersistentRateLimit() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> fixture.client.lookup("john@example.com"))
        .isInstanceOf(BreachFeedException.class)
        .extracting(ex -> ((BreachFeedException) ex).reason())
        .isEqualTo(BreachFeedException.Reason.RATE_LIMITED);
  }

  @Test
  void lookupMapsUnauthorizedAsPermanent() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> fixture.client.lookup("john@example.com"))
        .isInstanceOfSatisfying(
            BreachFeedException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(BreachFeedException.Reason.UNAUTHORIZED);
              assertThat(ex.isTransient()).isFalse();
            });
  }

  @Test
  void lookupMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.lookup("john@example.com"))
        .isInstanceOf(BreachFeedException.class)
        .extracting(ex -> ((BreachFeedException) ex).reason())
        .isEqualTo(BreachFeedException.Reason.BAD_GATEWAY);
  }

  @Test
  void lookupMapsTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.lookup("john@example.com"))
        .isInstanceOf(BreachFeedException.class)
        .extracting(ex -> ((BreachFeedException) ex).reason())
        .isEqualTo(BreachFeedException.Reason.TIMEOUT);
  }

  @Test
  void lookupMapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo(startsWith("http://feed.test/breachedaccount/")))
        .andRespond(withSuccess("{\"foo\":\"bar\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.lookup("john@example.com"))
        .isInstanceOf(BreachFeedException.class)
        .extracting(ex -> ((BreachFeedException) ex).reason())
        .isEqualTo(BreachFeedException.Reason.INVALID_RESPONSE);
  }

  @Test
  void lookupAllIsCachedUntilTtlExpires() {
    final ClientFixture fixture = newFixture();
    fixture
        .feed
        .expect(requestTo("http://feed.test/breaches"))
        .andRespond(withSuccess(ADOBE, MediaType.APPLICATION_JSON));
    fixture
        .feed
        .expect(requestTo("http://feed.test/breaches"))
        .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.lookupAll()).hasSize(1);
    assertThat(fixture.client.lookupAll()).hasSize(1);
    fixture.clock.advance(Duration.ofHours(2));
    assertThat(fixture.client.lookupAll()).isEmpty();
    fixture.feed.verify();
  }

  @Test
  void checkLeakedSecretSendsOnlyHashPrefix() {
    final ClientFixture fixture = newFixture();
    fixture
        .range
        .expect(requestTo("http://range.test/range/5BAA6"))
        .andRespond(
            withSuccess(
                "0018A45C4D1DEF81644B54AB7F969B88D65:1\r\n"
                    + "1E4C9B93F3F0682250B6CF8331B7EE68FD8:3861493\r\n",
                MediaType.TEXT_PLAIN));

    assertThat(fixture.client.checkLeakedSecret("password")).isEqualTo(3861493L);
  }

  @Test
  void checkLeakedSecretReturnsZeroWhenSuffixAbsent() {
    final ClientFixture fixture = newFixture();
    fixture
        .range
        .expect(requestTo("http://range.test/range/5BAA6"))
        .andRespond(
            withSuccess("0018A45C4D1DEF81644B54AB7F969B88D65:1\r\n", MediaType.TEXT_PLAIN));

    assertThat(fixture.client.checkLeakedSecret("password")).isZero();
  }

  @Test
  void sha1HexIsUppercase() {
    assertThat(BreachFeedClient.sha1Hex("password"))
        .isEqualTo("5BAA61E4C9B93F3F0682250B6CF8331B7EE68FD8");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder feedBuilder = RestClient.builder();
    final MockRestServiceServer feed = MockRestServiceServer.bindTo(feedBuilder).build();
    final RestClient.Builder rangeBuilder = RestClient.builder();
    final MockRestServiceServer range = MockRestServiceServer.bindTo(rangeBuilder).build();
    final BreachFeedProperties properties =
        new BreachFeedProperties(
            "test-key",
            "http://feed.test",
            "http://range.test",
            "BreachWatch-Test",
            Duration.ZERO,
            Duration.ofSeconds(5),
            Duration.ofSeconds(1),
            Duration.ofSeconds(1),
            Duration.ofHours(1));
    final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T00:00:00Z"));
    final List<Duration> sleeps = new ArrayList<>();
    final BreachFeedRateLimiter limiter =
        new BreachFeedRateLimiter(Duration.ZERO, clock) {
          @Override
          void sleep(Duration duration) {
            sleeps.add(duration);
          }
        };
    final BreachFeedClient client =
        new BreachFeedClient(
            feedBuilder.baseUrl("http://feed.test").build(),
            rangeBuilder.baseUrl("http://range.test").build(),
            properties,
            limiter,
            clock);
    return new ClientFixture(client, feed, range, clock, sleeps);
  }

  private record ClientFixture(
      BreachFeedClient client,
      MockRestServiceServer feed,
      MockRestServiceServer range,
      MutableClock clock,
      List<Duration> sleeps) {}
}
