/*
 * Where: Breach feed client
 * What: Queries the HIBP v3 API for breaches, the breach catalog and leaked secrets
 * Why: Every feed call goes through the shared rate limiter and maps failures to typed reasons
 */
package com.breachwatch.monitor.client;

import com.breachwatch.monitor.config.BreachFeedProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class BreachFeedClient {

  private static final Logger logger = LoggerFactory.getLogger(BreachFeedClient.class);
  private static final ParameterizedTypeReference<List<RawBreach>> BREACH_LIST =
      new ParameterizedTypeReference<>() {};
  private static final String API_KEY_HEADER = "hibp-api-key";
  private static final String USER_AGENT_HEADER = "user-agent";
  private static final int PREFIX_LENGTH = 5;

  private final RestClient breachFeedRestClient;
  private final RestClient pwnedPasswordsRestClient;
  private final BreachFeedProperties properties;
  private final BreachFeedRateLimiter rateLimiter;
  private final Clock clock;
  private final Object catalogLock = new Object();

  private volatile CachedCatalog catalog;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient and the rate limiter are shared Spring-managed components")
  public BreachFeedClient(
      @Qualifier("breachFeedRestClient") RestClient breachFeedRestClient,
      @Qualifier("pwnedPasswordsRestClient") RestClient pwnedPasswordsRestClient,
      BreachFeedProperties properties,
      BreachFeedRateLimiter rateLimiter,
      Clock clock) {
    this.breachFeedRestClient = breachFeedRestClient;
    this.pwnedPasswordsRestClient = pwnedPasswordsRestClient;
    this.properties = properties;
    this.rateLimiter = rateLimiter;
    this.clock = clock;
  }

  /** Breaches the identity appears in; an identity unknown to the feed yields an empty list. */
  public List<RawBreach> lookup(String identity) {
    if (identity == null || identity.isBlank()) {
      throw new IllegalArgumentException("identity is required");
    }
    return callFeed(
        "lookup",
        () ->
            breachFeedRestClient
                .get()
                .uri("/breachedaccount/{account}?truncateResponse=false", identity)
                .header(API_KEY_HEADER, properties.apiKey())
                .header(USER_AGENT_HEADER, properties.userAgent())
                .retrieve()
                .body(BREACH_LIST));
  }

  /** The full breach catalog, cached in-process for the configured TTL. */
  public List<RawBreach> lookupAll() {
    final Instant now = clock.instant();
    final CachedCatalog current = catalog;
    if (current != null && current.isFresh(now, properties)) {
      return current.breaches();
    }
    synchronized (catalogLock) {
      final CachedCatalog latest = catalog;
      if (latest != null && latest.isFresh(now, properties)) {
        return latest.breaches();
      }
      final List<RawBreach> breaches =
          callFeed(
              "lookupAll",
              () ->
                  breachFeedRestClient
                      .get()
                      .uri("/breaches")
                      .header(USER_AGENT_HEADER, properties.userAgent())
                      .retrieve()
                      .body(BREACH_LIST));
      catalog = new CachedCatalog(breaches, now);
      logger.info("breach catalog refreshed count={}", breaches.size());
      return breaches;
    }
  }

  /**
   * How often the secret appears in known leaks. Only the first five hex characters of its
   * SHA-1 digest leave the process.
   */
  public long checkLeakedSecret(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("secret is required");
    }
    final String digest = sha1Hex(secret);
    final String prefix = digest.substring(0, PREFIX_LENGTH);
    final String suffix = digest.substring(PREFIX_LENGTH);
    final String body;
    try {
      body =
          pwnedPasswordsRestClient
              .get()
              .uri("/range/{prefix}", prefix)
              .header(USER_AGENT_HEADER, properties.userAgent())
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException("checkLeakedSecret", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("checkLeakedSecret", ex);
    }
    return parseRangeCount(body, suffix);
  }

  private List<RawBreach> callFeed(String operation, Supplier<List<RawBreach>> request) {
    boolean cooledDown = false;
    while (true) {
      rateLimiter.acquire();
      try {
        final List<RawBreach> body = request.get();
        return body == null ? List.of() : body;
      } catch (RestClientResponseException ex) {
        final int status = ex.getStatusCode().value();
        if (status == HttpStatus.NOT_FOUND.value()) {
          return List.of();
        }
        if (status == HttpStatus.TOO_MANY_REQUESTS.value() && !cooledDown) {
          cooledDown = true;
          rateLimiter.cooldown(properties.rateLimitCooldown());
          continue;
        }
        throw mapResponseException(operation, ex);
      } catch (ResourceAccessException ex) {
        throw mapResourceException(operation, ex);
      } catch (RestClientException ex) {
        logger.warn("breach feed {} response parse failed", operation, ex);
        throw new BreachFeedException(
            BreachFeedException.Reason.INVALID_RESPONSE, "breach feed response parse failed", ex);
      }
    }
  }

  private long parseRangeCount(String body, String suffix) {
    if (body == null) {
      return 0L;
    }
    for (String line : body.split("\\R")) {
      final int separator = line.indexOf(':');
      if (separator < 0) {
        continue;
      }
      if (line.substring(0, separator).trim().equalsIgnoreCase(suffix)) {
        try {
          return Long.parseLong(line.substring(separator + 1).trim());
        } catch (NumberFormatException ex) {
          throw new BreachFeedException(
              BreachFeedException.Reason.INVALID_RESPONSE, "leaked secret count is not numeric", ex);
        }
      }
    }
    return 0L;
  }

  private BreachFeedException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "breach feed {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == HttpStatus.UNAUTHORIZED.value()) {
      return new BreachFeedException(
          BreachFeedException.Reason.UNAUTHORIZED, "breach feed rejected the API key", ex);
    }
    if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
      return new BreachFeedException(
          BreachFeedException.Reason.RATE_LIMITED, "breach feed rate limit persisted", ex);
    }
    return new BreachFeedException(
        BreachFeedException.Reason.BAD_GATEWAY, "breach feed request failed status=" + status, ex);
  }

  private BreachFeedException mapResourceException(String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("breach feed {} timed out", operation);
      return new BreachFeedException(
          BreachFeedException.Reason.TIMEOUT, "breach feed request timeout", ex);
    }
    logger.warn("breach feed {} connection failed", operation, ex);
    return new BreachFeedException(
        BreachFeedException.Reason.BAD_GATEWAY, "breach feed connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  static String sha1Hex(String secret) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-1");
      return HexFormat.of()
          .formatHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)))
          .toUpperCase(Locale.ROOT);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-1 is not available", ex);
    }
  }

  private record CachedCatalog(List<RawBreach> breaches, Instant fetchedAt) {

    boolean isFresh(Instant now, BreachFeedProperties properties) {
      return fetchedAt.plus(properties.catalogTtl()).isAfter(now);
    }
  }
}
