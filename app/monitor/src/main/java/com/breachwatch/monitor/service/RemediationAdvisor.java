/*
 * Where: Monitor service layer
 * What: Returns remediation text for a breach shape through the shared cache
 * Why: Generation is slow and billed, so equivalent breaches reuse one text
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.client.RemediationGenerationException;
import com.breachwatch.monitor.client.RemediationTextGenerator;
import com.breachwatch.monitor.config.RemediationProperties;
import com.breachwatch.monitor.model.RemediationCacheEntry;
import com.breachwatch.monitor.repository.RemediationCacheRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RemediationAdvisor {

  private static final Logger logger = LoggerFactory.getLogger(RemediationAdvisor.class);

  private final RemediationCacheRepository cacheRepository;
  private final RemediationTextGenerator textGenerator;
  private final RemediationProperties properties;
  private final MonitorMetrics metrics;
  private final Clock clock;

  /**
   * Never fails: store errors bypass the cache and generator errors yield the fallback text,
   * which is not cached.
   */
  public String advise(String breachName, List<String> dataClasses) {
    return tryAdvise(breachName, dataClasses).orElseGet(properties::fallbackText);
  }

  /**
   * Same lookup and generation as {@link #advise}, but empty instead of the fallback text when the
   * generator fails.
   */
  public Optional<String> tryAdvise(String breachName, List<String> dataClasses) {
    final String cacheKey = RemediationCacheKeys.of(breachName, dataClasses);
    final Optional<String> cached = lookup(cacheKey);
    if (cached.isPresent()) {
      hit(cacheKey);
      metrics.recordRemediationCache("hit");
      logger.debug("remediation cache hit breach={} key={}", breachName, cacheKey);
      return cached;
    }
    final String text;
    try {
      text = textGenerator.generate(breachName, dataClasses);
    } catch (RemediationGenerationException ex) {
      metrics.recordRemediationCache("fallback");
      logger.warn(
          "remediation generation failed breach={} reason={}; using fallback text",
          breachName,
          ex.reason(),
          ex);
      return Optional.empty();
    } catch (RuntimeException ex) {
      metrics.recordRemediationCache("fallback");
      logger.warn(
          "remediation generation failed breach={}; using fallback text", breachName, ex);
      return Optional.empty();
    }
    metrics.recordRemediationCache("miss");
    store(cacheKey, breachName, dataClasses, text);
    return Optional.of(text);
  }

  /** Drops the cached text for the breach shape so the next advise call regenerates it. */
  public void invalidate(String breachName, List<String> dataClasses) {
    final String cacheKey = RemediationCacheKeys.of(breachName, dataClasses);
    final int deleted = cacheRepository.delete(cacheKey);
    logger.info(
        "remediation cache invalidated breach={} key={} deleted={}", breachName, cacheKey, deleted);
  }

  private Optional<String> lookup(String cacheKey) {
    try {
      return cacheRepository.findByKey(cacheKey).map(RemediationCacheEntry::remediationText);
    } catch (DataAccessException ex) {
      logger.warn("remediation cache lookup failed key={}; bypassing cache", cacheKey, ex);
      return Optional.empty();
    }
  }

  private void hit(String cacheKey) {
    try {
      cacheRepository.incrementHit(cacheKey);
    } catch (DataAccessException ex) {
      logger.warn("remediation cache hit count update failed key={}", cacheKey, ex);
    }
  }

  private void store(String cacheKey, String breachName, List<String> dataClasses, String text) {
    try {
      cacheRepository.upsert(cacheKey, breachName, dataClasses, text, Instant.now(clock));
    } catch (DataAccessException ex) {
      logger.warn("remediation cache store failed key={}; text not cached", cacheKey, ex);
    }
  }
}
