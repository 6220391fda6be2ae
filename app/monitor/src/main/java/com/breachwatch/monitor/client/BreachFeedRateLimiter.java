/*
 * Where: Breach feed client
 * What: Serializes feed requests so consecutive calls are at least min-interval apart
 * Why: The feed enforces a per-key request rate shared by every concurrent scan in the process
 */
package com.breachwatch.monitor.client;

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BreachFeedRateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(BreachFeedRateLimiter.class);

  private final ReentrantLock lock = new ReentrantLock(true);
  private final Duration minInterval;
  private final Clock clock;

  // guarded by lock
  private Instant lastCallAt;

  public BreachFeedRateLimiter(Duration minInterval, Clock clock) {
    this.minInterval = minInterval;
    this.clock = clock;
  }

  /** Blocks until the caller may issue the next feed request. */
  public void acquire() {
    lock.lock();
    try {
      Instant now = clock.instant();
      if (lastCallAt != null) {
        final Duration wait = Duration.between(now, lastCallAt.plus(minInterval));
        if (!wait.isNegative() && !wait.isZero()) {
          sleep(wait);
          now = clock.instant();
        }
      }
      lastCallAt = now;
    } finally {
      lock.unlock();
    }
  }

  /** Pauses every feed caller after the feed answered with a rate-limit response. */
  public void cooldown(Duration cooldown) {
    lock.lock();
    try {
      logger.warn("breach feed rate limited; cooling down for {}ms", cooldown.toMillis());
      sleep(cooldown);
      lastCallAt = clock.instant();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for breach feed slot", ex);
    }
  }
}
