/* Warden © 2025 Warden Devs — MIT */
package dev.warden.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.function.LongSupplier;
import org.junit.jupiter.api.Test;

class TokenBucketRateLimiterTest {

  @Test
  void suppressedAttemptsAreReportedWithTheNextGrant() {
    FakeTicker ticker = new FakeTicker();
    TokenBucketRateLimiter limiter =
        new TokenBucketRateLimiter(1, 1.0, Duration.ofMinutes(1), ticker);

    TokenBucketRateLimiter.Permit first = limiter.acquire("EFFECT_FAILED:mute.expire");
    assertTrue(first.granted());
    assertEquals(0L, first.suppressedBefore());
    assertFalse(limiter.acquire("EFFECT_FAILED:mute.expire").granted());
    assertFalse(limiter.acquire("EFFECT_FAILED:mute.expire").granted());

    ticker.advance(Duration.ofSeconds(1));
    TokenBucketRateLimiter.Permit next = limiter.acquire("EFFECT_FAILED:mute.expire");
    assertTrue(next.granted());
    assertEquals(2L, next.suppressedBefore());
  }

  @Test
  void keysHaveIndependentBuckets() {
    TokenBucketRateLimiter limiter =
        new TokenBucketRateLimiter(1, 0.001, Duration.ofMinutes(1), new FakeTicker());

    assertTrue(limiter.tryAcquire("a"));
    assertFalse(limiter.tryAcquire("a"));
    assertTrue(limiter.tryAcquire("b"));
  }

  @Test
  void idleFullBucketsAreSwept() {
    FakeTicker ticker = new FakeTicker();
    Duration ttl = Duration.ofSeconds(5);
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(2, 1.0, ttl, ticker);

    assertTrue(limiter.tryAcquire("a"));
    ticker.advance(ttl.plusSeconds(2));
    assertTrue(limiter.tryAcquire("b"));

    assertEquals(1, limiter.bucketCount());
  }

  @Test
  void bucketsHoldingSuppressedCountsSurviveTheSweep() {
    FakeTicker ticker = new FakeTicker();
    Duration ttl = Duration.ofSeconds(5);
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 1.0, ttl, ticker);

    assertTrue(limiter.tryAcquire("a"));
    assertFalse(limiter.tryAcquire("a"));
    ticker.advance(ttl.multipliedBy(2));
    assertTrue(limiter.tryAcquire("b"));

    assertEquals(2, limiter.bucketCount());
    assertEquals(1L, limiter.acquire("a").suppressedBefore());
  }

  private static final class FakeTicker implements LongSupplier {
    private long now;

    @Override
    public long getAsLong() {
      return now;
    }

    void advance(Duration duration) {
      now += duration.toNanos();
    }
  }
}
