/* Warden © 2025 Warden Devs — MIT */
package dev.warden.util;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Per-key token bucket used to throttle repeated operator alerts.
 *
 * <p>Every key starts with a full bucket of {@code capacity} tokens and regains {@code
 * refillPerSec} tokens per second. {@link #tryAcquire(String)} takes one token; when none is left
 * the attempt is counted as suppressed, and the count is handed back by the next successful {@link
 * #acquire(String)} so the caller can report how many lines were dropped. Full buckets that have
 * been idle for the configured TTL are evicted. Time comes from a monotonic nanosecond source.
 */
public final class TokenBucketRateLimiter {
  private static final Duration DEFAULT_IDLE_TTL = Duration.ofMinutes(5);

  private static final class Bucket {
    double tokens;
    long refilledAt;
    long usedAt;
    long suppressed;

    Bucket(double tokens, long now) {
      this.tokens = tokens;
      this.refilledAt = now;
      this.usedAt = now;
    }
  }

  /**
   * Outcome of {@link #acquire(String)}.
   *
   * @param granted whether a token was taken
   * @param suppressedBefore attempts rejected since the previous granted one (0 when not granted)
   */
  public record Permit(boolean granted, long suppressedBefore) {}

  private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
  private final double capacity;
  private final double refillPerNano;
  private final long idleTtlNanos;
  private final LongSupplier nanos;
  private final AtomicLong nextSweep;

  /**
   * Creates a limiter with a five minute idle TTL.
   *
   * @param capacity burst size (at least 1)
   * @param refillPerSec tokens regained per second
   */
  public TokenBucketRateLimiter(int capacity, double refillPerSec) {
    this(capacity, refillPerSec, DEFAULT_IDLE_TTL, System::nanoTime);
  }

  TokenBucketRateLimiter(
      int capacity, double refillPerSec, Duration idleTtl, LongSupplier nanoTimeSource) {
    Objects.requireNonNull(idleTtl, "idleTtl");
    this.nanos = Objects.requireNonNull(nanoTimeSource, "nanoTimeSource");
    this.capacity = Math.max(1, capacity);
    this.refillPerNano = Math.max(0.0001, refillPerSec) / 1_000_000_000.0d;
    this.idleTtlNanos = Math.max(0L, idleTtl.toNanos());
    long now = nanos.getAsLong();
    this.nextSweep = new AtomicLong(idleTtlNanos == 0 ? Long.MAX_VALUE : now + idleTtlNanos);
  }

  /**
   * Takes one token for {@code key}.
   *
   * @param key bucket identity, e.g. {@code CALLBACK_FAILED:expiry.mute}
   * @return {@code true} when a token was available
   */
  public boolean tryAcquire(String key) {
    return acquire(key).granted();
  }

  /**
   * Takes one token for {@code key} and reports how many attempts were dropped before it.
   *
   * @param key bucket identity
   * @return permit outcome
   */
  public Permit acquire(String key) {
    long now = nanos.getAsLong();
    sweep(now);
    Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket(capacity, now));
    synchronized (bucket) {
      refill(bucket, now);
      if (bucket.tokens < 1.0) {
        bucket.suppressed++;
        return new Permit(false, 0L);
      }
      bucket.tokens -= 1.0;
      bucket.usedAt = now;
      long dropped = bucket.suppressed;
      bucket.suppressed = 0L;
      return new Permit(true, dropped);
    }
  }

  int bucketCount() {
    return buckets.size();
  }

  private void refill(Bucket bucket, long now) {
    long elapsed = now - bucket.refilledAt;
    if (elapsed > 0L) {
      bucket.tokens = Math.min(capacity, bucket.tokens + elapsed * refillPerNano);
      bucket.refilledAt = now;
    }
  }

  private void sweep(long now) {
    long due = nextSweep.get();
    if (now < due || !nextSweep.compareAndSet(due, now + idleTtlNanos)) {
      return;
    }
    buckets.values()
        .removeIf(
            bucket -> {
              synchronized (bucket) {
                refill(bucket, now);
                // a bucket holding a suppressed count is kept so the count is not lost
                return bucket.suppressed == 0L
                    && bucket.tokens >= capacity - 1e-9
                    && now - bucket.usedAt >= idleTtlNanos;
              }
            });
  }
}
