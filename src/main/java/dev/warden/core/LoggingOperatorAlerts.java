/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ErrorCode;
import dev.warden.util.TokenBucketRateLimiter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default alert sink: writes alerts to the {@code warden} logger, rate limited per code and
 * operation so a burst of identical anomalies produces a bounded number of lines.
 */
public final class LoggingOperatorAlerts implements OperatorAlerts {
  private static final Logger LOG = LoggerFactory.getLogger("warden");

  private final TokenBucketRateLimiter limiter;
  private final Metrics metrics;

  /**
   * Creates the sink.
   *
   * @param limiter per-key limiter deciding whether an alert is written
   * @param metrics metrics registry counting every alert, written or not
   */
  public LoggingOperatorAlerts(TokenBucketRateLimiter limiter, Metrics metrics) {
    this.limiter = Objects.requireNonNull(limiter, "limiter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void alert(ErrorCode code, String op, String message, Throwable cause) {
    metrics.recordAlert(code);
    TokenBucketRateLimiter.Permit permit = limiter.acquire(code + ":" + op);
    if (!permit.granted()) {
      return;
    }
    long suppressed = permit.suppressedBefore();
    if (cause != null) {
      LOG.error(
          "(warden) ALERT code={} op={} message={} suppressed={}",
          code,
          op,
          message,
          suppressed,
          cause);
    } else {
      LOG.warn(
          "(warden) ALERT code={} op={} message={} suppressed={}", code, op, message, suppressed);
    }
  }
}
