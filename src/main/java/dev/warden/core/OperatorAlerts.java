/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ErrorCode;

/**
 * Sink for conditions an operator has to look at: failed effect calls, consistency anomalies,
 * store failures, and callback crashes.
 */
@FunctionalInterface
public interface OperatorAlerts {

  /**
   * Raises an alert.
   *
   * @param code canonical code
   * @param op operation that hit the condition, e.g. {@code mute.expire}
   * @param message human-readable detail
   * @param cause underlying failure (may be {@code null})
   */
  void alert(ErrorCode code, String op, String message, Throwable cause);

  /**
   * Raises an alert without an underlying exception.
   *
   * @param code canonical code
   * @param op operation that hit the condition
   * @param message human-readable detail
   */
  default void alert(ErrorCode code, String op, String message) {
    alert(code, op, message, null);
  }
}
