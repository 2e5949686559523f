/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

/** Raised by an {@link EffectProvider} when the target platform refuses or fails a call. */
public final class EffectException extends Exception {
  public EffectException(String message) {
    super(message);
  }

  public EffectException(String message, Throwable cause) {
    super(message, cause);
  }
}
