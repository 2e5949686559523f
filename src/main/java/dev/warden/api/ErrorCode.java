/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

/**
 * Canonical error/result codes produced by Warden.
 *
 * <p>Validation and duplicate codes are returned inside typed results; effect, anomaly and store
 * codes are attached to log lines and operator alerts.
 */
public enum ErrorCode {
  /** Issuer tried to act on themselves. */
  SELF_TARGET,

  /** Issuer does not outrank the subject. */
  INSUFFICIENT_RANK,

  /** Duration was malformed, non-positive, or supplied for a once-off kind. */
  INVALID_DURATION,

  /** Kind-specific payload (role) missing or supplied where not allowed. */
  INVALID_PAYLOAD,

  /** Same subject and kind issued recently and still active; nothing was issued. */
  DUPLICATE_SUPPRESSED,

  /** Revocation requested for a once-off kind. */
  NOT_REVOCABLE,

  /** No active record matched a revocation. */
  NO_ACTIVE_RECORD,

  /** Referenced case number does not exist. */
  CASE_NOT_FOUND,

  /** Case belongs to a kind that cannot take a duration. */
  CASE_NOT_DURABLE,

  /** External effect provider failed to apply or remove an effect. */
  EFFECT_FAILED,

  /** Expiry fired before the record's end time. */
  EXPIRED_EARLY,

  /** Record was active while already removed or expunged. */
  INCONSISTENT_RECORD,

  /** Unexpected failure inside a scheduled expiry or bus callback. */
  CALLBACK_FAILED,

  /** Unique constraint violated. */
  DUPLICATE_KEY,

  /** Deadlock or lock-wait timeout that was not cleared by retrying. */
  DEADLOCK_RETRY_EXHAUSTED,

  /** Database connection pool lost connectivity to the server. */
  CONNECTION_LOST,

  /** Migrations are locked by another node. */
  MIGRATION_LOCKED;
}
