/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Objects;

/**
 * Outcome of an issuance.
 *
 * @param ok whether a new record was issued
 * @param code reason the issuance did not happen ({@code null} on success)
 * @param message optional human-readable message
 * @param record the issued record, the recent duplicate that suppressed issuance, or {@code null}
 */
public record IssueResult(boolean ok, ErrorCode code, String message, ActionRecord record) {

  public IssueResult {
    if (!ok && code == null) {
      throw new IllegalArgumentException("failure results require an error code");
    }
  }

  public static IssueResult issued(ActionRecord record) {
    return new IssueResult(true, null, null, Objects.requireNonNull(record, "record"));
  }

  /**
   * Issuance suppressed because an identical action was issued recently and is still active.
   *
   * @param existing the recent record
   * @return no-op result carrying the existing record
   */
  public static IssueResult duplicate(ActionRecord existing) {
    return new IssueResult(
        false,
        ErrorCode.DUPLICATE_SUPPRESSED,
        "already issued recently (case " + existing.caseNumber() + ")",
        existing);
  }

  public static IssueResult rejected(ErrorCode code, String message) {
    return new IssueResult(false, Objects.requireNonNull(code, "code"), message, null);
  }

  /**
   * Whether the result is a duplicate suppression rather than a failure.
   *
   * @return {@code true} for {@link ErrorCode#DUPLICATE_SUPPRESSED}
   */
  public boolean duplicate() {
    return code == ErrorCode.DUPLICATE_SUPPRESSED;
  }
}
