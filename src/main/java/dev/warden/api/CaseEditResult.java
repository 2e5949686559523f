/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Objects;

/**
 * Outcome of a case edit (reason, duration, expunge).
 *
 * @param ok whether the edit was stored
 * @param code failure code ({@code null} on success)
 * @param message optional human-readable message
 * @param record record after the edit ({@code null} on failure)
 */
public record CaseEditResult(boolean ok, ErrorCode code, String message, ActionRecord record) {

  public CaseEditResult {
    if (!ok && code == null) {
      throw new IllegalArgumentException("failure results require an error code");
    }
  }

  public static CaseEditResult success(ActionRecord record) {
    return new CaseEditResult(true, null, null, Objects.requireNonNull(record, "record"));
  }

  public static CaseEditResult failure(ErrorCode code, String message) {
    return new CaseEditResult(false, Objects.requireNonNull(code, "code"), message, null);
  }
}
