/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a revocation.
 *
 * @param ok whether the action was ended (or the effect was force-removed)
 * @param code failure code ({@code null} on success)
 * @param message optional human-readable message
 * @param record the revoked record ({@code null} when forced or on failure)
 * @param remainingCases case numbers of other active records still holding the effect
 * @param effectRemoved whether the external effect was removed by this call
 * @param forced whether the effect was removed without a record
 */
public record RevokeResult(
    boolean ok,
    ErrorCode code,
    String message,
    ActionRecord record,
    List<Long> remainingCases,
    boolean effectRemoved,
    boolean forced) {

  public RevokeResult {
    if (!ok && code == null) {
      throw new IllegalArgumentException("failure results require an error code");
    }
    remainingCases = remainingCases == null ? List.of() : List.copyOf(remainingCases);
  }

  public static RevokeResult revoked(
      ActionRecord record, List<Long> remainingCases, boolean effectRemoved) {
    return new RevokeResult(
        true, null, null, Objects.requireNonNull(record, "record"), remainingCases, effectRemoved,
        false);
  }

  public static RevokeResult forced(boolean effectRemoved) {
    return new RevokeResult(true, null, null, null, List.of(), effectRemoved, true);
  }

  public static RevokeResult failure(ErrorCode code, String message) {
    return new RevokeResult(
        false, Objects.requireNonNull(code, "code"), message, null, List.of(), false, false);
  }
}
