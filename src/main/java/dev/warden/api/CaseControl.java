/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.List;
import java.util.Optional;

/**
 * Case-number addressed edits that apply to every kind.
 *
 * <p>Edits are persisted first and then published on the update bus so the owning controller can
 * reschedule, re-apply, or remove the external effect.
 */
public interface CaseControl {

  /**
   * Looks up a case.
   *
   * @param caseNumber case number
   * @return record, if it exists
   */
  Optional<ActionRecord> lookup(long caseNumber);

  /**
   * Lists a subject's records, newest first.
   *
   * @param subjectId subject
   * @param includeExpunged whether expunged records are included
   * @return records
   */
  List<ActionRecord> history(String subjectId, boolean includeExpunged);

  /**
   * Replaces the reason of a case.
   *
   * @param caseNumber case number
   * @param reason new reason
   * @return edited record or {@link ErrorCode#CASE_NOT_FOUND}
   */
  CaseEditResult updateReason(long caseNumber, String reason);

  /**
   * Changes the duration of a case. Extending an auto-expired case re-activates it.
   *
   * @param caseNumber case number
   * @param durationMs new duration in milliseconds, {@code null} for permanent
   * @return edited record, {@link ErrorCode#CASE_NOT_FOUND}, {@link ErrorCode#CASE_NOT_DURABLE} or
   *     {@link ErrorCode#INVALID_DURATION}
   */
  CaseEditResult updateDuration(long caseNumber, Long durationMs);

  /**
   * Strikes a case from user-facing history and deactivates it.
   *
   * @param caseNumber case number
   * @param actorId actor
   * @param actorName actor display name
   * @param reason reason (may be {@code null})
   * @return edited record or {@link ErrorCode#CASE_NOT_FOUND}
   */
  CaseEditResult expunge(long caseNumber, String actorId, String actorName, String reason);
}
