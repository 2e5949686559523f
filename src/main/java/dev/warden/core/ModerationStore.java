/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionKind;
import dev.warden.api.ActionRecord;
import dev.warden.api.EditInfo;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable collection of moderation action records.
 *
 * <p>Every method blocks until the store answers. Failures surface as {@link StoreException}. The
 * state transitions ({@link #markRemoved}, {@link #markInactive}) are conditional on the row still
 * being active, so a caller that loses a race sees {@code false} instead of overwriting another
 * caller's outcome.
 *
 * <p>"Matching" records share kind and subject and, for kinds that carry a role, the role id.
 */
public interface ModerationStore {

  /**
   * Loads a record by its store id.
   *
   * @param id store id
   * @return the record if present
   */
  Optional<ActionRecord> findById(long id);

  /**
   * Loads a record by case number.
   *
   * @param caseNumber case number
   * @return the record if present
   */
  Optional<ActionRecord> findByCase(long caseNumber);

  /**
   * All active records of a kind.
   *
   * @param kind action kind
   * @return active records, oldest first
   */
  List<ActionRecord> findActive(ActionKind kind);

  /**
   * Active records matching subject and (for role kinds) role.
   *
   * @param kind action kind
   * @param subjectId subject
   * @param roleId role, ignored for kinds without a role
   * @return matching records, most recently issued first
   */
  List<ActionRecord> findActiveFor(ActionKind kind, String subjectId, String roleId);

  /**
   * The newest matching active record issued strictly after {@code sinceMs}.
   *
   * @param kind action kind
   * @param subjectId subject
   * @param roleId role, ignored for kinds without a role
   * @param sinceMs lower bound on issue time
   * @return the record if present
   */
  Optional<ActionRecord> findRecentActive(
      ActionKind kind, String subjectId, String roleId, long sinceMs);

  /**
   * Active records sharing the effect of {@code record}, excluding {@code record} itself.
   *
   * @param record reference record
   * @return other active records, oldest first
   */
  List<ActionRecord> findOtherActive(ActionRecord record);

  /**
   * Count of {@link #findOtherActive}.
   *
   * @param record reference record
   * @return number of other active records
   */
  default long countOtherActive(ActionRecord record) {
    return findOtherActive(record).size();
  }

  /**
   * Persists a new record. The case number must already be assigned.
   *
   * @param record record with {@link ActionRecord#UNASSIGNED} id
   * @return the stored record carrying its store id
   */
  ActionRecord insert(ActionRecord record);

  /**
   * Sets {@code active=false} without touching removal information.
   *
   * @param id store id
   * @return {@code true} if the row was active and is now inactive
   */
  boolean markInactive(long id);

  /**
   * Ends an active record, recording who removed it.
   *
   * @param id store id
   * @param removed removal details
   * @param autoRemoved whether the removal was the natural expiry
   * @return {@code true} if the row was active and is now removed
   */
  boolean markRemoved(long id, EditInfo removed, boolean autoRemoved);

  /**
   * Expunges a record and deactivates it.
   *
   * @param id store id
   * @param expunged expunge details
   * @return {@code true} if the row was not already expunged
   */
  boolean markExpunged(long id, EditInfo expunged);

  /**
   * Replaces the reason text.
   *
   * @param id store id
   * @param reason new reason (may be {@code null})
   * @return {@code true} if the row exists
   */
  boolean updateReason(long id, String reason);

  /**
   * Replaces the duration. With {@code reactivate} the record becomes active again and its removal
   * information is cleared.
   *
   * @param id store id
   * @param durationMs new duration, {@code null} for permanent
   * @param reactivate whether to reactivate the record
   * @return {@code true} if the row exists
   */
  boolean updateDuration(long id, Long durationMs, boolean reactivate);

  /**
   * Record counts per kind.
   *
   * @return kind to total count (absent kinds have no records)
   */
  Map<ActionKind, Long> countByKind();

  /**
   * Active record counts per kind.
   *
   * @return kind to active count
   */
  Map<ActionKind, Long> countActiveByKind();

  /**
   * A subject's records, most recently issued first.
   *
   * @param subjectId subject
   * @param includeExpunged whether expunged records are included
   * @return records
   */
  List<ActionRecord> history(String subjectId, boolean includeExpunged);
}
