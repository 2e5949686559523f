/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Objects;

/**
 * One issued moderation action.
 *
 * <p>Records are never physically deleted; {@link #expunged()} marks a record as struck from
 * user-facing history while retaining it for audit. {@link #active()} means the system believes
 * the external effect should currently be in place.
 *
 * @param id store identifier ({@code 0} before the record is persisted)
 * @param caseNumber globally unique case number ({@link #UNASSIGNED} before issuance)
 * @param kind action kind
 * @param subjectId acted-upon entity
 * @param subjectName display name of the subject at issuance
 * @param issuerId actor that issued the action
 * @param issuerName display name of the issuer at issuance
 * @param roleId role discriminator for {@link ActionKind#ROLE_PERSIST}, otherwise {@code null}
 * @param roleName display name of the role, otherwise {@code null}
 * @param reason free-text reason (may be {@code null})
 * @param link provenance link (may be {@code null})
 * @param issuedAtMs epoch milliseconds
 * @param durationMs duration in milliseconds, {@code null} for permanent
 * @param active whether the effect should currently be applied
 * @param removed who ended the action early or at expiry (may be {@code null})
 * @param autoRemoved whether {@code removed} was produced by the expiry scheduler
 * @param expunged who struck the record (may be {@code null})
 */
public record ActionRecord(
    long id,
    long caseNumber,
    ActionKind kind,
    String subjectId,
    String subjectName,
    String issuerId,
    String issuerName,
    String roleId,
    String roleName,
    String reason,
    String link,
    long issuedAtMs,
    Long durationMs,
    boolean active,
    EditInfo removed,
    boolean autoRemoved,
    EditInfo expunged) {

  /** Case number placeholder for records that have not been issued yet. */
  public static final long UNASSIGNED = -1L;

  public ActionRecord {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(issuerId, "issuerId");
  }

  /**
   * Natural end of the action.
   *
   * @return {@code issuedAt + duration}, or {@code null} for permanent actions
   */
  public Long endsAtMs() {
    return durationMs == null ? null : issuedAtMs + durationMs;
  }

  /**
   * Whether the record has been ended or struck.
   *
   * @return {@code true} if {@code removed} or {@code expunged} is set
   */
  public boolean finalized() {
    return removed != null || expunged != null;
  }

  /** Copy with store identifier and case number assigned. */
  public ActionRecord withIdentity(long newId, long newCaseNumber) {
    return new ActionRecord(
        newId, newCaseNumber, kind, subjectId, subjectName, issuerId, issuerName, roleId,
        roleName, reason, link, issuedAtMs, durationMs, active, removed, autoRemoved, expunged);
  }

  /** Copy with a new duration. */
  public ActionRecord withDuration(Long newDurationMs) {
    return new ActionRecord(
        id, caseNumber, kind, subjectId, subjectName, issuerId, issuerName, roleId, roleName,
        reason, link, issuedAtMs, newDurationMs, active, removed, autoRemoved, expunged);
  }

  /** Copy with a new reason. */
  public ActionRecord withReason(String newReason) {
    return new ActionRecord(
        id, caseNumber, kind, subjectId, subjectName, issuerId, issuerName, roleId, roleName,
        newReason, link, issuedAtMs, durationMs, active, removed, autoRemoved, expunged);
  }

  /** Copy with lifecycle fields replaced. */
  public ActionRecord withState(
      boolean newActive, EditInfo newRemoved, boolean newAutoRemoved, EditInfo newExpunged) {
    return new ActionRecord(
        id, caseNumber, kind, subjectId, subjectName, issuerId, issuerName, roleId, roleName,
        reason, link, issuedAtMs, durationMs, newActive, newRemoved, newAutoRemoved, newExpunged);
  }
}
