/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Objects;

/**
 * Request to end the most recent active action of a kind on a subject.
 *
 * @param subjectId acted-upon entity
 * @param issuerId actor revoking the action
 * @param issuerName display name of the actor (falls back to the id)
 * @param reason free-text reason (may be {@code null})
 * @param roleId role discriminator for role-persist (may be {@code null} otherwise)
 * @param allowMissingRecord force-remove the effect when no active record exists
 */
public record RevokeRequest(
    String subjectId,
    String issuerId,
    String issuerName,
    String reason,
    String roleId,
    boolean allowMissingRecord) {

  public RevokeRequest {
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(issuerId, "issuerId");
    issuerName = issuerName == null ? issuerId : issuerName;
  }

  public static RevokeRequest of(String subjectId, String issuerId, String reason) {
    return new RevokeRequest(subjectId, issuerId, null, reason, null, false);
  }

  /** Copy with a role discriminator. */
  public RevokeRequest withRole(String newRoleId) {
    return new RevokeRequest(
        subjectId, issuerId, issuerName, reason, newRoleId, allowMissingRecord);
  }

  /** Copy that allows forcing removal without a record. */
  public RevokeRequest allowingMissingRecord() {
    return new RevokeRequest(subjectId, issuerId, issuerName, reason, roleId, true);
  }
}
