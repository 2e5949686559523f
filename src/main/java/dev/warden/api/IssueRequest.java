/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Objects;

/**
 * Everything an outer command or automation layer supplies to issue one action.
 *
 * @param subjectId acted-upon entity
 * @param subjectName display name of the subject (falls back to the id)
 * @param issuerId actor issuing the action
 * @param issuerName display name of the issuer (falls back to the id)
 * @param durationMs duration in milliseconds, {@code null} for permanent or once-off kinds
 * @param reason free-text reason (may be {@code null})
 * @param roleId role discriminator, required for {@link ActionKind#ROLE_PERSIST} only
 * @param roleName display name of the role (may be {@code null})
 * @param link provenance link (may be {@code null})
 */
public record IssueRequest(
    String subjectId,
    String subjectName,
    String issuerId,
    String issuerName,
    Long durationMs,
    String reason,
    String roleId,
    String roleName,
    String link) {

  public IssueRequest {
    Objects.requireNonNull(subjectId, "subjectId");
    Objects.requireNonNull(issuerId, "issuerId");
    subjectName = subjectName == null ? subjectId : subjectName;
    issuerName = issuerName == null ? issuerId : issuerName;
  }

  /**
   * Request without role payload or link.
   *
   * @param subjectId acted-upon entity
   * @param issuerId issuing actor
   * @param durationMs duration in milliseconds or {@code null}
   * @param reason free-text reason
   * @return request
   */
  public static IssueRequest of(String subjectId, String issuerId, Long durationMs, String reason) {
    return new IssueRequest(subjectId, null, issuerId, null, durationMs, reason, null, null, null);
  }

  /** Copy carrying a role payload. */
  public IssueRequest withRole(String newRoleId, String newRoleName) {
    return new IssueRequest(
        subjectId, subjectName, issuerId, issuerName, durationMs, reason, newRoleId, newRoleName,
        link);
  }

  /** Copy targeting a different subject (used by multi-issue). */
  public IssueRequest forSubject(String newSubjectId, String newSubjectName) {
    return new IssueRequest(
        newSubjectId, newSubjectName, issuerId, issuerName, durationMs, reason, roleId, roleName,
        link);
  }

  /** Copy with a provenance link. */
  public IssueRequest withLink(String newLink) {
    return new IssueRequest(
        subjectId, subjectName, issuerId, issuerName, durationMs, reason, roleId, roleName,
        newLink);
  }
}
