/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.List;

/**
 * Issuance-facing surface for one action kind.
 *
 * <p>These are the only entry points an outer command or automation layer needs. Validation and
 * duplicate conditions come back as typed results; store failures are thrown as {@code
 * dev.warden.core.StoreException}.
 */
public interface Moderation {

  /**
   * Kind handled by this surface.
   *
   * @return action kind
   */
  ActionKind kind();

  /**
   * Issues an action: applies the effect, assigns a case number, persists and schedules expiry.
   *
   * @param request subject, issuer, duration and payload
   * @return issued record, duplicate suppression, or a validation/effect failure
   */
  IssueResult issue(IssueRequest request);

  /**
   * Issues the same action to several subjects, continuing past per-subject failures.
   *
   * @param requests one request per subject
   * @return per-subject summary
   */
  MultiIssueReport multiIssue(List<IssueRequest> requests);

  /**
   * Ends the most recent active action matching the request.
   *
   * @param request subject, issuer, reason and role discriminator
   * @return revoked record and remaining stacked cases, or a failure
   */
  RevokeResult revoke(RevokeRequest request);

  /**
   * Re-applies every active action of this kind on a subject whose effect went missing, e.g. after
   * the subject left and re-joined.
   *
   * @param subjectId subject
   * @return number of effects re-applied
   */
  int reapplyFor(String subjectId);
}
