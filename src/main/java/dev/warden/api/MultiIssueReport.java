/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.List;

/**
 * Summary of a best-effort issuance over several subjects.
 *
 * @param entries per-subject outcomes in request order
 */
public record MultiIssueReport(List<Entry> entries) {

  public MultiIssueReport {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  /** Number of subjects that received a new record. */
  public int issued() {
    return (int) entries.stream().filter(e -> e.result().ok()).count();
  }

  /** Number of subjects skipped as recent duplicates. */
  public int duplicates() {
    return (int) entries.stream().filter(e -> e.result().duplicate()).count();
  }

  /** Number of subjects rejected or failed for any other reason. */
  public int failed() {
    return entries.size() - issued() - duplicates();
  }

  /**
   * One subject's outcome.
   *
   * @param subjectId subject
   * @param result issuance outcome
   */
  public record Entry(String subjectId, IssueResult result) {}
}
