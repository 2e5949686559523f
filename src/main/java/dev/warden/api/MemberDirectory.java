/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.OptionalInt;

/** Resolves the rank of community members for the issuer-outranks-subject check. */
@FunctionalInterface
public interface MemberDirectory {

  /**
   * Rank of a member; higher outranks lower.
   *
   * @param memberId member identifier
   * @return the member's highest rank, or empty when the id is not a current member
   */
  OptionalInt rankOf(String memberId);
}
