/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

/**
 * Applies and removes the external effect of one action kind on the target platform (a role
 * grant, a ban, a timeout).
 *
 * <p>Implementations are supplied by the host and resolved once per kind when the controllers are
 * built. Calls happen on Warden's worker threads and may block.
 */
public interface EffectProvider {

  /**
   * Enacts the action on the target platform.
   *
   * @param record action to enact (its case number may still be unassigned)
   * @throws EffectException if the platform call fails
   */
  void apply(ActionRecord record) throws EffectException;

  /**
   * Undoes the action on the target platform.
   *
   * @param record action to undo
   * @throws EffectException if the platform call fails
   */
  void remove(ActionRecord record) throws EffectException;

  /**
   * Checks whether the effect is currently in place.
   *
   * @param target subject, kind and role
   * @return {@code true} when the effect is observable on the platform
   * @throws EffectException if the platform cannot be queried
   */
  boolean isApplied(EffectTarget target) throws EffectException;

  /**
   * Removes the effect without a backing record, for manual cleanup of drift.
   *
   * @param target subject, kind and role
   * @throws EffectException if the platform call fails or the kind does not support it
   */
  default void forceRemove(EffectTarget target) throws EffectException {
    throw new EffectException("force removal is not supported for " + target.kind().id());
  }
}
