/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Objects;

/**
 * Identity of an external effect: subject, kind and optional role.
 *
 * @param kind action kind
 * @param subjectId subject
 * @param roleId role discriminator or {@code null}
 */
public record EffectTarget(ActionKind kind, String subjectId, String roleId) {
  public EffectTarget {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(subjectId, "subjectId");
  }

  public static EffectTarget of(ActionRecord record) {
    return new EffectTarget(record.kind(), record.subjectId(), record.roleId());
  }
}
