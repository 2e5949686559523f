/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Objects;

/**
 * Who ended or expunged an action, when, and why.
 *
 * @param actorId opaque identifier of the actor
 * @param actorName display name captured at the time of the edit
 * @param reason free-text reason (may be {@code null})
 * @param timestampMs epoch milliseconds
 */
public record EditInfo(String actorId, String actorName, String reason, long timestampMs) {
  public EditInfo {
    Objects.requireNonNull(actorId, "actorId");
  }
}
