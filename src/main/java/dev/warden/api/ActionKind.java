/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import java.util.Locale;

/**
 * Closed set of moderation action kinds.
 *
 * <p>Each kind carries three static properties that the lifecycle engine consults:
 *
 * <ul>
 *   <li><strong>once-off</strong>: the action happens once (warn, kick), never has a duration, is
 *       never scheduled and is stored with {@code active=false}
 *   <li><strong>persisted</strong>: the effect must survive the subject leaving and re-joining
 *   <li><strong>carries role</strong>: records are further keyed by a role identifier
 * </ul>
 */
public enum ActionKind {
  MUTE(false, true, false),
  BAN(false, false, false),
  TIMEOUT(false, false, false),
  ROLE_PERSIST(false, true, true),
  WARN(true, false, false),
  KICK(true, false, false),
  SOFTBAN(true, false, false),
  NOTE(true, false, false);

  private final boolean onceOff;
  private final boolean persisted;
  private final boolean carriesRole;

  ActionKind(boolean onceOff, boolean persisted, boolean carriesRole) {
    this.onceOff = onceOff;
    this.persisted = persisted;
    this.carriesRole = carriesRole;
  }

  /**
   * Whether the kind is a one-shot action without duration or active state.
   *
   * @return {@code true} for warn, kick, softban and note
   */
  public boolean onceOff() {
    return onceOff;
  }

  /**
   * Whether the effect has to be re-applied when the subject re-joins.
   *
   * @return {@code true} for mute and role-persist
   */
  public boolean persisted() {
    return persisted;
  }

  /**
   * Whether records of this kind are discriminated by a role identifier.
   *
   * @return {@code true} for role-persist
   */
  public boolean carriesRole() {
    return carriesRole;
  }

  /**
   * Storage/config identifier (lower snake case).
   *
   * @return stable identifier, e.g. {@code role_persist}
   */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a storage/config identifier.
   *
   * @param raw identifier such as {@code mute} or {@code role_persist}; dashes are accepted
   * @return matching kind
   * @throws IllegalArgumentException if no kind matches
   */
  public static ActionKind fromId(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("action kind required");
    }
    String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    if ("ROLEPERSIST".equals(normalized)) {
      return ROLE_PERSIST;
    }
    return ActionKind.valueOf(normalized);
  }
}
