/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api;

import dev.warden.api.events.ModerationEvents;

/**
 * Static accessors for the Warden singletons consumed by command front ends and integrations.
 *
 * <p>Core constructs its {@code Services} container and calls {@link
 * #bootstrap(dev.warden.core.Services)} once; {@link #clear()} drops the handle on shutdown.
 */
public final class WardenApi {
  private static volatile dev.warden.core.Services services;

  private WardenApi() {}

  /**
   * Wires core services into the static API.
   *
   * @param s service container
   * @throws IllegalStateException if called more than once without {@link #clear()}
   */
  public static synchronized void bootstrap(dev.warden.core.Services s) {
    if (services != null) {
      throw new IllegalStateException("WardenApi already bootstrapped");
    }
    services = s;
  }

  /** Drops the published services. */
  public static synchronized void clear() {
    services = null;
  }

  /**
   * Gets the lifecycle controller for one kind.
   *
   * @param kind action kind
   * @return moderation operations for that kind
   * @throws IllegalStateException if not bootstrapped or the kind is disabled
   */
  public static Moderation moderation(ActionKind kind) {
    return require().moderation(kind);
  }

  /**
   * Gets the case editor.
   *
   * @return case control singleton
   */
  public static CaseControl cases() {
    return require().cases();
  }

  /**
   * Gets the moderation event bus facade.
   *
   * @return event bus facade
   */
  public static ModerationEvents events() {
    return require().events();
  }

  private static dev.warden.core.Services require() {
    dev.warden.core.Services s = services;
    if (s == null) {
      throw new IllegalStateException("WardenApi not bootstrapped");
    }
    return s;
  }
}
