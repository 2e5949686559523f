/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionKind;
import dev.warden.api.CaseControl;
import dev.warden.api.Moderation;
import dev.warden.api.events.ModerationEvents;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import javax.sql.DataSource;

/** Service container exposed to the boot sequence and to {@link dev.warden.api.WardenApi}. */
public interface Services {

  /**
   * Lifecycle controller for a kind.
   *
   * @param kind action kind
   * @return the kind's controller
   * @throws IllegalStateException if the kind is not enabled
   */
  Moderation moderation(ActionKind kind);

  /**
   * Kinds with a running controller.
   *
   * @return enabled kinds
   */
  Set<ActionKind> kinds();

  /**
   * Case lookup and editing.
   *
   * @return case control
   */
  CaseControl cases();

  /**
   * Update bus subscriptions.
   *
   * @return events facade
   */
  ModerationEvents events();

  /**
   * Shared executor for expiry timers and maintenance.
   *
   * @return scheduler
   */
  ScheduledExecutorService scheduler();

  /** Pooled datasource, or {@code null} when the container runs on an in-memory store. */
  DataSource dataSource();

  /** Metrics registry. */
  Metrics metrics();

  /**
   * Rebuilds every kind's schedule from the store and re-applies missing effects.
   *
   * @return number of effects re-applied across kinds
   */
  int recover();

  /** Reloads the per-kind record gauges from the store. */
  void refreshGauges();

  /**
   * Stops timers and background threads and closes the pool.
   *
   * @throws IOException if a resource fails to close
   */
  void shutdown() throws IOException;
}
