/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.MemberDirectory;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators shared by every lifecycle controller.
 *
 * @param store moderation store
 * @param allocator issuance lock and case numbers
 * @param bus update bus
 * @param members rank lookup for issuers and subjects
 * @param executor executor driving expiry timers
 * @param clock wall clock
 * @param settings moderation tuning
 * @param alerts operator alert sink
 * @param metrics metrics registry
 */
public record LifecycleContext(
    ModerationStore store,
    CaseAllocator allocator,
    UpdateBus bus,
    MemberDirectory members,
    ScheduledExecutorService executor,
    Clock clock,
    Config.Moderation settings,
    OperatorAlerts alerts,
    Metrics metrics) {

  public LifecycleContext {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(allocator, "allocator");
    Objects.requireNonNull(bus, "bus");
    Objects.requireNonNull(members, "members");
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(alerts, "alerts");
    Objects.requireNonNull(metrics, "metrics");
  }
}
