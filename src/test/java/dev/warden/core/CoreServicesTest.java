/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.warden.api.ActionKind;
import dev.warden.api.ActionRecord;
import dev.warden.api.EffectProvider;
import dev.warden.api.EffectTarget;
import dev.warden.api.ErrorCode;
import dev.warden.api.IssueRequest;
import dev.warden.api.IssueResult;
import java.util.EnumSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CoreServicesTest {
  private static final long T0 = LifecycleHarness.T0;
  private static final long HOUR = 3_600_000L;

  private ManualClock clock;
  private ManualScheduler scheduler;
  private InMemoryModerationStore store;
  private RecordingEffectProvider effects;
  private Metrics metrics;
  private CoreServices services;

  @BeforeEach
  void setup() {
    clock = new ManualClock(T0);
    scheduler = new ManualScheduler(clock);
    store = new InMemoryModerationStore();
    effects = new RecordingEffectProvider();
    metrics = new Metrics(false);
  }

  @AfterEach
  void tearDown() throws Exception {
    if (services != null) {
      services.shutdown();
    }
  }

  private CoreServices assemble(Set<ActionKind> kinds, Map<ActionKind, EffectProvider> providers) {
    Config.Moderation settings =
        new Config.Moderation(
            300_000L, 1_000L, "system", "Warden", kinds, new Config.Alerts(20, 0.2));
    AtomicLong counter = new AtomicLong();
    return CoreServices.assemble(
        settings,
        null,
        store,
        name -> counter.incrementAndGet(),
        providers,
        id -> OptionalInt.empty(),
        scheduler,
        false,
        clock,
        new UpdateBus(Runnable::run),
        metrics);
  }

  private CoreServices muteAndBan() {
    return assemble(
        EnumSet.of(ActionKind.MUTE, ActionKind.BAN),
        Map.of(ActionKind.MUTE, effects, ActionKind.BAN, effects));
  }

  @Test
  void onlyEnabledKindsAreServed() {
    services = muteAndBan();

    assertEquals(EnumSet.of(ActionKind.MUTE, ActionKind.BAN), services.kinds());
    IssueResult result =
        services.moderation(ActionKind.BAN).issue(IssueRequest.of("s1", "mod", HOUR, "raid"));
    assertTrue(result.ok());
    assertEquals(1L, result.record().caseNumber());
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> services.moderation(ActionKind.KICK));
    assertTrue(e.getMessage().contains("kick"));
    assertNull(services.dataSource());
  }

  @Test
  void everyEnabledKindNeedsAProvider() {
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () ->
                assemble(
                    EnumSet.of(ActionKind.MUTE, ActionKind.TIMEOUT),
                    Map.of(ActionKind.MUTE, effects)));
    assertTrue(e.getMessage().contains("timeout"));
  }

  @Test
  void recoverReappliesAcrossKinds() {
    store.put(staged(101L, ActionKind.MUTE, "s1", T0 - 1_000L, HOUR));
    store.put(staged(102L, ActionKind.BAN, "s2", T0 - 1_000L, null));
    services = muteAndBan();

    assertEquals(2, services.recover());
    assertTrue(effects.applied(new EffectTarget(ActionKind.MUTE, "s1", null)));
    assertTrue(effects.applied(new EffectTarget(ActionKind.BAN, "s2", null)));
  }

  @Test
  void recoverAlertsPerKindWhenTheStoreIsDown() {
    services = muteAndBan();
    store.failWith(new StoreException(ErrorCode.CONNECTION_LOST, "down", null));

    assertEquals(0, services.recover());
    assertEquals(2L, metrics.alerts(ErrorCode.CONNECTION_LOST));
  }

  @Test
  void gaugesRefreshHourly() {
    services = muteAndBan();
    services.moderation(ActionKind.MUTE).issue(IssueRequest.of("s1", "mod", 2 * HOUR, "spam"));
    assertEquals(0L, metrics.activeGauge(ActionKind.MUTE));

    scheduler.advanceBy(HOUR);

    assertEquals(1L, metrics.activeGauge(ActionKind.MUTE));
  }

  @Test
  void failedGaugeRefreshIsAlerted() {
    services = muteAndBan();
    store.failWith(new StoreException(ErrorCode.CONNECTION_LOST, "down", null));

    scheduler.advanceBy(HOUR);

    assertEquals(1L, metrics.alerts(ErrorCode.CONNECTION_LOST));
  }

  @Test
  void shutdownIsIdempotentAndLeavesForeignSchedulerRunning() throws Exception {
    services = muteAndBan();

    services.shutdown();
    services.close();

    assertFalse(scheduler.isShutdown());
  }

  @Test
  void onlyLoopbackHostsCountAsLocal() {
    assertTrue(CoreServices.isLocalHost("localhost"));
    assertTrue(CoreServices.isLocalHost(" 127.0.0.1 "));
    assertTrue(CoreServices.isLocalHost("[::1]"));
    assertFalse(CoreServices.isLocalHost("db.internal"));
    assertFalse(CoreServices.isLocalHost(""));
    assertFalse(CoreServices.isLocalHost(null));
  }

  private static ActionRecord staged(
      long caseNumber, ActionKind kind, String subject, long issuedAt, Long duration) {
    return new ActionRecord(
        ActionRecord.UNASSIGNED, caseNumber, kind, subject, subject, "mod", "Mod", null, null,
        "staged", null, issuedAt, duration, true, null, false, null);
  }
}
