/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.zaxxer.hikari.HikariDataSource;
import dev.warden.api.ActionKind;
import dev.warden.api.ActionRecord;
import dev.warden.api.EditInfo;
import dev.warden.api.ErrorCode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class JdbcModerationStoreTest {
  private static final long T0 = 1_700_000_000_000L;
  private static final AtomicLong CASES = new AtomicLong();

  private static HikariDataSource ds;
  private static JdbcModerationStore store;

  @BeforeAll
  static void setup() throws Exception {
    ds = MariaDbTestSupport.freshDatabase("warden_store_test");
    Migrations.apply(ds, Clock.systemUTC());
    store = new JdbcModerationStore(ds);
  }

  @AfterAll
  static void tearDown() {
    if (ds != null) {
      ds.close();
    }
  }

  private static ActionRecord pending(
      ActionKind kind, String subject, String role, long issuedAt, Long duration) {
    return new ActionRecord(
        ActionRecord.UNASSIGNED, CASES.incrementAndGet(), kind, subject, "Name " + subject,
        "mod-1", "Mod", role, role == null ? null : "Role " + role, "reason", null, issuedAt,
        duration, !kind.onceOff(), null, false, null);
  }

  private static ActionRecord insert(
      ActionKind kind, String subject, String role, long issuedAt, Long duration) {
    return store.insert(pending(kind, subject, role, issuedAt, duration));
  }

  @Test
  void insertedRecordsReadBackIdentically() {
    ActionRecord stored = insert(ActionKind.ROLE_PERSIST, "rt-1", "vip", T0, null);

    assertTrue(stored.id() > 0);
    assertEquals(stored, store.findById(stored.id()).orElseThrow());
    assertEquals(stored, store.findByCase(stored.caseNumber()).orElseThrow());
    assertNull(store.findById(stored.id()).orElseThrow().durationMs());
    assertTrue(store.findByCase(999_999L).isEmpty());
  }

  @Test
  void duplicateCaseNumbersAreRejected() {
    ActionRecord first = insert(ActionKind.NOTE, "dup-1", null, T0, null);
    ActionRecord clash =
        new ActionRecord(
            ActionRecord.UNASSIGNED, first.caseNumber(), ActionKind.NOTE, "dup-2", null, "mod-1",
            null, null, null, null, null, T0, null, false, null, false, null);

    StoreException e = assertThrows(StoreException.class, () -> store.insert(clash));
    assertEquals(ErrorCode.DUPLICATE_KEY, e.errorCode());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            store.insert(
                new ActionRecord(
                    ActionRecord.UNASSIGNED, ActionRecord.UNASSIGNED, ActionKind.NOTE, "dup-3",
                    null, "mod-1", null, null, null, null, null, T0, null, false, null, false,
                    null)));
  }

  @Test
  void roleIsPartOfTheMatchOnlyForRoleCarryingKinds() {
    ActionRecord older = insert(ActionKind.ROLE_PERSIST, "match-1", "vip", T0, 60_000L);
    ActionRecord newer = insert(ActionKind.ROLE_PERSIST, "match-1", "vip", T0 + 10, 60_000L);
    insert(ActionKind.ROLE_PERSIST, "match-1", "staff", T0 + 20, 60_000L);
    ActionRecord mute = insert(ActionKind.MUTE, "match-1", null, T0, 60_000L);

    List<ActionRecord> vip = store.findActiveFor(ActionKind.ROLE_PERSIST, "match-1", "vip");
    assertEquals(List.of(newer.id(), older.id()), vip.stream().map(ActionRecord::id).toList());
    assertEquals(
        List.of(mute.id()),
        store.findActiveFor(ActionKind.MUTE, "match-1", "ignored").stream()
            .map(ActionRecord::id)
            .toList());
    assertEquals(List.of(newer), store.findOtherActive(older));
    assertEquals(1L, store.countOtherActive(older));
    assertEquals(0L, store.countOtherActive(mute));
  }

  @Test
  void recentActiveHonoursTheWindowStart() {
    ActionRecord r = insert(ActionKind.BAN, "recent-1", null, T0, null);

    assertEquals(r, store.findRecentActive(ActionKind.BAN, "recent-1", null, T0 - 1).orElseThrow());
    assertTrue(store.findRecentActive(ActionKind.BAN, "recent-1", null, T0).isEmpty());
    assertTrue(store.findRecentActive(ActionKind.BAN, "other", null, T0 - 1).isEmpty());
  }

  @Test
  void removalIsConditionalOnTheRowBeingActive() {
    ActionRecord r = insert(ActionKind.TIMEOUT, "remove-1", null, T0, 60_000L);
    EditInfo by = new EditInfo("system", "Warden", "expired", T0 + 60_000L);

    assertTrue(store.markRemoved(r.id(), by, true));
    assertFalse(store.markRemoved(r.id(), new EditInfo("mod-2", "Other", "late", T0), false));
    assertFalse(store.markInactive(r.id()));

    ActionRecord after = store.findById(r.id()).orElseThrow();
    assertFalse(after.active());
    assertEquals(by, after.removed());
    assertTrue(after.autoRemoved());
    assertTrue(store.findActive(ActionKind.TIMEOUT).stream().noneMatch(a -> a.id() == r.id()));
  }

  @Test
  void expungedRecordsLeaveTheDefaultHistory() {
    ActionRecord older = insert(ActionKind.WARN, "hist-1", null, T0, null);
    ActionRecord newer = insert(ActionKind.MUTE, "hist-1", null, T0 + 5, 60_000L);
    EditInfo by = new EditInfo("mod-1", "Mod", "mistake", T0 + 10);

    assertTrue(store.markExpunged(older.id(), by));
    assertFalse(store.markExpunged(older.id(), by));

    assertEquals(List.of(newer), store.history("hist-1", false));
    List<ActionRecord> all = store.history("hist-1", true);
    assertEquals(2, all.size());
    assertEquals(newer.id(), all.get(0).id());
    assertEquals(by, all.get(1).expunged());
  }

  @Test
  void durationEditCanReactivateAnEndedRecord() {
    ActionRecord r = insert(ActionKind.MUTE, "dur-1", null, T0, 60_000L);
    store.markRemoved(r.id(), new EditInfo("system", "Warden", "expired", T0 + 60_000L), true);

    assertTrue(store.updateDuration(r.id(), 600_000L, true));

    ActionRecord after = store.findById(r.id()).orElseThrow();
    assertTrue(after.active());
    assertNull(after.removed());
    assertFalse(after.autoRemoved());
    assertEquals(600_000L, after.durationMs());

    assertTrue(store.updateDuration(r.id(), null, false));
    assertNull(store.findById(r.id()).orElseThrow().durationMs());
    assertFalse(store.updateDuration(888_888L, 1L, false));
  }

  @Test
  void reasonEditReportsExistenceEvenWhenUnchanged() {
    ActionRecord r = insert(ActionKind.KICK, "reason-1", null, T0, null);

    assertTrue(store.updateReason(r.id(), "reason"));
    assertTrue(store.updateReason(r.id(), "rewritten"));
    assertEquals("rewritten", store.findById(r.id()).orElseThrow().reason());
    assertFalse(store.updateReason(777_777L, "nobody"));
  }

  @Test
  void countsGroupByKind() {
    Map<ActionKind, Long> totalBefore = store.countByKind();
    Map<ActionKind, Long> activeBefore = store.countActiveByKind();
    ActionRecord a = insert(ActionKind.SOFTBAN, "count-1", null, T0, null);
    insert(ActionKind.SOFTBAN, "count-2", null, T0, null);

    assertEquals(
        totalBefore.getOrDefault(ActionKind.SOFTBAN, 0L) + 2,
        store.countByKind().get(ActionKind.SOFTBAN));
    assertEquals(
        activeBefore.getOrDefault(ActionKind.SOFTBAN, 0L),
        store.countActiveByKind().getOrDefault(ActionKind.SOFTBAN, 0L));
    assertFalse(a.active());
  }
}
