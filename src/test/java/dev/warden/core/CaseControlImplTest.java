/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import static dev.warden.core.LifecycleHarness.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.warden.api.ActionKind;
import dev.warden.api.ActionRecord;
import dev.warden.api.CaseEditResult;
import dev.warden.api.EffectTarget;
import dev.warden.api.ErrorCode;
import dev.warden.api.IssueRequest;
import dev.warden.api.RevokeRequest;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class CaseControlImplTest {
  private LifecycleHarness h;
  private ModerationController mutes;
  private CaseControlImpl cases;

  @BeforeEach
  void setUp() {
    h = new LifecycleHarness();
    mutes = h.controller(ActionKind.MUTE);
    cases = h.cases();
  }

  @AfterEach
  void tearDown() {
    h.close();
  }

  @Test
  void extendingADurationMovesTheExpiry() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", 60_000L, null)).record();

    CaseEditResult edit = cases.updateDuration(r.caseNumber(), 120_000L);
    assertTrue(edit.ok());
    assertEquals(120_000L, edit.record().durationMs());

    h.executor.advanceTo(T0 + 60_001);
    assertTrue(h.current(r).active());
    assertEquals(0, h.effects.count("remove:"));

    h.executor.advanceTo(T0 + 120_001);
    assertFalse(h.current(r).active());
    assertEquals(1, h.effects.count("remove:"));
  }

  @Test
  void makingADurationPermanentCancelsTheExpiry() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", 60_000L, null)).record();

    cases.updateDuration(r.caseNumber(), null);
    h.executor.advanceTo(T0 + 3_600_000L);

    assertTrue(h.current(r).active());
    assertEquals(0, mutes.scheduler().size());
  }

  @Test
  void shorteningBelowElapsedTimeExpiresImmediately() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", 3_600_000L, null)).record();
    h.clock.set(T0 + 120_000L);

    cases.updateDuration(r.caseNumber(), 60_000L);
    h.executor.runDue();

    assertFalse(h.current(r).active());
    assertTrue(h.current(r).autoRemoved());
  }

  @Test
  void newDurationReactivatesANaturallyExpiredRecord() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", 1_000L, null)).record();
    h.executor.advanceTo(T0 + 1_001);
    assertFalse(h.current(r).active());

    CaseEditResult edit = cases.updateDuration(r.caseNumber(), 3_600_000L);

    assertTrue(edit.ok());
    assertTrue(edit.record().active());
    assertTrue(h.effects.isApplied(EffectTarget.of(r)));
    assertEquals(2, h.effects.count("apply:"));
    assertEquals(1, mutes.scheduler().size());
  }

  @Test
  void newDurationDoesNotReviveAManualRevoke() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", 60_000L, null)).record();
    mutes.revoke(RevokeRequest.of("U1", "mod", "appeal"));

    CaseEditResult edit = cases.updateDuration(r.caseNumber(), 3_600_000L);

    assertTrue(edit.ok());
    assertFalse(edit.record().active());
    assertFalse(h.effects.isApplied(EffectTarget.of(r)));
  }

  @Test
  void expungingAnActiveRecordLiftsTheEffect() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", null, null)).record();

    CaseEditResult edit = cases.expunge(r.caseNumber(), "admin", "Admin", "mistake");

    assertTrue(edit.ok());
    ActionRecord after = h.current(r);
    assertFalse(after.active());
    assertNotNull(after.expunged());
    assertEquals("admin", after.expunged().actorId());
    assertFalse(h.effects.isApplied(EffectTarget.of(r)));
    assertTrue(cases.history("U1", false).isEmpty());
    assertEquals(1, cases.history("U1", true).size());
  }

  @Test
  void expungeIsIdempotent() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", null, null)).record();
    List<ActionRecord> updates = new ArrayList<>();
    h.bus.onUpdated(updates::add);

    cases.expunge(r.caseNumber(), "admin", "Admin", "mistake");
    CaseEditResult again = cases.expunge(r.caseNumber(), "other", "Other", "again");

    assertTrue(again.ok());
    assertEquals("admin", again.record().expunged().actorId());
    assertEquals(1, updates.size());
  }

  @Test
  void expungingOneOfTwoKeepsTheEffect() {
    ModerationController roles = h.controller(ActionKind.ROLE_PERSIST, 0L);
    ActionRecord a =
        roles.issue(IssueRequest.of("U1", "mod", null, null).withRole("R", "R")).record();
    roles.issue(IssueRequest.of("U1", "mod", null, null).withRole("R", "R"));

    cases.expunge(a.caseNumber(), "admin", "Admin", null);

    assertTrue(h.effects.isApplied(EffectTarget.of(a)));
    assertEquals(0, h.effects.count("remove:"));
  }

  @Test
  void reasonEditsArePublished() {
    ActionRecord r = mutes.issue(IssueRequest.of("U1", "mod", null, "first")).record();

    CaseEditResult edit = cases.updateReason(r.caseNumber(), "second");

    assertTrue(edit.ok());
    assertEquals("second", cases.lookup(r.caseNumber()).orElseThrow().reason());
    assertTrue(h.current(r).active());
  }

  @Test
  void unknownCasesAndInvalidEditsAreRejected() {
    ModerationController warns = h.controller(ActionKind.WARN);
    ActionRecord warn = warns.issue(IssueRequest.of("U1", "mod", null, null)).record();

    assertEquals(ErrorCode.CASE_NOT_FOUND, cases.updateReason(999L, "x").code());
    assertEquals(ErrorCode.CASE_NOT_FOUND, cases.expunge(999L, "a", "A", null).code());
    assertEquals(ErrorCode.INVALID_DURATION, cases.updateDuration(warn.caseNumber(), -5L).code());
    assertEquals(
        ErrorCode.CASE_NOT_DURABLE, cases.updateDuration(warn.caseNumber(), 60_000L).code());
  }
}
