/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionRecord;
import dev.warden.api.CaseControl;
import dev.warden.api.CaseEditResult;
import dev.warden.api.EditInfo;
import dev.warden.api.ErrorCode;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store-backed {@link CaseControl}. Every successful edit is published on the {@link UpdateBus} so
 * the owning controller reschedules, re-applies or removes the effect.
 */
public final class CaseControlImpl implements CaseControl {
  private static final Logger LOG = LoggerFactory.getLogger("warden");

  private final ModerationStore store;
  private final UpdateBus bus;
  private final Clock clock;

  /**
   * Creates the case editor.
   *
   * @param store moderation store
   * @param bus bus receiving {@code updated} events
   * @param clock clock stamping expunges
   */
  public CaseControlImpl(ModerationStore store, UpdateBus bus, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<ActionRecord> lookup(long caseNumber) {
    return store.findByCase(caseNumber);
  }

  @Override
  public List<ActionRecord> history(String subjectId, boolean includeExpunged) {
    Objects.requireNonNull(subjectId, "subjectId");
    return store.history(subjectId, includeExpunged);
  }

  @Override
  public CaseEditResult updateReason(long caseNumber, String reason) {
    Optional<ActionRecord> found = store.findByCase(caseNumber);
    if (found.isEmpty()) {
      return notFound(caseNumber);
    }
    store.updateReason(found.get().id(), reason);
    return published("reason", caseNumber, found.get().withReason(reason));
  }

  @Override
  public CaseEditResult updateDuration(long caseNumber, Long durationMs) {
    if (durationMs != null && durationMs <= 0) {
      return CaseEditResult.failure(ErrorCode.INVALID_DURATION, "duration must be positive");
    }
    Optional<ActionRecord> found = store.findByCase(caseNumber);
    if (found.isEmpty()) {
      return notFound(caseNumber);
    }
    ActionRecord r = found.get();
    if (r.kind().onceOff()) {
      return CaseEditResult.failure(
          ErrorCode.CASE_NOT_DURABLE, r.kind().id() + " cases do not have a duration");
    }
    // only a natural expiry is undone by a new duration; manual removals and expunges stay ended
    boolean reactivate = !r.active() && r.autoRemoved() && r.expunged() == null;
    store.updateDuration(r.id(), durationMs, reactivate);
    ActionRecord edited = r.withDuration(durationMs);
    if (reactivate) {
      edited = edited.withState(true, null, false, null);
    }
    return published("duration", caseNumber, edited);
  }

  @Override
  public CaseEditResult expunge(long caseNumber, String actorId, String actorName, String reason) {
    Objects.requireNonNull(actorId, "actorId");
    Optional<ActionRecord> found = store.findByCase(caseNumber);
    if (found.isEmpty()) {
      return notFound(caseNumber);
    }
    ActionRecord r = found.get();
    if (r.expunged() != null) {
      return CaseEditResult.success(r);
    }
    EditInfo expunged = new EditInfo(actorId, actorName, reason, clock.millis());
    store.markExpunged(r.id(), expunged);
    return published(
        "expunge", caseNumber, r.withState(false, r.removed(), r.autoRemoved(), expunged));
  }

  private CaseEditResult published(String edit, long caseNumber, ActionRecord fallback) {
    ActionRecord current = store.findByCase(caseNumber).orElse(fallback);
    bus.fireUpdated(current);
    LOG.info(
        "(warden) op={} case={} kind={} active={}",
        "case." + edit,
        caseNumber,
        current.kind().id(),
        current.active());
    return CaseEditResult.success(current);
  }

  private static CaseEditResult notFound(long caseNumber) {
    return CaseEditResult.failure(ErrorCode.CASE_NOT_FOUND, "case " + caseNumber + " not found");
  }
}
