/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionKind;
import dev.warden.api.ActionRecord;
import dev.warden.api.EditInfo;
import dev.warden.api.EffectException;
import dev.warden.api.EffectProvider;
import dev.warden.api.EffectTarget;
import dev.warden.api.ErrorCode;
import dev.warden.api.IssueRequest;
import dev.warden.api.IssueResult;
import dev.warden.api.Moderation;
import dev.warden.api.MultiIssueReport;
import dev.warden.api.RevokeRequest;
import dev.warden.api.RevokeResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle engine for one action kind.
 *
 * <p>Owns the kind's {@link ExpiryScheduler} and its {@link EffectProvider}. Issuance, expiry and
 * revocation all take the {@link CaseAllocator} lock, so the reference-count decision ("is another
 * active record still holding this effect?") is never interleaved with an issuance for the same
 * subject. External edits arrive through the {@link UpdateBus}.
 */
public final class ModerationController implements Moderation, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("warden");
  private static final int REVOKE_ATTEMPTS = 3;

  private final ActionKind kind;
  private final EffectProvider effects;
  private final LifecycleContext ctx;
  private final ExpiryScheduler<ActionRecord, Long> scheduler;
  private final AutoCloseable updateSubscription;

  /**
   * Creates the controller and subscribes it to update events for its kind.
   *
   * @param kind action kind handled
   * @param effects external effect provider for the kind
   * @param ctx shared collaborators
   */
  public ModerationController(ActionKind kind, EffectProvider effects, LifecycleContext ctx) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.effects = Objects.requireNonNull(effects, "effects");
    this.ctx = Objects.requireNonNull(ctx, "ctx");
    this.scheduler =
        new ExpiryScheduler<>(
            kind.id(), ctx.executor(), ctx.clock(), this::handleExpire, ctx.alerts());
    this.updateSubscription = ctx.bus().onUpdated(this::onUpdated);
  }

  @Override
  public ActionKind kind() {
    return kind;
  }

  /**
   * Pending expiry items, for diagnostics and tests.
   *
   * @return the kind's scheduler
   */
  ExpiryScheduler<ActionRecord, Long> scheduler() {
    return scheduler;
  }

  // ---- issuance ----

  @Override
  public IssueResult issue(IssueRequest request) {
    Objects.requireNonNull(request, "request");
    IssueResult result;
    try {
      result = issueChecked(request);
    } catch (StoreException e) {
      ctx.metrics().recordStoreFailure();
      ctx.alerts()
          .alert(
              e.errorCode(),
              op("issue"),
              "store failure while issuing for " + request.subjectId(),
              e);
      throw e;
    }
    ctx.metrics().recordIssue(result);
    return result;
  }

  @Override
  public MultiIssueReport multiIssue(List<IssueRequest> requests) {
    List<MultiIssueReport.Entry> entries = new ArrayList<>(requests.size());
    for (IssueRequest request : requests) {
      IssueResult result;
      try {
        result = issue(request);
      } catch (StoreException e) {
        result = IssueResult.rejected(e.errorCode(), e.getMessage());
      }
      entries.add(new MultiIssueReport.Entry(request.subjectId(), result));
    }
    return new MultiIssueReport(entries);
  }

  private IssueResult issueChecked(IssueRequest request) {
    IssueResult invalid = validate(request);
    if (invalid != null) {
      return invalid;
    }
    Optional<ActionRecord> early = recentDuplicate(request);
    if (early.isPresent()) {
      return IssueResult.duplicate(early.get());
    }
    return ctx.allocator()
        .locked(
            numbers -> {
              Optional<ActionRecord> dup = recentDuplicate(request);
              if (dup.isPresent()) {
                return IssueResult.duplicate(dup.get());
              }
              ActionRecord draft = draft(request, ctx.clock().millis());
              try {
                effects.apply(draft);
              } catch (EffectException e) {
                ctx.metrics().recordEffectFailure();
                ctx.alerts()
                    .alert(
                        ErrorCode.EFFECT_FAILED,
                        op("issue"),
                        "apply failed for " + request.subjectId(),
                        e);
                return IssueResult.rejected(ErrorCode.EFFECT_FAILED, e.getMessage());
              }
              ActionRecord stored;
              try {
                long caseNumber = numbers.next();
                stored =
                    ctx.store().insert(draft.withIdentity(ActionRecord.UNASSIGNED, caseNumber));
              } catch (StoreException e) {
                ctx.alerts()
                    .alert(
                        ErrorCode.INCONSISTENT_RECORD,
                        op("issue"),
                        "effect applied to " + request.subjectId() + " without a stored record",
                        e);
                throw e;
              }
              if (stored.active() && stored.durationMs() != null) {
                scheduler.insert(stored.endsAtMs(), stored, stored.id());
              }
              ctx.bus().fireIssued(stored);
              LOG.info(
                  "(warden) op={} case={} subject={} issuer={} durationMs={}",
                  op("issue"),
                  stored.caseNumber(),
                  stored.subjectId(),
                  stored.issuerId(),
                  stored.durationMs());
              return IssueResult.issued(stored);
            });
  }

  private IssueResult validate(IssueRequest request) {
    if (request.subjectId().equals(request.issuerId())) {
      return IssueResult.rejected(ErrorCode.SELF_TARGET, "cannot " + kind.id() + " yourself");
    }
    OptionalInt subjectRank = ctx.members().rankOf(request.subjectId());
    if (subjectRank.isPresent()) {
      OptionalInt issuerRank = ctx.members().rankOf(request.issuerId());
      if (issuerRank.isEmpty() || issuerRank.getAsInt() <= subjectRank.getAsInt()) {
        return IssueResult.rejected(
            ErrorCode.INSUFFICIENT_RANK, "issuer does not outrank " + request.subjectId());
      }
    }
    Long duration = request.durationMs();
    if (duration != null && kind.onceOff()) {
      return IssueResult.rejected(
          ErrorCode.INVALID_DURATION, kind.id() + " does not take a duration");
    }
    if (duration != null && duration <= 0) {
      return IssueResult.rejected(ErrorCode.INVALID_DURATION, "duration must be positive");
    }
    boolean hasRole = request.roleId() != null && !request.roleId().isBlank();
    if (kind.carriesRole() && !hasRole) {
      return IssueResult.rejected(ErrorCode.INVALID_PAYLOAD, kind.id() + " requires a role");
    }
    if (!kind.carriesRole() && request.roleId() != null) {
      return IssueResult.rejected(ErrorCode.INVALID_PAYLOAD, kind.id() + " does not take a role");
    }
    return null;
  }

  private Optional<ActionRecord> recentDuplicate(IssueRequest request) {
    if (kind.onceOff()) {
      return Optional.empty();
    }
    long since = ctx.clock().millis() - ctx.settings().duplicateWindowMs();
    return ctx.store().findRecentActive(kind, request.subjectId(), request.roleId(), since);
  }

  private ActionRecord draft(IssueRequest request, long now) {
    return new ActionRecord(
        ActionRecord.UNASSIGNED,
        ActionRecord.UNASSIGNED,
        kind,
        request.subjectId(),
        request.subjectName(),
        request.issuerId(),
        request.issuerName(),
        request.roleId(),
        request.roleName(),
        request.reason(),
        request.link(),
        now,
        request.durationMs(),
        !kind.onceOff(),
        null,
        false,
        null);
  }

  // ---- expiry ----

  /**
   * Expiry callback for one scheduled record. The scheduled snapshot is only used for its id.
   *
   * @param scheduled record as it was when scheduled
   */
  void handleExpire(ActionRecord scheduled) {
    ctx.allocator()
        .locked(
            numbers -> {
              expire(scheduled);
              return null;
            });
  }

  private void expire(ActionRecord scheduled) {
    Optional<ActionRecord> current = ctx.store().findById(scheduled.id());
    if (current.isEmpty()) {
      ctx.alerts()
          .alert(
              ErrorCode.INCONSISTENT_RECORD,
              op("expire"),
              "case " + scheduled.caseNumber() + " vanished before expiry");
      return;
    }
    ActionRecord r = current.get();
    if (!r.active()) {
      LOG.debug("(warden) op={} case={} already inactive", op("expire"), r.caseNumber());
      return;
    }
    if (r.finalized()) {
      correctFinalized(r, op("expire"));
      return;
    }
    long now = ctx.clock().millis();
    Long end = r.endsAtMs();
    if (end == null || end > now + ctx.settings().expiryToleranceMs()) {
      ctx.alerts()
          .alert(
              ErrorCode.EXPIRED_EARLY,
              op("expire"),
              "case " + r.caseNumber() + " fired at " + now + " but ends at " + end);
      return;
    }
    if (ctx.store().countOtherActive(r) == 0) {
      EffectTarget target = EffectTarget.of(r);
      try {
        if (effects.isApplied(target)) {
          effects.remove(r);
        }
      } catch (EffectException e) {
        ctx.metrics().recordEffectFailure();
        ctx.alerts()
            .alert(
                ErrorCode.EFFECT_FAILED,
                op("expire"),
                "remove failed for case " + r.caseNumber() + "; record is closed anyway",
                e);
      }
    }
    EditInfo removed =
        new EditInfo(ctx.settings().systemActorId(), ctx.settings().systemActorName(), "Auto", now);
    if (ctx.store().markRemoved(r.id(), removed, true)) {
      ctx.metrics().recordExpired();
      ActionRecord ended = r.withState(false, removed, true, r.expunged());
      ctx.bus().fireLifted(ended);
      LOG.info(
          "(warden) op={} case={} subject={} message=expired",
          op("expire"),
          r.caseNumber(),
          r.subjectId());
    }
  }

  // ---- external edits ----

  private void onUpdated(ActionRecord record) {
    if (record.kind() != kind) {
      return;
    }
    try {
      handleUpdate(record);
    } catch (StoreException e) {
      ctx.alerts()
          .alert(
              e.errorCode(),
              op("update"),
              "store failure handling update for case " + record.caseNumber(),
              e);
    }
  }

  /**
   * Re-synchronizes the schedule and the external effect with an externally edited record.
   *
   * @param edited record after the edit
   */
  void handleUpdate(ActionRecord edited) {
    if (kind.onceOff()) {
      return;
    }
    ctx.allocator()
        .locked(
            numbers -> {
              resync(edited);
              return null;
            });
  }

  private void resync(ActionRecord edited) {
    scheduler.remove(edited.id());
    ActionRecord r = ctx.store().findById(edited.id()).orElse(edited);
    if (r.active() && r.finalized()) {
      correctFinalized(r, op("update"));
      r = r.withState(false, r.removed(), r.autoRemoved(), r.expunged());
    }
    if (r.active()) {
      Long end = r.endsAtMs();
      if (end != null) {
        scheduler.insert(end, r, r.id());
      }
      if (end != null && end <= ctx.clock().millis()) {
        return;
      }
      if (!ensureApplied(r, op("update"))) {
        return;
      }
      // the record can be closed while the provider is busy applying
      r = ctx.store().findById(r.id()).orElse(r);
      if (r.active() && !r.finalized()) {
        return;
      }
      scheduler.remove(r.id());
    }
    if (ctx.store().countOtherActive(r) == 0) {
      removeIfApplied(r, op("update"));
    }
  }

  private void correctFinalized(ActionRecord r, String op) {
    ctx.store().markInactive(r.id());
    ctx.alerts()
        .alert(
            ErrorCode.INCONSISTENT_RECORD,
            op,
            "case " + r.caseNumber() + " was active after removal or expunge; marked inactive");
  }

  // ---- revocation ----

  @Override
  public RevokeResult revoke(RevokeRequest request) {
    Objects.requireNonNull(request, "request");
    if (kind.onceOff()) {
      return RevokeResult.failure(ErrorCode.NOT_REVOCABLE, kind.id() + " cannot be revoked");
    }
    if (kind.carriesRole() && (request.roleId() == null || request.roleId().isBlank())) {
      return RevokeResult.failure(ErrorCode.INVALID_PAYLOAD, kind.id() + " requires a role");
    }
    try {
      return ctx.allocator().locked(numbers -> revokeLocked(request));
    } catch (StoreException e) {
      ctx.metrics().recordStoreFailure();
      ctx.alerts()
          .alert(
              e.errorCode(),
              op("revoke"),
              "store failure while revoking for " + request.subjectId(),
              e);
      throw e;
    }
  }

  private RevokeResult revokeLocked(RevokeRequest request) {
    long now = ctx.clock().millis();
    EditInfo removed =
        new EditInfo(request.issuerId(), request.issuerName(), request.reason(), now);
    for (int attempt = 0; attempt < REVOKE_ATTEMPTS; attempt++) {
      List<ActionRecord> candidates =
          ctx.store().findActiveFor(kind, request.subjectId(), request.roleId());
      if (candidates.isEmpty()) {
        break;
      }
      ActionRecord target = candidates.get(0);
      if (!ctx.store().markRemoved(target.id(), removed, false)) {
        continue;
      }
      scheduler.remove(target.id());
      ActionRecord ended = target.withState(false, removed, false, target.expunged());
      List<Long> remaining =
          ctx.store().findOtherActive(ended).stream().map(ActionRecord::caseNumber).toList();
      boolean effectRemoved = false;
      if (remaining.isEmpty()) {
        try {
          effects.remove(ended);
          effectRemoved = true;
        } catch (EffectException e) {
          ctx.metrics().recordEffectFailure();
          ctx.alerts()
              .alert(
                  ErrorCode.EFFECT_FAILED,
                  op("revoke"),
                  "remove failed for case " + ended.caseNumber() + "; record is closed anyway",
                  e);
        }
      }
      ctx.metrics().recordRevoked();
      ctx.bus().fireLifted(ended);
      LOG.info(
          "(warden) op={} case={} subject={} issuer={} remaining={}",
          op("revoke"),
          ended.caseNumber(),
          ended.subjectId(),
          request.issuerId(),
          remaining);
      return RevokeResult.revoked(ended, remaining, effectRemoved);
    }

    if (!request.allowMissingRecord()) {
      return RevokeResult.failure(
          ErrorCode.NO_ACTIVE_RECORD, "no active " + kind.id() + " for " + request.subjectId());
    }
    EffectTarget target = new EffectTarget(kind, request.subjectId(), request.roleId());
    try {
      effects.forceRemove(target);
    } catch (EffectException e) {
      ctx.metrics().recordEffectFailure();
      ctx.alerts()
          .alert(
              ErrorCode.EFFECT_FAILED,
              op("revoke"),
              "forced removal failed for " + request.subjectId(),
              e);
      return RevokeResult.failure(ErrorCode.EFFECT_FAILED, e.getMessage());
    }
    LOG.info(
        "(warden) op={} subject={} issuer={} message=forced removal without a record",
        op("revoke"),
        request.subjectId(),
        request.issuerId());
    return RevokeResult.forced(true);
  }

  // ---- recovery ----

  /**
   * Rebuilds the schedule from the store and re-applies effects that went missing while the
   * process was down. Safe to run more than once.
   *
   * @return number of effects re-applied
   */
  public int recover() {
    if (kind.onceOff()) {
      return 0;
    }
    List<ActionRecord> active = ctx.store().findActive(kind);
    List<ExpiryScheduler.Scheduled<ActionRecord, Long>> wakeups = new ArrayList<>();
    for (ActionRecord r : active) {
      scheduler.remove(r.id());
      if (r.finalized()) {
        wakeups.add(new ExpiryScheduler.Scheduled<>(r.issuedAtMs(), r, r.id()));
      } else if (r.durationMs() != null) {
        wakeups.add(new ExpiryScheduler.Scheduled<>(r.endsAtMs(), r, r.id()));
      }
    }
    wakeups.sort(Comparator.comparingLong(ExpiryScheduler.Scheduled::wakeAtMs));
    scheduler.bulkInsert(wakeups);

    long now = ctx.clock().millis();
    List<ActionRecord> byEnd = new ArrayList<>(active);
    byEnd.sort(
        Comparator.comparing(
            ActionRecord::endsAtMs, Comparator.nullsLast(Comparator.naturalOrder())));
    int reapplied = 0;
    for (ActionRecord r : byEnd) {
      if (r.finalized()) {
        ctx.alerts()
            .alert(
                ErrorCode.INCONSISTENT_RECORD,
                op("recover"),
                "case " + r.caseNumber() + " is active but already removed or expunged");
        continue;
      }
      Long end = r.endsAtMs();
      if (end != null && end <= now) {
        LOG.debug(
            "(warden) op={} case={} message=already ended; left to expiry",
            op("recover"),
            r.caseNumber());
        continue;
      }
      if (ensureApplied(r, op("recover"))) {
        reapplied++;
      }
    }
    LOG.info(
        "(warden) op={} active={} scheduled={} reapplied={}",
        op("recover"),
        active.size(),
        wakeups.size(),
        reapplied);
    return reapplied;
  }

  @Override
  public int reapplyFor(String subjectId) {
    if (!kind.persisted()) {
      return 0;
    }
    long now = ctx.clock().millis();
    Map<EffectTarget, ActionRecord> targets = new LinkedHashMap<>();
    for (ActionRecord r : ctx.store().history(subjectId, true)) {
      if (r.kind() != kind || !r.active() || r.finalized()) {
        continue;
      }
      Long end = r.endsAtMs();
      if (end != null && end <= now) {
        continue;
      }
      targets.putIfAbsent(EffectTarget.of(r), r);
    }
    return ctx.allocator()
        .locked(
            numbers -> {
              int reapplied = 0;
              for (ActionRecord r : targets.values()) {
                ActionRecord latest = ctx.store().findById(r.id()).orElse(r);
                if (latest.active()
                    && !latest.finalized()
                    && ensureApplied(latest, op("reapply"))) {
                  reapplied++;
                }
              }
              return reapplied;
            });
  }

  private boolean ensureApplied(ActionRecord r, String op) {
    try {
      if (effects.isApplied(EffectTarget.of(r))) {
        return false;
      }
      effects.apply(r);
      LOG.info(
          "(warden) op={} case={} subject={} message=effect re-applied",
          op,
          r.caseNumber(),
          r.subjectId());
      return true;
    } catch (EffectException e) {
      ctx.metrics().recordEffectFailure();
      ctx.alerts()
          .alert(ErrorCode.EFFECT_FAILED, op, "re-apply failed for case " + r.caseNumber(), e);
      return false;
    }
  }

  private void removeIfApplied(ActionRecord r, String op) {
    try {
      if (effects.isApplied(EffectTarget.of(r))) {
        effects.remove(r);
      }
    } catch (EffectException e) {
      ctx.metrics().recordEffectFailure();
      ctx.alerts()
          .alert(ErrorCode.EFFECT_FAILED, op, "remove failed for case " + r.caseNumber(), e);
    }
  }

  private String op(String action) {
    return kind.id() + "." + action;
  }

  @Override
  public void close() {
    try {
      updateSubscription.close();
    } catch (Exception e) {
      LOG.debug("(warden) {} update subscription close issue", kind.id(), e);
    }
    scheduler.close();
  }
}
