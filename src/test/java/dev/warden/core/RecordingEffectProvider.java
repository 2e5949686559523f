/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionRecord;
import dev.warden.api.EffectException;
import dev.warden.api.EffectProvider;
import dev.warden.api.EffectTarget;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Effect provider that tracks applied targets in memory and can be told to fail. */
final class RecordingEffectProvider implements EffectProvider {
  private final Set<EffectTarget> applied = new HashSet<>();
  private final List<String> calls = new ArrayList<>();
  private boolean failApply;
  private boolean failRemove;
  private Runnable beforeNextLookup;

  synchronized void failApply(boolean fail) {
    this.failApply = fail;
  }

  synchronized void failRemove(boolean fail) {
    this.failRemove = fail;
  }

  /** Simulates the platform dropping an effect (e.g. the subject left and rejoined). */
  synchronized void drop(EffectTarget target) {
    applied.remove(target);
  }

  /** Simulates an effect applied outside Warden. */
  synchronized void plant(EffectTarget target) {
    applied.add(target);
  }

  /** Runs {@code action} once, at the start of the next {@link #isApplied} lookup. */
  synchronized void beforeNextLookup(Runnable action) {
    this.beforeNextLookup = action;
  }

  synchronized boolean applied(EffectTarget target) {
    return applied.contains(target);
  }

  synchronized List<String> calls() {
    return List.copyOf(calls);
  }

  synchronized long count(String prefix) {
    return calls.stream().filter(c -> c.startsWith(prefix)).count();
  }

  @Override
  public synchronized void apply(ActionRecord record) throws EffectException {
    calls.add("apply:" + record.subjectId());
    if (failApply) {
      throw new EffectException("platform refused apply for " + record.subjectId());
    }
    applied.add(EffectTarget.of(record));
  }

  @Override
  public synchronized void remove(ActionRecord record) throws EffectException {
    calls.add("remove:" + record.subjectId());
    if (failRemove) {
      throw new EffectException("platform refused remove for " + record.subjectId());
    }
    applied.remove(EffectTarget.of(record));
  }

  @Override
  public boolean isApplied(EffectTarget target) {
    Runnable hook;
    synchronized (this) {
      hook = beforeNextLookup;
      beforeNextLookup = null;
    }
    if (hook != null) {
      hook.run();
    }
    synchronized (this) {
      return applied.contains(target);
    }
  }

  @Override
  public synchronized void forceRemove(EffectTarget target) throws EffectException {
    calls.add("force:" + target.subjectId());
    if (failRemove) {
      throw new EffectException("platform refused remove for " + target.subjectId());
    }
    applied.remove(target);
  }
}
