/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ErrorCode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * "Wake me at time T for item X" primitive backed by a single rearmable timer.
 *
 * <p>Items are kept sorted by wake time (ties in insertion order). When the timer fires, every due
 * item is taken off the list and handed to the handler one after another on the executor thread;
 * then the timer is rearmed for the new earliest item, or left idle. The handler never runs while
 * the internal lock is held, so it may call {@link #insert} and {@link #remove} on this scheduler.
 * A handler failure is logged and alerted and does not stop the rest of the batch.
 *
 * @param <T> scheduled item
 * @param <K> equality-comparable key used for removal
 */
public final class ExpiryScheduler<T, K> implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("warden");

  /** Callback for due items. */
  @FunctionalInterface
  public interface Handler<T> {
    void handle(T item) throws Exception;
  }

  private final String name;
  private final ScheduledExecutorService executor;
  private final Clock clock;
  private final Handler<T> handler;
  private final OperatorAlerts alerts;

  private final Object lock = new Object();
  private final List<Entry<T, K>> entries = new ArrayList<>();
  private final List<Entry<T, K>> inFlight = new ArrayList<>();
  private ScheduledFuture<?> timer;
  private long armedFor = Long.MAX_VALUE;
  private boolean dispatching;
  private boolean closed;

  /**
   * Creates an idle scheduler.
   *
   * @param name short name used in logs and alerts, e.g. {@code mute}
   * @param executor executor whose timer drives the wake-ups
   * @param clock wall clock for wake times
   * @param handler callback for due items
   * @param alerts sink for handler failures
   */
  public ExpiryScheduler(
      String name,
      ScheduledExecutorService executor,
      Clock clock,
      Handler<T> handler,
      OperatorAlerts alerts) {
    this.name = Objects.requireNonNull(name, "name");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.alerts = Objects.requireNonNull(alerts, "alerts");
  }

  /**
   * Adds one item.
   *
   * @param wakeAtMs epoch milliseconds at which the item becomes due
   * @param item item handed to the handler
   * @param key removal key
   */
  public void insert(long wakeAtMs, T item, K key) {
    synchronized (lock) {
      if (closed) return;
      insertLocked(new Entry<>(wakeAtMs, item, key));
      rearmLocked();
    }
  }

  /**
   * Adds several items, rearming at most once.
   *
   * @param items wake time to item, keyed for removal
   */
  public void bulkInsert(Collection<Scheduled<T, K>> items) {
    synchronized (lock) {
      if (closed) return;
      for (Scheduled<T, K> s : items) {
        insertLocked(new Entry<>(s.wakeAtMs(), s.item(), s.key()));
      }
      rearmLocked();
    }
  }

  /**
   * Removes every item whose key equals {@code key}, including items of the batch currently being
   * dispatched that have not been handed out yet. No-op when absent.
   *
   * @param key removal key
   * @return number of items removed
   */
  public int remove(K key) {
    synchronized (lock) {
      int removed = 0;
      Iterator<Entry<T, K>> it = entries.iterator();
      while (it.hasNext()) {
        if (Objects.equals(it.next().key, key)) {
          it.remove();
          removed++;
        }
      }
      for (Entry<T, K> e : inFlight) {
        if (!e.cancelled && Objects.equals(e.key, key)) {
          e.cancelled = true;
          removed++;
        }
      }
      if (entries.isEmpty()) {
        cancelTimerLocked();
      }
      return removed;
    }
  }

  /**
   * Number of pending items.
   *
   * @return pending item count
   */
  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  /**
   * Earliest pending wake time.
   *
   * @return epoch milliseconds, or empty when idle
   */
  public OptionalLong nextWakeMs() {
    synchronized (lock) {
      return entries.isEmpty() ? OptionalLong.empty() : OptionalLong.of(entries.get(0).wakeAtMs);
    }
  }

  /**
   * Snapshot of pending wake times per key, in dispatch order.
   *
   * @return ordered key to wake time entries
   */
  public List<Map.Entry<K, Long>> pending() {
    synchronized (lock) {
      List<Map.Entry<K, Long>> out = new ArrayList<>(entries.size());
      for (Entry<T, K> e : entries) {
        out.add(Map.entry(e.key, e.wakeAtMs));
      }
      return out;
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      closed = true;
      cancelTimerLocked();
      entries.clear();
      inFlight.clear();
    }
  }

  private void insertLocked(Entry<T, K> entry) {
    int lo = 0;
    int hi = entries.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (entries.get(mid).wakeAtMs <= entry.wakeAtMs) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    entries.add(lo, entry);
  }

  private void rearmLocked() {
    if (closed || dispatching) {
      return;
    }
    if (entries.isEmpty()) {
      cancelTimerLocked();
      return;
    }
    long earliest = entries.get(0).wakeAtMs;
    if (timer != null && armedFor <= earliest) {
      return;
    }
    cancelTimerLocked();
    long delayMs = Math.max(0L, earliest - clock.millis());
    try {
      timer = executor.schedule(this::tick, delayMs, TimeUnit.MILLISECONDS);
      armedFor = earliest;
    } catch (RejectedExecutionException e) {
      LOG.warn("(warden) expiry[{}]: executor rejected timer", name, e);
    }
  }

  private void cancelTimerLocked() {
    ScheduledFuture<?> prev = timer;
    timer = null;
    armedFor = Long.MAX_VALUE;
    if (prev != null) {
      prev.cancel(false);
    }
  }

  private void tick() {
    synchronized (lock) {
      timer = null;
      armedFor = Long.MAX_VALUE;
      if (closed || dispatching) {
        return;
      }
      long now = clock.millis();
      Iterator<Entry<T, K>> it = entries.iterator();
      while (it.hasNext()) {
        Entry<T, K> e = it.next();
        if (e.wakeAtMs > now) {
          break;
        }
        it.remove();
        inFlight.add(e);
      }
      dispatching = true;
    }
    try {
      for (int i = 0; ; i++) {
        Entry<T, K> next;
        synchronized (lock) {
          if (i >= inFlight.size()) {
            break;
          }
          next = inFlight.get(i);
          if (next.cancelled) {
            continue;
          }
        }
        dispatch(next);
      }
    } finally {
      synchronized (lock) {
        inFlight.clear();
        dispatching = false;
        rearmLocked();
      }
    }
  }

  private void dispatch(Entry<T, K> entry) {
    try {
      handler.handle(entry.item);
    } catch (Exception e) {
      ErrorCode code =
          e instanceof StoreException store ? store.errorCode() : ErrorCode.CALLBACK_FAILED;
      LOG.warn(
          "(warden) code={} op={} message={} key={}",
          code,
          "expiry." + name,
          e.getMessage(),
          entry.key,
          e);
      alerts.alert(code, "expiry." + name, "expiry handler failed for " + entry.key, e);
    }
  }

  /**
   * One item to schedule.
   *
   * @param wakeAtMs epoch milliseconds
   * @param item item
   * @param key removal key
   */
  public record Scheduled<T, K>(long wakeAtMs, T item, K key) {}

  private static final class Entry<T, K> {
    final long wakeAtMs;
    final T item;
    final K key;
    boolean cancelled;

    Entry(long wakeAtMs, T item, K key) {
      this.wakeAtMs = wakeAtMs;
      this.item = item;
      this.key = key;
    }
  }
}
