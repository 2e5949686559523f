/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionRecord;
import dev.warden.api.events.ModerationEvents;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous in-process bus for action record changes.
 *
 * <p>Each subject has a dedicated serial queue to guarantee publish-order delivery while still
 * allowing concurrent dispatch for different subjects. The bus is owned by the composition root and
 * handed to every controller explicitly.
 */
public final class UpdateBus implements ModerationEvents, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("warden");

  private final List<Consumer<ActionRecord>> issued = new CopyOnWriteArrayList<>();
  private final List<Consumer<ActionRecord>> updated = new CopyOnWriteArrayList<>();
  private final List<Consumer<ActionRecord>> lifted = new CopyOnWriteArrayList<>();
  private final Map<String, SubjectQueue> queues = new ConcurrentHashMap<>();
  private final Executor executor;
  private final ExecutorService owned;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Creates a new bus with a daemon thread pool sized for the host. */
  public UpdateBus() {
    this(createExecutor());
  }

  private UpdateBus(ExecutorService executor) {
    this.executor = executor;
    this.owned = executor;
  }

  /**
   * Creates a bus dispatching on the given executor. The caller keeps ownership of the executor.
   *
   * @param executor executor running handler batches (e.g. {@code Runnable::run} for inline)
   */
  public UpdateBus(Executor executor) {
    this.executor = executor;
    this.owned = null;
  }

  private static ExecutorService createExecutor() {
    int threads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r, "warden-events");
          t.setDaemon(true);
          return t;
        };
    return Executors.newFixedThreadPool(threads, factory);
  }

  @Override
  public AutoCloseable onIssued(Consumer<ActionRecord> h) {
    issued.add(h);
    return () -> issued.remove(h);
  }

  @Override
  public AutoCloseable onUpdated(Consumer<ActionRecord> h) {
    updated.add(h);
    return () -> updated.remove(h);
  }

  @Override
  public AutoCloseable onLifted(Consumer<ActionRecord> h) {
    lifted.add(h);
    return () -> lifted.remove(h);
  }

  /**
   * Publishes a newly issued record.
   *
   * @param record issued record
   */
  public void fireIssued(ActionRecord record) {
    publish("issued", issued, record);
  }

  /**
   * Publishes an externally edited record.
   *
   * @param record record after the edit
   */
  public void fireUpdated(ActionRecord record) {
    publish("updated", updated, record);
  }

  /**
   * Publishes a record that has just ended.
   *
   * @param record record after it was marked inactive
   */
  public void fireLifted(ActionRecord record) {
    publish("lifted", lifted, record);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      if (owned != null) {
        owned.shutdownNow();
      }
      queues.clear();
      issued.clear();
      updated.clear();
      lifted.clear();
    }
  }

  private void publish(String event, List<Consumer<ActionRecord>> handlers, ActionRecord record) {
    if (record == null || closed.get()) return;
    enqueue(record.subjectId(), () -> dispatch(event, handlers, record));
  }

  private void dispatch(String event, List<Consumer<ActionRecord>> handlers, ActionRecord record) {
    for (Consumer<ActionRecord> handler : handlers) {
      try {
        handler.accept(record);
      } catch (RuntimeException e) {
        LOG.warn(
            "(warden) op={} message={} case={} kind={}",
            "bus." + event,
            e.getMessage(),
            record.caseNumber(),
            record.kind().id(),
            e);
      }
    }
  }

  private void enqueue(String subject, Runnable task) {
    SubjectQueue queue = queues.computeIfAbsent(subject, id -> new SubjectQueue());
    queue.tasks.add(task);
    if (queue.draining.compareAndSet(false, true)) {
      executor.execute(() -> drain(subject, queue));
    }
  }

  private void drain(String subject, SubjectQueue queue) {
    while (true) {
      Runnable next = queue.tasks.poll();
      if (next == null) {
        if (queue.draining.compareAndSet(true, false)) {
          if (queue.tasks.isEmpty()) {
            if (queues.remove(subject, queue)) {
              Runnable extra;
              while ((extra = queue.tasks.poll()) != null) {
                enqueue(subject, extra);
              }
            }
            return;
          }
          if (!queue.draining.compareAndSet(false, true)) {
            return;
          }
          continue;
        }
        return;
      }
      next.run();
    }
  }

  private static final class SubjectQueue {
    final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    final AtomicBoolean draining = new AtomicBoolean(false);
  }
}
