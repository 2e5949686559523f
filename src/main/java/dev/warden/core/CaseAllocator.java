/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide mutual exclusion for issuance plus the case number sequence.
 *
 * <p>Everything that has to happen atomically with respect to other issuances (duplicate check,
 * effect application, numbering, persistence, scheduling) runs inside {@link #locked}. Case numbers
 * can only be drawn from the {@link CaseNumbers} handle passed into the section, so numbering never
 * happens outside the lock. The lock is fair: waiting issuers proceed in arrival order.
 */
public final class CaseAllocator {
  static final String COUNTER_NAME = "moderation";

  /** Work performed while holding the issuance lock. */
  @FunctionalInterface
  public interface CriticalSection<T> {
    T run(CaseNumbers numbers);
  }

  /** Case number source, valid only inside the section it was handed to. */
  public interface CaseNumbers {
    /**
     * Draws the next case number.
     *
     * @return strictly greater than every number drawn before
     */
    long next();
  }

  private final ReentrantLock lock = new ReentrantLock(true);
  private final CaseCounter counter;

  /**
   * Creates the allocator.
   *
   * @param counter persistent counter backing case numbers
   */
  public CaseAllocator(CaseCounter counter) {
    this.counter = Objects.requireNonNull(counter, "counter");
  }

  /**
   * Runs {@code section} while holding the issuance lock. The lock is released on every exit path.
   *
   * @param section work to run
   * @param <T> result type
   * @return the section's result
   */
  public <T> T locked(CriticalSection<T> section) {
    Objects.requireNonNull(section, "section");
    lock.lock();
    Handle handle = new Handle();
    try {
      return section.run(handle);
    } finally {
      handle.open = false;
      lock.unlock();
    }
  }

  /**
   * Whether the calling thread currently holds the issuance lock.
   *
   * @return {@code true} inside a critical section
   */
  public boolean heldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  private final class Handle implements CaseNumbers {
    private volatile boolean open = true;

    @Override
    public long next() {
      if (!open || !lock.isHeldByCurrentThread()) {
        throw new IllegalStateException("case numbers may only be drawn inside the issuance lock");
      }
      return counter.incrementAndGet(COUNTER_NAME);
    }
  }
}
