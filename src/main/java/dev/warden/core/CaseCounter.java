/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

/** Named monotonically increasing counter persisted by the store. */
@FunctionalInterface
public interface CaseCounter {

  /**
   * Atomically increments the named counter, creating it at {@code 1} when absent.
   *
   * @param name counter name, e.g. {@code moderation}
   * @return the value after the increment
   * @throws StoreException when the store cannot be reached
   */
  long incrementAndGet(String name);
}
