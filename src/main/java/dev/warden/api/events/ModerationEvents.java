/* Warden © 2025 Warden Devs — MIT */
package dev.warden.api.events;

import dev.warden.api.ActionRecord;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe surface for action record changes.
 *
 * <p>Delivery is asynchronous, at-least-once within the process, and ordered per subject. Nothing
 * is persisted across restarts; startup reconciliation covers that gap.
 */
public interface ModerationEvents {
  /**
   * Subscribes to newly issued records.
   *
   * @param h handler
   * @return a handle to close and unsubscribe
   */
  AutoCloseable onIssued(Consumer<ActionRecord> h);

  /**
   * Subscribes to external edits (duration change, expunge, reason change).
   *
   * @param h handler
   * @return a handle to close and unsubscribe
   */
  AutoCloseable onUpdated(Consumer<ActionRecord> h);

  /**
   * Subscribes to records that ended (expiry, revocation).
   *
   * @param h handler
   * @return a handle to close and unsubscribe
   */
  AutoCloseable onLifted(Consumer<ActionRecord> h);
}
