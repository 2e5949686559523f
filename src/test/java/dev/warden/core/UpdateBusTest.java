/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.warden.api.ActionKind;
import dev.warden.api.ActionRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class UpdateBusTest {

  private static ActionRecord record(String subject, long caseNumber) {
    return new ActionRecord(
        caseNumber, caseNumber, ActionKind.MUTE, subject, subject, "mod", "Mod", null, null,
        "r", null, 0L, 60_000L, true, null, false, null);
  }

  @Test
  void eventsForOneSubjectArriveInPublishOrder() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    int events = 500;
    List<Long> seen = Collections.synchronizedList(new ArrayList<>());
    CountDownLatch done = new CountDownLatch(events);
    try (UpdateBus bus = new UpdateBus(pool)) {
      bus.onUpdated(
          r -> {
            seen.add(r.caseNumber());
            done.countDown();
          });
      for (long i = 1; i <= events; i++) {
        bus.fireUpdated(record("s1", i));
      }
      assertTrue(done.await(10, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    for (int i = 0; i < events; i++) {
      assertEquals(i + 1L, seen.get(i));
    }
  }

  @Test
  void failingHandlerDoesNotStarveOthers() throws Exception {
    List<Long> seen = new ArrayList<>();
    try (UpdateBus bus = new UpdateBus(Runnable::run)) {
      bus.onIssued(
          r -> {
            throw new IllegalStateException("listener bug");
          });
      bus.onIssued(r -> seen.add(r.caseNumber()));

      bus.fireIssued(record("s1", 1));
      bus.fireIssued(record("s1", 2));
    }

    assertEquals(List.of(1L, 2L), seen);
  }

  @Test
  void unsubscribeAndCloseStopDelivery() throws Exception {
    List<Long> seen = new ArrayList<>();
    UpdateBus bus = new UpdateBus(Runnable::run);
    AutoCloseable subscription = bus.onLifted(r -> seen.add(r.caseNumber()));

    bus.fireLifted(record("s1", 1));
    subscription.close();
    bus.fireLifted(record("s1", 2));

    bus.onLifted(r -> seen.add(r.caseNumber()));
    bus.close();
    bus.fireLifted(record("s1", 3));

    assertEquals(List.of(1L), seen);
  }
}
