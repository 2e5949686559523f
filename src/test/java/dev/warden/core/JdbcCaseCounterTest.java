/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.zaxxer.hikari.HikariDataSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class JdbcCaseCounterTest {
  private static HikariDataSource ds;

  @BeforeAll
  static void setup() throws Exception {
    ds = MariaDbTestSupport.freshDatabase("warden_counter_test");
    Migrations.apply(ds, Clock.systemUTC());
  }

  @AfterAll
  static void tearDown() {
    if (ds != null) {
      ds.close();
    }
  }

  @Test
  void firstValueIsOneAndCountersAreIndependent() {
    JdbcCaseCounter counter = new JdbcCaseCounter(ds);

    assertEquals(1L, counter.incrementAndGet("first"));
    assertEquals(2L, counter.incrementAndGet("first"));
    assertEquals(1L, counter.incrementAndGet("second"));
    assertEquals(3L, counter.incrementAndGet("first"));
  }

  @Test
  void concurrentIncrementsNeverRepeat() throws Exception {
    JdbcCaseCounter counter = new JdbcCaseCounter(ds);
    ExecutorService pool = Executors.newFixedThreadPool(6);
    List<Future<Long>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 120; i++) {
        futures.add(pool.submit(() -> counter.incrementAndGet("racing")));
      }
      Set<Long> values = new HashSet<>();
      for (Future<Long> f : futures) {
        values.add(f.get(30, TimeUnit.SECONDS));
      }
      assertEquals(120, values.size());
      assertEquals(121L, counter.incrementAndGet("racing"));
    } finally {
      pool.shutdownNow();
    }
  }
}
