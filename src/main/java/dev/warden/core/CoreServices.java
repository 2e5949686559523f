/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.warden.api.ActionKind;
import dev.warden.api.CaseControl;
import dev.warden.api.EffectProvider;
import dev.warden.api.ErrorCode;
import dev.warden.api.MemberDirectory;
import dev.warden.api.Moderation;
import dev.warden.api.events.ModerationEvents;
import dev.warden.util.TokenBucketRateLimiter;
import java.io.Closeable;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the store, allocator, bus and one controller per enabled kind, and owns the shared
 * resources (Hikari pool, scheduler thread, bus threads, metrics MBean).
 */
public final class CoreServices implements Services, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger("warden");
  private static final long GAUGE_REFRESH_HOURS = 1L;

  private final HikariDataSource pool;
  private final ModerationStore store;
  private final UpdateBus bus;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Metrics metrics;
  private final OperatorAlerts alerts;
  private final Map<ActionKind, ModerationController> controllers;
  private final CaseControl cases;
  private final ScheduledFuture<?> gaugeTask;
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private CoreServices(
      HikariDataSource pool,
      ModerationStore store,
      UpdateBus bus,
      ScheduledExecutorService scheduler,
      boolean ownsScheduler,
      Metrics metrics,
      OperatorAlerts alerts,
      Map<ActionKind, ModerationController> controllers,
      CaseControl cases) {
    this.pool = pool;
    this.store = store;
    this.bus = bus;
    this.scheduler = scheduler;
    this.ownsScheduler = ownsScheduler;
    this.metrics = metrics;
    this.alerts = alerts;
    this.controllers = controllers;
    this.cases = cases;
    this.gaugeTask =
        scheduler.scheduleAtFixedRate(
            this::refreshGaugesQuietly,
            GAUGE_REFRESH_HOURS,
            GAUGE_REFRESH_HOURS,
            TimeUnit.HOURS);
  }

  /**
   * Starts the services against MariaDB.
   *
   * @param cfg runtime configuration
   * @param providers effect provider per kind; every enabled kind needs one
   * @param members rank lookup
   * @return service container
   */
  public static CoreServices start(
      Config cfg, Map<ActionKind, EffectProvider> providers, MemberDirectory members) {
    HikariDataSource ds = openPool(cfg.db());
    ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "warden-scheduler");
              t.setDaemon(true);
              return t;
            });
    return assemble(
        cfg.moderation(),
        ds,
        new JdbcModerationStore(ds),
        new JdbcCaseCounter(ds),
        providers,
        members,
        scheduler,
        true,
        Clock.systemUTC(),
        new UpdateBus(),
        new Metrics());
  }

  /**
   * Wires the services on caller-supplied collaborators. {@link #shutdown()} always closes the bus
   * and metrics but stops the scheduler only when {@code ownsScheduler} is set.
   *
   * @param settings moderation block
   * @param pool pooled datasource, may be {@code null}
   * @param store moderation store
   * @param counter case counter
   * @param providers effect provider per kind
   * @param members rank lookup
   * @param scheduler executor for expiry timers
   * @param ownsScheduler whether shutdown stops the scheduler
   * @param clock wall clock
   * @param bus update bus
   * @param metrics metrics registry
   * @return service container
   */
  static CoreServices assemble(
      Config.Moderation settings,
      HikariDataSource pool,
      ModerationStore store,
      CaseCounter counter,
      Map<ActionKind, EffectProvider> providers,
      MemberDirectory members,
      ScheduledExecutorService scheduler,
      boolean ownsScheduler,
      Clock clock,
      UpdateBus bus,
      Metrics metrics) {
    OperatorAlerts alerts =
        new LoggingOperatorAlerts(
            new TokenBucketRateLimiter(
                settings.alerts().capacity(), settings.alerts().refillPerSec()),
            metrics);
    LifecycleContext ctx =
        new LifecycleContext(
            store,
            new CaseAllocator(counter),
            bus,
            members,
            scheduler,
            clock,
            settings,
            alerts,
            metrics);
    Map<ActionKind, ModerationController> controllers = new EnumMap<>(ActionKind.class);
    for (ActionKind kind : settings.kinds()) {
      EffectProvider provider = providers.get(kind);
      if (provider == null) {
        throw new IllegalStateException("no effect provider registered for " + kind.id());
      }
      controllers.put(kind, new ModerationController(kind, provider, ctx));
    }
    CaseControl cases = new CaseControlImpl(store, bus, clock);
    return new CoreServices(
        pool,
        store,
        bus,
        scheduler,
        ownsScheduler,
        metrics,
        alerts,
        Collections.unmodifiableMap(controllers),
        cases);
  }

  private static HikariDataSource openPool(Config.Db db) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.jdbcUrl());
    hc.setUsername(db.user());
    hc.setPassword(db.password());
    hc.setMaximumPoolSize(db.pool().maxPoolSize());
    hc.setMinimumIdle(Math.min(db.pool().minimumIdle(), db.pool().maxPoolSize()));
    hc.setConnectionTimeout(db.pool().connectionTimeoutMs());
    hc.setIdleTimeout(db.pool().idleTimeoutMs());
    hc.setMaxLifetime(db.pool().maxLifetimeMs());
    hc.setAutoCommit(true);
    hc.setPoolName("warden-hikari");
    if (db.forceUtc()) {
      hc.setConnectionInitSql("SET time_zone = '+00:00'");
    }
    if (!db.tlsEnabled() && !isLocalHost(db.host())) {
      LOG.warn(
          "(warden) code={} op={} message={}",
          "DB_TLS_DISABLED",
          "config",
          "database host is remote and core.db.tls.enabled is false");
    }
    if ("change-me".equals(db.password())) {
      LOG.warn(
          "(warden) code={} op={} message={}",
          "DB_PASSWORD_DEFAULT",
          "config",
          "database password is still the template default");
    }

    int attempts = Math.max(1, db.pool().startupAttempts());
    boolean bootstrapped = false;
    RuntimeException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return new HikariDataSource(hc);
      } catch (RuntimeException ex) {
        last = ex;
        SQLException sql = findSqlException(ex);
        if (!bootstrapped && DbBootstrap.isUnknownDatabase(sql)) {
          bootstrapped = true;
          try {
            DbBootstrap.ensureDatabaseExists(db);
            attempt--;
            continue;
          } catch (SQLException bootstrapEx) {
            LOG.warn("(warden) database bootstrap failed: {}", bootstrapEx.getMessage());
          }
        }
        LOG.warn(
            "(warden) failed to start Hikari (attempt {}/{}): {}",
            attempt,
            attempts,
            ex.getMessage());
        if (!sleepBeforeRetry(250L * attempt)) {
          break;
        }
      }
    }
    throw new IllegalStateException("Unable to start datasource", last);
  }

  private static boolean sleepBeforeRetry(long millis) {
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  static boolean isLocalHost(String host) {
    if (host == null || host.isBlank()) {
      return false;
    }
    String h = host.trim();
    return h.equalsIgnoreCase("localhost")
        || h.equals("127.0.0.1")
        || h.equals("::1")
        || h.equals("[::1]");
  }

  private static SQLException findSqlException(Throwable error) {
    Throwable cursor = error;
    while (cursor != null) {
      if (cursor instanceof SQLException sql) {
        return sql;
      }
      cursor = cursor.getCause();
    }
    return null;
  }

  @Override
  public Moderation moderation(ActionKind kind) {
    ModerationController controller = controllers.get(kind);
    if (controller == null) {
      throw new IllegalStateException(kind.id() + " is not enabled");
    }
    return controller;
  }

  ModerationController controller(ActionKind kind) {
    return controllers.get(kind);
  }

  @Override
  public Set<ActionKind> kinds() {
    return controllers.keySet();
  }

  @Override
  public CaseControl cases() {
    return cases;
  }

  @Override
  public ModerationEvents events() {
    return bus;
  }

  @Override
  public ScheduledExecutorService scheduler() {
    return scheduler;
  }

  @Override
  public DataSource dataSource() {
    return pool;
  }

  @Override
  public Metrics metrics() {
    return metrics;
  }

  @Override
  public int recover() {
    int reapplied = 0;
    for (ModerationController controller : controllers.values()) {
      try {
        reapplied += controller.recover();
      } catch (StoreException e) {
        alerts.alert(
            e.errorCode(), controller.kind().id() + ".recover", "recovery aborted for kind", e);
      }
    }
    return reapplied;
  }

  @Override
  public void refreshGauges() {
    metrics.updateGauges(store.countByKind(), store.countActiveByKind());
  }

  private void refreshGaugesQuietly() {
    try {
      refreshGauges();
    } catch (StoreException e) {
      alerts.alert(e.errorCode(), "metrics.gauges", "gauge refresh failed", e);
    } catch (RuntimeException e) {
      alerts.alert(ErrorCode.CALLBACK_FAILED, "metrics.gauges", "gauge refresh failed", e);
    }
  }

  @Override
  public void shutdown() throws IOException {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    gaugeTask.cancel(false);
    for (ModerationController controller : controllers.values()) {
      controller.close();
    }
    bus.close();
    metrics.close();
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
    if (pool != null) {
      pool.close();
    }
  }

  /** Alias for {@link #shutdown()}. */
  @Override
  public void close() throws IOException {
    shutdown();
  }
}
