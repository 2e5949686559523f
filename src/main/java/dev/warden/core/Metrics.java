/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionKind;
import dev.warden.api.ErrorCode;
import dev.warden.api.IssueResult;
import java.lang.management.ManagementFactory;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;
import javax.management.StandardMBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics registry exposed over JMX as {@code dev.warden:type=WardenMetrics}.
 *
 * <p>Counters track lifecycle outcomes (issued, suppressed, rejected, expired, revoked) plus effect
 * and store failures; alerts are counted per {@link ErrorCode}. Per-kind gauges hold the total and
 * active record counts and are refreshed periodically from the store.
 */
public final class Metrics implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("warden");
  private static final String MBEAN_NAME = "dev.warden:type=WardenMetrics";

  private final AtomicLong issued = new AtomicLong();
  private final AtomicLong duplicates = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong expired = new AtomicLong();
  private final AtomicLong revoked = new AtomicLong();
  private final AtomicLong effectFailures = new AtomicLong();
  private final AtomicLong storeFailures = new AtomicLong();
  private final Map<ErrorCode, AtomicLong> alerts = new EnumMap<>(ErrorCode.class);
  private final AtomicReference<String> lastAlertCode = new AtomicReference<>("NONE");
  private final AtomicReference<Map<ActionKind, Long>> totalByKind =
      new AtomicReference<>(Map.of());
  private final AtomicReference<Map<ActionKind, Long>> activeByKind =
      new AtomicReference<>(Map.of());

  private final MBeanServer server;
  private final ObjectName objectName;
  private final boolean register;

  /** Creates and registers the metrics MBean. */
  public Metrics() {
    this(true);
  }

  /**
   * Creates the registry.
   *
   * @param register whether to register the MBean with the platform server
   */
  public Metrics(boolean register) {
    for (ErrorCode code : ErrorCode.values()) {
      alerts.put(code, new AtomicLong());
    }
    this.register = register;
    this.server = ManagementFactory.getPlatformMBeanServer();
    this.objectName = createObjectName();
    if (register) {
      registerMBean();
    }
  }

  /**
   * Records the outcome of an issue attempt.
   *
   * @param result typed outcome
   */
  public void recordIssue(IssueResult result) {
    if (result == null) {
      return;
    }
    if (result.ok()) {
      issued.incrementAndGet();
    } else if (result.duplicate()) {
      duplicates.incrementAndGet();
    } else {
      rejected.incrementAndGet();
    }
  }

  /** Records a record that ran to its natural end. */
  public void recordExpired() {
    expired.incrementAndGet();
  }

  /** Records a manual revocation. */
  public void recordRevoked() {
    revoked.incrementAndGet();
  }

  /** Records a failed effect provider call. */
  public void recordEffectFailure() {
    effectFailures.incrementAndGet();
  }

  /** Records a store failure surfaced to a caller. */
  public void recordStoreFailure() {
    storeFailures.incrementAndGet();
  }

  /**
   * Records an operator alert, whether or not it was written to the log.
   *
   * @param code alert code
   */
  public void recordAlert(ErrorCode code) {
    if (code == null) {
      return;
    }
    alerts.get(code).incrementAndGet();
    lastAlertCode.set(code.name());
  }

  /**
   * Replaces the per-kind gauges.
   *
   * @param total total records per kind
   * @param active active records per kind
   */
  public void updateGauges(Map<ActionKind, Long> total, Map<ActionKind, Long> active) {
    totalByKind.set(Map.copyOf(total));
    activeByKind.set(Map.copyOf(active));
  }

  long issued() {
    return issued.get();
  }

  long duplicates() {
    return duplicates.get();
  }

  long rejected() {
    return rejected.get();
  }

  long expired() {
    return expired.get();
  }

  long revoked() {
    return revoked.get();
  }

  long alerts(ErrorCode code) {
    return alerts.get(code).get();
  }

  long activeGauge(ActionKind kind) {
    return activeByKind.get().getOrDefault(kind, 0L);
  }

  private static Map<String, Long> byId(Map<ActionKind, Long> values) {
    Map<String, Long> out = new TreeMap<>();
    for (ActionKind kind : ActionKind.values()) {
      out.put(kind.id(), values.getOrDefault(kind, 0L));
    }
    return out;
  }

  private ObjectName createObjectName() {
    try {
      return new ObjectName(MBEAN_NAME);
    } catch (MalformedObjectNameException e) {
      throw new IllegalStateException("Invalid metrics object name", e);
    }
  }

  private void registerMBean() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
      server.registerMBean(new StandardMBean(new Bean(), WardenMetricsMBean.class), objectName);
    } catch (JMException e) {
      LOG.warn("(warden) metrics registration failed", e);
    }
  }

  @Override
  public void close() {
    if (!register) {
      return;
    }
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
    } catch (JMException e) {
      LOG.debug("(warden) metrics unregister failed", e);
    }
  }

  private final class Bean implements WardenMetricsMBean {
    @Override
    public long getIssued() {
      return issued.get();
    }

    @Override
    public long getDuplicatesSuppressed() {
      return duplicates.get();
    }

    @Override
    public long getRejected() {
      return rejected.get();
    }

    @Override
    public long getExpired() {
      return expired.get();
    }

    @Override
    public long getRevoked() {
      return revoked.get();
    }

    @Override
    public long getEffectFailures() {
      return effectFailures.get();
    }

    @Override
    public long getStoreFailures() {
      return storeFailures.get();
    }

    @Override
    public Map<String, Long> getAlertsByCode() {
      Map<String, Long> out = new TreeMap<>();
      alerts.forEach((code, count) -> out.put(code.name(), count.get()));
      return out;
    }

    @Override
    public String getLastAlertCode() {
      return lastAlertCode.get();
    }

    @Override
    public Map<String, Long> getRecordsByKind() {
      return byId(totalByKind.get());
    }

    @Override
    public Map<String, Long> getActiveByKind() {
      return byId(activeByKind.get());
    }
  }

  /** JMX view of the metrics registry. */
  public interface WardenMetricsMBean {
    /**
     * Returns actions issued successfully.
     *
     * @return issued count
     */
    long getIssued();

    /**
     * Returns issue attempts suppressed as duplicates.
     *
     * @return suppressed count
     */
    long getDuplicatesSuppressed();

    /** Issue attempts rejected by validation or effect failure. */
    long getRejected();

    /** Records that reached their natural end. */
    long getExpired();

    /** Manual revocations. */
    long getRevoked();

    /** Failed effect provider calls. */
    long getEffectFailures();

    /** Store failures surfaced to callers. */
    long getStoreFailures();

    /** Alert counts keyed by error code name. */
    Map<String, Long> getAlertsByCode();

    /** Last alert code raised. */
    String getLastAlertCode();

    /** Total records per kind id, as of the last gauge refresh. */
    Map<String, Long> getRecordsByKind();

    /** Active records per kind id, as of the last gauge refresh. */
    Map<String, Long> getActiveByKind();
  }
}
