/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ErrorCode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Idempotent schema migrations for the moderation tables. */
public final class Migrations {
  private static final Logger LOG = LoggerFactory.getLogger("warden");
  private static final int CURRENT_VERSION = 1;

  private static final String[] DDL = {
    """
    CREATE TABLE IF NOT EXISTS warden_schema_version (
      version        INT              NOT NULL,
      applied_at_ms  BIGINT UNSIGNED  NOT NULL,
      PRIMARY KEY (version)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """,
    """
    CREATE TABLE IF NOT EXISTS moderation_counters (
      name   VARCHAR(32)      NOT NULL,
      value  BIGINT UNSIGNED  NOT NULL,
      PRIMARY KEY (name)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """,
    """
    CREATE TABLE IF NOT EXISTS moderations (
      id                  BIGINT UNSIGNED  NOT NULL AUTO_INCREMENT,
      case_number         BIGINT UNSIGNED  NOT NULL,
      kind                VARCHAR(16)      NOT NULL,
      subject_id          VARCHAR(64)      NOT NULL,
      subject_name        VARCHAR(128)     NULL,
      issuer_id           VARCHAR(64)      NOT NULL,
      issuer_name         VARCHAR(128)     NULL,
      role_id             VARCHAR(64)      NULL,
      role_name           VARCHAR(128)     NULL,
      reason              TEXT             NULL,
      link                VARCHAR(512)     NULL,
      issued_at_ms        BIGINT UNSIGNED  NOT NULL,
      duration_ms         BIGINT UNSIGNED  NULL,
      active              TINYINT(1)       NOT NULL,
      removed_by_id       VARCHAR(64)      NULL,
      removed_by_name     VARCHAR(128)     NULL,
      removed_reason      TEXT             NULL,
      removed_at_ms       BIGINT UNSIGNED  NULL,
      auto_removed        TINYINT(1)       NOT NULL DEFAULT 0,
      expunged_by_id      VARCHAR(64)      NULL,
      expunged_by_name    VARCHAR(128)     NULL,
      expunged_reason     TEXT             NULL,
      expunged_at_ms      BIGINT UNSIGNED  NULL,
      PRIMARY KEY (id),
      UNIQUE KEY uq_moderations_case (case_number),
      KEY idx_moderations_kind_active (kind, active),
      KEY idx_moderations_subject_kind_active (subject_id, kind, active),
      KEY idx_moderations_subject_history (subject_id, expunged_at_ms, issued_at_ms),
      KEY idx_moderations_kind_issued (kind, issued_at_ms)
    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
    """
  };

  private Migrations() {}

  /**
   * Applies the DDL. Every statement runs even if an earlier one failed; the schema version is only
   * recorded when all succeeded.
   *
   * @param ds datasource
   * @param clock clock stamping the version row
   * @return {@code true} when every statement succeeded
   */
  public static boolean apply(DataSource ds, Clock clock) {
    boolean allSucceeded = true;
    try (Connection c = ds.getConnection();
        Statement st = c.createStatement()) {
      for (String sql : DDL) {
        try {
          st.execute(sql);
        } catch (SQLException e) {
          allSucceeded = false;
          LOG.warn(
              "(warden) code={} op={} message={} sql=\n{}",
              SqlErrorCodes.classify(e),
              "migrations.apply",
              e.getMessage(),
              sql);
        }
      }
    } catch (SQLException e) {
      throw new StoreException(SqlErrorCodes.classify(e), "migration failed", e);
    }

    if (!allSucceeded) {
      LOG.warn("(warden) migrations completed with errors; schema version unchanged");
      return false;
    }
    recordSchemaVersion(ds, clock);
    return true;
  }

  /**
   * Schema version written by {@link #apply}.
   *
   * @return version number
   */
  public static int currentVersion() {
    return CURRENT_VERSION;
  }

  private static void recordSchemaVersion(DataSource ds, Clock clock) {
    try (Connection c = ds.getConnection();
        PreparedStatement ps =
            c.prepareStatement(
                "INSERT INTO warden_schema_version(version, applied_at_ms) VALUES(?, ?) "
                    + "ON DUPLICATE KEY UPDATE applied_at_ms=VALUES(applied_at_ms)")) {
      ps.setInt(1, CURRENT_VERSION);
      ps.setLong(2, clock.millis());
      ps.executeUpdate();
      LOG.info("(warden) schema version recorded: {}", CURRENT_VERSION);
    } catch (SQLException e) {
      ErrorCode code = SqlErrorCodes.classify(e);
      throw new StoreException(code, "failed to record schema version", e);
    }
  }
}
