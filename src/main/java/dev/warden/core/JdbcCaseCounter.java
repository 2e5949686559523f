/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MariaDB-backed {@link CaseCounter} on {@code moderation_counters}.
 *
 * <p>The upsert stores {@code value+1} through {@code LAST_INSERT_ID(expr)}, so the new value is
 * read back on the same connection without a second round trip racing other writers.
 */
public final class JdbcCaseCounter implements CaseCounter {
  private static final Logger LOG = LoggerFactory.getLogger("warden");

  private final DataSource ds;

  /**
   * Creates the counter.
   *
   * @param ds shared datasource
   */
  public JdbcCaseCounter(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public long incrementAndGet(String name) {
    try (Connection c = ds.getConnection();
        PreparedStatement ps =
            c.prepareStatement(
                "INSERT INTO moderation_counters(name,value) VALUES(?,LAST_INSERT_ID(1)) "
                    + "ON DUPLICATE KEY UPDATE value=LAST_INSERT_ID(value+1)");
        Statement last = c.createStatement()) {
      ps.setString(1, name);
      ps.executeUpdate();
      try (ResultSet rs = last.executeQuery("SELECT LAST_INSERT_ID()")) {
        if (rs.next()) {
          return rs.getLong(1);
        }
      }
      throw new SQLException("LAST_INSERT_ID() returned no row", "HY000");
    } catch (SQLException e) {
      StoreException wrapped = StoreException.wrap("counter.increment", e);
      LOG.warn(
          "(warden) code={} op={} message={} sqlState={} vendor={}",
          wrapped.errorCode(),
          "counter.increment",
          e.getMessage(),
          e.getSQLState(),
          e.getErrorCode(),
          e);
      throw wrapped;
    }
  }
}
