/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates the configured database on first boot when the server does not have it yet. */
final class DbBootstrap {
  private static final Logger LOG = LoggerFactory.getLogger("warden");

  private DbBootstrap() {}

  /**
   * Whether the failure is MariaDB's "Unknown database" (vendor code 1049).
   *
   * @param e failure raised while opening the pool, may be {@code null}
   * @return {@code true} when the database itself is missing
   */
  static boolean isUnknownDatabase(SQLException e) {
    if (e == null) {
      return false;
    }
    return e.getErrorCode() == 1049
        || String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT).contains("unknown database");
  }

  /**
   * Connects without a schema and issues {@code CREATE DATABASE IF NOT EXISTS}.
   *
   * @param db database block
   * @throws SQLException if the server refuses
   */
  static void ensureDatabaseExists(Config.Db db) throws SQLException {
    String rootUrl = "jdbc:mariadb://" + db.host() + ":" + db.port() + "/";
    LOG.warn("(warden) database '{}' missing; attempting to create via {}", db.database(), rootUrl);
    try (Connection c = DriverManager.getConnection(rootUrl, db.user(), db.password());
        Statement st = c.createStatement()) {
      st.executeUpdate(
          "CREATE DATABASE IF NOT EXISTS `"
              + db.database()
              + "` CHARACTER SET utf8mb4 COLLATE utf8mb4_unicode_ci");
    }
    LOG.info("(warden) database '{}' created (or already existed)", db.database());
  }
}
