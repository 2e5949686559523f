/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import ch.vorburger.mariadb4j.DB;
import ch.vorburger.mariadb4j.DBConfigurationBuilder;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/** Embedded MariaDB shared by the JDBC integration tests; each test class uses its own schema. */
final class MariaDbTestSupport {
  static final String USER = "root";
  static final String PASSWORD = "";

  private static final DB EMBEDDED_DB;
  private static final String BASE_URL;

  static {
    try {
      Class.forName("org.mariadb.jdbc.Driver");
      DBConfigurationBuilder builder = DBConfigurationBuilder.newBuilder();
      builder.setPort(0);
      builder.setDeletingTemporaryBaseAndDataDirsOnShutdown(true);
      builder.setSecurityDisabled(true);
      builder.addArg("--user=" + USER);
      EMBEDDED_DB = DB.newEmbeddedDB(builder.build());
      EMBEDDED_DB.start();
      BASE_URL = "jdbc:mariadb://127.0.0.1:" + EMBEDDED_DB.getConfiguration().getPort() + "/";
      Runtime.getRuntime().addShutdownHook(new Thread(MariaDbTestSupport::stopQuietly));
    } catch (Exception e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private MariaDbTestSupport() {}

  /** Recreates {@code name} empty and returns a small pool on it. */
  static HikariDataSource freshDatabase(String name) throws SQLException {
    try (Connection c = DriverManager.getConnection(BASE_URL + "mysql", USER, PASSWORD);
        Statement st = c.createStatement()) {
      st.executeUpdate("DROP DATABASE IF EXISTS " + name);
      st.executeUpdate(
          "CREATE DATABASE " + name + " CHARACTER SET utf8mb4 COLLATE utf8mb4_unicode_ci");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(BASE_URL + name + "?useUnicode=true&characterEncoding=utf8mb4");
    hc.setUsername(USER);
    hc.setPassword(PASSWORD);
    hc.setMaximumPoolSize(8);
    hc.setPoolName("warden-test-" + name);
    hc.setConnectionInitSql("SET time_zone = '+00:00'");
    return new HikariDataSource(hc);
  }

  private static void stopQuietly() {
    try {
      EMBEDDED_DB.stop();
    } catch (Exception ignored) {
    }
  }
}
