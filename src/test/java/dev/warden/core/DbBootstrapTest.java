/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class DbBootstrapTest {

  @Test
  void recognisesUnknownDatabaseByVendorCodeOrMessage() {
    assertTrue(DbBootstrap.isUnknownDatabase(new SQLException("x", "42000", 1049)));
    assertTrue(DbBootstrap.isUnknownDatabase(new SQLException("Unknown database 'warden'")));
  }

  @Test
  void otherFailuresAreNotTreatedAsMissingDatabase() {
    assertFalse(DbBootstrap.isUnknownDatabase(null));
    assertFalse(DbBootstrap.isUnknownDatabase(new SQLException("Access denied", "28000", 1045)));
    assertFalse(DbBootstrap.isUnknownDatabase(new SQLException((String) null)));
  }
}
