/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ErrorCode;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;
import java.util.Set;

/** Maps JDBC {@link SQLException}s onto Warden {@link ErrorCode}s for logs and alerts. */
public final class SqlErrorCodes {
  private static final Set<Integer> DUPLICATE_VENDOR = Set.of(1022, 1062, 1586, 1761);
  private static final Set<Integer> LOCK_VENDOR = Set.of(1205, 1213);

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception, looking through chained causes for the most specific match.
   *
   * @param e failure raised by the MariaDB driver
   * @return mapped code, {@link ErrorCode#CONNECTION_LOST} when nothing more specific matches
   */
  public static ErrorCode classify(SQLException e) {
    Throwable current = e;
    int depth = 0;
    while (current != null && depth++ < 8) {
      if (current instanceof SQLException sql) {
        ErrorCode code = classifyOne(sql);
        if (code != null) {
          return code;
        }
      }
      current = current.getCause();
    }
    return ErrorCode.CONNECTION_LOST;
  }

  private static ErrorCode classifyOne(SQLException e) {
    if (e instanceof SQLIntegrityConstraintViolationException) {
      return ErrorCode.DUPLICATE_KEY;
    }
    if (e instanceof SQLTransactionRollbackException) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }
    if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException) {
      return ErrorCode.CONNECTION_LOST;
    }

    String state = e.getSQLState();
    if (state != null && state.length() >= 2) {
      switch (state.substring(0, 2)) {
        case "23":
          return ErrorCode.DUPLICATE_KEY;
        case "40":
          return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
        case "55":
          return ErrorCode.MIGRATION_LOCKED;
        case "08":
        case "28":
          return ErrorCode.CONNECTION_LOST;
        default:
          break;
      }
    }

    int vendor = e.getErrorCode();
    if (DUPLICATE_VENDOR.contains(vendor)) {
      return ErrorCode.DUPLICATE_KEY;
    }
    if (LOCK_VENDOR.contains(vendor)) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }

    String message = e.getMessage();
    if (message == null) {
      return null;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("duplicate") || lower.contains("unique constraint")) {
      return ErrorCode.DUPLICATE_KEY;
    }
    if (lower.contains("deadlock") || lower.contains("lock wait timeout")) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }
    if (lower.contains("get_lock") || lower.contains("advisory lock")) {
      return ErrorCode.MIGRATION_LOCKED;
    }
    return null;
  }
}
