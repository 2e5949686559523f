/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ErrorCode;
import java.sql.SQLException;
import java.util.Objects;

/** Unchecked wrapper for moderation store failures, tagged with a canonical {@link ErrorCode}. */
public final class StoreException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;

  /**
   * Creates an exception with an explicit code.
   *
   * @param errorCode canonical code
   * @param message detail
   * @param cause underlying failure (may be {@code null})
   */
  public StoreException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  /**
   * Wraps a JDBC failure, classifying it with {@link SqlErrorCodes}.
   *
   * @param op store operation, e.g. {@code insert}
   * @param e JDBC failure
   * @return wrapped exception
   */
  public static StoreException wrap(String op, SQLException e) {
    ErrorCode code = SqlErrorCodes.classify(e);
    return new StoreException(code, op + " failed: " + e.getMessage(), e);
  }

  /**
   * Canonical code for the failure.
   *
   * @return error code
   */
  public ErrorCode errorCode() {
    return errorCode;
  }
}
