package io.intellixity.sqlgate.error;

/** Raised when a request names a database that is not configured. */
public final class UnknownDatabaseException extends SqlGatewayException {
  public UnknownDatabaseException(String message) {
    super(message);
  }

  public UnknownDatabaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
