package io.intellixity.sqlgate.error;

/** Raised when SQL text (a statement or a WHERE fragment) cannot be parsed. */
public final class InvalidSqlException extends SqlGatewayException {
  public InvalidSqlException(String message) {
    super(message);
  }

  public InvalidSqlException(String message, Throwable cause) {
    super(message, cause);
  }
}
