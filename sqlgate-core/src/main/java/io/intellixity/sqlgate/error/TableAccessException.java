package io.intellixity.sqlgate.error;

/** Raised when a statement references a table the database policy forbids. */
public final class TableAccessException extends SqlGatewayException {
  public TableAccessException(String message) {
    super(message);
  }

  public TableAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
