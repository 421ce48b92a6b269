package io.intellixity.sqlgate.error;

/** Raised when the database rejects or fails a statement; carries the driver message. */
public final class QueryException extends SqlGatewayException {
  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
