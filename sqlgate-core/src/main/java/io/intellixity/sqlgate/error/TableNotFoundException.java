package io.intellixity.sqlgate.error;

/** Raised when the target table of a structural lookup does not exist. */
public final class TableNotFoundException extends SqlGatewayException {
  public TableNotFoundException(String message) {
    super(message);
  }

  public TableNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
