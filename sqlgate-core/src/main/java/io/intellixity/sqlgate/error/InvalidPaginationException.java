package io.intellixity.sqlgate.error;

/** Raised on a negative limit or offset. */
public final class InvalidPaginationException extends SqlGatewayException {
  public InvalidPaginationException(String message) {
    super(message);
  }

  public InvalidPaginationException(String message, Throwable cause) {
    super(message, cause);
  }
}
