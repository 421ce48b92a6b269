package io.intellixity.sqlgate.error;

/** Raised when a statement contains a mutating operation anywhere in its tree. */
public final class ReadOnlyViolationException extends SqlGatewayException {
  public ReadOnlyViolationException(String message) {
    super(message);
  }

  public ReadOnlyViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
