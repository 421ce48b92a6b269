package io.intellixity.sqlgate.error;

/**
 * Base type for every request-scoped or configuration failure raised by the gateway.
 * <p>
 * All subclasses are unchecked; callers surface the message verbatim.
 */
public class SqlGatewayException extends RuntimeException {
  public SqlGatewayException(String message) {
    super(message);
  }

  public SqlGatewayException(String message, Throwable cause) {
    super(message, cause);
  }
}
