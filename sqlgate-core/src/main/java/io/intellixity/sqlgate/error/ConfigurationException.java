package io.intellixity.sqlgate.error;

/** Raised when the gateway configuration is missing or invalid. */
public final class ConfigurationException extends SqlGatewayException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
