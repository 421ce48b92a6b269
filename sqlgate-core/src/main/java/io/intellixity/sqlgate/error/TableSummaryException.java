package io.intellixity.sqlgate.error;

/** Raised when one of the catalog lookups behind a table summary fails. */
public final class TableSummaryException extends SqlGatewayException {
  public TableSummaryException(String message) {
    super(message);
  }

  public TableSummaryException(String message, Throwable cause) {
    super(message, cause);
  }
}
