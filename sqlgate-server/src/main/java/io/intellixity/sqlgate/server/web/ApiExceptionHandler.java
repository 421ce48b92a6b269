package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.error.InvalidPaginationException;
import io.intellixity.sqlgate.error.InvalidSqlException;
import io.intellixity.sqlgate.error.QueryException;
import io.intellixity.sqlgate.error.ReadOnlyViolationException;
import io.intellixity.sqlgate.error.SqlGatewayException;
import io.intellixity.sqlgate.error.TableAccessException;
import io.intellixity.sqlgate.error.TableNotFoundException;
import io.intellixity.sqlgate.error.TableSummaryException;
import io.intellixity.sqlgate.error.UnknownDatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps gateway failures to status codes with an {@code {error, message}} body.
 * Configuration and unclassified failures are server errors.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  public record ApiError(String error, String message) {}

  @ExceptionHandler(SqlGatewayException.class)
  public ResponseEntity<ApiError> gateway(SqlGatewayException e) {
    HttpStatus status = statusOf(e);
    if (status.is5xxServerError()) {
      log.warn("sqlgate.api status={} error={} message={}", status.value(), e.getClass().getSimpleName(), e.getMessage());
    }
    return body(status, errorName(e), e.getMessage());
  }

  @ExceptionHandler(ToolNotAvailableException.class)
  public ResponseEntity<ApiError> unavailable(ToolNotAvailableException e) {
    return body(HttpStatus.NOT_FOUND, "ToolNotAvailable", e.getMessage());
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> badRequest(Exception e) {
    return body(HttpStatus.BAD_REQUEST, "InvalidArgument", e.getMessage());
  }

  static HttpStatus statusOf(SqlGatewayException e) {
    if (e instanceof InvalidSqlException
        || e instanceof ReadOnlyViolationException
        || e instanceof InvalidPaginationException
        || e instanceof TableAccessException) {
      return HttpStatus.BAD_REQUEST;
    }
    if (e instanceof TableNotFoundException || e instanceof UnknownDatabaseException) return HttpStatus.NOT_FOUND;
    if (e instanceof QueryException || e instanceof TableSummaryException) return HttpStatus.BAD_GATEWAY;
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  // InvalidSqlException -> InvalidSql
  static String errorName(SqlGatewayException e) {
    String n = e.getClass().getSimpleName();
    return n.endsWith("Exception") ? n.substring(0, n.length() - "Exception".length()) : n;
  }

  private static ResponseEntity<ApiError> body(HttpStatus status, String error, String message) {
    return ResponseEntity.status(status).body(new ApiError(error, message));
  }
}
