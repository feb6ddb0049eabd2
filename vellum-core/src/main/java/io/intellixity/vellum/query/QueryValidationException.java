package io.intellixity.vellum.query;

/**
 * Raised when a query references malformed or disallowed fields, filters, ordering or grouping.
 * <p>
 * Always thrown before any statement is rendered or executed.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
