package io.intellixity.dynaq.error;

/** Wraps a driver failure raised while executing a rendered query. */
public final class QueryExecutionException extends DslException {
  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
