package io.intellixity.dynaq.error;

/**
 * Base type for every failure raised while compiling or rendering a DSL query.
 * <p>
 * Failures are deterministic for a given input and never retried.
 */
public abstract class DslException extends RuntimeException {
  protected DslException(String message) {
    super(message);
  }

  protected DslException(String message, Throwable cause) {
    super(message, cause);
  }
}
