package io.intellixity.dynaq.error;

/** Unbalanced parentheses, an unparsable condition or a malformed logical expression. */
public final class SyntaxException extends DslException {
  public SyntaxException(String message) {
    super(message);
  }

  public SyntaxException(String message, Throwable cause) {
    super(message, cause);
  }
}
