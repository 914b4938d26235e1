package io.intellixity.dynaq.error;

/**
 * Unknown function, wrong arity, or a function the requested target cannot express.
 * {@link #target()} is null when the failure is raised while parsing.
 */
public final class UnsupportedFunctionException extends DslException {
  private final String function;
  private final String target;

  public UnsupportedFunctionException(String function, String message) {
    this(function, null, message);
  }

  public UnsupportedFunctionException(String function, String target, String message) {
    super(message);
    this.function = function;
    this.target = target;
  }

  public String function() { return function; }
  public String target() { return target; }
}
