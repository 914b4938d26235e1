package io.intellixity.dynaq.error;

/** An operator or join kind that the requested target cannot express. */
public final class UnsupportedOperatorException extends DslException {
  private final String operator;
  private final String target;

  public UnsupportedOperatorException(String operator, String target) {
    this(operator, target, "Operator " + operator + " is not supported by " + target);
  }

  public UnsupportedOperatorException(String operator, String target, String message) {
    super(message);
    this.operator = operator;
    this.target = target;
  }

  public String operator() { return operator; }
  public String target() { return target; }
}
