package io.intellixity.dynaq.expr;

import java.util.Objects;

/** Typed literal; {@code text} is the unquoted source text. */
public record Literal(Type type, String text) implements Expression {
  public enum Type { BOOLEAN, INTEGER, LONG, DOUBLE, DATE, TIMESTAMP, STRING, NULL }

  public Literal {
    Objects.requireNonNull(type, "type");
    if (type != Type.NULL) Objects.requireNonNull(text, "text");
  }

  public static Literal string(String text) { return new Literal(Type.STRING, text); }

  public boolean isNumeric() {
    return type == Type.INTEGER || type == Type.LONG || type == Type.DOUBLE;
  }

  public boolean isTemporal() { return type == Type.DATE || type == Type.TIMESTAMP; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
