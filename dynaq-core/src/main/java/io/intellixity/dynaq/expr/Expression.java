package io.intellixity.dynaq.expr;

/** A classified token: {@link Literal}, {@link ColumnRef} or {@link FunctionCall}. */
public interface Expression {
  <R> R accept(ExpressionVisitor<R> visitor);
}
