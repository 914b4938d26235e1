package io.intellixity.dynaq.expr;

public interface ExpressionVisitor<R> {
  R visit(Literal literal);
  R visit(ColumnRef column);
  R visit(FunctionCall call);
}
