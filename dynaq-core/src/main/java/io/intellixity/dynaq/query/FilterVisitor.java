package io.intellixity.dynaq.query;

public interface FilterVisitor<R> {
  R visit(Condition condition);
  R visit(Logical logical);
}
