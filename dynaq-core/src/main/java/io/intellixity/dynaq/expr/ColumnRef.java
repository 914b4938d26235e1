package io.intellixity.dynaq.expr;

import java.util.Objects;

/** Column reference; {@code table} is null for unqualified names and for {@code *}. */
public record ColumnRef(String table, String column) implements Expression {
  public ColumnRef {
    Objects.requireNonNull(column, "column");
  }

  public boolean isStar() { return "*".equals(column); }

  public String qualified() { return table == null ? column : table + "." + column; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
