package io.intellixity.dynaq.jdbc;

import java.util.Objects;

/** Rendered SELECT with literals inlined; {@code dialect} is the id of the dialect that produced it. */
public record SqlStatement(String dialect, String sql) {
  public SqlStatement {
    Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(sql, "sql");
  }

  @Override
  public String toString() { return sql; }
}
