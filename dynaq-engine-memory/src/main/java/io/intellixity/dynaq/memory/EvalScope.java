package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.expr.ColumnRef;
import io.intellixity.dynaq.expr.Expression;

import java.util.List;
import java.util.Map;

/** What an expression is evaluated against: one row, or one group of rows. */
interface EvalScope {
  Object column(ColumnRef ref);

  /** Rows aggregated over, or null outside a group. */
  List<Map<String, Object>> groupRows();

  boolean hasGroupKey(Expression e);

  Object groupKey(Expression e);

  /** Row copied for {@code FETCH(*)}. */
  Map<String, Object> starRow();

  static EvalScope row(Map<String, Object> row) {
    return new EvalScope() {
      @Override public Object column(ColumnRef ref) { return Rows.get(row, ref.column()); }
      @Override public List<Map<String, Object>> groupRows() { return null; }
      @Override public boolean hasGroupKey(Expression e) { return false; }
      @Override public Object groupKey(Expression e) { return null; }
      @Override public Map<String, Object> starRow() { return row; }
    };
  }

  /**
   * Group scope. Grouped expressions read their key value; any other column reads the group's first
   * row.
   */
  static EvalScope group(Map<Expression, Object> keys, Map<String, Object> keyRow, List<Map<String, Object>> rows) {
    return new EvalScope() {
      @Override
      public Object column(ColumnRef ref) {
        if (rows.isEmpty()) return null;
        return Rows.get(rows.get(0), ref.column());
      }

      @Override public List<Map<String, Object>> groupRows() { return rows; }
      @Override public boolean hasGroupKey(Expression e) { return keys.containsKey(e); }
      @Override public Object groupKey(Expression e) { return keys.get(e); }
      @Override public Map<String, Object> starRow() { return keyRow; }
    };
  }
}
