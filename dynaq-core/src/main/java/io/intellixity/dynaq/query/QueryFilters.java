package io.intellixity.dynaq.query;

import java.util.List;

/** Static factories for hand-built filter trees. */
public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String column, String value) { return Condition.of(column, Operator.EQ, value); }
  public static Condition neq(String column, String value) { return Condition.of(column, Operator.NEQ, value); }
  public static Condition gt(String column, String value) { return Condition.of(column, Operator.GT, value); }
  public static Condition gte(String column, String value) { return Condition.of(column, Operator.GTE, value); }
  public static Condition lt(String column, String value) { return Condition.of(column, Operator.LT, value); }
  public static Condition lte(String column, String value) { return Condition.of(column, Operator.LTE, value); }

  public static Condition eqText(String column, String value) { return Condition.text(column, Operator.EQ, value); }

  public static Condition like(String column, String pattern) { return Condition.text(column, Operator.LIKE, pattern); }
  public static Condition contains(String column, String value) { return Condition.text(column, Operator.CONTAINS, value); }
  public static Condition beginsWith(String column, String value) { return Condition.text(column, Operator.BEGINS_WITH, value); }
  public static Condition endsWith(String column, String value) { return Condition.text(column, Operator.ENDS_WITH, value); }

  public static Condition isNull(String column) { return Condition.isNull(column); }
  public static Condition isNotNull(String column) { return Condition.isNotNull(column); }

  public static Condition in(String column, String... values) { return Condition.list(column, Operator.IN, List.of(values)); }
  public static Condition notIn(String column, String... values) { return Condition.list(column, Operator.NOT_IN, List.of(values)); }
  public static Condition between(String column, String lower, String upper) {
    return Condition.list(column, Operator.BETWEEN, List.of(lower, upper));
  }

  public static Logical and(FilterNode left, FilterNode right) { return new Logical(Clause.AND, left, right); }
  public static Logical or(FilterNode left, FilterNode right) { return new Logical(Clause.OR, left, right); }
}
