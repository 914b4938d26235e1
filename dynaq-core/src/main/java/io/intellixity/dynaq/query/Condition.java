package io.intellixity.dynaq.query;

import java.util.*;

/**
 * Filter leaf: {@code column operator value}.
 * <p>
 * {@code value} is null only for null checks. {@code values} carries the items of IN/NOT IN and the
 * two bounds of BETWEEN/NOT BETWEEN. {@code quoted} records that the right-hand side was written as a
 * single-quoted literal and must be treated as text.
 */
public final class Condition implements FilterNode {
  private final String column;
  private final Operator operator;
  private final String value;
  private final List<String> values;
  private final boolean quoted;

  public Condition(String column, Operator operator, String value, List<String> values, boolean quoted) {
    this.column = Objects.requireNonNull(column, "column");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.values = List.copyOf(values == null ? List.of() : values);
    switch (operator.family()) {
      case NULL_CHECK -> {
        if (value != null) throw new IllegalArgumentException(operator + " takes no value");
      }
      case MEMBERSHIP -> {
        if (this.values.isEmpty()) throw new IllegalArgumentException(operator + " requires at least one value");
      }
      case RANGE -> {
        if (this.values.size() != 2) throw new IllegalArgumentException(operator + " requires exactly two bounds");
      }
      default -> {
        if (value == null) throw new IllegalArgumentException(operator + " requires a value");
      }
    }
    this.value = value;
    this.quoted = quoted;
  }

  public String column() { return column; }
  public Operator operator() { return operator; }
  public String value() { return value; }
  public List<String> values() { return values; }
  public boolean quoted() { return quoted; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  public static Condition of(String column, Operator operator, String value) {
    return new Condition(column, operator, value, null, false);
  }

  public static Condition text(String column, Operator operator, String value) {
    return new Condition(column, operator, value, null, true);
  }

  public static Condition isNull(String column) {
    return new Condition(column, Operator.IS_NULL, null, null, false);
  }

  public static Condition isNotNull(String column) {
    return new Condition(column, Operator.IS_NOT_NULL, null, null, false);
  }

  public static Condition list(String column, Operator operator, List<String> values) {
    return new Condition(column, operator, null, values, false);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition other)) return false;
    return quoted == other.quoted
        && column.equals(other.column)
        && operator == other.operator
        && Objects.equals(value, other.value)
        && values.equals(other.values);
  }

  @Override
  public int hashCode() { return Objects.hash(column, operator, value, values, quoted); }

  @Override
  public String toString() {
    String rhs;
    if (operator.takesList()) rhs = " " + values;
    else if (value == null) rhs = "";
    else rhs = " " + (quoted ? "'" + value + "'" : value);
    return "Cond(" + column + " " + operator + rhs + ")";
  }
}
