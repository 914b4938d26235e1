package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.expr.Values;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.Comparator;

/**
 * Type-ordered comparison for ORDERBY: dates, then numbers, then text (case-insensitive); nulls
 * sort last in ascending order.
 */
final class SortValueComparator implements Comparator<Object> {
  static final SortValueComparator INSTANCE = new SortValueComparator();

  private SortValueComparator() {}

  @Override
  public int compare(Object a, Object b) {
    int ta = rank(a);
    int tb = rank(b);
    if (ta != tb) return Integer.compare(ta, tb);
    if (a == null) return 0;
    return switch (ta) {
      case 1 -> Values.toDateTime(a).compareTo(Values.toDateTime(b));
      case 2 -> Double.compare(Values.toDouble(a), Values.toDouble(b));
      default -> String.CASE_INSENSITIVE_ORDER.compare(FunctionEvaluator.text(a), FunctionEvaluator.text(b));
    };
  }

  private static int rank(Object v) {
    if (v == null) return 100;
    if (v instanceof LocalDateTime || v instanceof LocalDate || v instanceof java.util.Date) return 1;
    if (v instanceof Temporal && Values.toDateTime(v) != null) return 1;
    if (v instanceof Number) return 2;
    if (v instanceof CharSequence s) {
      if (Values.isTemporal(s.toString())) return 1;
      if (Values.isNumber(s.toString())) return 2;
    }
    return 3;
  }
}
