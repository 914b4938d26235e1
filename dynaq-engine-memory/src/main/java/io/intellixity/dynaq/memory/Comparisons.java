package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.expr.Values;
import io.intellixity.dynaq.query.Operator;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Operator semantics over loosely typed row values. Numeric when both sides are numbers, temporal
 * when both are dates, ordinal text otherwise.
 */
final class Comparisons {
  private Comparisons() {}

  static boolean test(Operator op, Object left, Object right) {
    if (op.family() == Operator.Family.NULL_CHECK) return (op == Operator.IS_NULL) == (left == null);
    if (left == null && right == null) return op == Operator.EQ;
    if (left == null || right == null) return false;

    String l = FunctionEvaluator.text(left);
    String r = FunctionEvaluator.text(right);
    boolean matched = switch (op.family()) {
      case COMPARISON -> compare(op, left, right);
      case LIKE -> like(l, r, op.caseInsensitive());
      case CONTAINS -> fold(l, op).contains(fold(r, op));
      case BEGINS_WITH -> fold(l, op).startsWith(fold(r, op));
      case ENDS_WITH -> fold(l, op).endsWith(fold(r, op));
      default -> throw new IllegalArgumentException(op + " takes a value list");
    };
    return op.family() != Operator.Family.COMPARISON && op.negated() ? !matched : matched;
  }

  /** IN / NOT IN: numeric equality when both parse, case-insensitive text otherwise. */
  static boolean member(Operator op, Object left, List<Object> items) {
    if (left == null) return false;
    boolean found = false;
    for (Object item : items) {
      if (item != null && sameMember(left, item)) {
        found = true;
        break;
      }
    }
    return op.negated() != found;
  }

  /** BETWEEN / NOT BETWEEN, bounds inclusive. */
  static boolean between(Operator op, Object value, Object lo, Object hi) {
    if (value == null || lo == null || hi == null) return false;
    boolean inside = order(value, lo) >= 0 && order(value, hi) <= 0;
    return op.negated() != inside;
  }

  private static boolean compare(Operator op, Object left, Object right) {
    int c = order(left, right);
    return switch (op) {
      case EQ -> c == 0;
      case NEQ -> c != 0;
      case LT -> c < 0;
      case LTE -> c <= 0;
      case GT -> c > 0;
      case GTE -> c >= 0;
      default -> throw new IllegalArgumentException(op.name());
    };
  }

  static int order(Object a, Object b) {
    Double x = Values.toDouble(a);
    Double y = Values.toDouble(b);
    if (x != null && y != null) return Double.compare(x, y);
    LocalDateTime dx = Values.toDateTime(a);
    LocalDateTime dy = Values.toDateTime(b);
    if (dx != null && dy != null) return dx.compareTo(dy);
    return FunctionEvaluator.text(a).compareTo(FunctionEvaluator.text(b));
  }

  private static boolean sameMember(Object a, Object b) {
    Double x = Values.toDouble(a);
    Double y = Values.toDouble(b);
    if (x != null && y != null) return x.doubleValue() == y.doubleValue();
    return FunctionEvaluator.text(a).equalsIgnoreCase(FunctionEvaluator.text(b));
  }

  private static String fold(String s, Operator op) {
    return op.caseInsensitive() ? s.toLowerCase(Locale.ROOT) : s;
  }

  static boolean like(String value, String pattern, boolean ignoreCase) {
    return likePattern(pattern, ignoreCase).matcher(value).matches();
  }

  /** {@code %} is any run, {@code _} one character; everything else is literal. */
  static Pattern likePattern(String pattern, boolean ignoreCase) {
    StringBuilder re = new StringBuilder(pattern.length() + 8);
    for (int i = 0; i < pattern.length(); i++) {
      char ch = pattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append('.');
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    return Pattern.compile(re.toString(), ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL : Pattern.DOTALL);
  }
}
