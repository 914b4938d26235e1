package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.expr.DatePart;
import io.intellixity.dynaq.expr.FunctionCall;
import io.intellixity.dynaq.expr.Values;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.*;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Locale;

/**
 * Catalog function semantics for the in-memory target.
 * <p>
 * String functions read null as {@code ""}; numeric functions return null for non-numeric input;
 * SUBSTRING and INDEXOF are 0-based; date functions work on UTC {@link LocalDateTime}s.
 */
public final class FunctionEvaluator {
  private static final String TARGET = "memory";

  private FunctionEvaluator() {}

  /** Scalar call over already evaluated arguments. */
  public static Object scalar(FunctionCall call, List<Object> args) {
    String fn = call.def().name();
    return switch (fn) {
      case "LENGTH" -> str(args, 0).length();
      case "SUBSTRING" -> substring(args);
      case "CONCAT" -> {
        StringBuilder sb = new StringBuilder();
        for (Object a : args) sb.append(a == null ? "" : text(a));
        yield sb.toString();
      }
      case "UPPER" -> str(args, 0).toUpperCase(Locale.ROOT);
      case "LOWER" -> str(args, 0).toLowerCase(Locale.ROOT);
      case "TRIM" -> str(args, 0).strip();
      case "LTRIM" -> str(args, 0).stripLeading();
      case "RTRIM" -> str(args, 0).stripTrailing();
      case "REPLACE" -> {
        String find = str(args, 1);
        yield find.isEmpty() ? str(args, 0) : str(args, 0).replace(find, str(args, 2));
      }
      case "INDEXOF" -> indexOf(args);
      case "REVERSE" -> new StringBuilder(str(args, 0)).reverse().toString();

      case "ABS" -> unary(args, Math::abs);
      case "CEIL" -> unary(args, Math::ceil);
      case "FLOOR" -> unary(args, Math::floor);
      case "ROUND" -> round(args);
      case "SQRT" -> {
        Double x = Values.toDouble(args.get(0));
        yield (x == null || x < 0) ? null : Math.sqrt(x);
      }
      case "POWER" -> {
        Double b = Values.toDouble(args.get(0));
        Double e = Values.toDouble(args.get(1));
        yield (b == null || e == null) ? null : Math.pow(b, e);
      }
      case "MOD" -> {
        Double a = Values.toDouble(args.get(0));
        Double b = Values.toDouble(args.get(1));
        yield (a == null || b == null || b == 0d) ? null : a % b;
      }
      case "EXP" -> unary(args, Math::exp);
      case "LOG" -> log(args);
      case "LN" -> {
        Double x = Values.toDouble(args.get(0));
        yield (x == null || x <= 0) ? null : Math.log(x);
      }
      case "LOG10" -> {
        Double x = Values.toDouble(args.get(0));
        yield (x == null || x <= 0) ? null : Math.log10(x);
      }

      case "COALESCE" -> {
        for (Object a : args) if (a != null) yield a;
        yield null;
      }

      case "NOW" -> now(call, args);
      case "CURRENT_DATE" -> now(call, args).toLocalDate();
      case "CURRENT_TIME" -> now(call, args).toLocalTime().truncatedTo(ChronoUnit.SECONDS);
      case "DATEADD" -> dateAdd(args);
      case "DATEDIFF" -> dateDiff(args);
      case "DATENAME" -> dateName(args);
      case "DAY" -> datePart(args.get(0), LocalDateTime::getDayOfMonth);
      case "MONTH" -> datePart(args.get(0), LocalDateTime::getMonthValue);
      case "YEAR" -> datePart(args.get(0), LocalDateTime::getYear);
      default -> throw new UnsupportedFunctionException(call.name(), TARGET,
          "Function " + call.name() + " is not supported by " + TARGET);
    };
  }

  /**
   * Aggregate over the per-row argument values. COUNT(*) counts rows, COUNT(x) non-null values; SUM
   * reads nulls as 0; AVG, MIN and MAX use numeric values only and return null when there are none.
   */
  public static Object aggregate(String function, boolean star, List<Object> values) {
    switch (function) {
      case "COUNT" -> {
        if (star) return (long) values.size();
        long n = 0;
        for (Object v : values) if (v != null) n++;
        return n;
      }
      case "SUM" -> {
        double sum = 0;
        for (Object v : values) {
          Double d = Values.toDouble(v);
          if (d != null) sum += d;
        }
        return sum;
      }
      case "AVG", "MIN", "MAX" -> {
        double acc = 0;
        int n = 0;
        for (Object v : values) {
          Double d = Values.toDouble(v);
          if (d == null) continue;
          if (n == 0) acc = d;
          else if (function.equals("AVG")) acc += d;
          else if (function.equals("MIN")) acc = Math.min(acc, d);
          else acc = Math.max(acc, d);
          n++;
        }
        if (n == 0) return null;
        return function.equals("AVG") ? acc / n : acc;
      }
      default -> throw new UnsupportedFunctionException(function, TARGET, "Unsupported aggregate function: " + function);
    }
  }

  // ---------------- strings ----------------

  private static String str(List<Object> args, int i) {
    Object v = i < args.size() ? args.get(i) : null;
    return v == null ? "" : text(v);
  }

  /** Integral doubles print without a fraction so {@code CONCAT(1.0)} reads {@code 1}. */
  static String text(Object v) {
    if (v instanceof Double d && d == Math.rint(d) && !d.isInfinite()) return Long.toString(d.longValue());
    return v.toString();
  }

  private static String substring(List<Object> args) {
    String s = str(args, 0);
    Integer start = Values.toInteger(args.get(1));
    if (start == null) return "";
    start = Math.max(0, start);
    if (start >= s.length()) return "";
    if (args.size() == 2) return s.substring(start);
    Integer len = Values.toInteger(args.get(2));
    if (len == null || len < 0) return "";
    return s.substring(start, Math.min(s.length(), start + len));
  }

  private static Integer indexOf(List<Object> args) {
    String s = str(args, 0);
    String find = str(args, 1);
    if (args.size() == 2) return s.indexOf(find);
    Integer from = Values.toInteger(args.get(2));
    if (from == null || from >= s.length()) return -1;
    return s.indexOf(find, Math.max(0, from));
  }

  // ---------------- numbers ----------------

  private interface DoubleOp {
    double apply(double x);
  }

  private static Double unary(List<Object> args, DoubleOp op) {
    Double x = Values.toDouble(args.get(0));
    return x == null ? null : op.apply(x);
  }

  private static Double round(List<Object> args) {
    Double x = Values.toDouble(args.get(0));
    if (x == null || x.isNaN() || x.isInfinite()) return null;
    int scale = 0;
    if (args.size() == 2) {
      Integer s = Values.toInteger(args.get(1));
      if (s != null) scale = s;
    }
    return BigDecimal.valueOf(x).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }

  /** LOG(x) is natural; LOG(x, b) is base b. */
  private static Double log(List<Object> args) {
    Double x = Values.toDouble(args.get(0));
    if (x == null || x <= 0) return null;
    if (args.size() == 1) return Math.log(x);
    Double b = Values.toDouble(args.get(1));
    if (b == null || b <= 0 || b == 1d) return null;
    return Math.log(x) / Math.log(b);
  }

  // ---------------- dates ----------------

  private static LocalDateTime now(FunctionCall call, List<Object> args) {
    if (args.isEmpty() || args.get(0) == null) return LocalDateTime.now(ZoneOffset.UTC);
    String zone = text(args.get(0));
    try {
      return LocalDateTime.now(ZoneId.of(zone));
    } catch (DateTimeException e) {
      throw new UnsupportedFunctionException(call.name(), TARGET, "Unknown time zone '" + zone + "' for " + call.name());
    }
  }

  private static LocalDateTime dateAdd(List<Object> args) {
    DatePart part = DatePart.parse(str(args, 0));
    LocalDateTime d = Values.toDateTime(args.get(1));
    Integer n = Values.toInteger(args.get(2));
    if (part == null || d == null || n == null) return null;
    return switch (part) {
      case YEAR -> d.plusYears(n);
      case QUARTER -> d.plusMonths(3L * n);
      case MONTH -> d.plusMonths(n);
      case WEEK -> d.plusWeeks(n);
      case DAY, DAYOFWEEK, DAYOFYEAR -> d.plusDays(n);
      case HOUR -> d.plusHours(n);
      case MINUTE -> d.plusMinutes(n);
      case SECOND -> d.plusSeconds(n);
    };
  }

  /** Calendar difference for YEAR/QUARTER/MONTH, truncated elapsed units otherwise. */
  private static Long dateDiff(List<Object> args) {
    DatePart part = DatePart.parse(str(args, 0));
    LocalDateTime a = Values.toDateTime(args.get(1));
    LocalDateTime b = Values.toDateTime(args.get(2));
    if (part == null || a == null || b == null) return null;
    long months = (b.getYear() - a.getYear()) * 12L + b.getMonthValue() - a.getMonthValue();
    Duration elapsed = Duration.between(a, b);
    return switch (part) {
      case YEAR -> (long) (b.getYear() - a.getYear());
      case QUARTER -> months / 3;
      case MONTH -> months;
      case WEEK -> Math.floorDiv(elapsed.toDays(), 7);
      case DAY, DAYOFWEEK, DAYOFYEAR -> elapsed.toDays();
      case HOUR -> elapsed.toHours();
      case MINUTE -> elapsed.toMinutes();
      case SECOND -> elapsed.getSeconds();
    };
  }

  private static String dateName(List<Object> args) {
    DatePart part = DatePart.parse(str(args, 0));
    LocalDateTime d = Values.toDateTime(args.get(1));
    if (part == null || d == null) return null;
    return switch (part) {
      case YEAR -> Integer.toString(d.getYear());
      case QUARTER -> Integer.toString((d.getMonthValue() + 2) / 3);
      case MONTH -> d.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
      case WEEK -> Integer.toString(d.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
      case DAY, DAYOFWEEK -> d.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
      case DAYOFYEAR -> Integer.toString(d.getDayOfYear());
      case HOUR -> String.format(Locale.ROOT, "%02d", d.getHour());
      case MINUTE -> String.format(Locale.ROOT, "%02d", d.getMinute());
      case SECOND -> String.format(Locale.ROOT, "%02d", d.getSecond());
    };
  }

  private interface DateField {
    int get(LocalDateTime d);
  }

  private static Integer datePart(Object v, DateField field) {
    LocalDateTime d = Values.toDateTime(v);
    return d == null ? null : field.get(d);
  }
}
