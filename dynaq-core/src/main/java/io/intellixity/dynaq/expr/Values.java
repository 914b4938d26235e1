package io.intellixity.dynaq.expr;

import java.math.BigDecimal;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.regex.Pattern;

/** Literal shape detection and value coercion shared by the parser and the renderers. */
public final class Values {
  private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
  private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
  private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern TIMESTAMP =
      Pattern.compile("\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(\\.\\d{1,9})?(Z|[+-]\\d{2}:\\d{2})?");

  private Values() {}

  public static boolean isInteger(String s) { return s != null && INTEGER.matcher(s.trim()).matches(); }
  public static boolean isNumber(String s) { return s != null && DECIMAL.matcher(s.trim()).matches(); }
  public static boolean isBoolean(String s) { return s != null && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")); }
  public static boolean isDate(String s) { return s != null && DATE.matcher(s.trim()).matches(); }
  public static boolean isTimestamp(String s) { return s != null && TIMESTAMP.matcher(s.trim()).matches(); }
  public static boolean isTemporal(String s) { return isDate(s) || isTimestamp(s); }
  /** Date or timestamp shape that is also a real calendar value ({@code 2023-02-30} is not). */
  public static boolean isValidTemporal(String s) { return isTemporal(s) && toDateTime(s) != null; }

  /** Typed literal for unquoted text, or null when the text is not a literal shape. */
  public static Literal literalOf(String raw) {
    String s = raw.trim();
    if (isBoolean(s)) return new Literal(Literal.Type.BOOLEAN, s.toLowerCase());
    if (s.equalsIgnoreCase("null")) return new Literal(Literal.Type.NULL, null);
    if (isInteger(s)) {
      try {
        Integer.parseInt(s);
        return new Literal(Literal.Type.INTEGER, s);
      } catch (NumberFormatException e) {
        try {
          Long.parseLong(s);
          return new Literal(Literal.Type.LONG, s);
        } catch (NumberFormatException tooBig) {
          return new Literal(Literal.Type.DOUBLE, s);
        }
      }
    }
    if (isNumber(s)) return new Literal(Literal.Type.DOUBLE, s);
    if (isTemporal(s)) {
      if (!isValidTemporal(s)) return Literal.string(s);
      return new Literal(isDate(s) ? Literal.Type.DATE : Literal.Type.TIMESTAMP, s);
    }
    return null;
  }

  /** Numeric view of a value, or null when it has none. */
  public static Double toDouble(Object v) {
    if (v == null) return null;
    if (v instanceof Number n) return n.doubleValue();
    if (v instanceof Boolean) return null;
    String s = v.toString().trim();
    if (!isNumber(s)) return null;
    try {
      return Double.parseDouble(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public static Integer toInteger(Object v) {
    if (v instanceof Integer i) return i;
    if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) return n.intValue();
    if (v != null && isInteger(v.toString())) {
      try {
        return Integer.parseInt(v.toString().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  /** Java value for a literal: Integer, Long, Double, Boolean, LocalDateTime, String or null. */
  public static Object valueOf(Literal lit) {
    return switch (lit.type()) {
      case BOOLEAN -> Boolean.parseBoolean(lit.text());
      case INTEGER -> Integer.parseInt(stripPlus(lit.text()));
      case LONG -> Long.parseLong(stripPlus(lit.text()));
      case DOUBLE -> new BigDecimal(stripPlus(lit.text())).doubleValue();
      case DATE, TIMESTAMP -> toDateTime(lit.text());
      case STRING -> lit.text();
      case NULL -> null;
    };
  }

  /** UTC date-time view of a value, or null when it has none. */
  public static LocalDateTime toDateTime(Object v) {
    if (v == null) return null;
    if (v instanceof LocalDateTime ldt) return ldt;
    if (v instanceof LocalDate ld) return ld.atStartOfDay();
    if (v instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    if (v instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof ZonedDateTime zdt) return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay();
    if (v instanceof Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
    String s = v.toString().trim();
    try {
      if (isDate(s)) return LocalDate.parse(s).atStartOfDay();
      if (!isTimestamp(s)) return null;
      String iso = s.replace(' ', 'T');
      if (iso.endsWith("Z") || iso.matches(".*[+-]\\d{2}:\\d{2}$")) {
        return OffsetDateTime.parse(iso).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      }
      return LocalDateTime.parse(iso);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String stripPlus(String s) {
    return s.startsWith("+") ? s.substring(1) : s;
  }
}
