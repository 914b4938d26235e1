package io.intellixity.dynaq.mongo;

import io.intellixity.dynaq.error.RenderException;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.expr.DatePart;
import io.intellixity.dynaq.expr.FunctionCall;
import io.intellixity.dynaq.expr.Literal;
import io.intellixity.dynaq.expr.Values;
import org.bson.Document;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

/** Aggregation-expression syntax for literals, catalog functions and accumulators. */
final class MongoFunctions {
  /** Length used by the two-argument SUBSTRING, which runs to the end of the string. */
  static final int TO_END = 1_000_000;

  private MongoFunctions() {}

  static Object literal(Literal l) {
    return switch (l.type()) {
      case NULL -> null;
      case BOOLEAN -> Boolean.parseBoolean(l.text());
      case INTEGER -> Integer.valueOf(l.text());
      case LONG -> Long.valueOf(l.text());
      case DOUBLE -> Double.valueOf(l.text());
      case DATE, TIMESTAMP -> date(l);
      // a leading '$' would otherwise read as a field path
      case STRING -> l.text().startsWith("$") ? new Document("$literal", l.text()) : l.text();
    };
  }

  private static Date date(Literal l) {
    LocalDateTime dt = Values.toDateTime(l.text());
    if (dt == null) throw new RenderException(MongoPipelineRenderer.ID, "Invalid date literal '" + l.text() + "'");
    return Date.from(dt.toInstant(ZoneOffset.UTC));
  }

  static Document accumulator(FunctionCall call, Object arg) {
    return switch (call.def().name()) {
      case "COUNT" -> arg == null
          ? new Document("$sum", 1)
          : new Document("$sum", new Document("$cond", Arrays.asList(
              new Document("$eq", Arrays.asList(new Document("$ifNull", Arrays.asList(arg, null)), null)), 0, 1)));
      case "SUM" -> new Document("$sum", arg);
      case "AVG" -> new Document("$avg", arg);
      case "MIN" -> new Document("$min", arg);
      case "MAX" -> new Document("$max", arg);
      default -> throw new IllegalArgumentException("Not an aggregate: " + call.name());
    };
  }

  /** {@code a} holds the resolved arguments; for date-part functions {@code a.get(0)} is the part name. */
  static Object function(FunctionCall call, List<Object> a) {
    String fn = call.def().name();
    return switch (fn) {
      case "ABS" -> op("$abs", a.get(0));
      case "CEIL" -> op("$ceil", a.get(0));
      case "FLOOR" -> op("$floor", a.get(0));
      case "ROUND" -> op("$round", a.size() > 1 ? list(a.get(0), a.get(1)) : list(a.get(0), 0));
      case "SQRT" -> op("$sqrt", a.get(0));
      case "POWER" -> op("$pow", list(a.get(0), a.get(1)));
      case "MOD" -> op("$mod", list(a.get(0), a.get(1)));
      case "EXP" -> op("$exp", a.get(0));
      case "LOG" -> a.size() == 2 ? op("$log", list(a.get(0), a.get(1))) : op("$ln", a.get(0));
      case "LN" -> op("$ln", a.get(0));
      case "LOG10" -> op("$log10", a.get(0));

      case "LENGTH" -> op("$strLenCP", a.get(0));
      case "SUBSTRING" -> op("$substrCP", list(a.get(0), a.get(1), a.size() > 2 ? a.get(2) : TO_END));
      case "CONCAT" -> op("$concat", new ArrayList<>(a));
      case "UPPER" -> op("$toUpper", a.get(0));
      case "LOWER" -> op("$toLower", a.get(0));
      case "TRIM" -> op("$trim", new Document("input", a.get(0)));
      case "LTRIM" -> op("$ltrim", new Document("input", a.get(0)));
      case "RTRIM" -> op("$rtrim", new Document("input", a.get(0)));
      case "REPLACE" -> op("$replaceAll", new Document("input", a.get(0)).append("find", a.get(1)).append("replacement", a.get(2)));
      case "INDEXOF" -> op("$indexOfCP", a.size() > 2 ? list(a.get(0), a.get(1), a.get(2)) : list(a.get(0), a.get(1)));
      case "REVERSE" -> reverse(a.get(0));

      case "COALESCE" -> coalesce(a);

      case "NOW" -> a.isEmpty() ? "$$NOW"
          : op("$toDate", op("$dateToString", new Document("date", "$$NOW").append("timezone", a.get(0))));
      case "CURRENT_DATE" -> op("$dateTrunc", zoned(new Document("date", "$$NOW").append("unit", "day"), a));
      case "CURRENT_TIME" -> op("$dateToString", zoned(new Document("date", "$$NOW").append("format", "%H:%M:%S"), a));
      case "DATEADD" -> op("$dateAdd", new Document("startDate", a.get(1))
          .append("unit", unit(call.datePart())).append("amount", a.get(2)));
      case "DATEDIFF" -> op("$dateDiff", new Document("startDate", a.get(1))
          .append("endDate", a.get(2)).append("unit", unit(call.datePart())));
      case "DATENAME" -> dateName(call.datePart(), a.get(1));
      case "DAY" -> op("$dayOfMonth", a.get(0));
      case "MONTH" -> op("$month", a.get(0));
      case "YEAR" -> op("$year", a.get(0));
      default -> throw new UnsupportedFunctionException(call.name(), MongoPipelineRenderer.ID,
          "Function " + call.name() + " is not supported by " + MongoPipelineRenderer.ID);
    };
  }

  /** Prepends each character in turn: {@code $reduce} over the code-point indexes. */
  private static Document reverse(Object s) {
    return op("$reduce", new Document("input", op("$range", list(0, op("$strLenCP", s))))
        .append("initialValue", "")
        .append("in", op("$concat", list(op("$substrCP", list(s, "$$this", 1)), "$$value"))));
  }

  private static Object coalesce(List<Object> a) {
    Object result = a.get(a.size() - 1);
    for (int i = a.size() - 2; i >= 0; i--) result = op("$ifNull", list(a.get(i), result));
    return result;
  }

  private static Document dateName(DatePart part, Object date) {
    if (part == DatePart.QUARTER) {
      return op("$toString", op("$ceil", op("$divide", list(op("$month", date), 3))));
    }
    String format = switch (part) {
      case YEAR -> "%Y";
      case MONTH -> "%m";
      case WEEK -> "%V";
      case DAY -> "%d";
      case HOUR -> "%H";
      case MINUTE -> "%M";
      case SECOND -> "%S";
      case DAYOFWEEK -> "%u";
      case DAYOFYEAR -> "%j";
      case QUARTER -> throw new IllegalStateException();
    };
    return op("$dateToString", new Document("date", date).append("format", format));
  }

  /** {@code $dateAdd}/{@code $dateDiff} unit; day-of-week and day-of-year count days. */
  static String unit(DatePart part) {
    return switch (part) {
      case DAYOFWEEK, DAYOFYEAR -> "day";
      default -> part.lower();
    };
  }

  private static Document zoned(Document d, List<Object> a) {
    if (!a.isEmpty()) d.append("timezone", a.get(0));
    return d;
  }

  static Document op(String operator, Object operand) {
    return new Document(operator, operand);
  }

  /** Allows null elements, unlike {@code List.of}. */
  static List<Object> list(Object... items) {
    return Arrays.asList(items);
  }
}
