package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.expr.DatePart;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.query.JoinKind;
import io.intellixity.dynaq.query.QueryModel;

import java.util.ArrayList;
import java.util.List;

/** MySQL dialect. */
public final class MySqlDialect extends AbstractSqlDialect {
  public static final String ID = "mysql";

  /** MySQL has no OFFSET without LIMIT; this is the documented "all rows" limit. */
  static final String MAX_ROWS = "18446744073709551615";

  public MySqlDialect() {
    this(CompilerOptions.load());
  }

  public MySqlDialect(CompilerOptions options) {
    super(options, ExpressionResolver.standard());
  }

  @Override public String id() { return ID; }

  @Override
  protected String joinKeyword(JoinKind kind) {
    if (kind == JoinKind.FULL) throw unsupportedJoin(kind);
    return super.joinKeyword(kind);
  }

  /** A backslash inside a MySQL string literal is itself an escape. */
  @Override
  protected char likeEscape() { return '!'; }

  /** CONCAT is null if any argument is null. */
  @Override
  protected String concat(List<String> parts) {
    List<String> guarded = new ArrayList<>(parts.size());
    for (String p : parts) guarded.add("COALESCE(" + p + ", '')");
    return "CONCAT(" + String.join(", ", guarded) + ")";
  }

  @Override
  protected String length(String s) { return "CHAR_LENGTH(" + s + ")"; }

  @Override
  protected String indexOf(String s, String find, String from) {
    if (from == null) return "(INSTR(" + s + ", " + find + ") - 1)";
    return "(LOCATE(" + find + ", " + s + ", " + from + " + 1) - 1)";
  }

  @Override
  protected String now(String tz) {
    return tz == null ? "UTC_TIMESTAMP()" : "CONVERT_TZ(UTC_TIMESTAMP(), 'UTC', " + tz + ")";
  }

  @Override
  protected String currentDate(String tz) {
    return tz == null ? "UTC_DATE()" : "DATE(" + now(tz) + ")";
  }

  @Override
  protected String currentTime(String tz) {
    return tz == null ? "UTC_TIME()" : "DATE_FORMAT(" + now(tz) + ", '%H:%i:%s')";
  }

  @Override
  protected String dateAdd(DatePart part, String date, String amount) {
    return "DATE_ADD(" + date + ", INTERVAL " + amount + " " + unit(part) + ")";
  }

  @Override
  protected String dateDiff(DatePart part, String start, String end) {
    return switch (part) {
      case YEAR -> yearDiff(start, end);
      case QUARTER -> "(" + monthDiff(start, end) + " DIV 3)";
      case MONTH -> monthDiff(start, end);
      case WEEK -> "FLOOR(TIMESTAMPDIFF(DAY, " + start + ", " + end + ") / 7)";
      default -> "TIMESTAMPDIFF(" + unit(part) + ", " + start + ", " + end + ")";
    };
  }

  @Override
  protected String dateName(DatePart part, String date) {
    return switch (part) {
      case YEAR -> "DATE_FORMAT(" + date + ", '%Y')";
      case QUARTER -> "CAST(QUARTER(" + date + ") AS CHAR)";
      case MONTH -> "MONTHNAME(" + date + ")";
      case WEEK -> "CAST(WEEK(" + date + ", 3) AS CHAR)";
      case DAY, DAYOFWEEK -> "DAYNAME(" + date + ")";
      case DAYOFYEAR -> "CAST(DAYOFYEAR(" + date + ") AS CHAR)";
      case HOUR -> "DATE_FORMAT(" + date + ", '%H')";
      case MINUTE -> "DATE_FORMAT(" + date + ", '%i')";
      case SECOND -> "DATE_FORMAT(" + date + ", '%s')";
    };
  }

  @Override
  protected String datePart(String field, String date) { return field + "(" + date + ")"; }

  @Override
  protected String applyOffsetPage(String sql, QueryModel model, RenderCtx ctx) {
    if (model.limit() == null) return sql + " LIMIT " + MAX_ROWS + " OFFSET " + model.offset();
    return limitOffset(sql, model);
  }
}
