package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.expr.DatePart;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.query.QueryModel;

import java.util.Set;

/** SQL Server dialect. Pagination is OFFSET/FETCH and needs ORDER BY. */
public final class SqlServerDialect extends AbstractSqlDialect {
  public static final String ID = "sqlserver";

  public SqlServerDialect() {
    this(CompilerOptions.load());
  }

  public SqlServerDialect(CompilerOptions options) {
    super(options, ExpressionResolver.standard());
  }

  @Override public String id() { return ID; }
  @Override public Set<String> aliases() { return Set.of("mssql"); }

  /** Brackets open a character class. */
  @Override
  protected String likeWildcards() { return "%_["; }

  @Override
  protected String mod(String a, String b) { return "(" + a + " % " + b + ")"; }

  @Override
  protected String log(String x, String base) { return "(LOG(" + x + ") / LOG(" + base + "))"; }

  @Override
  protected String ln(String x) { return "LOG(" + x + ")"; }

  @Override
  protected String length(String s) { return "LEN(" + s + ")"; }

  @Override
  protected String substring(String s, String start, String length) {
    String n = length == null ? "LEN(" + s + ") - " + start : length;
    return "SUBSTRING(" + s + ", " + start + " + 1, " + n + ")";
  }

  @Override
  protected String indexOf(String s, String find, String from) {
    if (from == null) return "(CHARINDEX(" + find + ", " + s + ") - 1)";
    return "(CHARINDEX(" + find + ", " + s + ", " + from + " + 1) - 1)";
  }

  @Override
  protected String now(String tz) {
    return tz == null ? "GETUTCDATE()" : "(GETUTCDATE() AT TIME ZONE 'UTC' AT TIME ZONE " + tz + ")";
  }

  @Override
  protected String currentDate(String tz) { return "CAST(" + now(tz) + " AS DATE)"; }

  @Override
  protected String currentTime(String tz) { return "FORMAT(" + now(tz) + ", 'HH:mm:ss')"; }

  @Override
  protected String dateAdd(DatePart part, String date, String amount) {
    return "DATEADD(" + unit(part) + ", " + amount + ", " + date + ")";
  }

  @Override
  protected String dateDiff(DatePart part, String start, String end) {
    String seconds = "DATEDIFF_BIG(SECOND, " + start + ", " + end + ")";
    return switch (part) {
      case YEAR -> "DATEDIFF(YEAR, " + start + ", " + end + ")";
      case QUARTER -> "(DATEDIFF(MONTH, " + start + ", " + end + ") / 3)";
      case MONTH -> "DATEDIFF(MONTH, " + start + ", " + end + ")";
      case WEEK -> "FLOOR((" + seconds + " / 86400) / 7.0)";
      case DAY, DAYOFWEEK, DAYOFYEAR -> "(" + seconds + " / 86400)";
      case HOUR -> "(" + seconds + " / 3600)";
      case MINUTE -> "(" + seconds + " / 60)";
      case SECOND -> seconds;
    };
  }

  @Override
  protected String dateName(DatePart part, String date) {
    return switch (part) {
      case DAY, DAYOFWEEK -> "DATENAME(WEEKDAY, " + date + ")";
      case WEEK -> "DATENAME(ISO_WEEK, " + date + ")";
      case HOUR -> "FORMAT(" + date + ", 'HH')";
      case MINUTE -> "FORMAT(" + date + ", 'mm')";
      case SECOND -> "FORMAT(" + date + ", 'ss')";
      default -> "DATENAME(" + part.name() + ", " + date + ")";
    };
  }

  @Override
  protected String datePart(String field, String date) { return field + "(" + date + ")"; }

  @Override
  protected String applyOffsetPage(String sql, QueryModel model, RenderCtx ctx) {
    return offsetFetch(sql, model, ctx);
  }
}
