package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.expr.DatePart;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.query.Operator;
import io.intellixity.dynaq.query.QueryModel;

import java.util.Set;

/**
 * PostgreSQL dialect.
 *
 * Keeps only PostgreSQL-specific overrides; generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final String ID = "postgres";

  public PostgresDialect() {
    this(CompilerOptions.load());
  }

  public PostgresDialect(CompilerOptions options) {
    super(options, ExpressionResolver.standard());
  }

  @Override public String id() { return ID; }
  @Override public Set<String> aliases() { return Set.of("postgresql"); }

  @Override
  protected String booleanLiteral(boolean value) { return value ? "TRUE" : "FALSE"; }

  @Override
  protected String castTemporal(String text, boolean timestamp) {
    return quote(text) + (timestamp ? "::TIMESTAMP" : "::DATE");
  }

  @Override
  protected String like(String lhs, String pattern, Operator op) {
    if (!op.caseInsensitive()) return super.like(lhs, pattern, op);
    return lhs + (op.negated() ? " NOT ILIKE " : " ILIKE ") + pattern;
  }

  @Override
  protected String round(String x, String digits) { return "ROUND(" + x + "::numeric, " + digits + ")"; }

  @Override
  protected String indexOf(String s, String find, String from) {
    if (from == null) return "(STRPOS(" + s + ", " + find + ") - 1)";
    String tail = "STRPOS(SUBSTR(" + s + ", " + from + " + 1), " + find + ")";
    return "(CASE WHEN " + tail + " = 0 THEN -1 ELSE " + tail + " + " + from + " - 1 END)";
  }

  @Override
  protected String now(String tz) {
    return "(now() AT TIME ZONE " + (tz == null ? "'UTC'" : tz) + ")";
  }

  @Override
  protected String currentDate(String tz) { return "CAST(" + now(tz) + " AS DATE)"; }

  @Override
  protected String currentTime(String tz) { return "TO_CHAR(" + now(tz) + ", 'HH24:MI:SS')"; }

  @Override
  protected String dateAdd(DatePart part, String date, String amount) {
    String step = part == DatePart.QUARTER ? "3 MONTH" : "1 " + unit(part);
    return "(" + date + " + " + amount + " * INTERVAL '" + step + "')";
  }

  @Override
  protected String dateDiff(DatePart part, String start, String end) {
    String seconds = "EXTRACT(EPOCH FROM (CAST(" + end + " AS TIMESTAMP) - CAST(" + start + " AS TIMESTAMP)))";
    return switch (part) {
      case YEAR -> yearDiff(start, end);
      case QUARTER -> "TRUNC(" + monthDiff(start, end) + " / 3)";
      case MONTH -> monthDiff(start, end);
      case WEEK -> "FLOOR(TRUNC(" + seconds + " / 86400) / 7)";
      case DAY, DAYOFWEEK, DAYOFYEAR -> "TRUNC(" + seconds + " / 86400)";
      case HOUR -> "TRUNC(" + seconds + " / 3600)";
      case MINUTE -> "TRUNC(" + seconds + " / 60)";
      case SECOND -> "TRUNC(" + seconds + ")";
    };
  }

  @Override
  protected String dateName(DatePart part, String date) {
    return "TO_CHAR(" + date + ", '" + toCharPattern(part) + "')";
  }

  @Override
  protected String applyOffsetPage(String sql, QueryModel model, RenderCtx ctx) {
    return limitOffset(sql, model);
  }
}
