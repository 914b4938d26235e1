package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.expr.DatePart;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.expr.FunctionCall;
import io.intellixity.dynaq.query.QueryModel;

import java.util.List;

/** Oracle dialect (12c+ for OFFSET/FETCH). */
public final class OracleDialect extends AbstractSqlDialect {
  public static final String ID = "oracle";

  public OracleDialect() {
    this(CompilerOptions.load());
  }

  public OracleDialect(CompilerOptions options) {
    super(options, ExpressionResolver.standard());
  }

  @Override public String id() { return ID; }

  @Override
  protected String castTemporal(String text, boolean timestamp) {
    if (!timestamp) return "TO_DATE(" + quote(text) + ", 'YYYY-MM-DD')";
    String ts = text.replace('T', ' ');
    if (ts.endsWith("Z")) ts = ts.substring(0, ts.length() - 1);
    int zone = Math.max(ts.lastIndexOf('+'), ts.lastIndexOf('-'));
    if (zone > 10) {
      String fmt = ts.contains(".") ? "YYYY-MM-DD HH24:MI:SS.FFTZH:TZM" : "YYYY-MM-DD HH24:MI:SSTZH:TZM";
      return "TO_TIMESTAMP_TZ(" + quote(ts) + ", '" + fmt + "')";
    }
    String fmt = ts.contains(".") ? "YYYY-MM-DD HH24:MI:SS.FF" : "YYYY-MM-DD HH24:MI:SS";
    return "TO_TIMESTAMP(" + quote(ts) + ", '" + fmt + "')";
  }

  @Override
  protected String concat(List<String> parts) {
    return parts.size() == 1 ? parts.get(0) : "(" + String.join(" || ", parts) + ")";
  }

  @Override
  protected String function(FunctionCall call, List<String> a) {
    return switch (call.def().name()) {
      case "CEIL" -> "CEIL(" + a.get(0) + ")";
      case "LOG10" -> "LOG(10, " + a.get(0) + ")";
      default -> super.function(call, a);
    };
  }

  @Override
  protected String reverse(FunctionCall call, String s) {
    throw new UnsupportedFunctionException(call.name(), ID, "Function " + call.name() + " is not supported by " + ID);
  }

  @Override
  protected String indexOf(String s, String find, String from) {
    if (from == null) return "(INSTR(" + s + ", " + find + ") - 1)";
    return "(INSTR(" + s + ", " + find + ", " + from + " + 1) - 1)";
  }

  @Override
  protected String now(String tz) {
    return tz == null ? "SYS_EXTRACT_UTC(SYSTIMESTAMP)" : "(SYSTIMESTAMP AT TIME ZONE " + tz + ")";
  }

  @Override
  protected String currentDate(String tz) { return "TRUNC(CAST(" + now(tz) + " AS DATE))"; }

  @Override
  protected String currentTime(String tz) { return "TO_CHAR(" + now(tz) + ", 'HH24:MI:SS')"; }

  @Override
  protected String dateAdd(DatePart part, String date, String amount) {
    return switch (part) {
      case YEAR -> "ADD_MONTHS(" + date + ", " + amount + " * 12)";
      case QUARTER -> "ADD_MONTHS(" + date + ", " + amount + " * 3)";
      case MONTH -> "ADD_MONTHS(" + date + ", " + amount + ")";
      case WEEK -> "(" + date + " + " + amount + " * 7)";
      case DAY, DAYOFWEEK, DAYOFYEAR -> "(" + date + " + " + amount + ")";
      case HOUR -> "(" + date + " + " + amount + " / 24)";
      case MINUTE -> "(" + date + " + " + amount + " / 1440)";
      case SECOND -> "(" + date + " + " + amount + " / 86400)";
    };
  }

  @Override
  protected String dateDiff(DatePart part, String start, String end) {
    String days = "(CAST(" + end + " AS DATE) - CAST(" + start + " AS DATE))";
    return switch (part) {
      case YEAR -> yearDiff(start, end);
      case QUARTER -> "TRUNC(" + monthDiff(start, end) + " / 3)";
      case MONTH -> monthDiff(start, end);
      case WEEK -> "FLOOR(TRUNC(" + days + ") / 7)";
      case DAY, DAYOFWEEK, DAYOFYEAR -> "TRUNC(" + days + ")";
      case HOUR -> "TRUNC(" + days + " * 24)";
      case MINUTE -> "TRUNC(" + days + " * 1440)";
      case SECOND -> "ROUND(" + days + " * 86400)";
    };
  }

  @Override
  protected String dateName(DatePart part, String date) {
    return "TO_CHAR(" + date + ", '" + toCharPattern(part) + "', 'NLS_DATE_LANGUAGE=ENGLISH')";
  }

  @Override
  protected String applyOffsetPage(String sql, QueryModel model, RenderCtx ctx) {
    return offsetFetch(sql, model, ctx);
  }
}
