package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.error.RenderException;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.error.UnsupportedOperatorException;
import io.intellixity.dynaq.expr.*;
import io.intellixity.dynaq.jdbc.SqlStatement;
import io.intellixity.dynaq.query.*;
import io.intellixity.dynaq.spi.render.Rendered;

import java.util.*;

/**
 * Dialect-neutral SQL rendering.
 * <p>
 * Renders {@code SELECT [DISTINCT] cols FROM t [JOIN ...] [WHERE] [GROUP BY] [HAVING] [ORDER BY] [page]}
 * with literals inlined. Dialects override the hooks for literals, string concatenation,
 * case-insensitive matching, joins, function syntax and paging.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  /** Per-render state; never shared between renders. */
  protected static final class RenderCtx {
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Expression> aliases;
    private boolean having;

    RenderCtx(Map<String, Expression> aliases) {
      this.aliases = aliases;
    }

    public void warn(String warning) { warnings.add(warning); }
    public List<String> warnings() { return warnings; }
  }

  private final CompilerOptions options;
  private final ExpressionResolver resolver;

  protected AbstractSqlDialect(CompilerOptions options, ExpressionResolver resolver) {
    this.options = Objects.requireNonNull(options, "options");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public CompilerOptions options() { return options; }

  @Override
  public final Rendered<SqlStatement> render(QueryModel model) {
    Objects.requireNonNull(model, "model");
    Map<String, Expression> aliases = new HashMap<>();
    for (Column c : model.columns()) {
      if (c.hasAlias() && !c.isStar()) aliases.put(c.alias().toLowerCase(Locale.ROOT), resolver.classify(c.expression()));
    }
    RenderCtx ctx = new RenderCtx(aliases);

    StringBuilder sql = new StringBuilder("SELECT ");
    if (model.distinct()) sql.append("DISTINCT ");
    sql.append(selectList(model, ctx)).append(" FROM ").append(model.table());

    for (Include inc : model.includes()) {
      sql.append(' ').append(joinKeyword(inc.joinKind())).append(' ').append(inc.childTable())
          .append(" ON ").append(inc.parentTable()).append('.').append(inc.parentKey())
          .append(" = ").append(inc.childTable()).append('.').append(inc.childKey());
    }
    if (model.filter() != null) sql.append(" WHERE ").append(predicate(model.filter(), ctx));
    if (!model.groupBy().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (String g : model.groupBy()) parts.add(expr(resolver.classify(g), ctx));
      sql.append(" GROUP BY ").append(String.join(", ", parts));
    }
    if (model.having() != null) {
      ctx.having = true;
      sql.append(" HAVING ").append(predicate(model.having(), ctx));
      ctx.having = false;
    }
    if (!model.orderBy().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (SortField sf : model.orderBy()) {
        parts.add(expr(resolver.classify(sf.column()), ctx) + (sf.descending() ? " DESC" : " ASC"));
      }
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }

    String paged = model.paged() ? applyOffsetPage(sql.toString(), model, ctx) : sql.toString();
    return new Rendered<>(new SqlStatement(id(), paged), ctx.warnings());
  }

  private String selectList(QueryModel model, RenderCtx ctx) {
    List<String> parts = new ArrayList<>();
    for (Column c : model.columns()) {
      if (c.isStar()) {
        parts.add("*");
        continue;
      }
      String e = expr(resolver.classify(c.expression()), ctx);
      if (c.hasAlias()) e += " AS " + c.alias();
      else if (!c.isPlainColumn()) e += " AS " + c.outputName();
      parts.add(e);
    }
    return String.join(", ", parts);
  }

  // ---------------- predicates ----------------

  protected final String predicate(FilterNode node, RenderCtx ctx) {
    return node.accept(new FilterVisitor<String>() {
      @Override
      public String visit(Logical logical) {
        String op = logical.clause() == Clause.OR ? " OR " : " AND ";
        return "(" + logical.left().accept(this) + op + logical.right().accept(this) + ")";
      }

      @Override
      public String visit(Condition c) {
        return condition(c, ctx);
      }
    });
  }

  private String condition(Condition c, RenderCtx ctx) {
    Operator op = c.operator();
    String lhs = expr(resolver.classify(c.column()), ctx);
    switch (op.family()) {
      case NULL_CHECK:
        return lhs + (op == Operator.IS_NULL ? " IS NULL" : " IS NOT NULL");
      case MEMBERSHIP: {
        List<String> items = new ArrayList<>();
        for (String item : c.values()) items.add(expr(resolver.classifyItem(item), ctx));
        return lhs + (op.negated() ? " NOT IN (" : " IN (") + String.join(", ", items) + ")";
      }
      case RANGE: {
        String lo = expr(resolver.classifyItem(c.values().get(0)), ctx);
        String hi = expr(resolver.classifyItem(c.values().get(1)), ctx);
        return lhs + (op.negated() ? " NOT BETWEEN " : " BETWEEN ") + lo + " AND " + hi;
      }
      case COMPARISON:
        return lhs + " " + op.keyword() + " " + expr(resolver.classifyValue(c.value(), c.quoted()), ctx);
      default: {
        Expression rhs = resolver.classifyValue(c.value(), c.quoted());
        String sql = like(lhs, likePattern(op, rhs, ctx), op);
        return needsEscape(op, rhs) ? sql + " ESCAPE " + quote(String.valueOf(likeEscape())) : sql;
      }
    }
  }

  /** Escape character for synthesized patterns. */
  protected char likeEscape() { return '\\'; }

  /** Characters LIKE treats as wildcards. */
  protected String likeWildcards() { return "%_"; }

  /** A synthesized pattern around a literal whose text holds a wildcard or the escape character. */
  private boolean needsEscape(Operator op, Expression rhs) {
    if (op.family() == Operator.Family.LIKE || !(rhs instanceof Literal l) || l.type() == Literal.Type.NULL) return false;
    String special = likeWildcards() + likeEscape();
    for (int i = 0; i < l.text().length(); i++) {
      if (special.indexOf(l.text().charAt(i)) >= 0) return true;
    }
    return false;
  }

  private String escapeLike(String v) {
    String special = likeWildcards() + likeEscape();
    StringBuilder sb = new StringBuilder(v.length() + 4);
    for (int i = 0; i < v.length(); i++) {
      char ch = v.charAt(i);
      if (special.indexOf(ch) >= 0) sb.append(likeEscape());
      sb.append(ch);
    }
    return sb.toString();
  }

  /**
   * Pattern operand for the LIKE family: a quoted literal pattern, or a concatenation around an expression.
   * Literal text of the synthesized families matches verbatim; an expression operand is not escaped.
   */
  private String likePattern(Operator op, Expression rhs, RenderCtx ctx) {
    if (rhs instanceof Literal l && l.type() != Literal.Type.NULL) {
      String v = op.family() == Operator.Family.LIKE ? l.text() : escapeLike(l.text());
      return quote(switch (op.family()) {
        case CONTAINS -> "%" + v + "%";
        case BEGINS_WITH -> v + "%";
        case ENDS_WITH -> "%" + v;
        default -> v;
      });
    }
    String e = expr(rhs, ctx);
    return switch (op.family()) {
      case CONTAINS -> concat(List.of("'%'", e, "'%'"));
      case BEGINS_WITH -> concat(List.of(e, "'%'"));
      case ENDS_WITH -> concat(List.of("'%'", e));
      default -> e;
    };
  }

  /** Case-insensitive variants fold both sides with LOWER; PostgreSQL overrides with ILIKE. */
  protected String like(String lhs, String pattern, Operator op) {
    String kw = op.negated() ? " NOT LIKE " : " LIKE ";
    if (op.caseInsensitive()) return "LOWER(" + lhs + ")" + kw + "LOWER(" + pattern + ")";
    return lhs + kw + pattern;
  }

  // ---------------- expressions ----------------

  protected final String expr(Expression e, RenderCtx ctx) {
    return e.accept(new ExpressionVisitor<String>() {
      @Override
      public String visit(Literal literal) {
        return literal(literal);
      }

      @Override
      public String visit(ColumnRef ref) {
        if (ref.isStar()) return "*";
        // HAVING repeats the aliased expression; not every database resolves select aliases there
        if (ctx.having && ref.table() == null) {
          Expression aliased = ctx.aliases.get(ref.column().toLowerCase(Locale.ROOT));
          if (aliased != null && !aliased.equals(ref)) return expr(aliased, ctx);
        }
        return ref.qualified();
      }

      @Override
      public String visit(FunctionCall call) {
        List<String> args = new ArrayList<>(call.arity());
        for (int i = 0; i < call.arity(); i++) {
          Expression a = call.arg(i);
          args.add(isDateArgument(call, i) ? dateArgument(a, ctx) : expr(a, ctx));
        }
        return function(call, args);
      }
    });
  }

  protected String literal(Literal l) {
    return switch (l.type()) {
      case INTEGER, LONG, DOUBLE -> l.text();
      case BOOLEAN -> booleanLiteral(Boolean.parseBoolean(l.text()));
      case NULL -> "NULL";
      case DATE, TIMESTAMP, STRING -> quote(l.text());
    };
  }

  protected String booleanLiteral(boolean value) { return value ? "1" : "0"; }

  /** Temporal literal used as a date-function argument; the default leaves it as a quoted string. */
  protected String castTemporal(String text, boolean timestamp) { return quote(text); }

  protected String concat(List<String> parts) {
    return "CONCAT(" + String.join(", ", parts) + ")";
  }

  protected String joinKeyword(JoinKind kind) {
    return kind.name() + " JOIN";
  }

  protected static String quote(String text) {
    return "'" + text.replace("'", "''") + "'";
  }

  private static boolean isDateArgument(FunctionCall call, int i) {
    return switch (call.def().name()) {
      case "DATEADD", "DATENAME" -> i == 1;
      case "DATEDIFF" -> i == 1 || i == 2;
      case "DAY", "MONTH", "YEAR" -> i == 0;
      default -> false;
    };
  }

  private String dateArgument(Expression e, RenderCtx ctx) {
    if (e instanceof Literal l && (l.isTemporal() || (l.type() == Literal.Type.STRING && Values.isValidTemporal(l.text())))) {
      return castTemporal(l.text(), l.type() == Literal.Type.TIMESTAMP || Values.isTimestamp(l.text()));
    }
    return expr(e, ctx);
  }

  // ---------------- functions ----------------

  /** Final syntax for a catalog function over already rendered arguments. */
  protected String function(FunctionCall call, List<String> a) {
    String fn = call.def().name();
    return switch (fn) {
      case "COUNT", "SUM", "AVG", "MIN", "MAX",
          "ABS", "FLOOR", "SQRT", "POWER", "EXP", "LOG10",
          "UPPER", "LOWER", "TRIM", "LTRIM", "RTRIM", "REPLACE", "COALESCE" -> call(fn, a);
      case "CEIL" -> call("CEILING", a);
      case "ROUND" -> round(a.get(0), a.size() > 1 ? a.get(1) : "0");
      case "MOD" -> mod(a.get(0), a.get(1));
      case "LOG" -> a.size() == 2 ? log(a.get(0), a.get(1)) : ln(a.get(0));
      case "LN" -> ln(a.get(0));
      case "LENGTH" -> length(a.get(0));
      case "SUBSTRING" -> substring(a.get(0), a.get(1), a.size() > 2 ? a.get(2) : null);
      case "CONCAT" -> concat(a);
      case "INDEXOF" -> indexOf(a.get(0), a.get(1), a.size() > 2 ? a.get(2) : null);
      case "REVERSE" -> reverse(call, a.get(0));
      case "NOW" -> now(a.isEmpty() ? null : a.get(0));
      case "CURRENT_DATE" -> currentDate(a.isEmpty() ? null : a.get(0));
      case "CURRENT_TIME" -> currentTime(a.isEmpty() ? null : a.get(0));
      case "DATEADD" -> dateAdd(call.datePart(), a.get(1), a.get(2));
      case "DATEDIFF" -> dateDiff(call.datePart(), a.get(1), a.get(2));
      case "DATENAME" -> dateName(call.datePart(), a.get(1));
      case "DAY", "MONTH", "YEAR" -> datePart(fn, a.get(0));
      default -> throw new UnsupportedFunctionException(call.name(), id(), "Function " + call.name() + " is not supported by " + id());
    };
  }

  protected static String call(String name, List<String> args) {
    return name + "(" + String.join(", ", args) + ")";
  }

  protected String round(String x, String digits) { return "ROUND(" + x + ", " + digits + ")"; }
  protected String mod(String a, String b) { return "MOD(" + a + ", " + b + ")"; }
  protected String log(String x, String base) { return "LOG(" + base + ", " + x + ")"; }
  protected String ln(String x) { return "LN(" + x + ")"; }
  protected String length(String s) { return "LENGTH(" + s + ")"; }

  /** DSL positions are 0-based. */
  protected String substring(String s, String start, String length) {
    return length == null
        ? "SUBSTR(" + s + ", " + start + " + 1)"
        : "SUBSTR(" + s + ", " + start + " + 1, " + length + ")";
  }

  protected String reverse(FunctionCall call, String s) { return "REVERSE(" + s + ")"; }

  /** 0-based position of {@code find} in {@code s} at or after {@code from}, -1 when absent. */
  protected abstract String indexOf(String s, String find, String from);

  /** {@code tz} is the rendered time-zone argument, or null for UTC. */
  protected abstract String now(String tz);
  protected abstract String currentDate(String tz);
  protected abstract String currentTime(String tz);

  protected abstract String dateAdd(DatePart part, String date, String amount);

  /**
   * Calendar difference for YEAR, QUARTER and MONTH; elapsed units truncated toward zero otherwise;
   * WEEK is the floor of elapsed days over seven.
   */
  protected abstract String dateDiff(DatePart part, String start, String end);

  protected abstract String dateName(DatePart part, String date);

  protected String datePart(String field, String date) { return extract(field, date); }

  protected String extract(String field, String date) {
    return "EXTRACT(" + field + " FROM " + date + ")";
  }

  protected final String yearDiff(String start, String end) {
    return "(" + extract("YEAR", end) + " - " + extract("YEAR", start) + ")";
  }

  protected final String monthDiff(String start, String end) {
    return "((" + extract("YEAR", end) + " - " + extract("YEAR", start) + ") * 12 + "
        + extract("MONTH", end) + " - " + extract("MONTH", start) + ")";
  }

  /** Interval keyword for DATEADD: day-of-week and day-of-year step in days. */
  protected static String unit(DatePart part) {
    return switch (part) {
      case DAYOFWEEK, DAYOFYEAR -> "DAY";
      default -> part.name();
    };
  }

  /** TO_CHAR pattern shared by PostgreSQL and Oracle. */
  protected static String toCharPattern(DatePart part) {
    return switch (part) {
      case YEAR -> "YYYY";
      case QUARTER -> "Q";
      case MONTH -> "FMMonth";
      case WEEK -> "FMIW";
      case DAY, DAYOFWEEK -> "FMDay";
      case DAYOFYEAR -> "FMDDD";
      case HOUR -> "HH24";
      case MINUTE -> "MI";
      case SECOND -> "SS";
    };
  }

  // ---------------- paging ----------------

  /** Called only when the model has TAKE or SKIP. */
  protected abstract String applyOffsetPage(String sql, QueryModel model, RenderCtx ctx);

  protected static String limitOffset(String sql, QueryModel model) {
    StringBuilder sb = new StringBuilder(sql);
    if (model.limit() != null) sb.append(" LIMIT ").append(model.limit());
    if (model.offset() != null) sb.append(" OFFSET ").append(model.offset());
    return sb.toString();
  }

  /**
   * {@code OFFSET m ROWS [FETCH NEXT n ROWS ONLY]}. Both databases accept it only after ORDER BY,
   * so an unordered model follows {@link CompilerOptions#paginationWithoutOrder()}.
   */
  protected final String offsetFetch(String sql, QueryModel model, RenderCtx ctx) {
    if (model.orderBy().isEmpty()) {
      if (options.paginationWithoutOrder() == CompilerOptions.PaginationPolicy.OMIT) {
        ctx.warn("TAKE/SKIP omitted: " + id() + " requires ORDERBY for OFFSET/FETCH pagination; rows are not paged");
        return sql;
      }
      throw new RenderException(id(), id() + " requires ORDERBY for TAKE/SKIP (OFFSET/FETCH pagination)");
    }
    StringBuilder sb = new StringBuilder(sql)
        .append(" OFFSET ").append(model.offset() == null ? 0 : model.offset()).append(" ROWS");
    if (model.limit() != null) sb.append(" FETCH NEXT ").append(model.limit()).append(" ROWS ONLY");
    return sb.toString();
  }

  protected final UnsupportedOperatorException unsupportedJoin(JoinKind kind) {
    return new UnsupportedOperatorException(kind.name() + " JOIN", id(), id() + " does not support " + kind.name() + " JOIN");
  }
}
