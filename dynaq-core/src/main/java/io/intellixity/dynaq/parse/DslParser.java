package io.intellixity.dynaq.parse;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.error.DslException;
import io.intellixity.dynaq.error.SchemaResolutionException;
import io.intellixity.dynaq.error.SyntaxException;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.query.*;
import io.intellixity.dynaq.scan.Scanner;
import io.intellixity.dynaq.schema.ForeignKey;
import io.intellixity.dynaq.schema.SchemaLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds a {@link QueryModel} from a DSL string.
 * <p>
 * Thread-safe: all state lives on the stack of {@link #parse(String)}. The only blocking
 * collaborator is the {@link SchemaLookup} consulted for INCLUDE; a lookup failure aborts the parse.
 */
public final class DslParser {
  private static final Logger log = LoggerFactory.getLogger(DslParser.class);

  private final SchemaLookup schema;
  private final CompilerOptions options;
  private final ExpressionResolver resolver;

  public DslParser(SchemaLookup schema, CompilerOptions options, ExpressionResolver resolver) {
    this.schema = schema == null ? SchemaLookup.NONE : schema;
    this.options = options == null ? CompilerOptions.defaults() : options;
    this.resolver = resolver == null ? ExpressionResolver.standard() : resolver;
  }

  public DslParser(SchemaLookup schema) {
    this(schema, CompilerOptions.defaults(), ExpressionResolver.standard());
  }

  public CompilerOptions options() { return options; }

  public QueryModel parse(String dsl) {
    if (dsl == null || dsl.isBlank()) throw new SyntaxException("Query string is empty");
    if (!Scanner.isBalanced(dsl)) throw new SyntaxException("Query string has unbalanced parentheses.");
    int unterminated = Scanner.findUnterminatedQuote(dsl);
    if (unterminated >= 0) throw new SyntaxException("Unterminated string literal at position " + unterminated);

    Clauses c = Clauses.extract(dsl);
    if (c.from() == null) throw new SyntaxException("FROM clause is required");
    String table = c.from();

    List<Column> raw = fetchColumns(c.fetch());
    Set<String> aliases = new LinkedHashSet<>();
    for (Column col : raw) if (col.hasAlias()) aliases.add(col.alias());

    ColumnQualifier qualifier = new ColumnQualifier(table, aliases, resolver);
    FilterParser filters = new FilterParser(qualifier, resolver);

    QueryModel.Builder b = QueryModel.builder(table).distinct(c.distinct());
    for (Column col : raw) {
      b.columns(List.of(col.isStar() ? col : new Column(qualifier.qualify(col.expression()), col.alias())));
    }

    if (c.include() != null) {
      for (Include inc : includes(table, c.include())) b.include(inc);
    }
    if (c.filter() != null && !c.filter().isBlank()) b.filter(filters.parseFilter(c.filter()));
    if (c.groupBy() != null) {
      for (String g : Scanner.splitTopLevel(c.groupBy(), ',')) b.groupBy(qualifier.qualify(g));
    }
    if (c.having() != null && !c.having().isBlank()) b.having(filters.parseHaving(c.having()));
    if (c.orderBy() != null) {
      for (String entry : Scanner.splitTopLevel(c.orderBy(), ',')) orderEntry(b, qualifier, entry);
    }

    Integer take = nonNegative("TAKE", c.take());
    if (take != null && options.maxLimit() != null && take > options.maxLimit()) {
      throw new SyntaxException("TAKE(" + take + ") exceeds the configured maximum of " + options.maxLimit());
    }
    b.limit(take).offset(nonNegative("SKIP", c.skip()));

    QueryModel model = b.build();
    if (log.isDebugEnabled()) {
      log.debug("dynaq.parse table={} columns={} includes={} grouped={}",
          table, model.columns().size(), model.includes().size(), !model.groupBy().isEmpty());
    }
    return model;
  }

  private static List<Column> fetchColumns(String body) {
    List<Column> out = new ArrayList<>();
    if (body == null) return out;
    for (String entry : Scanner.splitTopLevel(body, ',')) {
      List<String> tokens = Scanner.splitWhitespace(entry);
      int n = tokens.size();
      if (n >= 3 && tokens.get(n - 2).equalsIgnoreCase("AS")) {
        out.add(new Column(String.join(" ", tokens.subList(0, n - 2)), tokens.get(n - 1)));
      } else if (entry.equals("*")) {
        out.add(Column.star());
      } else {
        out.add(new Column(entry, null));
      }
    }
    return out;
  }

  private List<Include> includes(String root, String body) {
    List<Include> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (String entry : Scanner.splitTopLevel(body, ',')) {
      List<String> tokens = Scanner.splitWhitespace(entry);
      if (tokens.size() > 2) throw new SyntaxException("Invalid INCLUDE entry: '" + entry + "'");
      JoinKind kind = options.defaultJoinKind();
      if (tokens.size() == 2) {
        kind = JoinKind.parse(tokens.get(1));
        if (kind == null) throw new SyntaxException("Unknown join kind '" + tokens.get(1) + "' in INCLUDE");
      }

      String parent = root;
      for (String child : tokens.get(0).split("\\.")) {
        if (child.isEmpty()) throw new SyntaxException("Invalid INCLUDE path: '" + tokens.get(0) + "'");
        String hop = parent.toLowerCase(Locale.ROOT) + "->" + child.toLowerCase(Locale.ROOT);
        if (seen.add(hop)) {
          ForeignKey fk = resolveHop(parent, child);
          out.add(new Include(parent, fk.parentKey(), child, fk.childKey(), kind));
        }
        parent = child;
      }
    }
    return out;
  }

  private ForeignKey resolveHop(String parent, String child) {
    try {
      Optional<ForeignKey> direct = schema.resolveForeignKey(parent, child);
      if (direct.isPresent()) return direct.get();
      Optional<ForeignKey> reverse = schema.resolveForeignKey(child, parent);
      if (reverse.isPresent()) return reverse.get().swapped();
    } catch (DslException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SchemaResolutionException(parent, child, e);
    }
    throw new SchemaResolutionException(parent, child);
  }

  private static void orderEntry(QueryModel.Builder b, ColumnQualifier qualifier, String entry) {
    List<String> tokens = Scanner.splitWhitespace(entry);
    SortField.Direction dir = SortField.Direction.ASC;
    String last = tokens.get(tokens.size() - 1);
    List<String> expr = tokens;
    if (tokens.size() > 1 && (last.equalsIgnoreCase("ASC") || last.equalsIgnoreCase("DESC"))) {
      dir = last.equalsIgnoreCase("DESC") ? SortField.Direction.DESC : SortField.Direction.ASC;
      expr = tokens.subList(0, tokens.size() - 1);
    }
    b.orderBy(qualifier.qualify(String.join(" ", expr)), dir);
  }

  private static Integer nonNegative(String clause, String body) {
    if (body == null) return null;
    String s = body.trim();
    try {
      int v = Integer.parseInt(s);
      if (v >= 0) return v;
    } catch (NumberFormatException e) {
      throw new SyntaxException(clause + " requires a non-negative integer, got '" + s + "'", e);
    }
    throw new SyntaxException(clause + " requires a non-negative integer, got '" + s + "'");
  }
}
