package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.expr.*;
import io.intellixity.dynaq.query.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executable form of a {@link QueryModel} over rows held in memory.
 * <p>
 * Order of operations: filter, group (GROUPBY or any aggregate), having, projection, distinct,
 * order by, offset, limit. Rows must already be joined; INCLUDE is not evaluated here.
 * <p>
 * Immutable after construction and safe to execute concurrently.
 */
public final class InMemoryPlan {
  private static final Logger log = LoggerFactory.getLogger(InMemoryPlan.class);

  private final QueryModel model;
  private final ExpressionResolver resolver;
  private final List<String> warnings;
  private final List<Expression> columnExprs;
  private final List<Expression> groupExprs;
  private final List<SortKey> sortKeys;
  private final boolean grouped;
  private final ExpressionEvaluator evaluator;
  private final Map<String, Expression> cache = new ConcurrentHashMap<>();

  /** Sort by an already projected key when the ORDERBY entry names an output column. */
  private record SortKey(String projectedKey, Expression expression, boolean descending) {}

  private record Entry(EvalScope scope, Map<String, Object> row) {}

  InMemoryPlan(QueryModel model, ExpressionResolver resolver, List<String> warnings) {
    this.model = Objects.requireNonNull(model, "model");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.warnings = List.copyOf(warnings);

    List<Expression> cols = new ArrayList<>();
    Map<String, Expression> aliases = new HashMap<>();
    boolean aggregates = false;
    for (Column c : model.columns()) {
      Expression e = c.isStar() ? null : validated(expression(c.expression()));
      cols.add(e);
      if (e != null && c.hasAlias()) aliases.put(c.alias().toLowerCase(Locale.ROOT), e);
      aggregates |= ExpressionResolver.firstAggregate(e) != null;
    }
    this.columnExprs = Collections.unmodifiableList(cols);
    this.evaluator = new ExpressionEvaluator(aliases);

    List<Expression> groups = new ArrayList<>();
    for (String g : model.groupBy()) groups.add(validated(expression(g)));
    this.groupExprs = List.copyOf(groups);

    List<SortKey> keys = new ArrayList<>();
    for (SortField sf : model.orderBy()) {
      Expression e = validated(expression(sf.column()));
      aggregates |= ExpressionResolver.firstAggregate(e) != null;
      keys.add(new SortKey(projectedKey(sf.column()), e, sf.descending()));
    }
    this.sortKeys = List.copyOf(keys);

    if (model.filter() != null) model.filter().accept(new Precompiler());
    if (model.having() != null) {
      Precompiler having = new Precompiler();
      model.having().accept(having);
      aggregates |= having.aggregates;
    }
    this.grouped = !model.groupBy().isEmpty() || aggregates;
  }

  public QueryModel model() { return model; }
  public List<String> warnings() { return warnings; }

  public List<Map<String, Object>> execute(List<Map<String, Object>> rows) {
    List<Map<String, Object>> input = rows == null ? List.of() : rows;

    List<EvalScope> scopes = new ArrayList<>();
    List<Map<String, Object>> kept = new ArrayList<>();
    for (Map<String, Object> r : input) {
      if (RowPredicate.test(model.filter(), this, EvalScope.row(r))) kept.add(r);
    }
    if (grouped) {
      scopes.addAll(group(kept));
    } else {
      for (Map<String, Object> r : kept) scopes.add(EvalScope.row(r));
    }

    List<Entry> entries = new ArrayList<>(scopes.size());
    Set<Map<String, Object>> seen = new HashSet<>();
    for (EvalScope s : scopes) {
      if (!RowPredicate.test(model.having(), this, s)) continue;
      Map<String, Object> projected = project(s);
      if (model.distinct() && !seen.add(projected)) continue;
      entries.add(new Entry(s, projected));
    }

    if (!sortKeys.isEmpty()) entries.sort(this::compareEntries);

    int from = model.offset() == null ? 0 : Math.min(model.offset(), entries.size());
    int to = model.limit() == null ? entries.size() : from + (int) Math.min(model.limit(), (long) entries.size() - from);
    List<Map<String, Object>> out = new ArrayList<>(to - from);
    for (Entry e : entries.subList(from, to)) out.add(e.row());

    if (log.isDebugEnabled()) {
      log.debug("dynaq.memory table={} rowsIn={} rowsOut={}", model.table(), input.size(), out.size());
    }
    return out;
  }

  Object evaluate(Expression e, EvalScope scope) {
    return evaluator.evaluate(e, scope);
  }

  Expression expression(String text) {
    return cache.computeIfAbsent("c:" + text, k -> resolver.classify(text));
  }

  Expression valueExpression(Condition c) {
    return cache.computeIfAbsent("v:" + c.quoted() + ":" + c.value(), k -> resolver.classifyValue(c.value(), c.quoted()));
  }

  Expression itemExpression(String item) {
    return cache.computeIfAbsent("i:" + item, k -> resolver.classifyItem(item));
  }

  private List<EvalScope> group(List<Map<String, Object>> rows) {
    Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    for (Map<String, Object> r : rows) {
      EvalScope rs = EvalScope.row(r);
      List<Object> key = new ArrayList<>(groupExprs.size());
      for (Expression g : groupExprs) key.add(evaluate(g, rs));
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
    }
    // aggregates without GROUPBY form one group, even over no rows
    if (groupExprs.isEmpty() && groups.isEmpty()) groups.put(List.of(), List.of());

    List<EvalScope> out = new ArrayList<>(groups.size());
    for (Map.Entry<List<Object>, List<Map<String, Object>>> g : groups.entrySet()) {
      Map<Expression, Object> keys = new HashMap<>();
      Map<String, Object> keyRow = new LinkedHashMap<>();
      for (int i = 0; i < groupExprs.size(); i++) {
        Expression ge = groupExprs.get(i);
        Object v = g.getKey().get(i);
        keys.put(ge, v);
        keyRow.put(keyName(model.groupBy().get(i)), v);
      }
      out.add(EvalScope.group(keys, keyRow, g.getValue()));
    }
    return out;
  }

  private Map<String, Object> project(EvalScope scope) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < columnExprs.size(); i++) {
      Column c = model.columns().get(i);
      Expression e = columnExprs.get(i);
      if (e == null) {
        out.putAll(scope.starRow());
      } else {
        out.put(c.outputName(), evaluate(e, scope));
      }
    }
    return out;
  }

  private int compareEntries(Entry a, Entry b) {
    for (SortKey k : sortKeys) {
      int c = SortValueComparator.INSTANCE.compare(sortValue(k, a), sortValue(k, b));
      if (c != 0) return k.descending() ? -c : c;
    }
    return 0;
  }

  private Object sortValue(SortKey k, Entry e) {
    if (k.projectedKey() != null && e.row().containsKey(k.projectedKey())) return e.row().get(k.projectedKey());
    return evaluate(k.expression(), e.scope());
  }

  private String projectedKey(String sortColumn) {
    for (Column c : model.columns()) {
      if (c.isStar()) continue;
      if (c.expression().equalsIgnoreCase(sortColumn)) return c.outputName();
      if (c.hasAlias() && c.alias().equalsIgnoreCase(sortColumn)) return c.alias();
    }
    return null;
  }

  private static String keyName(String groupExpression) {
    Column c = new Column(groupExpression, null);
    return c.outputName();
  }

  /** Rejects what can be rejected before any row is seen, such as unknown NOW() time zones. */
  private static Expression validated(Expression e) {
    if (e instanceof FunctionCall fc) {
      String fn = fc.def().name();
      boolean zoned = fn.equals("NOW") || fn.equals("CURRENT_DATE") || fn.equals("CURRENT_TIME");
      if (zoned && fc.arity() == 1 && fc.arg(0) instanceof Literal l && l.type() == Literal.Type.STRING) {
        try {
          ZoneId.of(l.text());
        } catch (DateTimeException ex) {
          throw new UnsupportedFunctionException(fc.name(), "memory", "Unknown time zone '" + l.text() + "' for " + fc.name());
        }
      }
      for (Expression a : fc.args()) validated(a);
    }
    return e;
  }

  private final class Precompiler implements FilterVisitor<Void> {
    boolean aggregates;

    @Override
    public Void visit(Logical logical) {
      logical.left().accept(this);
      logical.right().accept(this);
      return null;
    }

    @Override
    public Void visit(Condition c) {
      Expression col = validated(expression(c.column()));
      aggregates |= ExpressionResolver.firstAggregate(col) != null;
      if (c.value() != null) {
        Expression v = validated(valueExpression(c));
        aggregates |= ExpressionResolver.firstAggregate(v) != null;
      }
      for (String item : c.values()) validated(itemExpression(item));
      return null;
    }
  }
}
