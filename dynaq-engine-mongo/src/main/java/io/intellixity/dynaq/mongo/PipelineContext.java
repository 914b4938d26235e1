package io.intellixity.dynaq.mongo;

import io.intellixity.dynaq.expr.ColumnRef;
import io.intellixity.dynaq.expr.Expression;
import io.intellixity.dynaq.expr.FunctionCall;
import org.bson.Document;

import java.util.*;

/**
 * Mutable state of one pipeline render, passed alongside {@link FieldResolver}.
 * <p>
 * Resolving a function is not side-effect free: a computed function becomes a field of the
 * {@code $addFields} stage ahead of the filter, and an aggregate becomes an accumulator of the
 * {@code $group} stage. Both are named after the function ({@code UPPER_1}, {@code COUNT_2}) unless an
 * alias was given, and identical expressions share one field.
 * <p>
 * Names that would shadow a document field read by the query are never used for computed fields.
 */
public final class PipelineContext {
  private final String rootTable;
  private final boolean grouped;
  private final Map<String, Expression> aliases;
  private final Set<String> reserved;

  private final Document computed = new Document();
  private final Document groupId = new Document();
  private final Document accumulators = new Document();
  private final Document regrouped = new Document();

  private final Map<Expression, String> computedByExpression = new HashMap<>();
  private final Map<Expression, String> accumulatorByExpression = new HashMap<>();
  private final Map<Expression, String> groupKeys = new HashMap<>();
  private final Map<String, Integer> counters = new HashMap<>();
  private final List<String> warnings = new ArrayList<>();
  private boolean afterGroup;

  PipelineContext(String rootTable, boolean grouped, Map<String, Expression> aliases, Set<String> reserved) {
    this.rootTable = Objects.requireNonNull(rootTable, "rootTable");
    this.grouped = grouped;
    this.aliases = Map.copyOf(aliases);
    this.reserved = Set.copyOf(reserved);
  }

  /** True when the pipeline has a {@code $group} stage. */
  public boolean grouped() { return grouped; }

  /** True once resolution has moved past the {@code $group} stage. */
  public boolean afterGroup() { return afterGroup; }

  void enterGroup() {
    if (!grouped) throw new IllegalStateException("pipeline has no group stage");
    afterGroup = true;
  }

  public Document computed() { return computed; }
  public Document groupId() { return groupId; }
  public Document accumulators() { return accumulators; }
  /** {@code $addFields} after the group: grouped keys lifted out of {@code _id}. */
  public Document regrouped() { return regrouped; }

  public List<String> warnings() { return warnings; }

  void warn(String warning) { warnings.add(warning); }

  /** Document path of a column: root-table columns are top-level, joined ones sit under the table name. */
  String path(ColumnRef ref) {
    if (ref.table() == null || ref.table().equalsIgnoreCase(rootTable)) return ref.column();
    return ref.table() + "." + ref.column();
  }

  /** FETCH alias referenced by an unqualified name, or null. */
  Expression aliased(ColumnRef ref) {
    if (ref.table() != null) return null;
    Expression e = aliases.get(ref.column().toLowerCase(Locale.ROOT));
    return e == null || e.equals(ref) ? null : e;
  }

  // ---------------- computed fields ----------------

  String computedField(Expression e) { return computedByExpression.get(e); }

  String compute(FunctionCall call, String alias, Object value) {
    String name = claim(alias, call.def().name(), true);
    computed.put(name, value);
    computedByExpression.put(call, name);
    return name;
  }

  // ---------------- group stage ----------------

  String accumulatorField(Expression e) { return accumulatorByExpression.get(e); }

  String accumulate(FunctionCall call, String alias, Document accumulator) {
    String name = claim(alias, call.def().name(), false);
    accumulators.put(name, accumulator);
    accumulatorByExpression.put(call, name);
    return name;
  }

  /** Registers a grouped expression under {@code _id.key} and re-exposes it as {@code key}. */
  String groupBy(Expression e, String key, Object value) {
    String existing = groupKeys.get(e);
    if (existing != null) return existing;
    String k = key;
    for (int i = 2; taken(k); i++) k = key + "_" + i;
    groupId.put(k, value);
    regrouped.put(k, "$_id." + k);
    groupKeys.put(e, k);
    return k;
  }

  String groupKey(Expression e) { return groupKeys.get(e); }

  // ---------------- naming ----------------

  private String claim(String alias, String function, boolean avoidReserved) {
    if (alias != null && !taken(alias) && !(avoidReserved && isReserved(alias))) return alias;
    int n = counters.getOrDefault(function, 0);
    String name;
    do {
      name = function + "_" + (++n);
    } while (taken(name) || (avoidReserved && isReserved(name)));
    counters.put(function, n);
    return name;
  }

  private boolean isReserved(String name) {
    return reserved.contains(name.toLowerCase(Locale.ROOT));
  }

  private boolean taken(String name) {
    return "_id".equals(name) || computed.containsKey(name) || groupId.containsKey(name) || accumulators.containsKey(name);
  }
}
