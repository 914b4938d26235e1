package io.intellixity.dynaq.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Canonical, immutable form of one compiled DSL query. Handed read-only to exactly one renderer.
 */
@JsonSerialize(using = QueryModelJsonSerializer.class)
@JsonDeserialize(using = QueryModelJsonDeserializer.class)
public record QueryModel(String table,
                         List<Column> columns,
                         boolean distinct,
                         List<Include> includes,
                         FilterNode filter,
                         List<String> groupBy,
                         FilterNode having,
                         List<SortField> orderBy,
                         Integer limit,
                         Integer offset) {
  public QueryModel {
    Objects.requireNonNull(table, "table");
    columns = (columns == null || columns.isEmpty()) ? List.of(Column.star()) : List.copyOf(columns);
    includes = List.copyOf(includes == null ? List.of() : includes);
    groupBy = List.copyOf(groupBy == null ? List.of() : groupBy);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (offset != null && offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  public boolean selectsAll() {
    return columns.size() == 1 && columns.get(0).isStar();
  }

  public boolean paged() { return limit != null || offset != null; }

  /** Explicit FETCH aliases; qualification leaves these names alone. */
  public Set<String> aliases() {
    Set<String> out = new LinkedHashSet<>();
    for (Column c : columns) if (c.hasAlias()) out.add(c.alias());
    return out;
  }

  public static Builder builder(String table) { return new Builder(table); }

  public static final class Builder {
    private final String table;
    private final List<Column> columns = new ArrayList<>();
    private boolean distinct;
    private final List<Include> includes = new ArrayList<>();
    private FilterNode filter;
    private final List<String> groupBy = new ArrayList<>();
    private FilterNode having;
    private final List<SortField> orderBy = new ArrayList<>();
    private Integer limit;
    private Integer offset;

    private Builder(String table) { this.table = table; }

    public Builder column(String expression) { columns.add(new Column(expression, null)); return this; }
    public Builder column(String expression, String alias) { columns.add(new Column(expression, alias)); return this; }
    public Builder columns(List<Column> cols) { columns.addAll(cols); return this; }
    public Builder distinct(boolean distinct) { this.distinct = distinct; return this; }
    public Builder include(Include include) { includes.add(include); return this; }
    public Builder filter(FilterNode filter) { this.filter = filter; return this; }
    public Builder groupBy(String column) { groupBy.add(column); return this; }
    public Builder having(FilterNode having) { this.having = having; return this; }
    public Builder orderBy(String column, SortField.Direction direction) { orderBy.add(new SortField(column, direction)); return this; }
    public Builder limit(Integer limit) { this.limit = limit; return this; }
    public Builder offset(Integer offset) { this.offset = offset; return this; }

    public QueryModel build() {
      return new QueryModel(table, columns, distinct, includes, filter, groupBy, having, orderBy, limit, offset);
    }
  }
}
