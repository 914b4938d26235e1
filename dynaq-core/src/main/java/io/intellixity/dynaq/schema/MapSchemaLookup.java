package io.intellixity.dynaq.schema;

import java.util.*;

/**
 * Schema lookup over declared relationships, e.g. for tests or the in-memory target.
 * <pre>
 * MapSchemaLookup.builder()
 *     .relate("users", "id", "orders", "user_id")
 *     .build();
 * </pre>
 */
public final class MapSchemaLookup implements SchemaLookup {
  private final Map<String, ForeignKey> keys;

  private MapSchemaLookup(Map<String, ForeignKey> keys) {
    this.keys = Map.copyOf(keys);
  }

  public static Builder builder() { return new Builder(); }

  @Override
  public Optional<ForeignKey> resolveForeignKey(String tableA, String tableB) {
    return Optional.ofNullable(keys.get(key(tableA, tableB)));
  }

  private static String key(String a, String b) {
    return a.toLowerCase(Locale.ROOT) + "->" + b.toLowerCase(Locale.ROOT);
  }

  public static final class Builder {
    private final Map<String, ForeignKey> keys = new LinkedHashMap<>();

    /** {@code parentTable.parentKey = childTable.childKey}; registered in one direction only. */
    public Builder relate(String parentTable, String parentKey, String childTable, String childKey) {
      keys.put(key(parentTable, childTable), new ForeignKey(parentKey, childKey));
      return this;
    }

    public MapSchemaLookup build() { return new MapSchemaLookup(keys); }
  }
}
