package io.intellixity.dynaq.schema;

import java.util.Objects;

/**
 * Key pair joining two tables: {@code parentKey} belongs to the first table passed to
 * {@link SchemaLookup#resolveForeignKey}, {@code childKey} to the second.
 */
public record ForeignKey(String parentKey, String childKey) {
  public ForeignKey {
    Objects.requireNonNull(parentKey, "parentKey");
    Objects.requireNonNull(childKey, "childKey");
  }

  public ForeignKey swapped() { return new ForeignKey(childKey, parentKey); }
}
