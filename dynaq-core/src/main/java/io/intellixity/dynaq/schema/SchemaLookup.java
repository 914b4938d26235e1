package io.intellixity.dynaq.schema;

import java.util.Optional;

/**
 * Resolves the key pair relating two tables, used once per INCLUDE hop.
 * <p>
 * Implementations answer for the given direction only; the parser tries both directions.
 * They may block (metadata round trips) and may throw; a failure aborts the compile.
 */
public interface SchemaLookup {
  Optional<ForeignKey> resolveForeignKey(String tableA, String tableB);

  /** Lookup that knows no relationships; INCLUDE always fails against it. */
  SchemaLookup NONE = (a, b) -> Optional.empty();
}
