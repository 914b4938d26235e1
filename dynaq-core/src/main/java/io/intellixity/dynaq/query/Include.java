package io.intellixity.dynaq.query;

import java.util.Objects;

/** One join/lookup hop; {@code parentKey} is a column of {@code parentTable}. */
public record Include(String parentTable, String parentKey, String childTable, String childKey, JoinKind joinKind) {
  public Include {
    Objects.requireNonNull(parentTable, "parentTable");
    Objects.requireNonNull(parentKey, "parentKey");
    Objects.requireNonNull(childTable, "childTable");
    Objects.requireNonNull(childKey, "childKey");
    joinKind = (joinKind == null) ? JoinKind.LEFT : joinKind;
  }
}
