package io.intellixity.dynaq.query;

import java.util.Objects;

public record SortField(String column, Direction direction) {
  public SortField {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public boolean descending() { return direction == Direction.DESC; }

  public enum Direction { ASC, DESC }
}
