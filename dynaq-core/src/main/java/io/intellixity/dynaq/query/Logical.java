package io.intellixity.dynaq.query;

import java.util.Objects;

public final class Logical implements FilterNode {
  private final Clause clause;
  private final FilterNode left;
  private final FilterNode right;

  public Logical(Clause clause, FilterNode left, FilterNode right) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
  }

  public Clause clause() { return clause; }
  public FilterNode left() { return left; }
  public FilterNode right() { return right; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Logical other)) return false;
    return clause == other.clause && left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode() { return Objects.hash(clause, left, right); }

  @Override
  public String toString() {
    return (clause == Clause.AND ? "And(" : "Or(") + left + ", " + right + ")";
  }
}
