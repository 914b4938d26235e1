package io.intellixity.dynaq.query;

/**
 * Node of a filter tree: either a {@link Condition} leaf or a binary {@link Logical} node.
 * Trees are built bottom-up and never mutated.
 */
public interface FilterNode {
  <R> R accept(FilterVisitor<R> visitor);
}
