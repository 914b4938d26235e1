package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.query.*;

import java.util.ArrayList;
import java.util.List;

/** Filter tree evaluation for one scope. */
final class RowPredicate implements FilterVisitor<Boolean> {
  private final InMemoryPlan plan;
  private final EvalScope scope;

  RowPredicate(InMemoryPlan plan, EvalScope scope) {
    this.plan = plan;
    this.scope = scope;
  }

  static boolean test(FilterNode node, InMemoryPlan plan, EvalScope scope) {
    return node == null || node.accept(new RowPredicate(plan, scope));
  }

  @Override
  public Boolean visit(Logical logical) {
    boolean left = logical.left().accept(this);
    if (logical.clause() == Clause.AND) return left && logical.right().accept(this);
    return left || logical.right().accept(this);
  }

  @Override
  public Boolean visit(Condition c) {
    Object left = plan.evaluate(plan.expression(c.column()), scope);
    Operator op = c.operator();
    return switch (op.family()) {
      case NULL_CHECK -> Comparisons.test(op, left, null);
      case MEMBERSHIP -> Comparisons.member(op, left, items(c));
      case RANGE -> {
        List<Object> bounds = items(c);
        yield Comparisons.between(op, left, bounds.get(0), bounds.get(1));
      }
      default -> Comparisons.test(op, left, plan.evaluate(plan.valueExpression(c), scope));
    };
  }

  private List<Object> items(Condition c) {
    List<Object> out = new ArrayList<>(c.values().size());
    for (String item : c.values()) out.add(plan.evaluate(plan.itemExpression(item), scope));
    return out;
  }
}
