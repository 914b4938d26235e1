package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.expr.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Evaluates resolved expressions against an {@link EvalScope}. Unqualified names resolve FETCH aliases first. */
final class ExpressionEvaluator {
  private final Map<String, Expression> aliases;

  ExpressionEvaluator(Map<String, Expression> aliases) {
    this.aliases = Map.copyOf(aliases);
  }

  Object evaluate(Expression e, EvalScope scope) {
    if (scope.hasGroupKey(e)) return scope.groupKey(e);
    return e.accept(new ExpressionVisitor<Object>() {
      @Override
      public Object visit(Literal literal) {
        return Values.valueOf(literal);
      }

      @Override
      public Object visit(ColumnRef ref) {
        if (ref.isStar()) return null;
        if (ref.table() == null) {
          Expression aliased = aliases.get(ref.column().toLowerCase(Locale.ROOT));
          if (aliased != null && !aliased.equals(ref)) return evaluate(aliased, scope);
        }
        return scope.column(ref);
      }

      @Override
      public Object visit(FunctionCall call) {
        if (call.def().isAggregate()) return aggregate(call, scope);
        List<Object> args = new ArrayList<>(call.arity());
        for (Expression a : call.args()) args.add(evaluate(a, scope));
        return FunctionEvaluator.scalar(call, args);
      }
    });
  }

  private Object aggregate(FunctionCall call, EvalScope scope) {
    List<Map<String, Object>> rows = scope.groupRows();
    if (rows == null) return null;
    Expression arg = call.arg(0);
    boolean star = arg instanceof ColumnRef c && c.isStar();
    List<Object> values = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) values.add(star ? Boolean.TRUE : evaluate(arg, EvalScope.row(r)));
    return FunctionEvaluator.aggregate(call.def().name(), star, values);
  }
}
