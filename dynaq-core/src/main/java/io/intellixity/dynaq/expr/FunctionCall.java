package io.intellixity.dynaq.expr;

import java.util.List;
import java.util.Objects;

/**
 * Call of a catalog function. {@code name} is the spelling used in the query (upper-cased), which
 * may be an alias of {@code def}.
 */
public record FunctionCall(FunctionDef def, String name, List<Expression> args) implements Expression {
  public FunctionCall {
    Objects.requireNonNull(def, "def");
    Objects.requireNonNull(name, "name");
    args = List.copyOf(args == null ? List.of() : args);
  }

  public Expression arg(int i) { return args.get(i); }

  public int arity() { return args.size(); }

  /** True when this call or any nested argument is an aggregate. */
  public boolean containsAggregate() {
    if (def.isAggregate()) return true;
    for (Expression a : args) {
      if (a instanceof FunctionCall fc && fc.containsAggregate()) return true;
    }
    return false;
  }

  /** Date part of DATEADD/DATEDIFF/DATENAME. */
  public DatePart datePart() {
    if (!def.leadingDatePart()) throw new IllegalStateException(name + " has no date part argument");
    return DatePart.require(((Literal) args.get(0)).text(), name);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
