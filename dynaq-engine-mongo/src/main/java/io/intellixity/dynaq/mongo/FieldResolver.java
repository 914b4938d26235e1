package io.intellixity.dynaq.mongo;

import io.intellixity.dynaq.error.RenderException;
import io.intellixity.dynaq.expr.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves expressions to aggregation operands: a field path ({@code "$name"}), a BSON literal or an
 * inline expression document. Every side effect goes to the {@link PipelineContext}.
 * <p>
 * Before the group stage columns are document paths and top-level functions become computed fields.
 * After it only grouped expressions, aggregates and functions over them can be referenced.
 */
final class FieldResolver {
  private final ExpressionResolver resolver;

  FieldResolver(ExpressionResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  Expression classify(String text) { return resolver.classify(text); }
  ExpressionResolver resolver() { return resolver; }

  /** Top-level operand; a function is registered as a field named by {@code alias} when given. */
  Object field(Expression e, String alias, PipelineContext ctx) {
    if (ctx.afterGroup()) return grouped(e, alias, ctx);
    if (e instanceof FunctionCall call && !call.def().isAggregate()) {
      String existing = ctx.computedField(call);
      if (existing != null) return "$" + existing;
      return "$" + ctx.compute(call, alias, inline(call, ctx));
    }
    return value(e, ctx);
  }

  /** Nested operand before the group stage; functions are inlined. */
  Object value(Expression e, PipelineContext ctx) {
    if (e instanceof Literal l) return MongoFunctions.literal(l);
    if (e instanceof ColumnRef ref) {
      if (ref.isStar()) throw new RenderException(MongoPipelineRenderer.ID, "'*' is only valid in FETCH and COUNT(*)");
      return "$" + ctx.path(ref);
    }
    FunctionCall call = (FunctionCall) e;
    if (call.def().isAggregate()) throw aggregateOutsideGroup(call, ctx);
    return inline(call, ctx);
  }

  private Object inline(FunctionCall call, PipelineContext ctx) {
    List<Object> args = new ArrayList<>(call.arity());
    for (int i = 0; i < call.arity(); i++) {
      args.add(i == 0 && call.def().leadingDatePart() ? ((Literal) call.arg(0)).text() : value(call.arg(i), ctx));
    }
    return MongoFunctions.function(call, args);
  }

  private Object grouped(Expression e, String alias, PipelineContext ctx) {
    String key = ctx.groupKey(e);
    if (key != null) return "$" + key;
    if (e instanceof Literal l) return MongoFunctions.literal(l);
    if (e instanceof ColumnRef ref) {
      Expression aliased = ctx.aliased(ref);
      if (aliased != null) return grouped(aliased, null, ctx);
      throw new RenderException(MongoPipelineRenderer.ID,
          "Column " + ref.qualified() + " must appear in GROUPBY or inside an aggregate function");
    }
    FunctionCall call = (FunctionCall) e;
    if (call.def().isAggregate()) return "$" + accumulator(call, alias, ctx);

    List<Object> args = new ArrayList<>(call.arity());
    for (int i = 0; i < call.arity(); i++) {
      args.add(i == 0 && call.def().leadingDatePart() ? ((Literal) call.arg(0)).text() : grouped(call.arg(i), null, ctx));
    }
    return MongoFunctions.function(call, args);
  }

  /** Accumulator field for an aggregate; its argument is evaluated per input document. */
  private String accumulator(FunctionCall call, String alias, PipelineContext ctx) {
    String existing = ctx.accumulatorField(call);
    if (existing != null) return existing;
    Expression arg = call.arg(0);
    boolean star = arg instanceof ColumnRef ref && ref.isStar();
    if (star && !"COUNT".equals(call.def().name())) {
      throw new RenderException(MongoPipelineRenderer.ID, call.name() + "(*) is not supported; only COUNT(*) is");
    }
    return ctx.accumulate(call, alias, MongoFunctions.accumulator(call, star ? null : value(arg, ctx)));
  }

  private static RenderException aggregateOutsideGroup(FunctionCall call, PipelineContext ctx) {
    if (ctx.grouped()) {
      return new RenderException(MongoPipelineRenderer.ID, "Aggregate function " + call.name() + " cannot be nested in "
          + "another aggregate or used before grouping");
    }
    return new RenderException(MongoPipelineRenderer.ID, "Aggregate function " + call.name()
        + " needs a group context: GROUPBY, or an aggregate in FETCH or HAVING");
  }
}
