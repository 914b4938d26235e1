package io.intellixity.dynaq.mongo;

import io.intellixity.dynaq.error.RenderException;
import io.intellixity.dynaq.error.UnsupportedOperatorException;
import io.intellixity.dynaq.expr.*;
import io.intellixity.dynaq.query.*;
import io.intellixity.dynaq.spi.render.QueryRenderer;
import io.intellixity.dynaq.spi.render.RenderTarget;
import io.intellixity.dynaq.spi.render.Rendered;
import org.bson.Document;

import java.util.*;

/**
 * Renders a model into a {@link MongoPipeline} over the root table's collection.
 * <p>
 * Stages, each omitted when empty: {@code $lookup}/{@code $unwind} per include, {@code $addFields}
 * for computed functions, {@code $match} for FILTER, {@code $group}, {@code $addFields} lifting the
 * group keys out of {@code _id}, {@code $match} for HAVING, {@code $project}, {@code $sort},
 * {@code $skip} and {@code $limit}. A sort on something the projection drops runs ahead of it.
 * <p>
 * Predicates are {@code $expr} documents, so computed fields, group fields and literals compare
 * alike.
 */
public final class MongoPipelineRenderer implements QueryRenderer<MongoPipeline> {
  public static final String ID = "mongo";

  private final ExpressionResolver resolver;
  private final FieldResolver fields;
  private final MongoPredicates predicates;

  public MongoPipelineRenderer() {
    this(ExpressionResolver.standard());
  }

  public MongoPipelineRenderer(ExpressionResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.fields = new FieldResolver(resolver);
    this.predicates = new MongoPredicates(fields);
  }

  @Override public String id() { return ID; }
  @Override public Set<String> aliases() { return Set.of("mongodb"); }
  @Override public RenderTarget target() { return RenderTarget.PIPELINE; }

  @Override
  public Rendered<MongoPipeline> render(QueryModel model) {
    Objects.requireNonNull(model, "model");
    boolean star = false;
    Map<String, Expression> aliases = new HashMap<>();
    List<Expression> fetched = new ArrayList<>(model.columns().size());
    for (Column c : model.columns()) {
      if (c.isStar()) {
        star = true;
        fetched.add(null);
        continue;
      }
      Expression e = resolver.classify(c.expression());
      fetched.add(e);
      if (c.hasAlias()) aliases.put(c.alias().toLowerCase(Locale.ROOT), e);
    }

    boolean aggregates = containsAggregate(fetched) || (model.having() != null && containsAggregate(model.having()));
    boolean distinctGroup = model.distinct() && !star && model.groupBy().isEmpty() && !aggregates;
    boolean grouped = !model.groupBy().isEmpty() || aggregates || distinctGroup;
    if (star && grouped) {
      throw new RenderException(ID, "FETCH * cannot be combined with GROUPBY or aggregates");
    }
    if (model.having() != null && !grouped) {
      throw new RenderException(ID, "HAVING requires GROUPBY or an aggregate");
    }

    PipelineContext ctx = new PipelineContext(model.table(), grouped, aliases, referencedNames(model, fetched));
    if (model.distinct() && !distinctGroup) {
      ctx.warn(star ? "DISTINCT with FETCH * is not supported on " + ID + "; ignored"
          : "DISTINCT is implied by grouping on " + ID + "; ignored");
    }

    List<Document> lookups = lookups(model);
    Document match = model.filter() == null ? null : predicates.build(model.filter(), ctx);

    if (grouped) {
      if (distinctGroup) {
        for (int i = 0; i < fetched.size(); i++) {
          groupKey(fetched.get(i), model.columns().get(i).outputName(), ctx);
        }
      } else {
        for (String g : model.groupBy()) groupKey(resolver.classify(g), new Column(g, null).outputName(), ctx);
      }
      ctx.enterGroup();
    }

    Document project = null;
    if (!model.selectsAll() && !star) {
      project = new Document();
      boolean idOutput = false;
      for (Column c : model.columns()) idOutput |= "_id".equals(c.outputName());
      if (!idOutput) project.put("_id", 0);
      for (int i = 0; i < fetched.size(); i++) {
        Column c = model.columns().get(i);
        project.put(c.outputName(), projected(fetched.get(i), c.alias(), ctx));
      }
    }

    Document having = model.having() == null ? null : predicates.build(model.having(), ctx);

    Document sort = new Document();
    boolean sortAfterProject = project != null && sortsOnOutputs(model, fetched);
    for (SortField sf : model.orderBy()) {
      int dir = sf.descending() ? -1 : 1;
      if (sortAfterProject) {
        sort.put(outputFor(sf, model, fetched).outputName(), dir);
      } else {
        sort.put(sortPath(sf, ctx), dir);
      }
    }

    List<Document> stages = new ArrayList<>(lookups);
    if (!ctx.computed().isEmpty()) stages.add(new Document("$addFields", ctx.computed()));
    if (match != null) stages.add(new Document("$match", new Document("$expr", match)));
    if (grouped) {
      Document group = new Document("_id", ctx.groupId().isEmpty() ? null : ctx.groupId());
      group.putAll(ctx.accumulators());
      stages.add(new Document("$group", group));
      if (!ctx.regrouped().isEmpty()) stages.add(new Document("$addFields", ctx.regrouped()));
    }
    if (having != null) stages.add(new Document("$match", new Document("$expr", having)));
    if (!sort.isEmpty() && !sortAfterProject) stages.add(new Document("$sort", sort));
    if (project != null) stages.add(new Document("$project", project));
    if (!sort.isEmpty() && sortAfterProject) stages.add(new Document("$sort", sort));
    if (model.offset() != null && model.offset() > 0) stages.add(new Document("$skip", model.offset()));
    if (model.limit() != null) {
      // $limit must be positive
      stages.add(model.limit() > 0 ? new Document("$limit", model.limit())
          : new Document("$match", new Document("$expr", false)));
    }

    return new Rendered<>(new MongoPipeline(model.table(), stages), ctx.warnings());
  }

  private void groupKey(Expression e, String name, PipelineContext ctx) {
    if (e instanceof FunctionCall call && call.containsAggregate()) {
      throw new RenderException(ID, "GROUPBY cannot contain aggregate function " + call.name());
    }
    ctx.groupBy(e, name, fields.value(e, ctx));
  }

  private Object projected(Expression e, String alias, PipelineContext ctx) {
    if (e instanceof Literal l) {
      Object v = MongoFunctions.literal(l);
      return v instanceof Document ? v : new Document("$literal", v);
    }
    return fields.field(e, alias, ctx);
  }

  private String sortPath(SortField sf, PipelineContext ctx) {
    Object resolved = fields.field(resolver.classify(sf.column()), null, ctx);
    if (resolved instanceof String s && s.startsWith("$")) return s.substring(1);
    throw new RenderException(ID, "ORDERBY " + sf.column() + " must name a field, a FETCH column or an aggregate");
  }

  private boolean sortsOnOutputs(QueryModel model, List<Expression> fetched) {
    for (SortField sf : model.orderBy()) {
      if (outputFor(sf, model, fetched) == null) return false;
    }
    return true;
  }

  /** FETCH column the sort key names, by alias or by expression; null when it is not projected. */
  private Column outputFor(SortField sf, QueryModel model, List<Expression> fetched) {
    Expression key = resolver.classify(sf.column());
    for (int i = 0; i < fetched.size(); i++) {
      Column c = model.columns().get(i);
      if (c.hasAlias() && c.alias().equalsIgnoreCase(sf.column())) return c;
      if (key.equals(fetched.get(i))) return c;
    }
    return null;
  }

  private List<Document> lookups(QueryModel model) {
    List<Document> out = new ArrayList<>();
    for (Include inc : model.includes()) {
      if (inc.joinKind() == JoinKind.RIGHT || inc.joinKind() == JoinKind.FULL) {
        throw new UnsupportedOperatorException(inc.joinKind() + " JOIN", ID,
            inc.joinKind() + " JOIN of " + inc.childTable() + " is not supported by " + ID + "; use INNER or LEFT");
      }
      String localField = inc.parentTable().equalsIgnoreCase(model.table())
          ? inc.parentKey() : inc.parentTable() + "." + inc.parentKey();
      out.add(new Document("$lookup", new Document("from", inc.childTable())
          .append("localField", localField)
          .append("foreignField", inc.childKey())
          .append("as", inc.childTable())));
      out.add(new Document("$unwind", new Document("path", "$" + inc.childTable())
          .append("preserveNullAndEmptyArrays", inc.joinKind() == JoinKind.LEFT)));
    }
    return out;
  }

  private boolean containsAggregate(List<Expression> expressions) {
    for (Expression e : expressions) {
      if (e instanceof FunctionCall call && call.containsAggregate()) return true;
    }
    return false;
  }

  private boolean containsAggregate(FilterNode node) {
    return node.accept(new FilterVisitor<Boolean>() {
      @Override
      public Boolean visit(Logical logical) {
        return logical.left().accept(this) || logical.right().accept(this);
      }

      @Override
      public Boolean visit(Condition c) {
        List<Expression> operands = new ArrayList<>();
        operands.add(resolver.classify(c.column()));
        if (c.value() != null) operands.add(resolver.classifyValue(c.value(), c.quoted()));
        return containsAggregate(operands);
      }
    });
  }

  /**
   * Lower-cased names a computed field must not take: root-table columns and joined table names
   * read anywhere in the query.
   */
  private Set<String> referencedNames(QueryModel model, List<Expression> fetched) {
    Set<String> out = new HashSet<>();
    List<Expression> all = new ArrayList<>();
    for (Expression e : fetched) if (e != null) all.add(e);
    for (String g : model.groupBy()) all.add(resolver.classify(g));
    for (SortField sf : model.orderBy()) all.add(resolver.classify(sf.column()));
    for (FilterNode node : Arrays.asList(model.filter(), model.having())) {
      if (node != null) collectOperands(node, all);
    }
    for (Expression e : all) collectNames(e, model.table(), out);
    return out;
  }

  private void collectOperands(FilterNode node, List<Expression> out) {
    node.accept(new FilterVisitor<Void>() {
      @Override
      public Void visit(Logical logical) {
        logical.left().accept(this);
        logical.right().accept(this);
        return null;
      }

      @Override
      public Void visit(Condition c) {
        out.add(resolver.classify(c.column()));
        if (c.value() != null) out.add(resolver.classifyValue(c.value(), c.quoted()));
        for (String item : c.values()) out.add(resolver.classifyItem(item));
        return null;
      }
    });
  }

  private static void collectNames(Expression e, String root, Set<String> out) {
    if (e instanceof ColumnRef ref) {
      if (ref.isStar()) return;
      String name = ref.table() == null || ref.table().equalsIgnoreCase(root) ? ref.column() : ref.table();
      out.add(name.toLowerCase(Locale.ROOT));
    } else if (e instanceof FunctionCall call) {
      for (Expression a : call.args()) collectNames(a, root, out);
    }
  }
}
