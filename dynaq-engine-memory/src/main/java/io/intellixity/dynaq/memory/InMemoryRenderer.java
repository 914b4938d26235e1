package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.query.QueryModel;
import io.intellixity.dynaq.spi.render.QueryRenderer;
import io.intellixity.dynaq.spi.render.RenderTarget;
import io.intellixity.dynaq.spi.render.Rendered;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Renders a model into an {@link InMemoryPlan}. */
public final class InMemoryRenderer implements QueryRenderer<InMemoryPlan> {
  public static final String ID = "memory";

  private final ExpressionResolver resolver;

  public InMemoryRenderer() {
    this(ExpressionResolver.standard());
  }

  public InMemoryRenderer(ExpressionResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  @Override public String id() { return ID; }
  @Override public Set<String> aliases() { return Set.of("inmemory"); }
  @Override public RenderTarget target() { return RenderTarget.IN_MEMORY; }

  @Override
  public Rendered<InMemoryPlan> render(QueryModel model) {
    List<String> warnings = new ArrayList<>();
    if (!model.includes().isEmpty()) {
      warnings.add("INCLUDE is not evaluated in memory; " + model.includes().size()
          + " join(s) ignored, rows must already be joined");
    }
    InMemoryPlan plan = new InMemoryPlan(model, resolver, warnings);
    return new Rendered<>(plan, warnings);
  }
}
