package io.intellixity.dynaq.spi;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.parse.DslParser;
import io.intellixity.dynaq.query.QueryModel;
import io.intellixity.dynaq.schema.SchemaLookup;
import io.intellixity.dynaq.spi.render.QueryRenderer;
import io.intellixity.dynaq.spi.render.Rendered;
import io.intellixity.dynaq.spi.render.RendererRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for request layers: parse a DSL string once and render it for one target.
 * <p>
 * Compiles are synchronous and share no mutable state; one instance may serve concurrent callers.
 */
public final class DynaqCompiler {
  private static final Logger log = LoggerFactory.getLogger(DynaqCompiler.class);

  private final DslParser parser;
  private final RendererRegistry renderers;

  public DynaqCompiler(DslParser parser, RendererRegistry renderers) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.renderers = Objects.requireNonNull(renderers, "renderers");
  }

  /** Discovered renderers, options from {@code dynaq.properties}. */
  public DynaqCompiler(SchemaLookup schema) {
    this(new DslParser(schema, CompilerOptions.load(), ExpressionResolver.standard()), new RendererRegistry());
  }

  public RendererRegistry renderers() { return renderers; }

  public QueryModel parse(String dsl) {
    return parser.parse(dsl);
  }

  public CompiledQuery<?> compile(String dsl, String rendererId) {
    return compile(dsl, renderers.require(rendererId));
  }

  public <A> CompiledQuery<A> compile(String dsl, QueryRenderer<A> renderer) {
    Objects.requireNonNull(renderer, "renderer");
    long t0 = System.nanoTime();
    QueryModel model = parser.parse(dsl);
    Rendered<A> rendered = renderer.render(model);

    for (String w : rendered.warnings()) {
      log.warn("dynaq.compile renderer={} table={} warning={}", renderer.id(), model.table(), w);
    }
    if (log.isDebugEnabled()) {
      long ms = (System.nanoTime() - t0) / 1_000_000;
      log.debug("dynaq.compile renderer={} table={} durationMs={}", renderer.id(), model.table(), ms);
    }
    return new CompiledQuery<>(model, renderer.id(), rendered.artifact(), rendered.warnings());
  }
}
