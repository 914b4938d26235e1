package io.intellixity.dynaq.spi.render;

import io.intellixity.dynaq.query.QueryModel;

import java.util.Set;

/**
 * Backend SPI: turns a {@link QueryModel} into a target artifact (SQL statement, aggregation
 * pipeline, in-memory plan).
 * <p>
 * Implementations are stateless and thread-safe; per-render state lives in a context allocated by
 * {@link #render(QueryModel)}. A render either returns a complete artifact or throws a
 * {@link io.intellixity.dynaq.error.DslException}; it never returns partial output.
 * <p>
 * Discovered through {@code META-INF/dynaq.factories}; implementations need a public no-arg
 * constructor.
 */
public interface QueryRenderer<A> {
  String id();

  /** Alternative ids accepted by {@link RendererRegistry}. */
  default Set<String> aliases() { return Set.of(); }

  RenderTarget target();

  Rendered<A> render(QueryModel model);
}
