package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.jdbc.SqlStatement;
import io.intellixity.dynaq.spi.render.QueryRenderer;
import io.intellixity.dynaq.spi.render.RenderTarget;

/** Renderer for a SQL dialect (statement text only, no execution). */
public interface SqlDialect extends QueryRenderer<SqlStatement> {
  @Override
  default RenderTarget target() { return RenderTarget.SQL; }
}
