package io.intellixity.dynaq.jdbc;

import io.intellixity.dynaq.jdbc.dialect.SqlServerDialect;
import io.intellixity.dynaq.schema.SchemaLookup;
import io.intellixity.dynaq.spi.CompiledQuery;
import io.intellixity.dynaq.spi.DynaqCompiler;
import io.intellixity.dynaq.spi.render.RendererRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DialectDiscoveryTest {
  @Test
  void dialectsAreRegisteredFromFactories() {
    RendererRegistry registry = new RendererRegistry();
    assertTrue(registry.ids().containsAll(java.util.List.of("postgres", "mysql", "sqlserver", "oracle")));
    assertInstanceOf(SqlServerDialect.class, registry.require("MSSQL"));
  }

  @Test
  void compilesThroughAlias() {
    CompiledQuery<?> q = new DynaqCompiler(SchemaLookup.NONE).compile("FROM users FETCH(name) TAKE(2)", "postgresql");
    SqlStatement sql = assertInstanceOf(SqlStatement.class, q.artifact());
    assertEquals("SELECT users.name FROM users LIMIT 2", sql.sql());
    assertEquals("postgres", q.rendererId());
  }
}
