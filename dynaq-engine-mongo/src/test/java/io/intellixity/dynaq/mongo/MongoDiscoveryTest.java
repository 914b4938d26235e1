package io.intellixity.dynaq.mongo;

import io.intellixity.dynaq.schema.SchemaLookup;
import io.intellixity.dynaq.spi.CompiledQuery;
import io.intellixity.dynaq.spi.DynaqCompiler;
import io.intellixity.dynaq.spi.render.RenderTarget;
import io.intellixity.dynaq.spi.render.RendererRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MongoDiscoveryTest {
  @Test
  void rendererIsRegisteredFromFactories() {
    RendererRegistry registry = new RendererRegistry();
    assertTrue(registry.ids().contains("mongo"));
    assertEquals(RenderTarget.PIPELINE, registry.require("MongoDB").target());
  }

  @Test
  void compilesThroughAlias() {
    CompiledQuery<?> q = new DynaqCompiler(SchemaLookup.NONE).compile("FROM users FETCH(name) TAKE(2)", "mongodb");
    MongoPipeline p = assertInstanceOf(MongoPipeline.class, q.artifact());
    assertEquals("mongo", q.rendererId());
    assertEquals(List.of("$project", "$limit"), p.operators());
  }
}
