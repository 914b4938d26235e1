package io.intellixity.dynaq.spi.render;

import io.intellixity.dynaq.query.QueryModel;
import io.intellixity.dynaq.util.DynaqFactoriesLoader;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class RendererRegistryTest {
  @Test
  void discoversRenderersFromFactoriesFile() {
    RendererRegistry r = new RendererRegistry();
    assertEquals(List.of("echo"), r.ids());
    assertInstanceOf(EchoRenderer.class, r.require("Echo"));
    assertInstanceOf(EchoRenderer.class, r.require("echo-alias"));
  }

  @Test
  void factoriesAreKeyedByInterfaceName() {
    ClassLoader cl = getClass().getClassLoader();
    assertEquals(Set.of(EchoRenderer.class.getName()), DynaqFactoriesLoader.implementationNames(QueryRenderer.class, cl));
    assertTrue(DynaqFactoriesLoader.load(Runnable.class, cl).isEmpty());
  }

  @Test
  void unknownIdListsKnownOnes() {
    RendererRegistry r = new RendererRegistry(List.of(new EchoRenderer()));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> r.require("oracle"));
    assertTrue(e.getMessage().contains("known=[echo]"));
    assertTrue(r.find(null).isEmpty());
  }

  @Test
  void firstRendererWinsOnDuplicateId() {
    QueryRenderer<String> shadow = new QueryRenderer<>() {
      @Override public String id() { return "echo"; }
      @Override public Set<String> aliases() { return Set.of("shadow"); }
      @Override public RenderTarget target() { return RenderTarget.SQL; }
      @Override public Rendered<String> render(QueryModel model) { return Rendered.of("shadow"); }
    };
    RendererRegistry r = new RendererRegistry(List.of(new EchoRenderer(), shadow));
    assertInstanceOf(EchoRenderer.class, r.require("echo"));
    assertSame(shadow, r.require("shadow"));
  }
}
