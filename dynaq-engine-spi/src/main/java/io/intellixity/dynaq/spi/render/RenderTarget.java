package io.intellixity.dynaq.spi.render;

public enum RenderTarget {
  SQL,
  PIPELINE,
  IN_MEMORY
}
