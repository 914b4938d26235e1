package io.intellixity.dynaq.error;

/** A query model that parsed fine but cannot be rendered for one target as requested. */
public final class RenderException extends DslException {
  private final String target;

  public RenderException(String target, String message) {
    super(message);
    this.target = target;
  }

  public String target() { return target; }
}
