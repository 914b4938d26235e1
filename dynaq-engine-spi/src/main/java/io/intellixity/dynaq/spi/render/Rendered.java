package io.intellixity.dynaq.spi.render;

import java.util.List;
import java.util.Objects;

/**
 * Successful render: the target artifact plus caller-visible warnings (for example pagination that
 * was dropped because the target could not honour it).
 */
public record Rendered<A>(A artifact, List<String> warnings) {
  public Rendered {
    Objects.requireNonNull(artifact, "artifact");
    warnings = List.copyOf(warnings == null ? List.of() : warnings);
  }

  public static <A> Rendered<A> of(A artifact) { return new Rendered<>(artifact, List.of()); }

  public boolean hasWarnings() { return !warnings.isEmpty(); }
}
