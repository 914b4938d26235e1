package io.intellixity.dynaq.spi;

import io.intellixity.dynaq.query.QueryModel;
import io.intellixity.dynaq.query.QueryModelJson;

import java.util.List;
import java.util.Objects;

/** Output of one compile: the canonical model and the artifact rendered from it. */
public record CompiledQuery<A>(QueryModel model, String rendererId, A artifact, List<String> warnings) {
  public CompiledQuery {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(rendererId, "rendererId");
    Objects.requireNonNull(artifact, "artifact");
    warnings = List.copyOf(warnings == null ? List.of() : warnings);
  }

  public String modelJson() { return QueryModelJson.toJson(model); }
}
