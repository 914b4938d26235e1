package io.intellixity.dynaq.mongo;

import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Aggregation pipeline over one collection; stages are in execution order. */
public record MongoPipeline(String collection, List<Document> stages) {
  public MongoPipeline {
    Objects.requireNonNull(collection, "collection");
    stages = List.copyOf(stages);
  }

  /** Stage operators in order, e.g. {@code [$match, $group, $project]}. */
  public List<String> operators() {
    List<String> out = new ArrayList<>(stages.size());
    for (Document d : stages) out.add(d.keySet().iterator().next());
    return out;
  }

  /** Body of the first stage with the given operator, or null. */
  public Object stage(String operator) {
    for (Document d : stages) {
      if (d.containsKey(operator)) return d.get(operator);
    }
    return null;
  }

  public String toJson() {
    List<String> parts = new ArrayList<>(stages.size());
    for (Document d : stages) parts.add(d.toJson());
    return "[" + String.join(", ", parts) + "]";
  }

  @Override
  public String toString() { return collection + ".aggregate(" + toJson() + ")"; }
}
