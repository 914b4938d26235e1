package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.spi.exec.QueryExecutor;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/** Executes plans over a row source; the source is read once per execution. */
public final class InMemoryQueryExecutor implements QueryExecutor<InMemoryPlan> {
  private final Supplier<List<Map<String, Object>>> rows;

  public InMemoryQueryExecutor(Supplier<List<Map<String, Object>>> rows) {
    this.rows = Objects.requireNonNull(rows, "rows");
  }

  public InMemoryQueryExecutor(List<Map<String, Object>> rows) {
    this(() -> rows);
  }

  @Override
  public List<Map<String, Object>> execute(InMemoryPlan plan) {
    return plan.execute(rows.get());
  }
}
