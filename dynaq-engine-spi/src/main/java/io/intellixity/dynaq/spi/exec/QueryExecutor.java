package io.intellixity.dynaq.spi.exec;

import java.util.List;
import java.util.Map;

/**
 * Runs a rendered artifact against its backend. Rows are maps keyed by output column name, in
 * projection order.
 * <p>
 * Backend failures surface as {@link io.intellixity.dynaq.error.QueryExecutionException}.
 */
public interface QueryExecutor<A> {
  List<Map<String, Object>> execute(A artifact);
}
