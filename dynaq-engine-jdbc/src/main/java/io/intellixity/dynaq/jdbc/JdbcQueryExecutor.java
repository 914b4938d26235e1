package io.intellixity.dynaq.jdbc;

import io.intellixity.dynaq.error.QueryExecutionException;
import io.intellixity.dynaq.spi.exec.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/**
 * Runs a rendered {@link SqlStatement} on a connection borrowed from a {@link DataSource}.
 * Rows are keyed by column label in select order.
 */
public final class JdbcQueryExecutor implements QueryExecutor<SqlStatement> {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);
  private final DataSource ds;

  public JdbcQueryExecutor(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public List<Map<String, Object>> execute(SqlStatement statement) {
    Objects.requireNonNull(statement, "statement");
    long start = System.nanoTime();
    debugSql(statement);
    try (Connection c = ds.getConnection();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery(statement.sql())) {
      ResultSetMetaData md = rs.getMetaData();
      int n = md.getColumnCount();
      String[] labels = new String[n];
      for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);

      List<Map<String, Object>> out = new ArrayList<>();
      while (rs.next()) {
        Map<String, Object> row = new LinkedHashMap<>(n * 2);
        for (int i = 0; i < n; i++) row.put(labels[i], value(rs.getObject(i + 1)));
        out.add(row);
      }
      debugDone(out.size(), System.nanoTime() - start);
      return out;
    } catch (SQLException e) {
      throw new QueryExecutionException("SQL execution failed (" + statement.dialect() + "): " + statement.sql(), e);
    }
  }

  /** JDBC temporal types become java.time values. */
  private static Object value(Object v) {
    if (v instanceof Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof Time t) return t.toLocalTime();
    return v;
  }

  private void debugSql(SqlStatement statement) {
    if (!log.isDebugEnabled()) return;
    log.debug("dynaq.jdbc dialect={} sql={}", statement.dialect(), statement.sql());
  }

  private void debugDone(int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("dynaq.jdbc_done rows={} durationMs={}", rows, durationNanos / 1_000_000.0);
  }
}
