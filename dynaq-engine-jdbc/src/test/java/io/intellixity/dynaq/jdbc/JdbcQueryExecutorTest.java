package io.intellixity.dynaq.jdbc;

import io.intellixity.dynaq.error.QueryExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
final class JdbcQueryExecutorTest {
  @Mock DataSource ds;
  @Mock Connection connection;
  @Mock Statement statement;
  @Mock ResultSet rs;
  @Mock ResultSetMetaData md;

  @Test
  void rowsAreKeyedByLabelWithJavaTimeValues() throws SQLException {
    SqlStatement sql = new SqlStatement("postgres", "SELECT users.name, users.created AS c, users.seen FROM users");
    when(ds.getConnection()).thenReturn(connection);
    when(connection.createStatement()).thenReturn(statement);
    when(statement.executeQuery(sql.sql())).thenReturn(rs);
    when(rs.getMetaData()).thenReturn(md);
    when(md.getColumnCount()).thenReturn(3);
    when(md.getColumnLabel(1)).thenReturn("name");
    when(md.getColumnLabel(2)).thenReturn("c");
    when(md.getColumnLabel(3)).thenReturn("seen");
    when(rs.next()).thenReturn(true, false);
    when(rs.getObject(1)).thenReturn("Alice");
    when(rs.getObject(2)).thenReturn(Date.valueOf("2023-01-15"));
    when(rs.getObject(3)).thenReturn(Timestamp.valueOf("2024-02-29 10:15:00"));

    List<Map<String, Object>> rows = new JdbcQueryExecutor(ds).execute(sql);

    assertEquals(1, rows.size());
    assertEquals(List.of("name", "c", "seen"), List.copyOf(rows.get(0).keySet()));
    assertEquals(LocalDate.of(2023, 1, 15), rows.get(0).get("c"));
    assertEquals(LocalDateTime.of(2024, 2, 29, 10, 15), rows.get(0).get("seen"));
    verify(rs).close();
    verify(statement).close();
    verify(connection).close();
  }

  @Test
  void driverFailureCarriesStatement() throws SQLException {
    SqlStatement sql = new SqlStatement("mysql", "SELECT * FROM missing");
    SQLException cause = new SQLException("Table 'missing' doesn't exist");
    when(ds.getConnection()).thenReturn(connection);
    when(connection.createStatement()).thenReturn(statement);
    when(statement.executeQuery(sql.sql())).thenThrow(cause);

    QueryExecutionException ex = assertThrows(QueryExecutionException.class, () -> new JdbcQueryExecutor(ds).execute(sql));
    assertTrue(ex.getMessage().contains("(mysql)"));
    assertTrue(ex.getMessage().contains("SELECT * FROM missing"));
    assertSame(cause, ex.getCause());
    verify(connection).close();
  }
}
