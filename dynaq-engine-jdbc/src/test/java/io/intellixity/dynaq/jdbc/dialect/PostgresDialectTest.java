package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.parse.DslParser;
import io.intellixity.dynaq.schema.MapSchemaLookup;
import io.intellixity.dynaq.schema.SchemaLookup;
import io.intellixity.dynaq.spi.render.Rendered;
import io.intellixity.dynaq.jdbc.SqlStatement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect(CompilerOptions.defaults());

  private String sql(String dsl) {
    return d.render(new DslParser(SchemaLookup.NONE).parse(dsl)).artifact().sql();
  }

  @Test
  void rendersFullStatementShape() {
    Rendered<SqlStatement> r = d.render(new DslParser(SchemaLookup.NONE).parse(
        "FROM users FETCH(name, COUNT(*) AS cnt) FILTER(age >= 18 AND status = 'A' OR name CONTAINS 'x') "
            + "GROUPBY(name) HAVING(cnt > 1) ORDERBY(cnt DESC) TAKE(10) SKIP(5)"));
    assertEquals("SELECT users.name, COUNT(*) AS cnt FROM users"
        + " WHERE ((users.age >= 18 AND users.status = 'A') OR users.name LIKE '%x%')"
        + " GROUP BY users.name HAVING COUNT(*) > 1 ORDER BY cnt DESC LIMIT 10 OFFSET 5", r.artifact().sql());
    assertEquals("postgres", r.artifact().dialect());
    assertFalse(r.hasWarnings());
  }

  @Test
  void rendersJoinsFromSchema() {
    DslParser parser = new DslParser(MapSchemaLookup.builder().relate("users", "id", "orders", "user_id").build());
    String sql = d.render(parser.parse("FROM users INCLUDE(orders INNER) FETCH(name, orders.total)")).artifact().sql();
    assertEquals("SELECT users.name, orders.total FROM users INNER JOIN orders ON users.id = orders.user_id", sql);
  }

  @Test
  void caseInsensitiveMatchingUsesIlike() {
    assertEquals("SELECT * FROM users WHERE users.name ILIKE '%ab%'", sql("FROM users FILTER(name ICONTAINS 'ab')"));
    assertEquals("SELECT * FROM users WHERE users.name NOT ILIKE 'a%'", sql("FROM users FILTER(name NOT ILIKE 'a%')"));
  }

  @Test
  void wildcardsInSynthesizedPatternsAreEscaped() {
    assertEquals("SELECT * FROM users WHERE users.name LIKE '%50\\%\\_off%' ESCAPE '\\'",
        sql("FROM users FILTER(name CONTAINS '50%_off')"));
    assertEquals("SELECT * FROM users WHERE users.name NOT ILIKE 'a\\\\b%' ESCAPE '\\'",
        sql("FROM users FILTER(name NOT IBEGINSWITH 'a\\b')"));
    assertEquals("SELECT * FROM users WHERE users.name LIKE 'a_%'", sql("FROM users FILTER(name LIKE 'a_%')"));
  }

  @Test
  void functionRightHandSideIsConcatenated() {
    assertEquals("SELECT * FROM users WHERE users.name LIKE CONCAT(UPPER(users.nick), '%')",
        sql("FROM users FILTER(name BEGINSWITH UPPER(nick))"));
  }

  @Test
  void literalsAndNullChecks() {
    assertEquals("SELECT * FROM users WHERE ((users.active = TRUE AND users.nick IS NULL) AND users.name = 'O''Neil')",
        sql("FROM users FILTER(active = true AND nick = NULL AND name = 'O''Neil')"));
    assertEquals("SELECT * FROM users WHERE (users.status IN ('A', 'B') AND users.age NOT BETWEEN 18 AND 65)",
        sql("FROM users FILTER(status IN ('A', 'B') AND age NOT BETWEEN (18, 65))"));
  }

  @Test
  void functionMapping() {
    assertEquals("SELECT ROUND(users.score::numeric, 0) AS round_users_score_ FROM users", sql("FROM users FETCH(ROUND(score))"));
    assertEquals("SELECT (STRPOS(users.name, 'a') - 1) AS p, SUBSTR(users.name, 1 + 1, 2) AS s, CEILING(users.score) AS c FROM users",
        sql("FROM users FETCH(INDEXOF(name, 'a') AS p, SUBSTRING(name, 1, 2) AS s, CEIL(score) AS c)"));
    assertEquals("SELECT LOG(2, users.score) AS l, LN(users.score) AS n FROM users", sql("FROM users FETCH(LOG(score, 2) AS l, LOG(score) AS n)"));
    assertEquals("SELECT (now() AT TIME ZONE 'Europe/Istanbul') AS t FROM users", sql("FROM users FETCH(NOW('Europe/Istanbul') AS t)"));
  }

  @Test
  void dateLiteralsAreCastInDateFunctions() {
    assertEquals("SELECT EXTRACT(YEAR FROM '2024-01-05'::DATE) AS y FROM users", sql("FROM users FETCH(YEAR('2024-01-05') AS y)"));
    assertEquals("SELECT (users.created + 2 * INTERVAL '3 MONTH') AS q FROM users", sql("FROM users FETCH(DATEADD(quarter, created, 2) AS q)"));
    assertEquals("SELECT TO_CHAR('2024-01-05 10:00:00'::TIMESTAMP, 'FMMonth') AS m FROM users",
        sql("FROM users FETCH(DATENAME(month, '2024-01-05 10:00:00') AS m)"));
  }

  @Test
  void skipWithoutTakeAndAliases() {
    assertEquals("SELECT * FROM users OFFSET 5", sql("FROM users SKIP(5)"));
    assertTrue(d.aliases().contains("postgresql"));
  }
}
