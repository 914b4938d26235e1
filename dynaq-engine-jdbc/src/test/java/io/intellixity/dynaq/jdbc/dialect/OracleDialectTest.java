package io.intellixity.dynaq.jdbc.dialect;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.error.RenderException;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.parse.DslParser;
import io.intellixity.dynaq.query.QueryModel;
import io.intellixity.dynaq.schema.SchemaLookup;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OracleDialectTest {
  private final DslParser parser = new DslParser(SchemaLookup.NONE);
  private final OracleDialect d = new OracleDialect(CompilerOptions.defaults());

  private String sql(String dsl) {
    return d.render(parser.parse(dsl)).artifact().sql();
  }

  @Test
  void reverseIsNotAvailable() {
    QueryModel m = parser.parse("FROM users FETCH(REVERSE(name))");
    UnsupportedFunctionException ex = assertThrows(UnsupportedFunctionException.class, () -> d.render(m));
    assertEquals("REVERSE", ex.function());
    assertEquals("oracle", ex.target());
  }

  @Test
  void temporalLiteralsAreConverted() {
    assertEquals("SELECT EXTRACT(YEAR FROM TO_DATE('2024-01-05', 'YYYY-MM-DD')) AS y FROM users",
        sql("FROM users FETCH(YEAR('2024-01-05') AS y)"));
    assertEquals("SELECT ADD_MONTHS(TO_TIMESTAMP('2024-01-05 10:30:00', 'YYYY-MM-DD HH24:MI:SS'), 1) AS m FROM users",
        sql("FROM users FETCH(DATEADD(month, '2024-01-05T10:30:00', 1) AS m)"));
  }

  @Test
  void concatenationUsesPipes() {
    assertEquals("SELECT * FROM users WHERE users.name LIKE ('%' || LOWER(users.nick))",
        sql("FROM users FILTER(name ENDSWITH LOWER(nick))"));
  }

  @Test
  void functionMapping() {
    assertEquals("SELECT CEIL(users.score) AS c, LOG(10, users.score) AS l, (INSTR(users.name, 'a', 1 + 1) - 1) AS p FROM users",
        sql("FROM users FETCH(CEIL(score) AS c, LOG10(score) AS l, INDEXOF(name, 'a', 1) AS p)"));
  }

  @Test
  void offsetFetchNeedsOrderBy() {
    assertThrows(RenderException.class, () -> d.render(parser.parse("FROM users SKIP(3)")));
    assertEquals("SELECT * FROM users ORDER BY users.id ASC OFFSET 3 ROWS", sql("FROM users ORDERBY(id) SKIP(3)"));
  }
}
