package io.intellixity.dynaq.parse;

import io.intellixity.dynaq.config.CompilerOptions;
import io.intellixity.dynaq.error.SchemaResolutionException;
import io.intellixity.dynaq.error.SyntaxException;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.query.*;
import io.intellixity.dynaq.schema.ForeignKey;
import io.intellixity.dynaq.schema.MapSchemaLookup;
import io.intellixity.dynaq.schema.SchemaLookup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DslParserTest {
  private static final SchemaLookup SCHEMA = MapSchemaLookup.builder()
      .relate("users", "id", "orders", "user_id")
      .relate("orders", "id", "items", "order_id")
      .build();

  private final DslParser parser = new DslParser(SCHEMA);

  @Test
  void unbalancedParenthesesFailBeforeClauseExtraction() {
    SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("FETCH(id FILTER(a = 1)"));
    assertEquals("Query string has unbalanced parentheses.", e.getMessage());
  }

  @Test
  void fromIsRequired() {
    SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("FETCH(id)"));
    assertEquals("FROM clause is required", e.getMessage());
  }

  @Test
  void unterminatedLiteralIsRejected() {
    assertThrows(SyntaxException.class, () -> parser.parse("FROM users FILTER(name = 'bob)"));
  }

  @Test
  void fullQuery() {
    QueryModel q = parser.parse(
        "from(users) fetchd(id, name AS n, COUNT(*)) filter(age > 18 AND status = 'A') "
            + "groupby(id, name) having(COUNT(*) > 2) orderby(n DESC, id) take(10) skip(5)");

    assertEquals("users", q.table());
    assertTrue(q.distinct());
    assertEquals(List.of(
        new Column("users.id", null),
        new Column("users.name", "n"),
        new Column("COUNT(*)", null)), q.columns());
    assertEquals(QueryFilters.and(QueryFilters.gt("users.age", "18"), QueryFilters.eqText("users.status", "A")), q.filter());
    assertEquals(List.of("users.id", "users.name"), q.groupBy());
    assertEquals(Condition.of("COUNT(*)", Operator.GT, "2"), q.having());
    assertEquals(List.of(new SortField("n", SortField.Direction.DESC), new SortField("users.id", SortField.Direction.ASC)), q.orderBy());
    assertEquals(10, q.limit());
    assertEquals(5, q.offset());
  }

  @Test
  void fetchDefaultsToStarAndFromAcceptsBareForm() {
    QueryModel q = parser.parse("FROM users");
    assertTrue(q.selectsAll());
    assertNull(q.filter());
    assertFalse(q.paged());

    assertTrue(parser.parse("FROM users FETCH()").selectsAll());
    assertTrue(parser.parse("FROM users FETCH DISTINCT(name)").distinct());
    assertTrue(parser.parse("FROM users FETCHDISTINCT(name)").distinct());
  }

  @Test
  void keywordsInsideLiteralsAreIgnored() {
    QueryModel q = parser.parse("FROM users FILTER(note = 'TAKE(3) FROM x')");
    assertEquals("users", q.table());
    assertNull(q.limit());
    assertEquals(QueryFilters.eqText("users.note", "TAKE(3) FROM x"), q.filter());
  }

  @Test
  void limitAndOffsetSynonyms() {
    QueryModel q = parser.parse("FROM users LIMIT(3) OFFSET(1)");
    assertEquals(3, q.limit());
    assertEquals(1, q.offset());
  }

  @Test
  void paginationMustBeNonNegativeInteger() {
    assertThrows(SyntaxException.class, () -> parser.parse("FROM users TAKE(-1)"));
    assertThrows(SyntaxException.class, () -> parser.parse("FROM users SKIP(x)"));
  }

  @Test
  void maxLimitIsEnforced() {
    DslParser capped = new DslParser(SCHEMA, CompilerOptions.defaults().withMaxLimit(100), ExpressionResolver.standard());
    assertEquals(100, capped.parse("FROM users TAKE(100)").limit());
    assertThrows(SyntaxException.class, () -> capped.parse("FROM users TAKE(101)"));
  }

  @Test
  void qualificationIsIdempotentAndKeepsLastTwoSegments() {
    QueryModel q = parser.parse("FROM users FETCH(users.id, db.users.name, age)");
    assertEquals(List.of("users.id", "users.name", "users.age"),
        q.columns().stream().map(Column::expression).toList());

    QueryModel again = parser.parse("FROM users FETCH(" + String.join(", ", q.columns().stream().map(Column::expression).toList()) + ")");
    assertEquals(q.columns(), again.columns());
  }

  @Test
  void includeExpandsHopsInBothDirections() {
    QueryModel q = parser.parse("FROM users INCLUDE(orders INNER, orders.items)");
    assertEquals(List.of(
        new Include("users", "id", "orders", "user_id", JoinKind.INNER),
        new Include("orders", "id", "items", "order_id", JoinKind.LEFT)), q.includes());

    QueryModel reverse = parser.parse("FROM orders INCLUDE(users)");
    assertEquals(new Include("orders", "user_id", "users", "id", JoinKind.LEFT), reverse.includes().get(0));
  }

  @Test
  void includeHonoursConfiguredDefaultJoinKind() {
    CompilerOptions opts = new CompilerOptions(JoinKind.INNER, CompilerOptions.PaginationPolicy.ERROR, null);
    DslParser p = new DslParser(SCHEMA, opts, ExpressionResolver.standard());
    assertEquals(JoinKind.INNER, p.parse("FROM users INCLUDE(orders)").includes().get(0).joinKind());
  }

  @Test
  void unresolvableIncludeFails() {
    SchemaResolutionException e =
        assertThrows(SchemaResolutionException.class, () -> parser.parse("FROM users INCLUDE(payments)"));
    assertEquals("No foreign key relationship found between 'users' and 'payments'", e.getMessage());
    assertEquals("users", e.tableA());
    assertEquals("payments", e.tableB());
  }

  @Test
  void failingLookupIsWrapped() {
    SchemaLookup broken = (a, b) -> {
      throw new IllegalStateException("metadata unavailable");
    };
    SchemaResolutionException e = assertThrows(SchemaResolutionException.class,
        () -> new DslParser(broken).parse("FROM users INCLUDE(orders)"));
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void unknownJoinKindIsSyntaxError() {
    SchemaLookup any = (a, b) -> Optional.of(new ForeignKey("id", "ref"));
    assertThrows(SyntaxException.class, () -> new DslParser(any).parse("FROM users INCLUDE(orders SIDEWAYS)"));
  }

  @Test
  void functionErrorsSurfaceFromFetch() {
    UnsupportedFunctionException unknown =
        assertThrows(UnsupportedFunctionException.class, () -> parser.parse("FROM users FETCH(FOO(id))"));
    assertEquals("Unknown function: FOO", unknown.getMessage());

    UnsupportedFunctionException arity =
        assertThrows(UnsupportedFunctionException.class, () -> parser.parse("FROM users FETCH(POWER(id))"));
    assertEquals("POWER requires 2 arguments", arity.getMessage());

    assertThrows(UnsupportedFunctionException.class, () -> parser.parse("FROM users FETCH(DATEADD(fortnight, created, 1))"));
  }

  @Test
  void datePartArgumentIsNotQualified() {
    QueryModel q = parser.parse("FROM users FETCH(dateadd(day, created, 1) AS due)");
    assertEquals(new Column("DATEADD(day, users.created, 1)", "due"), q.columns().get(0));
  }
}
