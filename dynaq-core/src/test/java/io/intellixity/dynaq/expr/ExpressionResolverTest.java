package io.intellixity.dynaq.expr;

import io.intellixity.dynaq.error.UnsupportedFunctionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ExpressionResolverTest {
  private final ExpressionResolver resolver = ExpressionResolver.standard();

  @Test
  void literalDetectionOrder() {
    assertEquals(new Literal(Literal.Type.BOOLEAN, "true"), resolver.classify("TRUE"));
    assertEquals(new Literal(Literal.Type.NULL, null), resolver.classify("null"));
    assertEquals(Literal.Type.INTEGER, ((Literal) resolver.classify("42")).type());
    assertEquals(Literal.Type.LONG, ((Literal) resolver.classify("4294967296")).type());
    assertEquals(Literal.Type.DOUBLE, ((Literal) resolver.classify("1.5")).type());
    assertEquals(Literal.Type.DATE, ((Literal) resolver.classify("2024-01-31")).type());
    assertEquals(Literal.Type.TIMESTAMP, ((Literal) resolver.classify("2024-01-31T10:00:00Z")).type());
    assertEquals(new Literal(Literal.Type.DATE, "2024-01-31"), resolver.classify("'2024-01-31'"));
    assertEquals(Literal.string("it's"), resolver.classify("'it''s'"));
  }

  @Test
  void impossibleCalendarValuesAreText() {
    assertEquals(Literal.string("2023-02-30"), resolver.classify("'2023-02-30'"));
    assertEquals(Literal.string("2023-02-30"), resolver.classifyValue("2023-02-30", true));
    assertEquals(Literal.string("2023-13-01T10:00:00"), resolver.classifyValue("2023-13-01T10:00:00", true));
    assertEquals(Literal.string("2023-02-30"), resolver.classify("2023-02-30"));
    assertEquals(new Literal(Literal.Type.DATE, "2024-02-29"), resolver.classifyValue("2024-02-29", true));
    assertFalse(Values.isValidTemporal("2023-02-30"));
    assertTrue(Values.isValidTemporal("2024-02-29T23:59:59"));
  }

  @Test
  void columnsAndStar() {
    assertEquals(new ColumnRef("users", "age"), resolver.classify("db.users.age"));
    assertEquals(new ColumnRef(null, "age"), resolver.classify("age"));
    assertTrue(((ColumnRef) resolver.classify("*")).isStar());
  }

  @Test
  void bareValueIsTextOnTheRightHandSide() {
    assertEquals(Literal.string("active"), resolver.classifyValue("active", false));
    assertEquals(Literal.string("42"), resolver.classifyValue("42", true));
    assertEquals(Literal.Type.INTEGER, ((Literal) resolver.classifyValue("42", false)).type());
    assertEquals(Literal.string("A"), resolver.classifyItem("'A'"));
  }

  @Test
  void functionsResolveThroughAliases() {
    FunctionCall fc = (FunctionCall) resolver.classify("ifnull(users.nick, 'n/a')");
    assertEquals("COALESCE", fc.def().name());
    assertEquals("IFNULL", fc.name());
    assertEquals(new ColumnRef("users", "nick"), fc.arg(0));
    assertEquals(Literal.string("n/a"), fc.arg(1));
  }

  @Test
  void leadingDatePartIsNormalised() {
    FunctionCall fc = (FunctionCall) resolver.classify("DATEDIFF(Days, users.a, users.b)");
    assertEquals(DatePart.DAY, fc.datePart());
    assertEquals(Literal.string("day"), fc.arg(0));
  }

  @Test
  void nestedAggregateIsDetected() {
    FunctionCall fc = (FunctionCall) resolver.classify("ROUND(AVG(users.age), 1)");
    assertTrue(fc.containsAggregate());
    assertEquals("AVG", ExpressionResolver.firstAggregate(fc).name());
    assertFalse(((FunctionCall) resolver.classify("UPPER(users.name)")).containsAggregate());
  }

  @Test
  void substringNeedsIntegerBounds() {
    UnsupportedFunctionException e =
        assertThrows(UnsupportedFunctionException.class, () -> resolver.classify("SUBSTRING(users.name, users.x)"));
    assertEquals("SUBSTRING requires integer start and length", e.getMessage());
    assertDoesNotThrow(() -> resolver.classify("SUBSTR(users.name, 1, 3)"));
  }

  @Test
  void starOnlyInsideCount() {
    assertDoesNotThrow(() -> resolver.classify("COUNT(*)"));
    assertThrows(UnsupportedFunctionException.class, () -> resolver.classify("SUM(*)"));
  }

  @Test
  void functionSyntaxRequiresCallToSpanWholeToken() {
    assertNull(ExpressionResolver.functionSyntax("UPPER(a) || x"));
    assertEquals(new ExpressionResolver.FunctionSyntax("NOW", ""), ExpressionResolver.functionSyntax("now()"));
  }
}
