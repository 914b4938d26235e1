package io.intellixity.dynaq.parse;

import io.intellixity.dynaq.expr.ExpressionResolver;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnQualifierTest {
  private final ColumnQualifier q = new ColumnQualifier("users", Set.of("Total"), ExpressionResolver.standard());

  @Test
  void passThroughs() {
    assertEquals("*", q.qualify("*"));
    assertEquals("42", q.qualify("42"));
    assertEquals("'x'", q.qualify("'x'"));
    assertEquals("true", q.qualify("true"));
    assertEquals("total", q.qualify("total"));
  }

  @Test
  void segments() {
    assertEquals("users.age", q.qualify("age"));
    assertEquals("orders.total_price", q.qualify("orders.total_price"));
    assertEquals("b.c", q.qualify("a.b.c"));
    assertEquals(q.qualify("a.b.c"), q.qualify(q.qualify("a.b.c")));
  }

  @Test
  void functionsAreCanonicalised() {
    String once = q.qualify("coalesce(nick,  'n/a' ,name)");
    assertEquals("COALESCE(users.nick, 'n/a', users.name)", once);
    assertEquals(once, q.qualify(once));
    assertEquals("DATEDIFF(day, users.created, NOW())", q.qualify("datediff(day, created, now())"));
  }
}
