package io.intellixity.dynaq.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ClausesTest {
  @Test
  void firstTopLevelOccurrenceWins() {
    Clauses c = Clauses.extract("FROM a FILTER(x = 1) FILTER(y = 2) TAKE(1) LIMIT(9)");
    assertEquals("a", c.from());
    assertEquals("x = 1", c.filter());
    assertEquals("1", c.take());
  }

  @Test
  void nestedKeywordsDoNotCount() {
    Clauses c = Clauses.extract("FROM(a) FETCH(COALESCE(x, 1)) FILTER(f IN (SKIP(1)))");
    assertEquals("COALESCE(x, 1)", c.fetch());
    assertNull(c.skip());
    assertFalse(c.distinct());
  }

  @Test
  void missingClausesAreNull() {
    Clauses c = Clauses.extract("FETCH(a)");
    assertNull(c.from());
    assertNull(c.orderBy());
    assertNull(c.include());
  }
}
