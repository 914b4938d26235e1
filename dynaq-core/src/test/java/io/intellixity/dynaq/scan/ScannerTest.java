package io.intellixity.dynaq.scan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ScannerTest {
  @Test
  void closingQuoteSkipsDoubledQuotes() {
    String s = "'it''s' x";
    assertEquals(6, Scanner.findClosingQuote(s, 0));
    assertEquals(-1, Scanner.findClosingQuote("'open", 0));
  }

  @Test
  void matchingCloseIgnoresParensInsideLiterals() {
    String s = "(a = ')' OR b)";
    assertEquals(s.length() - 1, Scanner.findMatchingClose(s, 0));
    assertEquals(-1, Scanner.findMatchingClose("(a", 0));
  }

  @Test
  void balanceIsQuoteAware() {
    assertTrue(Scanner.isBalanced("FILTER(name = '(')"));
    assertFalse(Scanner.isBalanced("FILTER(a = 1"));
    assertFalse(Scanner.isBalanced(")("));
  }

  @Test
  void splitTopLevelKeepsNestedAndQuotedDelimiters() {
    List<String> parts = Scanner.splitTopLevel(" a, COALESCE(b, c) , 'x,y',, {p, q} ", ',');
    assertEquals(List.of("a", "COALESCE(b, c)", "'x,y'", "{p, q}"), parts);
  }

  @Test
  void splitWhitespaceKeepsCallsTogether() {
    assertEquals(List.of("COUNT( * )", "AS", "n"), Scanner.splitWhitespace("COUNT( * )   AS n"));
  }

  @Test
  void depthMaskMarksQuotesAndNesting() {
    int[] m = Scanner.depthMask("a(b'c')");
    assertEquals(0, m[0]);
    assertEquals(0, m[1]);
    assertEquals(1, m[2]);
    assertEquals(Scanner.QUOTED, m[3]);
    assertEquals(Scanner.QUOTED, m[5]);
    assertEquals(0, m[6]);
  }

  @Test
  void unquoteUndoublesEmbeddedQuotes() {
    assertTrue(Scanner.isQuoted("'a''b'"));
    assertFalse(Scanner.isQuoted("'a' + 'b'"));
    assertEquals("a'b", Scanner.unquote("'a''b'"));
    assertEquals("plain", Scanner.unquote("plain"));
    assertEquals("'a''b'", Scanner.quote("a'b"));
  }

  @Test
  void stripsOnlyWrappingParens() {
    assertEquals("a = 1", Scanner.stripOuterParens("((a = 1))"));
    assertEquals("(a) OR (b)", Scanner.stripOuterParens("(a) OR (b)"));
  }

  @Test
  void findsUnterminatedQuote() {
    assertEquals(4, Scanner.findUnterminatedQuote("a = 'x"));
    assertEquals(-1, Scanner.findUnterminatedQuote("a = 'x'"));
  }
}
